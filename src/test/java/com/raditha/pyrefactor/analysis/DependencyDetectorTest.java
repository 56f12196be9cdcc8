package com.raditha.pyrefactor.analysis;

import com.raditha.pyrefactor.model.DependencyInfo;
import com.raditha.pyrefactor.parser.PythonParser;
import com.raditha.pyrefactor.parser.PythonSyntaxException;
import com.raditha.pyrefactor.parser.SourceRenderer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DependencyDetectorTest {

    private DependencyDetector detector;

    @BeforeEach
    void setUp() {
        detector = new DependencyDetector(BuiltinNames.standard(), new SourceRenderer());
    }

    @Test
    void testDetectsInstantiationsInConstructor() throws PythonSyntaxException {
        Map<String, List<DependencyInfo>> result = detector.analyze(PythonParser.parse("""
                class Service:
                    def __init__(self, url):
                        self.db = Database(url, timeout=5)
                        self.cache = {}
                        self.items = list()
                        self.mailer = Mailer()
                        if url:
                            self.log = Logger( "svc" )
                """));

        assertEquals(List.of("Service"), List.copyOf(result.keySet()));
        List<DependencyInfo> dependencies = result.get("Service");
        assertEquals(List.of("db", "mailer", "log"), dependencies.stream().map(DependencyInfo::attributeName).toList());

        DependencyInfo db = dependencies.get(0);
        assertEquals("Service", db.className());
        assertEquals("Database", db.dependencyType());
        assertEquals(3, db.line());
        assertEquals("Database(url, timeout=5)", db.instantiation());
        assertEquals(List.of("url", "timeout=5"), db.arguments());
        assertTrue(db.hasParameters());
        assertFalse(db.isOptional());

        DependencyInfo mailer = dependencies.get(1);
        assertFalse(mailer.hasParameters());
        assertEquals("Logger(\"svc\")", dependencies.get(2).instantiation());
    }

    @Test
    void testIgnoresOtherMethodsAndNestedFunctions() throws PythonSyntaxException {
        Map<String, List<DependencyInfo>> result = detector.analyze(PythonParser.parse("""
                class Lazy:
                    def __init__(self):
                        def later():
                            self.db = Database()
                        self.factory = later

                    def connect(self):
                        self.db = Database()
                """));

        assertTrue(result.isEmpty());
    }

    @Test
    void testCustomReceiverName() throws PythonSyntaxException {
        Map<String, List<DependencyInfo>> result = detector.analyze(PythonParser.parse("""
                class Odd:
                    def __init__(this):
                        this.repo = Repository()
                """));

        assertEquals("repo", result.get("Odd").get(0).attributeName());
    }

    @Test
    void testClassWithoutConstructor() throws PythonSyntaxException {
        assertTrue(detector.analyze(PythonParser.parse("class Plain:\n    x = Thing()\n")).isEmpty());
    }
}
