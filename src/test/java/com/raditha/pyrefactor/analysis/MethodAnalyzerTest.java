package com.raditha.pyrefactor.analysis;

import com.raditha.pyrefactor.ast.Stmt;
import com.raditha.pyrefactor.model.MethodInfo;
import com.raditha.pyrefactor.parser.PythonParser;
import com.raditha.pyrefactor.parser.PythonSyntaxException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class MethodAnalyzerTest {

    private final MethodAnalyzer analyzer = new MethodAnalyzer();
    private Stmt.ClassDef order;

    @BeforeEach
    void setUp() throws PythonSyntaxException {
        order = (Stmt.ClassDef) PythonParser.parse("""
                import abc

                class Order:
                    \"\"\"An order.\"\"\"
                    TAX = 0.2
                    currency: str = "EUR"

                    def total(self, discount):
                        return self.subtotal() * (1 + self.TAX) - discount

                    @staticmethod
                    def parse(text):
                        return Order()

                    @classmethod
                    def empty(cls):
                        return cls()

                    @abc.abstractmethod
                    def validate(self):
                        pass

                    class Line:
                        pass
                """).body().get(1);
    }

    @Test
    void testReceiverUsage() {
        MethodInfo info = analyzer.analyze(Scopes.findMethod(order, "total"));

        assertEquals("total", info.name());
        assertEquals(List.of("discount"), info.parameters());
        assertEquals(Set.of("subtotal"), info.methodCalls());
        assertTrue(info.selfReferences().containsAll(Set.of("subtotal", "TAX")));
        assertFalse(info.isAbstract());
    }

    @Test
    void testDecorators() {
        MethodInfo parse = analyzer.analyze(Scopes.findMethod(order, "parse"));
        MethodInfo empty = analyzer.analyze(Scopes.findMethod(order, "empty"));
        MethodInfo validate = analyzer.analyze(Scopes.findMethod(order, "validate"));

        assertTrue(parse.isStatic());
        assertEquals(List.of("text"), parse.parameters());
        assertTrue(empty.isClassmethod());
        assertTrue(empty.parameters().isEmpty(), "cls is the receiver");
        assertTrue(validate.isAbstract());
        assertTrue(MethodAnalyzer.isAbstract(Scopes.findMethod(order, "validate")));
        assertEquals(validate.range().startLine() + 1, Scopes.findMethod(order, "validate").range().startLine());
    }

    @Test
    void testReceiverName() {
        assertEquals("self", MethodAnalyzer.receiverName(Scopes.findMethod(order, "total")));
        assertEquals("cls", MethodAnalyzer.receiverName(Scopes.findMethod(order, "empty")));
        assertEquals("self", MethodAnalyzer.receiverName(Scopes.findMethod(order, "parse")));
    }

    @Test
    void testMemberNamesIncludeAttributesAndNestedClasses() {
        assertEquals(Set.of("TAX", "currency", "total", "parse", "empty", "validate", "Line"),
                analyzer.memberNames(order));
    }

    @Test
    void testKeepsMembersWithout() throws PythonSyntaxException {
        Stmt.ClassDef single = (Stmt.ClassDef) PythonParser.parse("""
                class A:
                    \"\"\"Doc.\"\"\"
                    def only(self):
                        return 1
                """).body().get(0);

        assertFalse(analyzer.keepsMembersWithout(single, "only"));
        assertTrue(analyzer.keepsMembersWithout(order, "total"));
    }

    @Test
    void testPlaceholderBody() throws PythonSyntaxException {
        Stmt.ClassDef empty = (Stmt.ClassDef) PythonParser.parse("class B:\n    \"\"\"Doc.\"\"\"\n    pass\n")
                .body().get(0);

        assertTrue(MethodAnalyzer.isPlaceholderBody(empty.body()));
        assertFalse(MethodAnalyzer.isPlaceholderBody(order.body()));
    }
}
