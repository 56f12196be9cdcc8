package com.raditha.pyrefactor.analysis;

import com.raditha.pyrefactor.ast.Module;
import com.raditha.pyrefactor.ast.Stmt;
import com.raditha.pyrefactor.parser.PythonParser;
import com.raditha.pyrefactor.parser.PythonSyntaxException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ScopesTest {

    private Module module;

    @BeforeEach
    void setUp() throws PythonSyntaxException {
        module = PythonParser.parse("""
                class Outer:
                    def method(self):
                        def helper():
                            return 1
                        return helper()

                def helper():
                    for x in range(3):
                        if x:
                            pass
                    return 2
                """);
    }

    @Test
    void testEnclosingOutermostFirst() {
        List<Stmt> chain = Scopes.enclosing(module, 4);

        assertEquals(3, chain.size());
        assertEquals("Outer", ((Stmt.ClassDef) chain.get(0)).name());
        assertEquals("method", ((Stmt.FunctionDef) chain.get(1)).name());
        assertEquals("helper", Scopes.enclosingFunction(module, 4).name());
        assertNull(Scopes.enclosingFunction(module, 6));
    }

    @Test
    void testFindFunctionPrefersModuleLevel() {
        Stmt.FunctionDef helper = Scopes.findFunction(module, "helper");

        assertNotNull(helper);
        assertEquals(7, helper.range().startLine());
        assertNull(Scopes.findFunction(module, "missing"));
    }

    @Test
    void testAllFunctionsAndClasses() {
        assertEquals(List.of("method", "helper", "helper"),
                Scopes.allFunctions(module).stream().map(Stmt.FunctionDef::name).toList());
        assertEquals(1, Scopes.allClasses(module).size());
        assertNotNull(Scopes.findMethod(Scopes.findClass(module, "Outer"), "method"));
        assertNull(Scopes.findMethod(Scopes.findClass(module, "Outer"), "helper"));
    }

    @Test
    void testFlattenVisitsNestedBlocks() {
        List<Stmt> all = Scopes.flatten(module.body());

        assertTrue(all.stream().anyMatch(s -> s instanceof Stmt.For));
        assertTrue(all.stream().anyMatch(s -> s instanceof Stmt.Pass));
        assertEquals(2, Scopes.blocks(all.stream().filter(s -> s instanceof Stmt.If).findFirst().orElseThrow()).size());
    }
}
