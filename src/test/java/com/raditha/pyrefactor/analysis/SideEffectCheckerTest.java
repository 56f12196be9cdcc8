package com.raditha.pyrefactor.analysis;

import com.raditha.pyrefactor.ast.Stmt;
import com.raditha.pyrefactor.model.FunctionInfo;
import com.raditha.pyrefactor.model.UnsafeReason;
import com.raditha.pyrefactor.parser.PythonParser;
import com.raditha.pyrefactor.parser.PythonSyntaxException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class SideEffectCheckerTest {

    private final SideEffectChecker checker = new SideEffectChecker();

    private FunctionInfo analyze(String source) throws PythonSyntaxException {
        Stmt.FunctionDef function = (Stmt.FunctionDef) PythonParser.parse(source).body().get(0);
        return checker.analyze(function);
    }

    @Test
    void testPureFunctionIsSafe() throws PythonSyntaxException {
        FunctionInfo info = analyze("""
                def area(w, h):
                    \"\"\"Rectangle area.\"\"\"
                    product = w * h
                    return product
                """);

        assertTrue(info.isSafe());
        assertNull(info.describeUnsafeReason());
        assertEquals(List.of("w", "h"), info.parameters());
        assertEquals(1, info.body().size(), "The docstring is not part of the inlined body");
        assertNotNull(info.returnValue());
    }

    @Test
    void testFunctionWithoutReturnIsSafe() throws PythonSyntaxException {
        FunctionInfo info = analyze("""
                def noop(x):
                    pass
                """);

        assertTrue(info.isSafe());
        assertNull(info.returnValue());
        assertTrue(info.body().isEmpty());
    }

    static Stream<Arguments> unsafeFunctions() {
        return Stream.of(
                Arguments.of("def f(a=1):\n    return a\n", UnsafeReason.HAS_DEFAULT_ARGUMENTS,
                        "has default arguments"),
                Arguments.of("def f(*args):\n    return args\n", UnsafeReason.HAS_VARIADIC_PARAMETERS,
                        "has *args or **kwargs"),
                Arguments.of("def f(n):\n    return f(n - 1)\n", UnsafeReason.RECURSIVE, "is recursive"),
                Arguments.of("def f(n):\n    yield n\n", UnsafeReason.GENERATOR, "is a generator function"),
                Arguments.of("def f():\n    global g\n    return g\n", UnsafeReason.USES_GLOBAL,
                        "uses global statement"),
                Arguments.of("def f(x):\n    print(x)\n", UnsafeReason.SIDE_EFFECT_CALL,
                        "calls side-effect function 'print'"),
                Arguments.of("def f(o):\n    o.x = 1\n    return o\n", UnsafeReason.MODIFIES_ATTRIBUTES,
                        "modifies object attributes"),
                Arguments.of("def f(d):\n    d['k'] = 1\n    return d\n", UnsafeReason.MODIFIES_SUBSCRIPT,
                        "modifies subscript"),
                Arguments.of("def f(x):\n    if x:\n        return 1\n    return 2\n", UnsafeReason.MULTIPLE_RETURNS,
                        "has multiple return statements"),
                Arguments.of("def f(x):\n    if x:\n        return 1\n    y = 2\n", UnsafeReason.EARLY_RETURN,
                        "has early return"),
                Arguments.of("def f(x):\n    for i in x:\n        pass\n    return x\n",
                        UnsafeReason.UNSUPPORTED_STATEMENTS, "has statements that cannot be inlined"));
    }

    @ParameterizedTest
    @MethodSource("unsafeFunctions")
    void testUnsafeFunctions(String source, UnsafeReason reason, String description) throws PythonSyntaxException {
        FunctionInfo info = analyze(source);

        assertFalse(info.isSafe());
        assertEquals(reason, info.unsafeReason());
        assertEquals(description, info.describeUnsafeReason());
    }

    @Test
    void testFirstFailingCheckWins() throws PythonSyntaxException {
        FunctionInfo info = analyze("def f(a=1, *rest):\n    print(a)\n");

        assertEquals(UnsafeReason.HAS_DEFAULT_ARGUMENTS, info.unsafeReason());
    }

    @Test
    void testSideEffectInsideLambda() throws PythonSyntaxException {
        FunctionInfo info = analyze("""
                def show(xs):
                    return list(map(lambda v: print(v), xs))
                """);

        assertFalse(info.isSafe());
        assertEquals(UnsafeReason.SIDE_EFFECT_CALL, info.unsafeReason());
        assertEquals("calls side-effect function 'print'", info.describeUnsafeReason());
    }

    @Test
    void testSideEffectInsideNestedFunction() throws PythonSyntaxException {
        FunctionInfo info = analyze("""
                def run(code):
                    def inner():
                        return eval(code)
                    return inner()
                """);

        assertEquals(UnsafeReason.SIDE_EFFECT_CALL, info.unsafeReason());
        assertEquals("calls side-effect function 'eval'", info.describeUnsafeReason());
    }

    @Test
    void testMatchStatementCannotBeInlined() throws PythonSyntaxException {
        FunctionInfo info = analyze("""
                def label(code):
                    match code:
                        case 200:
                            status = "ok"
                """);

        assertEquals(UnsafeReason.UNSUPPORTED_STATEMENTS, info.unsafeReason());
    }
}
