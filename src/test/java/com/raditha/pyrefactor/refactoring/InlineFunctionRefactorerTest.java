package com.raditha.pyrefactor.refactoring;

import com.raditha.pyrefactor.ast.Expr;
import com.raditha.pyrefactor.ast.Stmt;
import com.raditha.pyrefactor.config.RefactoringConfig;
import com.raditha.pyrefactor.history.InMemoryFixHistory;
import com.raditha.pyrefactor.parser.PythonParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class InlineFunctionRefactorerTest {

    private static final String DOUBLE = """
            def double(n):
                return n * 2


            result = double(5)
            """;

    @TempDir
    Path tempDir;

    private InMemoryFixHistory history;
    private InlineFunctionRefactorer refactorer;

    @BeforeEach
    void setUp() {
        history = new InMemoryFixHistory();
        refactorer = new InlineFunctionRefactorer(RefactoringConfig.defaults(), history);
    }

    private Path write(String content) throws IOException {
        Path file = tempDir.resolve("module.py");
        Files.writeString(file, content);
        return file;
    }

    @Test
    void testInlineAndRemoveFunction() throws IOException {
        Path file = write(DOUBLE);

        RefactorResult<InlinedFunction> result = refactorer.inlineFunction(file, "double", true);

        assertTrue(result.isSuccess(), () -> "Inlining failed: " + result);
        InlinedFunction inlined = result.getValue();
        assertEquals(1, inlined.inlinedCount());
        assertTrue(inlined.functionRemoved());
        assertEquals("result = 5 * 2\n", Files.readString(file));
        assertEquals(1, history.getAllFixes().size());
        assertEquals("Inlined 1 calls to function 'double'", history.getAllFixes().get(0).description());
    }

    @Test
    void testByteOrderMarkIsKept() throws IOException {
        Path file = write("\ufeffdef double(n):\n    return n * 2\n\n\nresult = double(5)\n");

        RefactorResult<InlinedFunction> result = refactorer.inlineFunction(file, "double", true);

        assertTrue(result.isSuccess(), () -> "Inlining failed: " + result);
        assertEquals("\ufeffresult = 5 * 2\n", Files.readString(file));
        assertTrue(history.getAllFixes().get(0).originalContent().startsWith("\ufeffdef double"));
    }

    @Test
    void testInlineKeepingFunction() throws IOException {
        Path file = write(DOUBLE);

        RefactorResult<InlinedFunction> result = refactorer.inlineFunction(file, "double", false);

        assertTrue(result.isSuccess());
        assertFalse(result.getValue().functionRemoved());
        assertEquals("""
                def double(n):
                    return n * 2


                result = 5 * 2
                """, Files.readString(file));
    }

    @Test
    void testOperandPositionIsParenthesized() throws IOException {
        Path file = write("""
                def double(n):
                    return n * 2

                y = double(a + b) * 3
                """);

        RefactorResult<InlinedFunction> result = refactorer.inlineFunction(file, "double", true);

        assertTrue(result.isSuccess());
        assertEquals("y = ((a + b) * 2) * 3\n", Files.readString(file));
    }

    @Test
    void testLocalBindingsAreFolded() throws IOException {
        Path file = write("""
                def area(w, h):
                    \"\"\"Area plus margin.\"\"\"
                    product = w * h
                    return product + 1

                x = area(2, 3)
                z = area(h=4, w=size)
                """);

        RefactorResult<InlinedFunction> result = refactorer.inlineFunction(file, "area", true);

        assertTrue(result.isSuccess());
        assertEquals(2, result.getValue().inlinedCount());
        assertEquals("x = 2 * 3 + 1\nz = size * 4 + 1\n", Files.readString(file));
    }

    @Test
    void testNestedCallsAreCountedAndExpanded() throws IOException {
        Path file = write("""
                def double(n):
                    return n * 2

                x = double(double(1))
                """);

        RefactorResult<InlinedFunction> result = refactorer.inlineFunction(file, "double", true);

        assertTrue(result.isSuccess());
        assertEquals(2, result.getValue().inlinedCount(), "Every call found is counted");
        assertEquals("x = 1 * 2 * 2\n", Files.readString(file));
    }

    @Test
    void testStatementCallOfProcedureIsSpliced() throws IOException {
        Path file = write("""
                def reset(items):
                    items.clear()


                def main(data):
                    reset(data)
                    return data
                """);

        RefactorResult<InlinedFunction> result = refactorer.inlineFunction(file, "reset", true);

        assertTrue(result.isSuccess());
        assertEquals("""
                def main(data):
                    data.clear()
                    return data
                """, Files.readString(file));
    }

    @Test
    void testUnsafeFunctionIsRefused() throws IOException {
        String source = """
                def shout(text):
                    print(text)

                shout("hi")
                """;
        Path file = write(source);

        RefactorResult<InlinedFunction> result = refactorer.inlineFunction(file, "shout", true);

        assertEquals(ErrorKind.UNSAFE_OPERATION, result.getError().kind());
        assertEquals("Function cannot be inlined: calls side-effect function 'print'", result.getError().message());
        assertEquals(source, Files.readString(file));
        assertTrue(history.getAllFixes().isEmpty());
    }

    @Test
    void testMissingFunction() throws IOException {
        Path file = write(DOUBLE);

        RefactorResult<InlinedFunction> result = refactorer.inlineFunction(file, "triple", true);

        assertEquals(ErrorKind.TARGET_NOT_FOUND, result.getError().kind());
        assertEquals("Function 'triple' not found", result.getError().message());
    }

    @Test
    void testNoCallSites() throws IOException {
        Path file = write("def double(n):\n    return n * 2\n");

        RefactorResult<InlinedFunction> result = refactorer.inlineFunction(file, "double", true);

        assertEquals(ErrorKind.NO_CALL_SITES, result.getError().kind());
        assertEquals("No call sites found for function 'double'", result.getError().message());
    }

    @Test
    void testArgumentMismatchIsRefused() throws IOException {
        String source = """
                def double(n):
                    return n * 2

                a = double(1)
                b = double(1, 2)
                """;
        Path file = write(source);

        RefactorResult<InlinedFunction> result = refactorer.inlineFunction(file, "double", true);

        assertEquals(ErrorKind.UNSAFE_OPERATION, result.getError().kind());
        assertTrue(result.getError().message().endsWith("at line 5"), result.getError().message());
        assertEquals(source, Files.readString(file), "No call site is rewritten when one of them fails");
    }

    @Test
    void testBindRules() throws Exception {
        Stmt.FunctionDef function = (Stmt.FunctionDef) PythonParser.parse("def f(a, /, b, *, c): pass\n")
                .body().get(0);

        assertEquals(3, InlineFunctionRefactorer.bind(function, call("f(1, 2, c=3)")).size());
        assertEquals(3, InlineFunctionRefactorer.bind(function, call("f(1, c=3, b=2)")).size());
        assertThrows(RefactoringException.class, () -> InlineFunctionRefactorer.bind(function, call("f(a=1, b=2, c=3)")));
        assertThrows(RefactoringException.class, () -> InlineFunctionRefactorer.bind(function, call("f(1, 2, 3)")));
        assertThrows(RefactoringException.class, () -> InlineFunctionRefactorer.bind(function, call("f(*xs, c=3)")));
        assertThrows(RefactoringException.class, () -> InlineFunctionRefactorer.bind(function, call("f(1, 2)")));
    }

    private static Expr.Call call(String text) throws Exception {
        return (Expr.Call) PythonParser.parseExpression(text);
    }

    @Test
    void testDryRun() throws IOException {
        Path file = write(DOUBLE);

        RefactorResult<InlinedFunction> result = refactorer.inlineFunction(file, "double", true, true);

        assertTrue(result.isSuccess());
        assertEquals("result = 5 * 2\n", result.getValue().newContent());
        assertEquals(DOUBLE, Files.readString(file));
        assertTrue(history.getAllFixes().isEmpty());
    }

    @Test
    void testCanInline() throws IOException {
        Path file = write(DOUBLE + "\ndef shout(x):\n    print(x)\n");

        assertTrue(refactorer.canInline(file, "double").canInline());
        InlineCheck shout = refactorer.canInline(file, "shout");
        assertFalse(shout.canInline());
        assertEquals("calls side-effect function 'print'", shout.reason());
        assertEquals("Function 'missing' not found", refactorer.canInline(file, "missing").reason());
        assertTrue(refactorer.canInline(tempDir.resolve("none.py"), "double").reason().startsWith("FileNotFound"));
    }
}
