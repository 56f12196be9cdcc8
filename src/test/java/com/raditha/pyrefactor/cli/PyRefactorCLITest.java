package com.raditha.pyrefactor.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class PyRefactorCLITest {

    private static final String CALC = """
            def double(x):
                return x * 2


            result = double(5)
            """;

    @TempDir
    Path tempDir;

    private StringWriter out;
    private StringWriter err;
    private Path historyFile;
    private Path file;

    @BeforeEach
    void setUp() throws IOException {
        out = new StringWriter();
        err = new StringWriter();
        historyFile = tempDir.resolve("history.json");
        file = tempDir.resolve("calc.py");
        Files.writeString(file, CALC);
    }

    private int run(String... args) {
        CommandLine cmd = PyRefactorCLI.createCommandLine();
        cmd.setOut(new PrintWriter(out, true));
        cmd.setErr(new PrintWriter(err, true));
        String[] all = new String[args.length + 2];
        all[0] = "--history-file";
        all[1] = historyFile.toString();
        System.arraycopy(args, 0, all, 2, args.length);
        return cmd.execute(all);
    }

    @Test
    void testInlineWritesAndRecords() throws IOException {
        int code = run("inline", file.toString(), "double");

        assertEquals(0, code, err.toString());
        assertEquals("result = 5 * 2\n", Files.readString(file));
        assertTrue(out.toString().contains("Inlined 1 calls to 'double' and removed the definition"));
        assertTrue(out.toString().contains("Fix id: fix-"));
        assertTrue(Files.exists(historyFile));
    }

    @Test
    void testDryRunPrintsDiff() throws IOException {
        int code = run("inline", "--dry-run", file.toString(), "double");

        assertEquals(0, code);
        assertTrue(out.toString().contains("--- a/calc.py"));
        assertTrue(out.toString().contains("+result = 5 * 2"));
        assertEquals(CALC, Files.readString(file));
        assertFalse(Files.exists(historyFile));
    }

    @Test
    void testFailureGoesToErr() {
        int code = run("inline", file.toString(), "triple");

        assertEquals(1, code);
        assertTrue(err.toString().startsWith("TargetNotFound: "), err.toString());
    }

    @Test
    void testHistoryAndRollback() throws IOException {
        run("inline", file.toString(), "double");
        String fixId = out.toString().lines()
                .filter(l -> l.startsWith("Fix id: "))
                .map(l -> l.substring("Fix id: ".length()))
                .findFirst().orElseThrow();

        out.getBuffer().setLength(0);
        assertEquals(0, run("history"));
        assertTrue(out.toString().contains(fixId));
        assertTrue(out.toString().contains("inline_function"));

        out.getBuffer().setLength(0);
        assertEquals(0, run("history", "--stats"));
        assertTrue(out.toString().contains("Total fixes: 1"));

        assertEquals(0, run("rollback", fixId));
        assertEquals(CALC, Files.readString(file));
        assertEquals(1, run("rollback", "fix-unknown"));
    }

    @Test
    void testCanInline() {
        assertEquals(0, run("can-inline", file.toString(), "double"));
        assertTrue(out.toString().contains("'double' can be inlined"));
    }

    @Test
    void testInjectPrintsContainer() throws IOException {
        Path service = tempDir.resolve("service.py");
        Files.writeString(service, """
                class Service:
                    def __init__(self):
                        self.db = Database()
                """);

        assertEquals(0, run("inject", service.toString(), "Service"));
        assertTrue(out.toString().contains("class ServiceDIContainer:"));
        assertTrue(Files.readString(service).contains("self.db = db or Database()"));
    }

    @Test
    void testDeps() throws IOException {
        Path service = tempDir.resolve("service.py");
        Files.writeString(service, """
                class Service:
                    def __init__(self):
                        self.db = Database()
                """);

        assertEquals(0, run("deps", service.toString()));
        assertTrue(out.toString().contains("line 3: self.db = Database()"));
    }

    @Test
    void testMissingConfigFile() {
        int code = run("--config-file", tempDir.resolve("none.yml").toString(), "history");

        assertEquals(2, code);
        assertTrue(err.toString().startsWith("Configuration error: "));
    }

    @Test
    void testUsageError() {
        assertEquals(2, run("inline", file.toString()));
    }
}
