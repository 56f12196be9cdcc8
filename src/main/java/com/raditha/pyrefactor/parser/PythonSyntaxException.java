package com.raditha.pyrefactor.parser;

/**
 * Raised when Python source cannot be tokenized or parsed.
 */
public class PythonSyntaxException extends Exception {

    private final String reason;
    private final int line;
    private final int column;

    public PythonSyntaxException(String reason, int line, int column) {
        super(reason + " (line " + line + ", column " + column + ")");
        this.reason = reason;
        this.line = line;
        this.column = column;
    }

    public String getReason() {
        return reason;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
