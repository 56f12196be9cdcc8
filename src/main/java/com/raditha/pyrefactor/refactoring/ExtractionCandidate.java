package com.raditha.pyrefactor.refactoring;

/**
 * A function long enough to be worth splitting.
 */
public record ExtractionCandidate(String functionName, int startLine, int endLine, String reason) {
}
