package com.raditha.pyrefactor.refactoring;

/**
 * @param functionName    the inlined function
 * @param inlinedCount    number of calls found and replaced, nested ones included
 * @param functionRemoved whether the definition was deleted
 * @param newContent      the file after the change
 */
public record InlinedFunction(
        String functionName,
        int inlinedCount,
        boolean functionRemoved,
        String newContent) {
}
