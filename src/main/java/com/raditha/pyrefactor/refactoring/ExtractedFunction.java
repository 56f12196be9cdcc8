package com.raditha.pyrefactor.refactoring;

import com.raditha.pyrefactor.model.VariableSet;

/**
 * @param functionName the new function
 * @param definition   the generated {@code def} block
 * @param callSite     the statement that replaced the extracted lines, without indentation
 * @param variables    how the names of the block were classified
 * @param newContent   the file after the change
 */
public record ExtractedFunction(
        String functionName,
        String definition,
        String callSite,
        VariableSet variables,
        String newContent) {
}
