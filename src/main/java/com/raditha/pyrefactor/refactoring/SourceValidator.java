package com.raditha.pyrefactor.refactoring;

import com.raditha.pyrefactor.ast.Module;
import com.raditha.pyrefactor.parser.PythonParser;
import com.raditha.pyrefactor.parser.PythonSyntaxException;

/**
 * The parse gate in front of and behind every refactoring.
 */
public class SourceValidator {

    public Module parseSource(String source) throws RefactoringException {
        try {
            return PythonParser.parse(source);
        } catch (PythonSyntaxException e) {
            throw new RefactoringException(ErrorKind.SYNTAX_ERROR_IN_SOURCE, e.getMessage(), e);
        }
    }

    /**
     * Parses text the refactoring produced. Nothing is written unless this passes.
     */
    public Module validateOutput(String generated) throws RefactoringException {
        try {
            return PythonParser.parse(generated);
        } catch (PythonSyntaxException e) {
            throw new RefactoringException(ErrorKind.SYNTAX_ERROR_IN_GENERATED_OUTPUT, e.getMessage(), e);
        }
    }
}
