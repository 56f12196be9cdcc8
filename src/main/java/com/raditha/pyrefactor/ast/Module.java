package com.raditha.pyrefactor.ast;

import java.util.List;

/**
 * Root of a parsed file.
 */
public record Module(List<Stmt> body) {
}
