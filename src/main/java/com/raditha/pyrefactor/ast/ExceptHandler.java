package com.raditha.pyrefactor.ast;

import com.raditha.pyrefactor.model.Range;
import org.jspecify.annotations.Nullable;

import java.util.List;

public record ExceptHandler(Range range, @Nullable Expr type, @Nullable String name,
                            List<Stmt> body, boolean isGroup) implements Node {
}
