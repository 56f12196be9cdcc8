package com.raditha.pyrefactor.ast;

import org.jspecify.annotations.Nullable;

public record WithItem(Expr context, @Nullable Expr optionalVars) {
}
