package com.raditha.pyrefactor.ast;

import com.raditha.pyrefactor.model.Range;

/**
 * Any element of a parsed Python file that occupies a span of source text.
 */
public interface Node {

    Range range();
}
