package com.raditha.pyrefactor.analysis;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Raw name facts collected from a block of statements.
 *
 * @param used       names read anywhere in the block
 * @param defined    names the block binds by any means
 * @param assigned   names the block binds through an assignment-like target
 * @param readFirst  names read at a point where the block has not yet bound them
 */
public record NameUsage(Set<String> used, Set<String> defined, Set<String> assigned, Set<String> readFirst) {

    public NameUsage {
        used = Collections.unmodifiableSet(new TreeSet<>(used));
        defined = Collections.unmodifiableSet(new TreeSet<>(defined));
        assigned = Collections.unmodifiableSet(new TreeSet<>(assigned));
        readFirst = Collections.unmodifiableSet(new TreeSet<>(readFirst));
    }
}
