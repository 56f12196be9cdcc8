package com.raditha.pyrefactor.model;

import java.util.Collections;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Classification of the names in a block of statements that is about to be
 * extracted.
 *
 * @param inputs  names read by the block that it does not define first; they
 *                become the parameters of the extracted function
 * @param outputs names the block assigns that are read after it; they become
 *                the return values
 * @param locals  names defined by the block that nothing after it reads
 */
public record VariableSet(
        SortedSet<String> inputs,
        SortedSet<String> outputs,
        SortedSet<String> locals) {

    public VariableSet {
        inputs = Collections.unmodifiableSortedSet(new TreeSet<>(inputs));
        outputs = Collections.unmodifiableSortedSet(new TreeSet<>(outputs));
        locals = Collections.unmodifiableSortedSet(new TreeSet<>(locals));
        for (String output : outputs) {
            if (locals.contains(output)) {
                throw new IllegalArgumentException("Name is both local and output: " + output);
            }
        }
    }

    /**
     * Builds the classification from the raw flow facts.
     *
     * @param inputs    names read before they are defined in the block
     * @param defined   every name the block binds
     * @param assigned  the names the block binds by assignment
     * @param usedAfter names read after the block in the same scope
     */
    public static VariableSet classify(Set<String> inputs, Set<String> defined, Set<String> assigned,
                                       Set<String> usedAfter) {
        SortedSet<String> outputs = new TreeSet<>(assigned);
        outputs.retainAll(usedAfter);
        outputs.retainAll(defined);
        SortedSet<String> locals = new TreeSet<>(defined);
        locals.removeAll(outputs);
        return new VariableSet(new TreeSet<>(inputs), outputs, locals);
    }
}
