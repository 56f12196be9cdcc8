package com.raditha.pyrefactor.refactoring;

/**
 * A class that could receive a moved method.
 *
 * @param className candidate class
 * @param score     share of the method's receiver attributes and calls the class defines, 0 to 1
 */
public record TargetSuggestion(String className, double score) {
}
