package com.raditha.pyrefactor.refactoring;

/**
 * Answer to "can this function be inlined", with the reason when it cannot.
 */
public record InlineCheck(boolean canInline, String reason) {

    public static InlineCheck yes() {
        return new InlineCheck(true, "");
    }

    public static InlineCheck no(String reason) {
        return new InlineCheck(false, reason);
    }
}
