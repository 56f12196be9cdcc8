package com.raditha.pyrefactor.analysis;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BuiltinNamesTest {

    @Test
    void testStandardVocabularyIsLoadedFromClasspath() {
        BuiltinNames builtins = BuiltinNames.standard();

        assertTrue(builtins.contains("print"));
        assertTrue(builtins.contains("Exception"));
        assertFalse(builtins.contains("Database"));
        assertSame(builtins, BuiltinNames.standard());
    }

    @Test
    void testWithAddsNamesWithoutChangingOriginal() {
        BuiltinNames standard = BuiltinNames.standard();
        BuiltinNames extended = standard.with(List.of("settings"));

        assertTrue(extended.contains("settings"));
        assertTrue(extended.contains("len"));
        assertFalse(standard.contains("settings"));
        assertSame(standard, standard.with(List.of()));
    }
}
