package com.calc.config.expression;

import com.calc.exception.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for FunctionNameTable.
 */
class FunctionNameTableTest {

    @Test
    @DisplayName("Default table holds the built-in functions")
    void defaultsContainBuiltIns() {
        FunctionNameTable table = FunctionNameTable.defaults();

        assertEquals(ExpressionConfig.DEFAULT_FUNCTION_NAMES.size(), table.size());
        for (String name : List.of("sin", "cos", "tan", "log", "ln", "exp", "sqrt", "sec", "floor")) {
            assertTrue(table.contains(name), name);
        }
    }

    @Test
    @DisplayName("Lookup is exact and case-sensitive")
    void lookupIsExact() {
        FunctionNameTable table = FunctionNameTable.defaults();

        assertFalse(table.contains("Sin"));
        assertFalse(table.contains("SIN"));
        assertFalse(table.contains("si"));
        assertFalse(table.contains("sinx"));
        assertFalse(table.contains(""));
        assertFalse(table.contains(null));
    }

    @Test
    @DisplayName("Additional names extend the defaults")
    void withDefaultsAddsNames() {
        FunctionNameTable table = FunctionNameTable.withDefaults(List.of("erf", "gamma", "sin"));

        assertTrue(table.contains("erf"));
        assertTrue(table.contains("gamma"));
        assertTrue(table.contains("sin"));
        assertEquals(ExpressionConfig.DEFAULT_FUNCTION_NAMES.size() + 2, table.size());
    }

    @Test
    @DisplayName("Custom table holds only the given names")
    void ofHoldsOnlyGivenNames() {
        FunctionNameTable table = FunctionNameTable.of(List.of("f", "g"));

        assertEquals(2, table.size());
        assertFalse(table.contains("sin"));
    }

    @Test
    @DisplayName("Table cannot be modified after construction")
    void tableIsImmutable() {
        FunctionNameTable table = FunctionNameTable.defaults();

        assertThrows(UnsupportedOperationException.class, () -> table.names().add("erf"));
    }

    @Test
    @DisplayName("Names that are not identifiers are rejected")
    void rejectsInvalidNames() {
        assertThrows(ConfigurationException.class, () -> FunctionNameTable.of(List.of("2bad")));
        assertThrows(ConfigurationException.class, () -> FunctionNameTable.of(List.of("")));
        assertThrows(ConfigurationException.class, () -> FunctionNameTable.of(List.of("a-b")));
        assertThrows(ConfigurationException.class, () -> FunctionNameTable.withDefaults(List.of("log 2")));
    }
}
