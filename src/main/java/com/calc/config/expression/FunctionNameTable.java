package com.calc.config.expression;

import com.calc.exception.ConfigurationException;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Immutable set of known function identifiers.
 * <p>
 * Lookups are exact and case-sensitive and are only ever made with a whole
 * identifier recovered by a scanner. Instances are built once at startup and
 * shared freely between threads.
 */
public final class FunctionNameTable {

    private static final FunctionNameTable DEFAULTS = new FunctionNameTable(ExpressionConfig.DEFAULT_FUNCTION_NAMES);

    private final Set<String> names;

    private FunctionNameTable(Collection<String> names) {
        Set<String> copy = new LinkedHashSet<>();
        for (String name : names) {
            validateName(name);
            copy.add(name);
        }
        this.names = Set.copyOf(copy);
    }

    /**
     * The built-in table.
     */
    public static FunctionNameTable defaults() {
        return DEFAULTS;
    }

    /**
     * Create a table holding exactly the given names.
     *
     * @throws ConfigurationException if a name is not a valid identifier
     */
    public static FunctionNameTable of(Collection<String> names) {
        return new FunctionNameTable(names);
    }

    /**
     * Create a table holding the built-in names plus the given ones.
     */
    public static FunctionNameTable withDefaults(Collection<String> additional) {
        Set<String> all = new LinkedHashSet<>(ExpressionConfig.DEFAULT_FUNCTION_NAMES);
        all.addAll(additional);
        return new FunctionNameTable(all);
    }

    public boolean contains(String identifier) {
        return identifier != null && names.contains(identifier);
    }

    public Set<String> names() {
        return names;
    }

    public int size() {
        return names.size();
    }

    @Override
    public String toString() {
        return "FunctionNameTable" + names;
    }

    private static void validateName(String name) {
        if (name == null || name.isEmpty() || !CharClass.isIdentifierStart(name.charAt(0))) {
            throw new ConfigurationException("Invalid function name '" + name + "'");
        }
        for (int i = 1; i < name.length(); i++) {
            if (!CharClass.isIdentifierPart(name.charAt(i))) {
                throw new ConfigurationException("Invalid function name '" + name + "'");
            }
        }
    }
}
