package org.pragmatica.smtfuzz.tree;

import com.google.common.collect.ImmutableSet;

/**
 * Top-level SMT-LIB command names grouped by the node variant they parse into.
 */
public final class Commands {
    public static final String ASSERT = "assert";
    public static final String CHECK_SAT = "check-sat";
    public static final String SET_LOGIC = "set-logic";

    public static final ImmutableSet<String> SETTINGS = ImmutableSet.of(SET_LOGIC, "set-option", "set-info");

    public static final ImmutableSet<String> META = ImmutableSet.of(
        CHECK_SAT, "check-sat-assuming", "push", "pop", "reset", "reset-assertions", "exit", "echo");

    /**
     * Commands introducing a named symbol as their first argument.
     */
    public static final ImmutableSet<String> DECLARATIONS = ImmutableSet.of(
        "declare-fun", "declare-const", "define-fun", "define-fun-rec");

    public static final ImmutableSet<String> SORT_DECLARATIONS = ImmutableSet.of("declare-sort", "define-sort");

    /**
     * Model and info requests; meaningless once a problem has been mutated.
     */
    public static final ImmutableSet<String> QUERIES = ImmutableSet.of(
        "get-model", "get-info", "get-value", "get-assertions", "get-assignment", "get-proof",
        "get-unsat-core", "get-unsat-assumptions", "get-option");

    private Commands() {}

    public static boolean isSetting(String command) {
        return SETTINGS.contains(command);
    }

    public static boolean isMeta(String command) {
        return META.contains(command);
    }

    public static boolean isQuery(String command) {
        return QUERIES.contains(command);
    }

    public static boolean isDeclaration(String command) {
        return DECLARATIONS.contains(command);
    }

    /**
     * Whether {@code command} may appear as a top-level form.
     */
    public static boolean isKnown(String command) {
        return ASSERT.equals(command)
               || SETTINGS.contains(command)
               || META.contains(command)
               || DECLARATIONS.contains(command)
               || SORT_DECLARATIONS.contains(command)
               || QUERIES.contains(command);
    }
}
