package io.github.eutro.phpir.symbols;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Facts discovered while rewriting single routines that affect the whole
 * compilation. They are collected from concurrently running passes, and
 * applied once every routine has been rewritten.
 */
public class DelayedTransformations {
    /**
     * Routines whose declarations can never execute.
     */
    public final Set<RoutineSymbol> unreachableRoutines = ConcurrentHashMap.newKeySet();
    /**
     * Types whose declarations can never execute.
     */
    public final Set<TypeSymbol> unreachableTypes = ConcurrentHashMap.newKeySet();
    /**
     * Conditionally declared functions whose declarations always execute.
     */
    public final Set<FunctionSymbol> functionsMarkedAsUnconditional = ConcurrentHashMap.newKeySet();
}
