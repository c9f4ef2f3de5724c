package io.github.eutro.phpir.symbols;

import org.jetbrains.annotations.Nullable;

/**
 * Resolves names to the symbols declared in a compilation.
 */
public interface SymbolProvider {
    /**
     * Resolve a global function.
     *
     * @param name The name of the function.
     * @return The function, an {@link AmbiguousRoutineSymbol} if several match, or null if none do.
     */
    @Nullable RoutineSymbol resolveFunction(QualifiedName name);
}
