package io.github.eutro.phpir.symbols;

import io.github.eutro.phpir.bound.ControlFlowGraph;

/**
 * The top level code of a source file.
 */
public class GlobalCodeSymbol extends RoutineSymbol {
    public GlobalCodeSymbol(SourceFile containingFile, Compilation compilation, ControlFlowGraph cfg) {
        super("{main}", containingFile, compilation, cfg);
    }

    @Override
    public boolean isGlobalScope() {
        return true;
    }

    @Override
    public String toString() {
        return getContainingFile() + "::{main}";
    }
}
