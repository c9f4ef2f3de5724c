package io.github.eutro.phpir.symbols;

import com.google.common.base.Preconditions;
import io.github.eutro.phpir.bound.ControlFlowGraph;
import org.jetbrains.annotations.Nullable;

/**
 * A compiled routine: a function, a method, or the global code of a file.
 * <p>
 * The control flow graph is replaced by the passes that rewrite it.
 */
public abstract class RoutineSymbol {
    private final String name;
    private final SourceFile containingFile;
    private final Compilation compilation;
    @Nullable
    private volatile ControlFlowGraph controlFlowGraph;

    protected RoutineSymbol(
            String name,
            SourceFile containingFile,
            Compilation compilation,
            @Nullable ControlFlowGraph controlFlowGraph
    ) {
        this.name = Preconditions.checkNotNull(name, "name");
        this.containingFile = Preconditions.checkNotNull(containingFile, "containingFile");
        this.compilation = Preconditions.checkNotNull(compilation, "compilation");
        this.controlFlowGraph = controlFlowGraph;
    }

    public String getName() {
        return name;
    }

    public SourceFile getContainingFile() {
        return containingFile;
    }

    public Compilation getDeclaringCompilation() {
        return compilation;
    }

    /**
     * Get the control flow graph of this routine.
     *
     * @return The graph, or null if the routine has no body.
     */
    public @Nullable ControlFlowGraph getControlFlowGraph() {
        return controlFlowGraph;
    }

    public void setControlFlowGraph(@Nullable ControlFlowGraph controlFlowGraph) {
        this.controlFlowGraph = controlFlowGraph;
    }

    /**
     * Get the type this routine is declared in.
     *
     * @return The type, or null for routines outside of any type.
     */
    public @Nullable TypeSymbol getContainingType() {
        return null;
    }

    /**
     * Whether this routine runs outside of any class context,
     * i.e. it is a global function or the global code of a file.
     *
     * @return Whether it does.
     */
    public abstract boolean isGlobalScope();

    /**
     * Whether this symbol denotes exactly one routine.
     *
     * @return Whether it does.
     */
    public boolean isValid() {
        return true;
    }

    @Override
    public String toString() {
        return name;
    }
}
