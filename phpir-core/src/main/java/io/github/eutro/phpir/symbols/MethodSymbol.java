package io.github.eutro.phpir.symbols;

import com.google.common.base.Preconditions;
import io.github.eutro.phpir.bound.ControlFlowGraph;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A method of a class or trait. Abstract methods have no control flow graph.
 */
public class MethodSymbol extends RoutineSymbol {
    private final TypeSymbol containingType;

    public MethodSymbol(
            String name,
            TypeSymbol containingType,
            SourceFile containingFile,
            Compilation compilation,
            @Nullable ControlFlowGraph cfg
    ) {
        super(name, containingFile, compilation, cfg);
        this.containingType = Preconditions.checkNotNull(containingType, "containingType");
    }

    @Override
    public @NotNull TypeSymbol getContainingType() {
        return containingType;
    }

    @Override
    public boolean isGlobalScope() {
        return false;
    }

    @Override
    public String toString() {
        return containingType.getQualifiedName() + "::" + getName();
    }
}
