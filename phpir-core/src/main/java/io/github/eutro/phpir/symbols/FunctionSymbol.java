package io.github.eutro.phpir.symbols;

import io.github.eutro.phpir.bound.ControlFlowGraph;
import org.jetbrains.annotations.Nullable;

/**
 * A global function.
 */
public class FunctionSymbol extends RoutineSymbol {
    private final QualifiedName qualifiedName;
    private final boolean isConditional;

    /**
     * @param qualifiedName  The name of the function.
     * @param containingFile The file it is declared in.
     * @param compilation    The compilation.
     * @param cfg            The body.
     * @param isConditional  Whether the declaration is only executed under some condition,
     *                       e.g. inside an {@code if}.
     */
    public FunctionSymbol(
            QualifiedName qualifiedName,
            SourceFile containingFile,
            Compilation compilation,
            @Nullable ControlFlowGraph cfg,
            boolean isConditional
    ) {
        super(qualifiedName.toString(), containingFile, compilation, cfg);
        this.qualifiedName = qualifiedName;
        this.isConditional = isConditional;
    }

    public QualifiedName getQualifiedName() {
        return qualifiedName;
    }

    public boolean isConditional() {
        return isConditional;
    }

    @Override
    public boolean isGlobalScope() {
        return true;
    }
}
