package io.github.eutro.phpir.passes.opts;

import com.google.common.base.Preconditions;
import io.github.eutro.phpir.bound.BoundBlock;
import io.github.eutro.phpir.bound.BoundStatement;
import io.github.eutro.phpir.bound.ControlFlowGraph;
import io.github.eutro.phpir.bound.Edge;
import io.github.eutro.phpir.ops.PhpOps;
import io.github.eutro.phpir.passes.InPlaceIRPass;
import io.github.eutro.phpir.symbols.DelayedTransformations;
import io.github.eutro.phpir.symbols.FunctionSymbol;
import io.github.eutro.phpir.symbols.GlobalCodeSymbol;
import io.github.eutro.phpir.symbols.RoutineSymbol;
import io.github.eutro.phpir.util.GraphWalker;

import java.util.Collections;
import java.util.List;

/**
 * A pass which finds declarations of conditional functions in global code that
 * are always executed, once folded edges have made them so, and reports the
 * functions as unconditional.
 * <p>
 * A block is always executed if it is reached from the start block through
 * unconditional jumps only, where a conditional jump to the same block on
 * both sides counts as unconditional.
 */
public class MarkUnconditionalDeclarations implements InPlaceIRPass<RoutineSymbol> {
    private final DelayedTransformations delayedTransformations;

    public MarkUnconditionalDeclarations(DelayedTransformations delayedTransformations) {
        this.delayedTransformations = Preconditions.checkNotNull(delayedTransformations, "delayedTransformations");
    }

    @Override
    public void runInPlace(RoutineSymbol routine) {
        // functions are global scope too, but declare nothing until called
        if (!(routine instanceof GlobalCodeSymbol)) return;
        ControlFlowGraph cfg = routine.getControlFlowGraph();
        if (cfg == null) return;

        GraphWalker<BoundBlock> walker = new GraphWalker<>(cfg.start(), MarkUnconditionalDeclarations::alwaysNext);
        for (BoundBlock block : walker.preOrder()) {
            for (BoundStatement statement : block.getStatements()) {
                FunctionSymbol function = PhpOps.FUNCTION_DECL.argNullable(statement.op);
                if (function != null && function.isConditional()) {
                    delayedTransformations.functionsMarkedAsUnconditional.add(function);
                }
            }
        }
    }

    private static List<BoundBlock> alwaysNext(BoundBlock block) {
        Edge edge = block.getEdge();
        if (edge.op.key == PhpOps.BR.key) return edge.targets;
        if (edge.isConditional() && edge.trueTarget() == edge.falseTarget()) {
            return Collections.singletonList(edge.trueTarget());
        }
        return Collections.emptyList();
    }
}
