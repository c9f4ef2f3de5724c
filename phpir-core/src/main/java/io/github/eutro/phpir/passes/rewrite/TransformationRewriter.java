package io.github.eutro.phpir.passes.rewrite;

import com.google.common.base.Preconditions;
import io.github.eutro.phpir.bound.BoundExpression;
import io.github.eutro.phpir.bound.ControlFlowGraph;
import io.github.eutro.phpir.bound.Edge;
import io.github.eutro.phpir.passes.meta.VerifyIntegrity;
import io.github.eutro.phpir.passes.opts.*;
import io.github.eutro.phpir.symbols.DelayedTransformations;
import io.github.eutro.phpir.symbols.FunctionSymbol;
import io.github.eutro.phpir.symbols.RoutineSymbol;
import io.github.eutro.phpir.symbols.TypeSymbol;
import org.apache.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * The peephole rewriter run once on every routine: folds statically known
 * conditions, concatenations and calls, and canonicalizes assignments.
 * <p>
 * Each instance rewrites a single routine, see {@link #tryTransform(DelayedTransformations, RoutineSymbol)}.
 * Running it again on its own result changes nothing.
 */
public class TransformationRewriter extends GraphRewriter implements RewriteContext {
    private static final Logger LOGGER = Logger.getLogger(TransformationRewriter.class);

    /**
     * Whether to throw if a rewrite breaks an invariant, rather than keeping the
     * original graph. On with assertions, or with {@code PHPIR_STRICT_INVARIANTS} set.
     */
    public static boolean STRICT_INVARIANTS = System.getenv("PHPIR_STRICT_INVARIANTS") != null
            || TransformationRewriter.class.desiredAssertionStatus();

    private final DelayedTransformations delayedTransformations;
    private final RoutineSymbol routine;

    public TransformationRewriter(DelayedTransformations delayedTransformations, RoutineSymbol routine) {
        this.delayedTransformations = Preconditions.checkNotNull(delayedTransformations, "delayedTransformations");
        this.routine = Preconditions.checkNotNull(routine, "routine");
    }

    /**
     * Rewrite the graph of a routine, replacing it if anything changed.
     *
     * @param delayedTransformations Where to report unreachable declarations.
     * @param routine                The routine.
     * @return Whether the graph of the routine was replaced.
     */
    public static boolean tryTransform(DelayedTransformations delayedTransformations, RoutineSymbol routine) {
        return tryTransform(routine, new TransformationRewriter(delayedTransformations, routine));
    }

    /**
     * Rewrite the graph of a routine with a given rewriter, replacing it if anything changed.
     *
     * @param routine  The routine.
     * @param rewriter The rewriter, which must not have been used yet.
     * @return Whether the graph of the routine was replaced.
     * @throws RewriteInvariantException If the result is inconsistent and {@link #STRICT_INVARIANTS} is set.
     */
    public static boolean tryTransform(RoutineSymbol routine, GraphRewriter rewriter) {
        ControlFlowGraph currentCfg = routine.getControlFlowGraph();
        if (currentCfg == null) {
            // abstract method
            return false;
        }

        ControlFlowGraph updatedCfg = rewriter.visitCFG(currentCfg);
        int count = rewriter.getTransformationCount();
        boolean changed = updatedCfg != currentCfg;
        if ((count != 0) != changed) {
            String message = String.format(
                    "%d transformations, but the graph was %s\n  in routine: %s",
                    count,
                    changed ? "replaced" : "kept",
                    routine);
            if (STRICT_INVARIANTS) throw new RewriteInvariantException(message);
            LOGGER.error(message + "\n  keeping the original graph");
            return false;
        }

        if (changed) {
            if (STRICT_INVARIANTS) {
                try {
                    VerifyIntegrity.INSTANCE.runInPlace(updatedCfg);
                } catch (IllegalStateException e) {
                    throw new RewriteInvariantException("rewritten graph is malformed: " + e.getMessage()
                            + "\n  in routine: " + routine);
                }
            }
            routine.setControlFlowGraph(updatedCfg);
        }
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(String.format("%d transformations in %s", count, routine));
        }
        return changed;
    }

    @Override
    public RoutineSymbol getRoutine() {
        return routine;
    }

    @Override
    protected void onVisitCFG(ControlFlowGraph cfg) {
        Preconditions.checkState(routine.getControlFlowGraph() == cfg, "graph is not that of %s", routine);
    }

    @Override
    protected void onUnreachableRoutineFound(FunctionSymbol function) {
        LOGGER.debug(String.format("unreachable declaration of %s in %s", function, routine));
        delayedTransformations.unreachableRoutines.add(function);
    }

    @Override
    protected void onUnreachableTypeFound(TypeSymbol type) {
        LOGGER.debug(String.format("unreachable declaration of %s in %s", type, routine));
        delayedTransformations.unreachableTypes.add(type);
    }

    private <T> T rewritten(T current, @Nullable T replacement) {
        if (replacement == null) return current;
        noteTransformation();
        return replacement;
    }

    @Override
    protected BoundExpression visitLiteral(BoundExpression x) {
        return rewritten(x, ConvertCallables.INSTANCE.rewrite(this, x));
    }

    @Override
    protected BoundExpression visitBinary(BoundExpression x) {
        BoundExpression updated = visitChildren(x);
        return rewritten(updated, SimplifyExpressions.INSTANCE.simplifyLogical(this, updated));
    }

    @Override
    protected BoundExpression visitUnary(BoundExpression x) {
        BoundExpression folded = SimplifyExpressions.INSTANCE.simplifyDoubleNegation(this, x, true);
        if (folded != null) {
            noteTransformation();
            return folded;
        }
        // the operand may have become a negation itself
        BoundExpression updated = visitChildren(x);
        return rewritten(updated, SimplifyExpressions.INSTANCE.simplifyDoubleNegation(this, updated, false));
    }

    @Override
    protected BoundExpression visitConditional(BoundExpression x) {
        BoundExpression updated = visitChildren(x);
        return rewritten(updated, SimplifyExpressions.INSTANCE.simplifyConditional(this, updated));
    }

    @Override
    protected BoundExpression visitAssign(BoundExpression x) {
        BoundExpression updated = visitChildren(x);
        return rewritten(updated, CanonicalizeAssignments.INSTANCE.rewrite(this, updated));
    }

    @Override
    protected BoundExpression visitConcat(BoundExpression x) {
        BoundExpression updated = visitChildren(x);
        return rewritten(updated, FoldConcat.INSTANCE.rewrite(this, updated));
    }

    @Override
    protected BoundExpression visitCall(BoundExpression x) {
        BoundExpression updated = visitChildren(x);
        return rewritten(updated, IntrinsicCalls.INSTANCE.rewrite(this, updated));
    }

    @Override
    protected BoundExpression visitCopyValue(BoundExpression x) {
        BoundExpression updated = visitChildren(x);
        return rewritten(updated, SimplifyExpressions.INSTANCE.elideCopy(this, updated));
    }

    @Override
    protected Edge visitConditionalEdge(Edge edge) {
        Edge updated = super.visitConditionalEdge(edge);
        return rewritten(updated, SimplifyEdges.INSTANCE.simplify(this, updated));
    }
}
