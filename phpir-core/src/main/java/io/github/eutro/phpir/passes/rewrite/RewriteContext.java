package io.github.eutro.phpir.passes.rewrite;

import io.github.eutro.phpir.bound.BoundBlock;
import io.github.eutro.phpir.bound.BoundExpression;
import io.github.eutro.phpir.symbols.Compilation;
import io.github.eutro.phpir.symbols.RoutineSymbol;

/**
 * What a rewrite rule can see of the rewriter running it.
 */
public interface RewriteContext {
    /**
     * Get the routine being rewritten.
     *
     * @return The routine.
     */
    RoutineSymbol getRoutine();

    default Compilation getCompilation() {
        return getRoutine().getDeclaringCompilation();
    }

    /**
     * Rewrite an expression.
     *
     * @param x The expression.
     * @return The rewritten expression.
     * @see GraphRewriter#accept(BoundExpression)
     */
    BoundExpression accept(BoundExpression x);

    /**
     * Record that a block may no longer be reachable.
     *
     * @param block The block.
     * @see GraphRewriter#notePossiblyUnreachable(BoundBlock)
     */
    void notePossiblyUnreachable(BoundBlock block);
}
