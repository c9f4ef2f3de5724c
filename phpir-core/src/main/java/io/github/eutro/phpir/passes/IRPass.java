package io.github.eutro.phpir.passes;

import io.github.eutro.phpir.passes.misc.ChainedPass;
import io.github.eutro.phpir.symbols.RoutineSymbol;
import io.github.eutro.phpir.bound.ControlFlowGraph;

/**
 * A pass to run on some part of the IR (e.g. a {@link RoutineSymbol}, a {@link ControlFlowGraph}),
 * which may modify the IR, or convert it to a different form.
 * <p>
 * A pass may be <i>in-place</i>, in which case it must have the same
 * input and result types, and should return true for {@link #isInPlace()}.
 *
 * @param <A> The input type.
 * @param <B> The result type.
 */
public interface IRPass<A, B> {
    /**
     * Run the pass.
     *
     * @param a The IR to run it on.
     * @return The result.
     */
    B run(A a);

    /**
     * Get whether this pass is in-place.
     *
     * @return Whether this pass is in-place.
     */
    default boolean isInPlace() {
        return false;
    }

    /**
     * Compose this pass with another.
     *
     * @param next The pass to run after this.
     * @param <C>  The result type.
     * @return The composed pass.
     */
    default <C> IRPass<A, C> then(IRPass<B, C> next) {
        return new ChainedPass<>(this, next);
    }
}
