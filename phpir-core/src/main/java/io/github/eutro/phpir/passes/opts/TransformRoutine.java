package io.github.eutro.phpir.passes.opts;

import com.google.common.base.Preconditions;
import io.github.eutro.phpir.passes.InPlaceIRPass;
import io.github.eutro.phpir.passes.rewrite.TransformationRewriter;
import io.github.eutro.phpir.symbols.DelayedTransformations;
import io.github.eutro.phpir.symbols.RoutineSymbol;

/**
 * A pass which runs the {@link TransformationRewriter} on a routine.
 */
public class TransformRoutine implements InPlaceIRPass<RoutineSymbol> {
    private final DelayedTransformations delayedTransformations;

    /**
     * @param delayedTransformations Where unreachable declarations are reported.
     */
    public TransformRoutine(DelayedTransformations delayedTransformations) {
        this.delayedTransformations = Preconditions.checkNotNull(delayedTransformations, "delayedTransformations");
    }

    @Override
    public void runInPlace(RoutineSymbol routine) {
        TransformationRewriter.tryTransform(delayedTransformations, routine);
    }
}
