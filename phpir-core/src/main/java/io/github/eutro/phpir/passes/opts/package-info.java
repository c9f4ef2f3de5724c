/**
 * The peephole rules of the {@link io.github.eutro.phpir.passes.rewrite.TransformationRewriter},
 * and the {@link io.github.eutro.phpir.passes.IRPass IR passes} that run it.
 * <p>
 * The rules are not <i>always</i> strictly necessary, but result in smaller and faster code.
 */
package io.github.eutro.phpir.passes.opts;
