/**
 * The bound tree of a routine: {@link io.github.eutro.phpir.bound.BoundExpression expressions}
 * and {@link io.github.eutro.phpir.bound.BoundStatement statements}, grouped into
 * {@link io.github.eutro.phpir.bound.BoundBlock blocks} of a
 * {@link io.github.eutro.phpir.bound.ControlFlowGraph control flow graph}.
 */
package io.github.eutro.phpir.bound;
