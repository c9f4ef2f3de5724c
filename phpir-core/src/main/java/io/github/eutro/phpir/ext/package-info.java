/**
 * The ext API associates arbitrary, typed facts with IR objects
 * that implement {@link io.github.eutro.phpir.ext.ExtContainer}.
 *
 * <pre>{@code
 * BoundExpression lit = Exprs.literal("abc");
 * lit.getNullable(CommonExts.CONSTANT_VALUE); // => "abc"
 *
 * BoundExpression call = Exprs.call(FunctionName.direct(QualifiedName.parse("foo", false)));
 * call.attachExt(CommonExts.IS_PURE, true);
 * Purity.isPure(call); // => true
 * }</pre>
 * <p>
 * Facts computed by earlier phases (constant values, purity, copy
 * requirements) reach the rewriter this way.
 */
package io.github.eutro.phpir.ext;
