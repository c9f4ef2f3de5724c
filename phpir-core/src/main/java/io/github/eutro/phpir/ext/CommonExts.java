package io.github.eutro.phpir.ext;

import io.github.eutro.phpir.bound.BoundExpression;
import io.github.eutro.phpir.ops.Op;
import io.github.eutro.phpir.ops.OpKey;
import io.github.eutro.phpir.util.Purity;

/**
 * The {@link Ext}s that the rewriter reads and writes.
 */
public class CommonExts {
    /**
     * Attached to a {@link BoundExpression}, computed by the analysis that runs before the rewriter.
     * The statically known value of the expression.
     * <p>
     * PHP's {@code null} is a valid constant, and is stored as {@link #CONSTANT_NULL_SENTINEL}.
     *
     * @see BoundExpression#constantValue()
     */
    public static final Ext<Object> CONSTANT_VALUE = Ext.create(Object.class, "CONSTANT_VALUE");

    /**
     * An object that stands for null in {@link #CONSTANT_VALUE}.
     */
    public static final Object CONSTANT_NULL_SENTINEL = new Object() {
        @Override
        public String toString() {
            return "NULL";
        }
    };

    /**
     * If {@code obj} is null, return {@link #CONSTANT_NULL_SENTINEL}, otherwise {@code obj}.
     *
     * @param obj The object.
     * @return {@code obj}, or {@link #CONSTANT_NULL_SENTINEL} if it is null.
     */
    public static Object fillNull(Object obj) {
        return obj == null ? CONSTANT_NULL_SENTINEL : obj;
    }

    /**
     * If {@code obj} is {@link #CONSTANT_NULL_SENTINEL}, returns null, otherwise {@code obj}.
     *
     * @param obj The object.
     * @return {@code obj}, or {@code null} if it is {@link #CONSTANT_NULL_SENTINEL}.
     */
    public static Object takeNull(Object obj) {
        return obj == CONSTANT_NULL_SENTINEL ? null : obj;
    }

    /**
     * Attached to a {@link BoundExpression}, {@link Op} or {@link OpKey}.
     * Whether the expression has no observable side effects.
     *
     * @see Purity
     */
    public static final Ext<Boolean> IS_PURE = Ext.create(Boolean.class, "IS_PURE");

    /**
     * Attached to a {@link BoundExpression}, {@link Op} or {@link OpKey}.
     * Whether the value of the expression must be deep copied when it is stored,
     * which keeps a copy-value wrapper around it alive. Absent means it must.
     */
    public static final Ext<Boolean> IS_DEEPLY_COPIED = Ext.create(Boolean.class, "IS_DEEPLY_COPIED");

    /**
     * Attached to a {@link BoundExpression}, {@link Op} or {@link OpKey}.
     * Whether the expression always evaluates to a PHP boolean.
     */
    public static final Ext<Boolean> IS_BOOL_VALUED = Ext.create(Boolean.class, "IS_BOOL_VALUED");

    /**
     * Mark something as pure, by attaching {@link #IS_PURE} {@code = true} to it.
     *
     * @param t   The thing to mark as pure.
     * @param <T> The type of {@code t}.
     * @return {@code t}.
     */
    public static <T extends ExtContainer> T markPure(T t) {
        t.attachExt(IS_PURE, true);
        return t;
    }
}
