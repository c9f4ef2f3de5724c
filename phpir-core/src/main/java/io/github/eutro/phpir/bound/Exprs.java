package io.github.eutro.phpir.bound;

import io.github.eutro.phpir.ext.CommonExts;
import io.github.eutro.phpir.ops.IncDecKind;
import io.github.eutro.phpir.ops.Operation;
import io.github.eutro.phpir.ops.PhpOps;
import io.github.eutro.phpir.ops.PseudoConstKind;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Factories for {@link BoundExpression}s. Unless stated otherwise,
 * the built nodes are {@link BoundAccess#READ read}.
 */
public class Exprs {
    /**
     * A literal, with its constant value set.
     *
     * @param value The value, a {@link Boolean}, {@link Long}, {@link Double}, {@link String} or null.
     * @return The literal.
     */
    public static BoundExpression literal(@Nullable Object value) {
        return PhpOps.LITERAL.create(value)
                .expr(BoundAccess.READ)
                .withConstantValue(value);
    }

    public static BoundExpression bool(boolean value) {
        return literal(value);
    }

    public static BoundExpression str(String value) {
        return literal(value);
    }

    public static BoundExpression integer(long value) {
        return literal(value);
    }

    public static BoundExpression ref(Variable variable) {
        return PhpOps.VAR_REF.create(variable).expr(BoundAccess.READ);
    }

    public static BoundExpression binary(Operation op, BoundExpression left, BoundExpression right) {
        return PhpOps.BINARY.create(op).expr(BoundAccess.READ, left, right);
    }

    public static BoundExpression unary(Operation op, BoundExpression operand) {
        return PhpOps.UNARY.create(op).expr(BoundAccess.READ, operand);
    }

    public static BoundExpression not(BoundExpression operand) {
        return unary(Operation.LOGIC_NEGATION, operand);
    }

    /**
     * {@code condition ? ifTrue : ifFalse}
     */
    public static BoundExpression conditional(BoundExpression condition, BoundExpression ifTrue, BoundExpression ifFalse) {
        return PhpOps.CONDITIONAL.expr(BoundAccess.READ, condition, ifTrue, ifFalse);
    }

    /**
     * {@code condition ?: ifFalse}
     */
    public static BoundExpression elvis(BoundExpression condition, BoundExpression ifFalse) {
        return PhpOps.CONDITIONAL.expr(BoundAccess.READ, condition, ifFalse);
    }

    /**
     * {@code target = value}, with the target written.
     */
    public static BoundExpression assign(BoundExpression target, BoundExpression value) {
        return PhpOps.ASSIGN.expr(BoundAccess.READ, target.withAccess(BoundAccess.WRITE), value);
    }

    public static BoundExpression concat(BoundExpression... parts) {
        return concat(Arrays.asList(parts));
    }

    public static BoundExpression concat(List<BoundExpression> parts) {
        return PhpOps.CONCAT.expr(BoundAccess.READ, parts);
    }

    /**
     * A direct call.
     */
    public static BoundExpression call(FunctionName name, BoundExpression... args) {
        return PhpOps.CALL.create(name).expr(BoundAccess.READ, args);
    }

    /**
     * A call through a name expression.
     */
    public static BoundExpression indirectCall(BoundExpression name, BoundExpression... args) {
        List<BoundExpression> allArgs = new ArrayList<>(args.length + 1);
        allArgs.add(name);
        allArgs.addAll(Arrays.asList(args));
        return PhpOps.CALL.create(FunctionName.indirect()).expr(BoundAccess.READ, allArgs);
    }

    public static BoundExpression pseudoConst(PseudoConstKind kind) {
        return PhpOps.PSEUDO_CONST.create(kind).expr(BoundAccess.READ);
    }

    public static BoundExpression convert(TypeRef type, BoundExpression operand) {
        return PhpOps.CONVERT.create(type).expr(BoundAccess.READ, operand);
    }

    public static BoundExpression incDec(IncDecKind kind, BoundExpression target) {
        return PhpOps.INC_DEC.create(kind).expr(BoundAccess.READ, target.withAccess(BoundAccess.READ_WRITE));
    }

    public static BoundExpression copyValue(BoundExpression operand) {
        return PhpOps.COPY_VALUE.expr(BoundAccess.READ, operand);
    }

    /**
     * Whether {@code expr} always evaluates to a PHP boolean.
     *
     * @param expr The expression.
     * @return Whether it does.
     */
    public static boolean isBoolValued(BoundExpression expr) {
        Boolean marked = expr.getNullable(CommonExts.IS_BOOL_VALUED);
        if (marked != null) return marked;
        if (expr.hasConstantValue()) return expr.constantValue() instanceof Boolean;
        Operation operation = PhpOps.BINARY.argNullable(expr.op);
        if (operation == null) operation = PhpOps.UNARY.argNullable(expr.op);
        if (operation != null) return operation.producesBool();
        return PhpOps.CONVERT.argNullable(expr.op) == TypeRef.BOOL;
    }
}
