package io.github.eutro.phpir.passes.opts;

import com.google.common.collect.Sets;
import io.github.eutro.phpir.bound.BoundAccess;
import io.github.eutro.phpir.bound.BoundExpression;
import io.github.eutro.phpir.bound.Variable;
import io.github.eutro.phpir.ops.IncDecKind;
import io.github.eutro.phpir.ops.Operation;
import io.github.eutro.phpir.ops.PhpOps;
import io.github.eutro.phpir.passes.rewrite.ExpressionRule;
import io.github.eutro.phpir.passes.rewrite.RewriteContext;
import io.github.eutro.phpir.util.PhpValues;
import io.github.eutro.phpir.util.Purity;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Set;

/**
 * Rewrites assignments of a variable to an operation on itself into the
 * in-place form: {@code $a = $a + 1} to {@code ++$a}, {@code $a = $a - 1}
 * to {@code --$a}, and {@code $a = $a op $b} to {@code $a op= $b}.
 * <p>
 * A right operand that is known to be 1 but has effects becomes {@code $a += f()}.
 */
public class CanonicalizeAssignments implements ExpressionRule {
    /**
     * A singleton instance of this rule.
     */
    public static final CanonicalizeAssignments INSTANCE = new CanonicalizeAssignments();

    private static final Set<Operation> COMPOUND_OPERATIONS = Sets.immutableEnumSet(
            Operation.BIT_AND,
            Operation.BIT_OR,
            Operation.BIT_XOR,
            Operation.SHIFT_LEFT,
            Operation.SHIFT_RIGHT,
            Operation.ADD,
            Operation.SUB,
            Operation.MUL,
            Operation.DIV,
            Operation.MOD,
            Operation.POW,
            Operation.CONCAT
    );

    @Override
    public @Nullable BoundExpression rewrite(RewriteContext ctx, BoundExpression x) {
        if (x.op.key != PhpOps.ASSIGN.key) return null;
        BoundExpression target = x.arg(0);
        Variable variable = PhpOps.VAR_REF.argNullable(target.op);
        if (variable == null) return null;
        BoundExpression value = skipCopies(x.arg(1));

        // the target is now also read
        BoundExpression newTarget = target.withAccess(target.access().withRead());

        Operation operation = PhpOps.BINARY.argNullable(value.op);
        if (operation != null) {
            if (!isReferenceTo(value.arg(0), variable)) return null;
            BoundExpression right = value.arg(1);

            if ((operation == Operation.ADD || operation == Operation.SUB)
                    && right.hasConstantValue()
                    && PhpValues.isInteger(right.constantValue(), 1)
                    && Purity.isPure(right)) {
                return PhpOps.INC_DEC.create(IncDecKind.prefix(operation == Operation.ADD))
                        .expr(x.access(), newTarget);
            }

            if (!COMPOUND_OPERATIONS.contains(operation)) return null;
            return PhpOps.COMPOUND_ASSIGN.create(operation).expr(x.access(), newTarget, right);
        }

        if (value.op.key == PhpOps.CONCAT.key) {
            List<BoundExpression> parts = value.args();
            if (parts.size() < 2 || !isReferenceTo(parts.get(0), variable)) return null;
            List<BoundExpression> rest = parts.subList(1, parts.size());
            BoundExpression appended = rest.size() == 1
                    ? rest.get(0)
                    : PhpOps.CONCAT.expr(BoundAccess.READ, rest);
            return PhpOps.COMPOUND_ASSIGN.create(Operation.CONCAT).expr(x.access(), newTarget, appended);
        }

        return null;
    }

    private static boolean isReferenceTo(BoundExpression x, Variable variable) {
        return PhpOps.VAR_REF.argNullable(x.op) == variable;
    }

    private static BoundExpression skipCopies(BoundExpression x) {
        // the value is combined in place, so the copy has nothing left to protect
        while (x.op.key == PhpOps.COPY_VALUE.key) {
            x = x.arg(0);
        }
        return x;
    }
}
