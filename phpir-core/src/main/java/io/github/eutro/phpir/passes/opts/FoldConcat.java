package io.github.eutro.phpir.passes.opts;

import io.github.eutro.phpir.bound.BoundAccess;
import io.github.eutro.phpir.bound.BoundExpression;
import io.github.eutro.phpir.bound.Exprs;
import io.github.eutro.phpir.bound.TypeRef;
import io.github.eutro.phpir.ops.PhpOps;
import io.github.eutro.phpir.passes.rewrite.ExpressionRule;
import io.github.eutro.phpir.passes.rewrite.RewriteContext;
import io.github.eutro.phpir.util.PhpValues;
import io.github.eutro.phpir.util.Purity;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Folds the parts of a string concatenation that are known at compile time.
 * <p>
 * Adjacent known parts are merged in a single pass from left to right, so
 * {@code "a" . "b" . $x . "c" . "d"} becomes {@code "ab" . $x . "cd"}. Known parts
 * are never merged across an unknown one. Empty parts are dropped, and a
 * concatenation left with a single part is replaced by that part.
 */
public class FoldConcat implements ExpressionRule {
    /**
     * A singleton instance of this rule.
     */
    public static final FoldConcat INSTANCE = new FoldConcat();

    @Override
    public @Nullable BoundExpression rewrite(RewriteContext ctx, BoundExpression x) {
        if (x.op.key != PhpOps.CONCAT.key) return null;
        List<BoundExpression> parts = x.args();
        if (parts.isEmpty() || allEmpty(parts)) {
            return Exprs.str("").withAccessOf(x);
        }

        List<BoundExpression> newParts = new ArrayList<>(parts.size());
        boolean changed = false;
        int i = 0;
        while (i < parts.size()) {
            BoundExpression part = parts.get(i);
            String value = foldable(part);
            if (value == null) {
                newParts.add(part);
                i++;
                continue;
            }

            StringBuilder sb = new StringBuilder(value);
            int end = i + 1;
            String next;
            while (end < parts.size() && (next = foldable(parts.get(end))) != null) {
                sb.append(next);
                end++;
            }

            if (end > i + 1 || sb.length() == 0) {
                changed = true;
                if (sb.length() != 0) {
                    newParts.add(Exprs.str(sb.toString()));
                }
            } else {
                newParts.add(part);
            }
            i = end;
        }

        if (!changed) return null;
        if (newParts.isEmpty()) {
            return Exprs.str("").withAccessOf(x);
        }
        if (newParts.size() == 1) {
            BoundExpression only = newParts.get(0);
            String value = foldable(only);
            if (value != null) {
                return Exprs.str(value).withAccessOf(x);
            }
            BoundAccess access = x.access();
            if (access.isRead() && access.getTargetType() == null) {
                // still converted to a string, as the concatenation did
                return only.withAccess(access.withRead(TypeRef.STRING));
            }
        }
        return x.update(newParts);
    }

    private static boolean allEmpty(List<BoundExpression> parts) {
        for (BoundExpression part : parts) {
            if (!"".equals(foldable(part))) return false;
        }
        return true;
    }

    private static @Nullable String foldable(BoundExpression part) {
        if (!Purity.isPure(part)) return null;
        return PhpValues.knownString(part);
    }
}
