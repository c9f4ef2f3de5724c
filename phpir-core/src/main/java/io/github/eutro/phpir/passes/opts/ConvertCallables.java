package io.github.eutro.phpir.passes.opts;

import io.github.eutro.phpir.bound.BoundAccess;
import io.github.eutro.phpir.bound.BoundExpression;
import io.github.eutro.phpir.bound.TypeRef;
import io.github.eutro.phpir.ops.PhpOps;
import io.github.eutro.phpir.passes.rewrite.ExpressionRule;
import io.github.eutro.phpir.passes.rewrite.RewriteContext;
import io.github.eutro.phpir.symbols.AmbiguousRoutineSymbol;
import io.github.eutro.phpir.symbols.QualifiedName;
import io.github.eutro.phpir.symbols.RoutineSymbol;
import org.jetbrains.annotations.Nullable;

/**
 * Binds string literals used as callables, like {@code array_map("foo", $xs)},
 * to the function they name, if it can be resolved at compile time.
 * <p>
 * The literal itself is kept as the operand, read as a plain string.
 */
public class ConvertCallables implements ExpressionRule {
    /**
     * A singleton instance of this rule.
     */
    public static final ConvertCallables INSTANCE = new ConvertCallables();

    @Override
    public @Nullable BoundExpression rewrite(RewriteContext ctx, BoundExpression x) {
        if (x.op.key != PhpOps.LITERAL) return null;
        if (x.access().getTargetType() != TypeRef.CALLABLE) return null;
        Object value = x.constantValue();
        if (!(value instanceof String)) return null;
        String text = (String) value;

        // TODO resolve "Type::method" once method lookup is part of SymbolProvider
        if (text.contains("::")) return null;

        QualifiedName name = QualifiedName.tryParse(text, true);
        if (name == null) return null;
        RoutineSymbol routine = ctx.getCompilation().getSymbols().resolveFunction(name);
        if (routine == null) return null;
        if (!routine.isValid()) {
            if (!(routine instanceof AmbiguousRoutineSymbol)) return null;
            AmbiguousRoutineSymbol ambiguous = (AmbiguousRoutineSymbol) routine;
            if (!ambiguous.isOverloadable() || ambiguous.getAmbiguities().isEmpty()) return null;
        }

        BoundExpression literal = x.withAccess(BoundAccess.READ.withRead(TypeRef.STRING));
        return PhpOps.CALLABLE_CONVERT.create(routine).expr(x.access(), literal);
    }
}
