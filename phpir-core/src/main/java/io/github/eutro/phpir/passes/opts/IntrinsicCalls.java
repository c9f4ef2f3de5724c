package io.github.eutro.phpir.passes.opts;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.github.eutro.phpir.bound.BoundExpression;
import io.github.eutro.phpir.bound.Exprs;
import io.github.eutro.phpir.bound.FunctionName;
import io.github.eutro.phpir.bound.Variable;
import io.github.eutro.phpir.ops.PhpOps;
import io.github.eutro.phpir.ops.PseudoConstKind;
import io.github.eutro.phpir.passes.rewrite.ExpressionRule;
import io.github.eutro.phpir.passes.rewrite.RewriteContext;
import io.github.eutro.phpir.symbols.QualifiedName;
import io.github.eutro.phpir.symbols.RoutineSymbol;
import io.github.eutro.phpir.symbols.TypeSymbol;
import io.github.eutro.phpir.util.PhpValues;
import io.github.eutro.phpir.util.Purity;
import org.apache.log4j.Logger;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Locale;

/**
 * Evaluates calls to well-known library functions whose result is known at compile time.
 * <p>
 * Only direct calls are considered. The rules are looked up by the lower case name of
 * the called function and see the call with its arguments already rewritten.
 * A rule only drops arguments that are {@link Purity#isPure(BoundExpression) pure}.
 */
public class IntrinsicCalls implements ExpressionRule {
    private static final Logger LOGGER = Logger.getLogger(IntrinsicCalls.class);

    /**
     * A singleton instance of this rule.
     */
    public static final IntrinsicCalls INSTANCE = new IntrinsicCalls();

    /**
     * Configuration options of extensions that are never available to compiled code.
     */
    public static final List<String> EXCLUDED_OPTION_PREFIXES = ImmutableList.of(
            "xdebug.",
            "xcache.",
            "opcache.",
            "apc."
    );

    private static final ImmutableMap<String, ExpressionRule> RULES = ImmutableMap.<String, ExpressionRule>builder()
            .put("dirname", IntrinsicCalls::dirname)
            .put("basename", IntrinsicCalls::basename)
            .put("get_parent_class", IntrinsicCalls::getParentClass)
            .put("method_exists", IntrinsicCalls::methodExists)
            .put("ini_get", IntrinsicCalls::iniGet)
            .put("extension_loaded", IntrinsicCalls::extensionLoaded)
            .build();

    @Override
    public @Nullable BoundExpression rewrite(RewriteContext ctx, BoundExpression x) {
        FunctionName name = PhpOps.CALL.argNullable(x.op);
        if (name == null || !name.isDirect()) return null;
        ExpressionRule rule = lookup(ctx, name);
        if (rule == null) return null;
        return rule.rewrite(ctx, x);
    }

    private static @Nullable ExpressionRule lookup(RewriteContext ctx, FunctionName name) {
        QualifiedName qualified = name.getNameValue();
        assert qualified != null;
        ExpressionRule rule = ruleFor(qualified);
        if (rule != null) return rule;

        // foo() in a namespace calls \foo() only if there is no namespaced foo()
        QualifiedName fallback = name.getFallbackName();
        if (fallback == null) return null;
        if (ctx.getCompilation().getSymbols().resolveFunction(qualified) != null) return null;
        return ruleFor(fallback);
    }

    private static @Nullable ExpressionRule ruleFor(QualifiedName name) {
        if (!name.getNamespaces().isEmpty()) return null;
        return RULES.get(name.getName().toLowerCase(Locale.ROOT));
    }

    private static boolean isFileConst(BoundExpression x) {
        return PhpOps.PSEUDO_CONST.argNullable(x.op) == PseudoConstKind.FILE;
    }

    private static BoundExpression falseLiteral(BoundExpression x) {
        return Exprs.bool(false).withAccessOf(x);
    }

    // dirname(__FILE__) -> __DIR__
    private static @Nullable BoundExpression dirname(RewriteContext ctx, BoundExpression x) {
        if (x.args().size() != 1 || !isFileConst(x.arg(0))) return null;
        return Exprs.pseudoConst(PseudoConstKind.DIR).withAccessOf(x);
    }

    // basename(__FILE__) -> "file.php"
    private static @Nullable BoundExpression basename(RewriteContext ctx, BoundExpression x) {
        if (x.args().size() != 1 || !isFileConst(x.arg(0))) return null;
        return Exprs.str(ctx.getRoutine().getContainingFile().fileName()).withAccessOf(x);
    }

    // get_parent_class(), get_parent_class($this), get_parent_class(__CLASS__) -> "Base" | false
    private static @Nullable BoundExpression getParentClass(RewriteContext ctx, BoundExpression x) {
        List<BoundExpression> args = x.args();
        if (args.size() > 1) return null;
        if (args.size() == 1) {
            BoundExpression arg = args.get(0);
            Variable variable = PhpOps.VAR_REF.argNullable(arg.op);
            boolean isThis = variable != null && variable.isThis();
            boolean isClass = PhpOps.PSEUDO_CONST.argNullable(arg.op) == PseudoConstKind.CLASS;
            if (!isThis && !isClass) return null;
        }

        RoutineSymbol routine = ctx.getRoutine();
        if (routine.isGlobalScope()) {
            return falseLiteral(x);
        }
        TypeSymbol type = routine.getContainingType();
        // a trait's parent is that of the class using it
        if (type == null || type.isTrait()) return null;
        TypeSymbol baseType = type.getBaseType();
        if (baseType == null || baseType.isObjectType()) {
            return falseLiteral(x);
        }
        return Exprs.str(baseType.getQualifiedName().toString()).withAccessOf(x);
    }

    // method_exists(false, ...) -> false
    private static @Nullable BoundExpression methodExists(RewriteContext ctx, BoundExpression x) {
        if (x.args().size() != 2) return null;
        BoundExpression subject = x.arg(0);
        if (!Boolean.FALSE.equals(PhpValues.knownBool(subject))) return null;
        if (!Purity.isPure(subject) || !Purity.isPure(x.arg(1))) return null;
        return falseLiteral(x);
    }

    // ini_get("xdebug.*") -> false
    private static @Nullable BoundExpression iniGet(RewriteContext ctx, BoundExpression x) {
        if (x.args().size() != 1) return null;
        String option = pureString(x.arg(0));
        if (option == null || !isExcludedOption(option)) return null;
        return falseLiteral(x);
    }

    // extension_loaded("ext") -> true | false
    private static @Nullable BoundExpression extensionLoaded(RewriteContext ctx, BoundExpression x) {
        if (x.args().size() != 1) return null;
        String extension = pureString(x.arg(0));
        if (extension == null) return null;
        boolean loaded = !isExcludedOption(extension) && ctx.getCompilation().hasExtension(extension);
        LOGGER.debug(String.format("'extension_loaded(%s)' evaluated to %b in %s", extension, loaded, ctx.getRoutine()));
        return Exprs.bool(loaded).withAccessOf(x);
    }

    private static boolean isExcludedOption(String name) {
        for (String prefix : EXCLUDED_OPTION_PREFIXES) {
            if (name.startsWith(prefix)) return true;
        }
        return false;
    }

    private static @Nullable String pureString(BoundExpression x) {
        if (!Purity.isPure(x)) return null;
        return PhpValues.knownString(x);
    }
}
