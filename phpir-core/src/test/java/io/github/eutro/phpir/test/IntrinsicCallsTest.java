package io.github.eutro.phpir.test;

import io.github.eutro.phpir.bound.*;
import io.github.eutro.phpir.ops.PhpOps;
import io.github.eutro.phpir.ops.PseudoConstKind;
import io.github.eutro.phpir.symbols.*;
import org.junit.jupiter.api.Test;

import static io.github.eutro.phpir.test.Utils.*;
import static org.junit.jupiter.api.Assertions.*;

public class IntrinsicCallsTest {
    private static BoundExpression file() {
        return Exprs.pseudoConst(PseudoConstKind.FILE);
    }

    private static void assertLiteral(Object expected, BoundExpression actual) {
        assertSame(PhpOps.LITERAL, actual.op.key, () -> "not a literal: " + actual);
        assertEquals(expected, actual.constantValue());
    }

    @Test
    void testDirname() {
        BoundExpression result = rewrite(call("dirname", file()));
        assertSame(PseudoConstKind.DIR, PhpOps.PSEUDO_CONST.argNullable(result.op));
    }

    @Test
    void testBasename() {
        assertLiteral("helpers.php", rewrite(call("basename", file())));
    }

    @Test
    void testOtherArgumentsKept() {
        BoundExpression dirname = call("dirname", Exprs.str("a/b.php"));
        assertSame(dirname, rewrite(dirname));
        BoundExpression basename = call("basename", file(), Exprs.str(".php"));
        assertSame(basename, rewrite(basename));
    }

    @Test
    void testCaseInsensitiveName() {
        BoundExpression result = rewrite(call("DirName", file()));
        assertSame(PseudoConstKind.DIR, PhpOps.PSEUDO_CONST.argNullable(result.op));
    }

    @Test
    void testAccessIsKept() {
        BoundAccess access = BoundAccess.READ.withRead(TypeRef.STRING);
        BoundExpression result = rewrite(call("basename", file()).withAccess(access));
        assertEquals(access, result.access());
    }

    @Test
    void testExtensionLoaded() {
        Compilation compilation = compilation("mbstring", "Xdebug.Foo");
        FunctionSymbol routine = function(compilation, "test", emptyGraph());
        assertLiteral(true, rewriteIn(routine, call("extension_loaded", Exprs.str("MBString"))));
        assertLiteral(false, rewriteIn(routine, call("extension_loaded", Exprs.str("intl"))));
        assertLiteral(false, rewriteIn(routine, call("extension_loaded", Exprs.str("xdebug.foo"))));
    }

    @Test
    void testExtensionLoadedUnknown() {
        BoundExpression unknown = call("extension_loaded", Exprs.ref(Variable.local("name")));
        assertSame(unknown, rewrite(unknown));
        BoundExpression effect = call("extension_loaded", call("name").withConstantValue("mbstring"));
        assertSame(effect, rewrite(effect));
    }

    @Test
    void testIniGet() {
        assertLiteral(false, rewrite(call("ini_get", Exprs.str("xdebug.max_nesting_level"))));
        assertLiteral(false, rewrite(call("ini_get", Exprs.str("opcache.enable"))));
        BoundExpression kept = call("ini_get", Exprs.str("memory_limit"));
        assertSame(kept, rewrite(kept));
    }

    @Test
    void testMethodExists() {
        assertLiteral(false, rewrite(call("method_exists", Exprs.bool(false), Exprs.str("foo"))));
        assertLiteral(false, rewrite(call("method_exists", Exprs.literal(null), Exprs.str("foo"))));

        BoundExpression object = call("method_exists", Exprs.ref(Variable.local("o")), Exprs.str("foo"));
        assertSame(object, rewrite(object));
        BoundExpression effect = call("method_exists", Exprs.bool(false), call("name"));
        assertSame(effect, rewrite(effect));
    }

    @Test
    void testGetParentClassOutsideClass() {
        Compilation compilation = compilation();
        assertLiteral(false, rewrite(call("get_parent_class")));
        GlobalCodeSymbol main = new GlobalCodeSymbol(FILE, compilation, emptyGraph());
        assertLiteral(false, rewriteIn(main, call("get_parent_class")));
    }

    @Test
    void testGetParentClassInClass() {
        Compilation compilation = compilation();
        TypeSymbol base = TypeSymbol.ofClass(QualifiedName.parse("App\\Base", false), null);
        TypeSymbol derived = TypeSymbol.ofClass(QualifiedName.parse("App\\Derived", false), base);
        MethodSymbol method = new MethodSymbol("run", derived, FILE, compilation, emptyGraph());

        assertLiteral("App\\Base", rewriteIn(method, call("get_parent_class")));
        assertLiteral("App\\Base", rewriteIn(method,
                call("get_parent_class", Exprs.ref(Variable.thisVariable()))));
        assertLiteral("App\\Base", rewriteIn(method,
                call("get_parent_class", Exprs.pseudoConst(PseudoConstKind.CLASS))));

        BoundExpression other = call("get_parent_class", Exprs.ref(Variable.local("other")));
        assertSame(other, rewriteIn(method, other));

        MethodSymbol inBase = new MethodSymbol("run", base, FILE, compilation, emptyGraph());
        assertLiteral(false, rewriteIn(inBase, call("get_parent_class")));
    }

    @Test
    void testGetParentClassInTrait() {
        TypeSymbol trait = TypeSymbol.ofTrait(QualifiedName.of("Helpers"));
        MethodSymbol method = new MethodSymbol("run", trait, FILE, compilation(), emptyGraph());
        BoundExpression expr = call("get_parent_class");
        assertSame(expr, rewriteIn(method, expr));
    }

    @Test
    void testNamespaceFallback() {
        FunctionName name = FunctionName.direct(
                QualifiedName.parse("App\\basename", false),
                QualifiedName.of("basename"));
        assertLiteral("helpers.php", rewrite(Exprs.call(name, file())));

        SourceSymbolTable symbols = new SourceSymbolTable();
        Compilation compilation = compilation(symbols);
        symbols.addFunction(new FunctionSymbol(
                QualifiedName.parse("App\\basename", false), FILE, compilation, emptyGraph(), false));
        BoundExpression shadowed = Exprs.call(name, file());
        assertSame(shadowed, rewriteIn(function(compilation, "test", emptyGraph()), shadowed));
    }

    @Test
    void testNamespacedNameIsNotIntrinsic() {
        BoundExpression expr = call("App\\basename", file());
        assertSame(expr, rewrite(expr));
    }

    @Test
    void testIndirectCallKept() {
        BoundExpression expr = Exprs.indirectCall(Exprs.str("basename"), file());
        assertSame(expr, rewrite(expr));
    }
}
