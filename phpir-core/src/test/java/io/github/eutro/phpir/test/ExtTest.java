package io.github.eutro.phpir.test;

import io.github.eutro.phpir.bound.BoundExpression;
import io.github.eutro.phpir.bound.Exprs;
import io.github.eutro.phpir.bound.TypeRef;
import io.github.eutro.phpir.bound.Variable;
import io.github.eutro.phpir.ext.CommonExts;
import io.github.eutro.phpir.ext.Ext;
import io.github.eutro.phpir.ext.ExtHolder;
import io.github.eutro.phpir.ops.PhpOps;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ExtTest {
    private static final Ext<String> NOTE = Ext.create(String.class, "NOTE");

    @Test
    void testAttach() {
        ExtHolder holder = new ExtHolder();
        assertNull(holder.getNullable(NOTE));
        assertThrows(IllegalStateException.class, () -> holder.getExtOrThrow(NOTE));

        holder.attachExt(NOTE, "hello");
        assertEquals("hello", holder.getExtOrThrow(NOTE));
        assertEquals("NOTE", NOTE.getName());
        assertEquals("fallback", NOTE.getOrDefault(new ExtHolder(), "fallback"));
    }

    @Test
    void testDelegation() {
        BoundExpression literal = Exprs.str("x");
        assertEquals(Boolean.TRUE, literal.getExtOrThrow(CommonExts.IS_PURE));
        assertFalse(literal.isDeeplyCopied());

        BoundExpression call = Utils.call("f");
        assertNull(call.getNullable(CommonExts.IS_PURE));
        assertTrue(call.isDeeplyCopied());

        // attached to the node only, not its kind
        CommonExts.markPure(call);
        assertEquals(Boolean.TRUE, call.getNullable(CommonExts.IS_PURE));
        assertNull(Utils.call("f").getNullable(CommonExts.IS_PURE));
        assertNull(PhpOps.CALL.getNullable(CommonExts.IS_PURE));
    }

    @Test
    void testExtsSurviveAccessChange() {
        BoundExpression ref = Exprs.ref(Variable.local("x"));
        ref.attachExt(NOTE, "kept");
        BoundExpression read = ref.withAccess(ref.access().withRead(TypeRef.STRING));
        assertNotSame(ref, read);
        assertEquals("kept", read.getNullable(NOTE));
    }

    @Test
    void testNullConstant() {
        BoundExpression literal = Exprs.literal(null);
        assertTrue(literal.hasConstantValue());
        assertNull(literal.constantValue());
        assertSame(CommonExts.CONSTANT_NULL_SENTINEL, literal.getNullable(CommonExts.CONSTANT_VALUE));
        assertFalse(Exprs.ref(Variable.local("x")).hasConstantValue());
    }
}
