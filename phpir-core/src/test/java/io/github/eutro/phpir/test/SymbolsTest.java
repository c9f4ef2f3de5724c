package io.github.eutro.phpir.test;

import io.github.eutro.phpir.symbols.*;
import io.github.eutro.phpir.util.PhpValues;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static io.github.eutro.phpir.test.Utils.*;
import static org.junit.jupiter.api.Assertions.*;

public class SymbolsTest {
    @Test
    void testParseName() {
        QualifiedName name = QualifiedName.parse("\\App\\Util\\helper", false);
        assertTrue(name.isFullyQualified());
        assertEquals(Arrays.asList("App", "Util"), name.getNamespaces());
        assertEquals("helper", name.getName());
        assertEquals("App\\Util\\helper", name.toString());
        assertEquals(QualifiedName.of("helper"), name.unqualified());

        assertNull(QualifiedName.tryParse("App\\", false));
        assertNull(QualifiedName.tryParse("1abc", false));
        assertThrows(IllegalArgumentException.class, () -> QualifiedName.parse("a b", false));
    }

    @Test
    void testNamesIgnoreCase() {
        assertEquals(QualifiedName.parse("App\\Helper", false), QualifiedName.parse("app\\HELPER", false));
        assertEquals(QualifiedName.parse("App\\Helper", false).hashCode(),
                QualifiedName.parse("app\\HELPER", false).hashCode());
        assertNotEquals(QualifiedName.parse("App\\Helper", false), QualifiedName.of("Helper"));
    }

    @Test
    void testSourceFile() {
        assertEquals("src/lib/helpers.php", FILE.getPath());
        assertEquals("helpers.php", FILE.fileName());
        assertEquals("src/lib", FILE.directory());
        SourceFile root = new SourceFile("index.php");
        assertEquals("index.php", root.fileName());
        assertEquals("", root.directory());
    }

    @Test
    void testResolveFunction() {
        SourceSymbolTable symbols = new SourceSymbolTable();
        Compilation compilation = compilation(symbols);
        assertNull(symbols.resolveFunction(QualifiedName.of("f")));

        FunctionSymbol f = function(compilation, "f", emptyGraph());
        symbols.addFunction(f);
        assertSame(f, symbols.resolveFunction(QualifiedName.of("F")));

        FunctionSymbol g1 = conditionalFunction(compilation, "g");
        FunctionSymbol g2 = conditionalFunction(compilation, "g");
        symbols.addFunction(g1);
        symbols.addFunction(g2);
        RoutineSymbol g = symbols.resolveFunction(QualifiedName.of("g"));
        assertTrue(g instanceof AmbiguousRoutineSymbol);
        assertFalse(g.isValid());
        assertTrue(((AmbiguousRoutineSymbol) g).isOverloadable());
        assertEquals(Arrays.asList(g1, g2), ((AmbiguousRoutineSymbol) g).getAmbiguities());

        symbols.addFunction(function(compilation, "g", emptyGraph()));
        assertFalse(((AmbiguousRoutineSymbol) symbols.resolveFunction(QualifiedName.of("g"))).isOverloadable());
    }

    @Test
    void testExtensions() {
        Compilation compilation = compilation("MBString", "intl");
        assertTrue(compilation.getExtensions().contains("mbstring"));
        assertTrue(compilation.hasExtension("INTL"));
        assertFalse(compilation.hasExtension("xdebug"));
    }

    @Test
    void testBoolConversion() {
        assertEquals(false, PhpValues.tryConvertToBool(null));
        assertEquals(false, PhpValues.tryConvertToBool(0L));
        assertEquals(true, PhpValues.tryConvertToBool(-1L));
        assertEquals(false, PhpValues.tryConvertToBool(0.0));
        assertEquals(true, PhpValues.tryConvertToBool(Double.NaN));
        assertEquals(false, PhpValues.tryConvertToBool(""));
        assertEquals(false, PhpValues.tryConvertToBool("0"));
        assertEquals(true, PhpValues.tryConvertToBool("0.0"));
        assertEquals(true, PhpValues.tryConvertToBool(" "));
        assertNull(PhpValues.tryConvertToBool(new Object()));
    }

    @Test
    void testStringConversion() {
        assertEquals("", PhpValues.tryConvertToString(null));
        assertEquals("1", PhpValues.tryConvertToString(true));
        assertEquals("", PhpValues.tryConvertToString(false));
        assertEquals("-42", PhpValues.tryConvertToString(-42L));
        assertNull(PhpValues.tryConvertToString(0.1));
    }
}
