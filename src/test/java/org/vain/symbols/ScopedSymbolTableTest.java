package org.vain.symbols;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ScopedSymbolTableTest {

    @Test
    public void testInnerScopesShadowAndExpire() {
        ScopedSymbolTable table = new ScopedSymbolTable();
        assertTrue(table.addVariable("x", null, true));
        assertFalse(table.addVariable("x", null, false));

        int scope = table.enterScope();
        assertEquals(2, table.depth());
        assertTrue(table.addVariable("x", null, false));
        assertFalse(table.lookup("x").isConst());
        assertTrue(table.addVariable("y", null, false));
        table.exitScope(scope);

        assertEquals(1, table.depth());
        assertTrue(table.lookup("x").isConst());
        assertNull(table.lookup("y"));
    }

    @Test
    public void testFunctionTables() {
        ScopedSymbolTable top = new ScopedSymbolTable();
        top.addVariable("global", null, true);
        ScopedSymbolTable outer = new ScopedSymbolTable(null, top.topLevelFrame());
        outer.addVariable("local", null, false);

        ScopedSymbolTable plain = new ScopedSymbolTable(null, outer.topLevelFrame());
        assertNotNull(plain.lookup("global"));
        assertNull(plain.lookup("local"));

        ScopedSymbolTable closure = new ScopedSymbolTable(outer, outer.topLevelFrame());
        assertNotNull(closure.lookup("global"));
        assertNotNull(closure.lookup("local"));
        assertNull(closure.lookupInCurrentScope("local"));
    }

    @Test
    public void testTopLevelIsSharedLive() {
        ScopedSymbolTable top = new ScopedSymbolTable();
        ScopedSymbolTable function = new ScopedSymbolTable(null, top.topLevelFrame());
        assertNull(function.lookup("later"));
        top.addVariable("later", null, false);
        assertEquals("later", function.lookup("later").name());
    }
}
