package org.vain.symbols;

import org.vain.astnode.Node;

import java.util.Stack;

/**
 * A stack of lexical frames, one per block.
 * <p>
 * Each function body gets its own ScopedSymbolTable. Lookups search this table
 * from the innermost frame outwards, then the enclosing table when the function
 * captures its surroundings (closures and lambdas), and finally the top-level
 * frame of the file, which every function can see.
 */
public class ScopedSymbolTable {
    // A stack to manage nested scopes of symbol tables.
    private final Stack<SymbolTable> symbolTableStack = new Stack<>();
    // Visible function scopes of a closure, or null
    private final ScopedSymbolTable enclosing;
    // The top-level frame of the file, or null for the top-level table itself
    private final SymbolTable topLevel;

    /**
     * Creates the table for the top level of a file.
     */
    public ScopedSymbolTable() {
        this(null, null);
    }

    /**
     * Creates the table for a function body.
     *
     * @param enclosing table whose frames stay visible, or null
     * @param topLevel  the top-level frame of the file
     */
    public ScopedSymbolTable(ScopedSymbolTable enclosing, SymbolTable topLevel) {
        this.enclosing = enclosing;
        this.topLevel = topLevel;
        symbolTableStack.push(new SymbolTable());
    }

    /**
     * Enters a new scope by pushing a new SymbolTable onto the stack.
     *
     * @return the index of the new scope, to be passed to {@link #exitScope(int)}
     */
    public int enterScope() {
        symbolTableStack.push(new SymbolTable());
        return symbolTableStack.size() - 1;
    }

    /**
     * Exits scopes down to the specified index.
     *
     * @param scopeIndex the index returned by {@link #enterScope()}
     */
    public void exitScope(int scopeIndex) {
        while (symbolTableStack.size() > scopeIndex) {
            symbolTableStack.pop();
        }
    }

    /**
     * Returns the frame holding the names of the file's top level.
     */
    public SymbolTable topLevelFrame() {
        return topLevel != null ? topLevel : symbolTableStack.get(0);
    }

    public boolean addVariable(String name, Node declaration, boolean isConst) {
        return symbolTableStack.peek().addVariable(name, declaration, isConst);
    }

    /**
     * Looks a name up in the innermost frame only. Redeclaration is checked this way.
     */
    public SymbolTable.SymbolEntry lookupInCurrentScope(String name) {
        return symbolTableStack.peek().get(name);
    }

    /**
     * Looks a name up through every visible frame.
     *
     * @return the entry, or null if the name is not declared
     */
    public SymbolTable.SymbolEntry lookup(String name) {
        // Iterate from innermost scope to outermost
        for (int i = symbolTableStack.size() - 1; i >= 0; i--) {
            SymbolTable.SymbolEntry entry = symbolTableStack.get(i).get(name);
            if (entry != null) {
                return entry;
            }
        }
        if (enclosing != null) {
            SymbolTable.SymbolEntry entry = enclosing.lookup(name);
            if (entry != null) {
                return entry;
            }
        }
        return topLevel == null ? null : topLevel.get(name);
    }

    public int depth() {
        return symbolTableStack.size();
    }

    @Override
    public String toString() {
        return "ScopedSymbolTable" + symbolTableStack;
    }
}
