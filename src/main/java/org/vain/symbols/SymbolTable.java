package org.vain.symbols;

import org.vain.astnode.Node;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One lexical frame: the names declared directly in one block.
 */
public class SymbolTable {
    // Declared names in declaration order
    public final Map<String, SymbolEntry> variables = new LinkedHashMap<>();

    /**
     * @param name        the declared name
     * @param declaration the node that declared it
     * @param isConst     true for {@code const} declarations and named functions
     */
    public record SymbolEntry(String name, Node declaration, boolean isConst) {}

    /**
     * Adds a variable if it is not already declared in this frame.
     *
     * @return true if the variable was added
     */
    public boolean addVariable(String name, Node declaration, boolean isConst) {
        if (variables.containsKey(name)) {
            return false;
        }
        variables.put(name, new SymbolEntry(name, declaration, isConst));
        return true;
    }

    public SymbolEntry get(String name) {
        return variables.get(name);
    }

    @Override
    public String toString() {
        return "SymbolTable" + variables.keySet();
    }
}
