package org.vain.astnode;

import org.vain.astvisitor.Visitor;

import java.util.List;

/**
 * The ImportNode class represents {@code import "pkg" [as alias]} and
 * {@code from "pkg" import name [as renamed], ...}.
 * <p>
 * Imports are parsed and formatted but not resolved.
 */
public class ImportNode extends AbstractNode {
    /**
     * The package string literal, quotes included.
     */
    public final String packageLiteral;

    /**
     * The alias of {@code import "pkg" as alias}, or null.
     */
    public final String alias;

    /**
     * The named imports of the {@code from} form, or null for the plain form.
     */
    public final List<Name> names;

    public ImportNode(String packageLiteral, String alias, List<Name> names, Position position) {
        this.packageLiteral = packageLiteral;
        this.alias = alias;
        this.names = names;
        this.position = position;
    }

    public boolean isFromImport() {
        return names != null;
    }

    @Override
    public boolean isExpression() {
        return false;
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }

    /**
     * One {@code original [as renamed]} pair of a from-import.
     */
    public static final class Name {
        public final String original;
        public final String renamed;

        public Name(String original, String renamed) {
            this.original = original;
            this.renamed = renamed;
        }
    }
}
