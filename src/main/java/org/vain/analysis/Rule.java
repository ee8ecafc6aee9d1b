package org.vain.analysis;

/**
 * Names of the analyzer rules, as used in configuration files and diagnostics.
 */
public final class Rule {
    public static final String TOPLEVEL_RETURN = "toplevel-return";
    public static final String UNDECLARED_VARIABLE = "undeclared-variable";
    public static final String DUPLICATE_DECLARATION = "duplicate-declaration";
    public static final String UNDERSCORE_VARIABLE_REFERENCE = "underscore-variable-reference";
    public static final String ASSIGNMENT_TO_CONST_VARIABLE = "assignment-to-const-variable";
    public static final String CONVERT_UNDERSCORE_VARIABLE = "convert-underscore-variable";

    public static final String[] ALL = {
            TOPLEVEL_RETURN,
            UNDECLARED_VARIABLE,
            DUPLICATE_DECLARATION,
            UNDERSCORE_VARIABLE_REFERENCE,
            ASSIGNMENT_TO_CONST_VARIABLE,
            CONVERT_UNDERSCORE_VARIABLE,
    };

    private Rule() {
    }
}
