package org.vain.lexer;

/**
 * Token kinds. {@link #display} is the text used in parser error messages.
 */
public enum LexerTokenType {
    ERROR("error"),
    EOF("EOF"),
    NEWLINE("newline"),
    COMMENT("comment"),

    IDENTIFIER("identifier"),
    INT("int literal"),
    FLOAT("float literal"),
    STRING("string literal"),
    OPTION("option"),
    ENV("environment variable"),
    REGISTER("register"),
    BOOL("bool literal"),
    NONE("none literal"),

    COMMA(","),
    EQUAL("="),
    EQ_EQ("=="),
    EQ_EQ_CI("==?"),
    NEQ("!="),
    NEQ_CI("!=?"),
    GT(">"),
    GT_CI(">?"),
    GT_EQ(">="),
    GT_EQ_CI(">=?"),
    LT("<"),
    LT_CI("<?"),
    LT_EQ("<="),
    LT_EQ_CI("<=?"),
    MATCH("=~"),
    MATCH_CI("=~?"),
    NO_MATCH("!~"),
    NO_MATCH_CI("!~?"),
    IS("is"),
    IS_CI("is?"),
    IS_NOT("isnot"),
    IS_NOT_CI("isnot?"),
    OR_OR("||"),
    AND_AND("&&"),
    PIPE("|"),
    AMP("&"),
    PLUS("+"),
    MINUS("-"),
    STAR("*"),
    SLASH("/"),
    PERCENT("%"),
    NOT("!"),
    QUESTION("?"),
    COLON(":"),
    DOT("."),
    DOT_DOT_DOT("..."),
    ARROW("->"),
    P_OPEN("("),
    P_CLOSE(")"),
    SQ_OPEN("["),
    SQ_CLOSE("]"),
    C_OPEN("{"),
    C_CLOSE("}"),

    CONST("const"),
    LET("let"),
    FUNC("func"),
    RETURN("return"),
    IMPORT("import"),
    AS("as"),
    FROM("from"),
    IF("if"),
    ELSE("else"),
    WHILE("while"),
    FOR("for"),
    IN("in");

    public final String display;

    LexerTokenType(String display) {
        this.display = display;
    }
}
