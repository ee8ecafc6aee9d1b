package org.vain.astnode;

public enum SpecialLiteral {
    TRUE("true", "v:true"),
    FALSE("false", "v:false"),
    NULL("null", "v:null"),
    NONE("none", "v:none");

    public final String text;
    public final String vimText;

    SpecialLiteral(String text, String vimText) {
        this.text = text;
        this.vimText = vimText;
    }

    public static SpecialLiteral fromText(String text) {
        for (SpecialLiteral literal : values()) {
            if (literal.text.equals(text)) {
                return literal;
            }
        }
        return null;
    }
}
