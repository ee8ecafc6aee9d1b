package org.vain.lexer;

import org.vain.astnode.Position;

/**
 * The LexerToken class represents a lexical token: its type, the exact source
 * text it was read from, and the position of its first character.
 * <p>
 * Tokens are immutable.
 */
public class LexerToken {
    /**
     * The type of the token.
     */
    public final LexerTokenType type;

    /**
     * The text of the token. For {@link LexerTokenType#ERROR} tokens this is the
     * formatted error message.
     */
    public final String text;

    public final Position position;

    public LexerToken(LexerTokenType type, String text, Position position) {
        this.type = type;
        this.text = text;
        this.position = position;
    }

    /**
     * Returns a string representation of the token.
     *
     * @return a string representation of the token
     */
    @Override
    public String toString() {
        return "LexerToken{" + "type=" + type + ", text='" + text + '\'' + ", pos=" + position + '}';
    }
}
