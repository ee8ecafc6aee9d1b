package org.vain.parser;

import org.vain.astnode.Position;
import org.vain.lexer.LexerToken;
import org.vain.lexer.LexerTokenType;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.function.Supplier;

/**
 * Pull interface over a token source: {@code next}, {@code peek} and {@code backup}.
 * <p>
 * The source may block, e.g. when it reads from a pipeline channel. Once an EOF
 * or ERROR token has been read, it is returned again on every further call.
 */
public class TokenStream {
    private static final int MAX_BACKUP = 16;

    private final Supplier<LexerToken> source;
    private final Deque<LexerToken> pushedBack = new ArrayDeque<>();
    private final Deque<LexerToken> history = new ArrayDeque<>();
    private LexerToken terminal;
    private Position lastPosition = new Position(0, 1, 0);

    /**
     * @param source supplies tokens; returning null means the input ended
     */
    public TokenStream(Supplier<LexerToken> source) {
        this.source = source;
    }

    public TokenStream(List<LexerToken> tokens) {
        Iterator<LexerToken> it = tokens.iterator();
        this.source = () -> it.hasNext() ? it.next() : null;
    }

    public LexerToken next() {
        LexerToken token;
        if (!pushedBack.isEmpty()) {
            token = pushedBack.pop();
        } else if (terminal != null) {
            token = terminal;
        } else {
            token = source.get();
            if (token == null) {
                token = new LexerToken(LexerTokenType.EOF, "", lastPosition);
            }
            if (token.type == LexerTokenType.EOF || token.type == LexerTokenType.ERROR) {
                terminal = token;
            }
            lastPosition = token.position;
        }
        history.push(token);
        if (history.size() > MAX_BACKUP) {
            history.removeLast();
        }
        return token;
    }

    public LexerToken peek() {
        LexerToken token = next();
        backup();
        return token;
    }

    /**
     * Pushes the most recently read token back.
     *
     * @throws IllegalStateException if there is nothing left to back up
     */
    public void backup() {
        if (history.isEmpty()) {
            throw new IllegalStateException("no token to back up");
        }
        pushedBack.push(history.pop());
    }
}
