package org.vain.lexer;

import com.ibm.icu.lang.UCharacter;
import com.ibm.icu.lang.UProperty;
import org.vain.astnode.Position;
import org.vain.runtime.ErrorMessageUtil;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * The Lexer class converts source text into a sequence of tokens.
 * <p>
 * Each token records the position of its first character. Every newline is a
 * token of its own because statements are newline separated; the parser
 * skips them where they are not significant.
 * <p>
 * A lexical error produces one {@link LexerTokenType#ERROR} token whose text is
 * the formatted message, and ends the token stream. No EOF token follows it.
 */
public class Lexer {
    private static final Map<String, LexerTokenType> KEYWORDS = new HashMap<>();

    static {
        KEYWORDS.put("const", LexerTokenType.CONST);
        KEYWORDS.put("let", LexerTokenType.LET);
        KEYWORDS.put("func", LexerTokenType.FUNC);
        KEYWORDS.put("return", LexerTokenType.RETURN);
        KEYWORDS.put("import", LexerTokenType.IMPORT);
        KEYWORDS.put("as", LexerTokenType.AS);
        KEYWORDS.put("from", LexerTokenType.FROM);
        KEYWORDS.put("if", LexerTokenType.IF);
        KEYWORDS.put("else", LexerTokenType.ELSE);
        KEYWORDS.put("while", LexerTokenType.WHILE);
        KEYWORDS.put("for", LexerTokenType.FOR);
        KEYWORDS.put("in", LexerTokenType.IN);
        KEYWORDS.put("is", LexerTokenType.IS);
        KEYWORDS.put("isnot", LexerTokenType.IS_NOT);
        KEYWORDS.put("true", LexerTokenType.BOOL);
        KEYWORDS.put("false", LexerTokenType.BOOL);
        KEYWORDS.put("null", LexerTokenType.NONE);
        KEYWORDS.put("none", LexerTokenType.NONE);
    }

    private final String input;
    private final int length;
    private final ErrorMessageUtil errorMessageUtil;

    // Current position in the input
    private int position;
    private int line = 1;
    private int col;

    // Start of the token being scanned
    private int startOffset;
    private int startLine;
    private int startCol;

    private boolean finished;

    public Lexer(String fileName, String input) {
        this.input = input;
        this.length = input.length();
        this.errorMessageUtil = new ErrorMessageUtil(fileName);
    }

    static boolean isIdentifierStart(int codePoint) {
        return codePoint == '_' || UCharacter.hasBinaryProperty(codePoint, UProperty.XID_START);
    }

    static boolean isIdentifierPart(int codePoint) {
        return codePoint == '_' || UCharacter.hasBinaryProperty(codePoint, UProperty.XID_CONTINUE);
    }

    private static boolean isDigit(int codePoint) {
        return codePoint >= '0' && codePoint <= '9';
    }

    private static boolean isHexDigit(int codePoint) {
        return isDigit(codePoint) || (codePoint >= 'a' && codePoint <= 'f') || (codePoint >= 'A' && codePoint <= 'F');
    }

    private static boolean isRegisterName(int codePoint) {
        return codePoint < 128 && (Character.isLetterOrDigit(codePoint) || "\"-:.%#=*+~_/".indexOf(codePoint) >= 0);
    }

    private int peekCodePoint(int offset) {
        if (offset >= length) {
            return -1;
        }
        return input.codePointAt(offset);
    }

    private int current() {
        return peekCodePoint(position);
    }

    /**
     * Returns the code point {@code n} code points after the current one, or -1.
     */
    private int lookahead(int n) {
        int offset = position;
        for (int i = 0; i < n; i++) {
            if (offset >= length) {
                return -1;
            }
            offset += Character.charCount(input.codePointAt(offset));
        }
        return peekCodePoint(offset);
    }

    private void advance() {
        int cp = current();
        if (cp == -1) {
            return;
        }
        position += Character.charCount(cp);
        if (cp == '\n') {
            line++;
            col = 0;
        } else {
            col++;
        }
    }

    private boolean accept(char c) {
        if (current() == c) {
            advance();
            return true;
        }
        return false;
    }

    private void markStart() {
        startOffset = position;
        startLine = line;
        startCol = col;
    }

    private LexerToken emit(LexerTokenType type) {
        return new LexerToken(type, input.substring(startOffset, position), startPosition());
    }

    private Position startPosition() {
        return new Position(startOffset, startLine, startCol);
    }

    private LexerToken error(String message) {
        finished = true;
        Position pos = startPosition();
        return new LexerToken(LexerTokenType.ERROR, "[lex] " + errorMessageUtil.errorMessage(pos, message), pos);
    }

    /**
     * Tokenizes the whole input.
     *
     * @return all tokens, ending with EOF or with a single ERROR token
     */
    public List<LexerToken> tokenize() {
        List<LexerToken> tokens = new ArrayList<>();
        tokenize(tokens::add);
        return tokens;
    }

    /**
     * Tokenizes the whole input, handing each token to {@code sink} as soon as it is read.
     */
    public void tokenize(Consumer<LexerToken> sink) {
        LexerToken token;
        while ((token = nextToken()) != null) {
            sink.accept(token);
        }
    }

    /**
     * Returns the next token, or null after EOF or an error token was returned.
     */
    public LexerToken nextToken() {
        if (finished) {
            return null;
        }
        while (current() == ' ' || current() == '\t' || current() == '\r') {
            advance();
        }
        markStart();
        int cp = current();
        if (cp == -1) {
            finished = true;
            return emit(LexerTokenType.EOF);
        }
        if (cp == '\n') {
            advance();
            return emit(LexerTokenType.NEWLINE);
        }
        if (cp == '#') {
            while (current() != -1 && current() != '\n') {
                advance();
            }
            return emit(LexerTokenType.COMMENT);
        }
        if (isDigit(cp)) {
            return lexNumber();
        }
        if (cp == '\'' || cp == '"') {
            return lexString();
        }
        if (isIdentifierStart(cp)) {
            return lexWord();
        }
        return lexOperator(cp);
    }

    private LexerToken lexNumber() {
        boolean isFloat = false;
        if (current() == '0' && (lookahead(1) == 'x' || lookahead(1) == 'X') && isHexDigit(lookahead(2))) {
            advance();
            advance();
            while (isHexDigit(current())) {
                advance();
            }
        } else {
            while (isDigit(current())) {
                advance();
            }
            if (current() == '.' && isDigit(lookahead(1))) {
                isFloat = true;
                advance();
                while (isDigit(current())) {
                    advance();
                }
                int e = current();
                if (e == 'e' || e == 'E') {
                    int sign = lookahead(1);
                    if (isDigit(sign) || ((sign == '+' || sign == '-') && isDigit(lookahead(2)))) {
                        advance();
                        accept('+');
                        accept('-');
                        while (isDigit(current())) {
                            advance();
                        }
                    }
                }
            }
        }
        if (current() != -1 && isIdentifierPart(current())) {
            return error("invalid number literal");
        }
        return emit(isFloat ? LexerTokenType.FLOAT : LexerTokenType.INT);
    }

    private LexerToken lexString() {
        int quote = current();
        advance();
        while (true) {
            int cp = current();
            if (cp == -1 || cp == '\n') {
                return error("unterminated string literal");
            }
            advance();
            if (cp == quote) {
                if (quote == '\'' && current() == '\'') {
                    advance();
                    continue;
                }
                return emit(LexerTokenType.STRING);
            }
            if (cp == '\\' && quote == '"') {
                if (current() == -1 || current() == '\n') {
                    return error("unterminated string literal");
                }
                advance();
            }
        }
    }

    private LexerToken lexWord() {
        while (current() != -1 && isIdentifierPart(current())) {
            advance();
        }
        // Autoload names: foo#bar#baz
        while (current() == '#' && lookahead(1) != -1 && isIdentifierPart(lookahead(1))) {
            advance();
            while (current() != -1 && isIdentifierPart(current())) {
                advance();
            }
        }
        String word = input.substring(startOffset, position);
        LexerTokenType type = KEYWORDS.get(word);
        if (type == null) {
            return emit(LexerTokenType.IDENTIFIER);
        }
        if (type == LexerTokenType.IS && accept('?')) {
            return emit(LexerTokenType.IS_CI);
        }
        if (type == LexerTokenType.IS_NOT && accept('?')) {
            return emit(LexerTokenType.IS_NOT_CI);
        }
        return emit(type);
    }

    private LexerToken lexOption() {
        // '&' already consumed
        if ((current() == 'g' || current() == 'l') && lookahead(1) == ':') {
            if (lookahead(2) == -1 || !isIdentifierPart(lookahead(2))) {
                return error("option name was missing");
            }
            advance();
            advance();
        }
        while (current() != -1 && isIdentifierPart(current())) {
            advance();
        }
        return emit(LexerTokenType.OPTION);
    }

    private LexerToken lexOperator(int cp) {
        advance();
        switch (cp) {
            case ',':
                return emit(LexerTokenType.COMMA);
            case '(':
                return emit(LexerTokenType.P_OPEN);
            case ')':
                return emit(LexerTokenType.P_CLOSE);
            case '[':
                return emit(LexerTokenType.SQ_OPEN);
            case ']':
                return emit(LexerTokenType.SQ_CLOSE);
            case '{':
                return emit(LexerTokenType.C_OPEN);
            case '}':
                return emit(LexerTokenType.C_CLOSE);
            case ':':
                return emit(LexerTokenType.COLON);
            case '?':
                return emit(LexerTokenType.QUESTION);
            case '+':
                return emit(LexerTokenType.PLUS);
            case '*':
                return emit(LexerTokenType.STAR);
            case '/':
                return emit(LexerTokenType.SLASH);
            case '%':
                return emit(LexerTokenType.PERCENT);
            case '-':
                return emit(accept('>') ? LexerTokenType.ARROW : LexerTokenType.MINUS);
            case '.':
                if (current() == '.' && lookahead(1) == '.') {
                    advance();
                    advance();
                    return emit(LexerTokenType.DOT_DOT_DOT);
                }
                return emit(LexerTokenType.DOT);
            case '=':
                if (accept('=')) {
                    return emit(accept('?') ? LexerTokenType.EQ_EQ_CI : LexerTokenType.EQ_EQ);
                }
                if (accept('~')) {
                    return emit(accept('?') ? LexerTokenType.MATCH_CI : LexerTokenType.MATCH);
                }
                return emit(LexerTokenType.EQUAL);
            case '!':
                if (accept('=')) {
                    return emit(accept('?') ? LexerTokenType.NEQ_CI : LexerTokenType.NEQ);
                }
                if (accept('~')) {
                    return emit(accept('?') ? LexerTokenType.NO_MATCH_CI : LexerTokenType.NO_MATCH);
                }
                return emit(LexerTokenType.NOT);
            case '<':
                if (accept('=')) {
                    return emit(accept('?') ? LexerTokenType.LT_EQ_CI : LexerTokenType.LT_EQ);
                }
                return emit(accept('?') ? LexerTokenType.LT_CI : LexerTokenType.LT);
            case '>':
                if (accept('=')) {
                    return emit(accept('?') ? LexerTokenType.GT_EQ_CI : LexerTokenType.GT_EQ);
                }
                return emit(accept('?') ? LexerTokenType.GT_CI : LexerTokenType.GT);
            case '|':
                return emit(accept('|') ? LexerTokenType.OR_OR : LexerTokenType.PIPE);
            case '&':
                if (accept('&')) {
                    return emit(LexerTokenType.AND_AND);
                }
                if (current() != -1 && isIdentifierStart(current())) {
                    return lexOption();
                }
                return emit(LexerTokenType.AMP);
            case '$':
                if (current() == -1 || !isIdentifierPart(current())) {
                    return error("environment variable name was missing");
                }
                while (current() != -1 && isIdentifierPart(current())) {
                    advance();
                }
                return emit(LexerTokenType.ENV);
            case '@':
                if (current() != -1 && isRegisterName(current())) {
                    advance();
                }
                return emit(LexerTokenType.REGISTER);
            default:
                return error("unknown token " + ErrorMessageUtil.errorMessageQuote(new String(Character.toChars(cp))));
        }
    }
}
