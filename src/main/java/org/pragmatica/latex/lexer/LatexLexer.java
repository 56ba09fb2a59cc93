package org.pragmatica.latex.lexer;

import org.pragmatica.latex.error.LatexError;
import org.pragmatica.latex.tree.SourceLocation;
import org.pragmatica.latex.tree.SourceSpan;
import org.pragmatica.latex.util.Result;

import java.util.ArrayList;
import java.util.List;

/**
 * Pull-based lexer for the LaTeX subset. Holds one token of lookahead, computed on demand.
 * Nothing is skipped: consecutive tokens cover the input without gaps.
 */
public final class LatexLexer {
    private static final String BEGIN_PREFIX = "\\begin{";
    private static final String END_PREFIX = "\\end{";
    private static final String RESERVED = "\\{}$%";
    private static final int CONTEXT_LENGTH = 16;

    private final String input;
    private final LexerConfig config;

    private int pos;
    private SourceLocation location;
    private LatexToken current;
    private String pendingVerbatim;

    private LatexLexer(String input, int pos, SourceLocation location, LexerConfig config) {
        this.input = input;
        this.pos = pos;
        this.location = location;
        this.config = config;
    }

    public static LatexLexer create(String input, LexerConfig config) {
        return new LatexLexer(input, 0, SourceLocation.START, config);
    }

    /**
     * Lexer scanning {@code input} from char index {@code pos}, which corresponds to {@code location}.
     */
    public static LatexLexer startingAt(String input, int pos, SourceLocation location, LexerConfig config) {
        if (pos < 0 || pos > input.length()) {
            throw new IllegalArgumentException("Start index " + pos + " outside of input of length " + input.length());
        }
        return new LatexLexer(input, pos, location, config);
    }

    /**
     * Lex the whole input up to and including {@link TokenKind#END_OF_INPUT}.
     */
    public static Result<List<LatexToken>> tokenize(String input, LexerConfig config) {
        var lexer = create(input, config);
        var tokens = new ArrayList<LatexToken>();
        while (true) {
            var next = lexer.peek();
            if (next instanceof Result.Failure<LatexToken> failure) {
                return Result.failure(failure.cause());
            }
            var token = next.unwrap();
            tokens.add(token);
            if (token.kind() == TokenKind.END_OF_INPUT) {
                return Result.success(List.copyOf(tokens));
            }
            lexer.advance();
        }
    }

    /**
     * Location where the next token starts.
     */
    public SourceLocation location() {
        return location;
    }

    /**
     * Char index in the input where the next token starts.
     */
    public int pos() {
        return pos;
    }

    /**
     * Current token, without consuming it. Calling it repeatedly yields the same token.
     */
    public Result<LatexToken> peek() {
        if (current != null) {
            return Result.success(current);
        }
        return scan().onSuccess(token -> current = token);
    }

    /**
     * Consume the current token. At end of input this is a no-op.
     *
     * @throws IllegalStateException if there is no successfully scanned current token
     */
    public void advance() {
        if (current == null) {
            throw new IllegalStateException("advance() without a current token at " + location);
        }
        var token = current;
        current = null;
        if (token.kind() == TokenKind.END_OF_INPUT) {
            return;
        }
        pos += token.literal().length();
        location = token.end();
        pendingVerbatim = token.kind() == TokenKind.ENV_BEGIN && config.isVerbatim(token.text())
                          ? token.text()
                          : null;
    }

    private Result<LatexToken> scan() {
        if (pos >= input.length()) {
            return Result.success(new LatexToken(TokenKind.END_OF_INPUT, "", SourceSpan.at(location)));
        }
        if (pendingVerbatim != null) {
            return scanVerbatim(pendingVerbatim);
        }
        char c = input.charAt(pos);
        return switch (c) {
            case '\\' -> scanBackslash();
            case '{' -> token(TokenKind.GROUP_BEGIN, "{");
            case '}' -> token(TokenKind.GROUP_END, "}");
            case '$' -> input.startsWith("$$", pos)
                        ? token(TokenKind.DOUBLE_DOLLAR, "$$")
                        : token(TokenKind.DOLLAR, "$");
            case '%' -> scanComment();
            default -> scanPlainText();
        };
    }

    private Result<LatexToken> scanVerbatim(String environment) {
        int end = input.indexOf(END_PREFIX + environment + "}", pos);
        if (end < 0) {
            return Result.failure(new LatexError.UnclosedVerbatim(environment, location));
        }
        return token(TokenKind.VERBATIM_BLOCK, input.substring(pos, end));
    }

    private Result<LatexToken> scanBackslash() {
        var begin = environmentName(BEGIN_PREFIX);
        if (begin != null) {
            return token(TokenKind.ENV_BEGIN, begin, BEGIN_PREFIX.length() + begin.length() + 1);
        }
        var end = environmentName(END_PREFIX);
        if (end != null) {
            return token(TokenKind.ENV_END, end, END_PREFIX.length() + end.length() + 1);
        }
        if (pos + 1 >= input.length()) {
            return stuck();
        }
        char next = input.charAt(pos + 1);
        switch (next) {
            case '[':
                return token(TokenKind.DISPLAY_MATH_BEGIN, "\\[");
            case ']':
                return token(TokenKind.DISPLAY_MATH_END, "\\]");
            case '(':
                return token(TokenKind.INLINE_MATH_BEGIN, "\\(");
            case ')':
                return token(TokenKind.INLINE_MATH_END, "\\)");
            default:
                break;
        }
        int i = pos + 1;
        while (i < input.length() && isAsciiLetter(input.charAt(i))) {
            i++;
        }
        if (i == pos + 1) {
            // control symbol: backslash and exactly one character
            i += Character.charCount(input.codePointAt(i));
        }
        return token(TokenKind.COMMAND_NAME, input.substring(pos, i));
    }

    /**
     * Environment name after {@code prefix} at the current position, matching {@code [A-Za-z]+\*?} followed by a brace.
     */
    private String environmentName(String prefix) {
        if (!input.startsWith(prefix, pos)) {
            return null;
        }
        int start = pos + prefix.length();
        int i = start;
        while (i < input.length() && isAsciiLetter(input.charAt(i))) {
            i++;
        }
        if (i == start) {
            return null;
        }
        if (i < input.length() && input.charAt(i) == '*') {
            i++;
        }
        if (i >= input.length() || input.charAt(i) != '}') {
            return null;
        }
        return input.substring(start, i);
    }

    private Result<LatexToken> scanComment() {
        int newline = input.indexOf('\n', pos);
        if (newline < 0) {
            return stuck();
        }
        return token(TokenKind.COMMENT, input.substring(pos, newline + 1));
    }

    private Result<LatexToken> scanPlainText() {
        int i = pos;
        while (i < input.length() && RESERVED.indexOf(input.charAt(i)) < 0) {
            i++;
        }
        return token(TokenKind.PLAIN_TEXT, input.substring(pos, i));
    }

    private Result<LatexToken> stuck() {
        var context = input.substring(pos, Math.min(input.length(), pos + CONTEXT_LENGTH));
        return Result.failure(new LatexError.TokenizerStuck(location, context));
    }

    private Result<LatexToken> token(TokenKind kind, String text) {
        return token(kind, text, text.length());
    }

    private Result<LatexToken> token(TokenKind kind, String text, int length) {
        var end = location.advance(input.substring(pos, pos + length));
        return Result.success(new LatexToken(kind, text, SourceSpan.of(location, end)));
    }

    private static boolean isAsciiLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }
}
