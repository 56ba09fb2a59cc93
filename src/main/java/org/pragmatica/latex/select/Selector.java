package org.pragmatica.latex.select;

import org.pragmatica.latex.error.LatexError;
import org.pragmatica.latex.tree.LatexNode;
import org.pragmatica.latex.tree.NodeKind;
import org.pragmatica.latex.util.Result;

import java.util.List;

/**
 * Compiled selector matching a single node by command name, environment name or leading comment word.
 *
 * <p>Syntax: {@code \NAME} or {@code m:NAME} for commands, {@code {NAME}} or {@code e:NAME} for environments,
 * {@code %WORD} or {@code c:WORD} for comments whose first word is exactly {@code WORD}.
 */
public sealed interface Selector {

    boolean matches(LatexNode node);

    /**
     * Command by name, including the leading backslash.
     */
    record CommandName(String name) implements Selector {
        @Override
        public boolean matches(LatexNode node) {
            return node.kind() == NodeKind.COMMAND_NAME && node.text().equals(name);
        }
    }

    record EnvironmentName(String name) implements Selector {
        @Override
        public boolean matches(LatexNode node) {
            return node.kind() == NodeKind.ENV && node.text().equals(name);
        }
    }

    /**
     * Comment whose first whitespace-delimited word after the percent sign equals {@code word}.
     */
    record CommentWord(String word) implements Selector {
        @Override
        public boolean matches(LatexNode node) {
            return node.kind() == NodeKind.COMMENT && word.equals(firstWord(node.text().substring(1)));
        }

        private static String firstWord(String text) {
            int start = 0;
            while (start < text.length() && isSeparator(text.charAt(start))) {
                start++;
            }
            int end = start;
            while (end < text.length() && !isSeparator(text.charAt(end))) {
                end++;
            }
            return text.substring(start, end);
        }

        // Unicode whitespace, no-break spaces and NEL included.
        private static boolean isSeparator(char c) {
            return Character.isWhitespace(c) || Character.isSpaceChar(c) || c == '\u0085';
        }
    }

    static Result<Selector> parse(String selector) {
        if (selector.startsWith("\\")) {
            return Result.success(new CommandName(selector));
        }
        if (selector.startsWith("m:")) {
            return Result.success(new CommandName("\\" + selector.substring(2)));
        }
        if (selector.length() >= 2 && selector.startsWith("{") && selector.endsWith("}")) {
            return Result.success(new EnvironmentName(selector.substring(1, selector.length() - 1)));
        }
        if (selector.startsWith("e:")) {
            return Result.success(new EnvironmentName(selector.substring(2)));
        }
        if (selector.startsWith("%")) {
            return Result.success(new CommentWord(selector.substring(1)));
        }
        if (selector.startsWith("c:")) {
            return Result.success(new CommentWord(selector.substring(2)));
        }
        return Result.failure(new LatexError.InvalidSelectorSyntax(selector));
    }

    static Result<List<Selector>> parseAll(List<String> selectors) {
        return Result.allOf(selectors.stream()
                                     .map(Selector::parse)
                                     .toList());
    }
}
