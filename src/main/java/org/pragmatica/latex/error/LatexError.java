package org.pragmatica.latex.error;

import org.pragmatica.latex.lexer.LatexToken;
import org.pragmatica.latex.lexer.TokenKind;
import org.pragmatica.latex.tree.SourceLocation;

/**
 * Failures of lexing, parsing, selection and chunking. All of them abort the current operation.
 */
public sealed interface LatexError extends Cause {

    /**
     * No lexical rule matches at the location.
     */
    record TokenizerStuck(SourceLocation location, String context) implements LatexError {
        @Override
        public String message() {
            return "Lexer stuck at offset " + location.offset() + " (" + location + "), looking at '" + context + "'";
        }
    }

    /**
     * A verbatim environment without its literal closing marker.
     */
    record UnclosedVerbatim(String environment, SourceLocation location) implements LatexError {
        @Override
        public String message() {
            return "Unclosed '" + environment + "' environment at offset " + location.offset() + " (" + location + ")";
        }
    }

    record DocumentMarkerMissing(String marker) implements LatexError {
        @Override
        public String message() {
            return marker + " not found";
        }
    }

    /**
     * The document marker is present but does not lex as an environment begin,
     * e.g. the configured environment name contains digits.
     */
    record UnrecognizedDocumentMarker(String marker, SourceLocation location) implements LatexError {
        @Override
        public String message() {
            return marker + " at " + location + " is not an environment begin"
                   + " (environment names are letters with an optional trailing '*')";
        }
    }

    /**
     * A token that neither belongs inside nor closes the innermost open construct.
     */
    record MismatchedClosingConstruct(
    TokenKind openKind,
    String openText,
    SourceLocation openLocation,
    LatexToken found) implements LatexError {
        @Override
        public String message() {
            return "Wrong closing construct " + found.kind() + " '" + found.literal() + "' at "
                   + found.start() + " (offset " + found.start().offset() + ") for "
                   + openKind + " '" + openText + "' opened at " + openLocation;
        }
    }

    record TrailingContentAfterDocumentBegin(SourceLocation location, String found) implements LatexError {
        @Override
        public String message() {
            return "Trailing content right after document begin at " + location + ": '" + found + "'";
        }
    }

    /**
     * Anchor position, 0-based line and column.
     */
    record AnchorNotAtLineStart(int line, int column) implements LatexError {
        @Override
        public String message() {
            return "Anchor not in column 0 (" + line + ":" + column + ")";
        }
    }

    record InvalidSelectorSyntax(String selector) implements LatexError {
        @Override
        public String message() {
            return "Invalid selector " + selector;
        }
    }
}
