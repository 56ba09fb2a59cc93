package org.pragmatica.latex.parser;

import org.pragmatica.latex.error.LatexError;
import org.pragmatica.latex.lexer.LatexLexer;
import org.pragmatica.latex.lexer.LatexToken;
import org.pragmatica.latex.lexer.TokenKind;
import org.pragmatica.latex.tree.LatexNode;
import org.pragmatica.latex.tree.NodeKind;
import org.pragmatica.latex.tree.SourceLocation;
import org.pragmatica.latex.util.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Document parser: splits off the preamble at the document marker, builds the body tree
 * and keeps everything after the body as raw postamble.
 *
 * <p>Construct nesting is tracked on a heap-allocated stack of open frames, so input depth
 * is bounded by memory rather than by the call stack.
 */
public final class DocumentParser implements LatexParser {
    private static final Logger LOG = LoggerFactory.getLogger(DocumentParser.class);

    private final ParserConfig config;

    private DocumentParser(ParserConfig config) {
        this.config = config;
    }

    public static DocumentParser create(ParserConfig config) {
        return new DocumentParser(config);
    }

    @Override
    public ParserConfig config() {
        return config;
    }

    @Override
    public Result<List<LatexToken>> tokenize(String source) {
        return LatexLexer.tokenize(source, config.lexerConfig());
    }

    @Override
    public Result<ParsedDocument> parseDocument(String source) {
        var marker = config.documentMarker();
        int markerPos = source.indexOf(marker);
        if (markerPos < 0) {
            LOG.debug("Document marker {} not found in {} chars of input", marker, source.length());
            return Result.failure(new LatexError.DocumentMarkerMissing(marker));
        }
        var preambleText = source.substring(0, markerPos);
        var preamble = LatexNode.terminal(NodeKind.PREAMBLE, preambleText, SourceLocation.START);
        var lexer = LatexLexer.startingAt(source, markerPos, SourceLocation.START.advance(preambleText), config.lexerConfig());
        LOG.debug("Document body starts at {}", lexer.location());

        var opening = lexer.peek();
        if (opening.isSuccess() && !isDocumentBegin(opening.unwrap())) {
            LOG.debug("Document marker {} is lexed as {}", marker, opening.unwrap());
            return Result.failure(new LatexError.UnrecognizedDocumentMarker(marker, lexer.location()));
        }

        return buildConstruct(lexer)
            .map(body -> {
                var postambleText = source.substring(lexer.pos());
                var postambleStart = lexer.location();
                var postamble = LatexNode.terminal(NodeKind.POSTAMBLE, postambleText, postambleStart);
                var root = LatexNode.nonTerminal(NodeKind.FILE,
                                                 "",
                                                 postambleStart.advance(postambleText),
                                                 List.of(preamble, body, postamble));
                LOG.debug("Parsed document body with {} top-level nodes, postamble at {}",
                          body.children().size(), postambleStart);
                return new ParsedDocument(root);
            })
            .onFailure(cause -> LOG.debug("Parsing failed: {}", cause.message()));
    }

    private boolean isDocumentBegin(LatexToken token) {
        return token.kind() == TokenKind.ENV_BEGIN && token.text().equals(config.documentEnvironment());
    }

    /**
     * Build the construct opened by the current token, leaving the lexer right after its closing token.
     * The token following the closing one is never scanned.
     */
    static Result<LatexNode.NonTerminal> buildConstruct(LatexLexer lexer) {
        var first = lexer.peek();
        if (first instanceof Result.Failure<LatexToken> failure) {
            return Result.failure(failure.cause());
        }
        var opening = first.unwrap();
        if (!opening.kind().opensConstruct()) {
            throw new IllegalStateException("Construct must start with an opening token, found " + opening);
        }
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(Frame.open(opening));
        lexer.advance();
        int maxDepth = 1;

        while (true) {
            var next = lexer.peek();
            if (next instanceof Result.Failure<LatexToken> failure) {
                return Result.failure(failure.cause());
            }
            var token = next.unwrap();
            var top = stack.peek();

            if (token.closes(top.openKind(), top.text())) {
                top.children().add(LatexNode.terminal(NodeKind.END, token.literal(), token.start()));
                lexer.advance();
                var node = stack.pop().toNode();
                if (stack.isEmpty()) {
                    LOG.debug("Construct {} closed at {}, max nesting depth {}", node.text(), token.start(), maxDepth);
                    return Result.success(node);
                }
                stack.peek().children().add(node);
            } else if (token.kind().opensConstruct()) {
                stack.push(Frame.open(token));
                lexer.advance();
                maxDepth = Math.max(maxDepth, stack.size());
            } else if (token.kind().isAtom()) {
                top.children().add(LatexNode.terminal(token.kind().nodeKind(), token.text(), token.start()));
                lexer.advance();
            } else {
                return Result.failure(new LatexError.MismatchedClosingConstruct(top.openKind(),
                                                                                top.text(),
                                                                                top.start(),
                                                                                token));
            }
        }
    }

    private record Frame(TokenKind openKind, String text, SourceLocation start, List<LatexNode> children) {
        static Frame open(LatexToken token) {
            return new Frame(token.kind(), token.text(), token.start(), new ArrayList<>());
        }

        LatexNode.NonTerminal toNode() {
            return LatexNode.nonTerminal(openKind.nodeKind(), text, start, children);
        }
    }
}
