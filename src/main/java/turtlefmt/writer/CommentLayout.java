package turtlefmt.writer;

import turtlefmt.model.SyntaxNode;

/**
 * Line break heuristics of the top level of a document, as functions of source rows and the
 * {@link RootContext}.
 */
final class CommentLayout {
    static final int MAX_LINE_BREAKS = 4;

    private CommentLayout() {}

    /**
     * A comment starting on the row the previous element ended on trails that element.
     */
    static boolean isTrailing(int previousEndRow, SyntaxNode comment, RootContext context) {
        return context != RootContext.START && comment.start().row() == previousEndRow;
    }

    static int lineBreaksBeforeComment(int previousEndRow, SyntaxNode comment,
            RootContext context) {
        if (context == RootContext.START) {
            return 0;
        }

        int min = context == RootContext.COMMENT ? 1 : 2;

        return Math.max(min, Math.min(comment.start().row() - previousEndRow, MAX_LINE_BREAKS));
    }

    static int lineBreaksBeforeTriples(int previousEndRow, SyntaxNode triples,
            RootContext context) {
        if (context == RootContext.START) {
            return 0;
        }

        if (context == RootContext.COMMENT && triples.start().row() <= previousEndRow + 1) {
            return 1;
        }

        return 2;
    }

    static int lineBreaksBeforeDirectives(RootContext context) {
        return switch (context) {
            case START -> 0;
            case TRIPLES -> 2;
            case PREFIXES, COMMENT -> 1;
        };
    }
}
