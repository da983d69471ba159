package turtlefmt.writer;

import java.util.Comparator;
import java.util.Optional;
import turtlefmt.model.NodeKind;
import turtlefmt.model.SyntaxNode;

/**
 * Sort order of terms: by kind first, so that similar terms end up next to each other, then by
 * source text.
 */
final class TermOrder {
    static final Comparator<Optional<SyntaxNode>> BY_KIND_THEN_TEXT =
            Comparator.<Optional<SyntaxNode>>comparingInt(
                    node -> node.map(n -> rank(n.kind())).orElse(rank(null)))
                    .thenComparing(node -> node.map(SyntaxNode::text).orElse(""));

    private TermOrder() {}

    static int rank(NodeKind kind) {
        if (kind == null) {
            return 14;
        }

        return switch (kind) {
            case COMMENT -> 0;
            case A -> 1;
            case PREFIXED_NAME -> 2;
            case IRIREF -> 3;
            case COLLECTION -> 4;
            case ANON -> 5;
            case BLANK_NODE_LABEL -> 6;
            case BLANK_NODE_PROPERTY_LIST -> 7;
            case LITERAL -> 8;
            case BOOLEAN -> 9;
            case INTEGER -> 10;
            case DECIMAL -> 11;
            case DOUBLE -> 12;
            case STRING -> 13;
            default -> 14;
        };
    }
}
