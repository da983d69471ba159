package turtlefmt.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Comment nodes collected while formatting a statement, waiting for the next point where they
 * can be written without breaking the statement.
 */
public record Comments(List<SyntaxNode> pending) {
    public Comments() {
        this(new ArrayList<>());
    }

    public void add(SyntaxNode comment) {
        if (comment.kind() != NodeKind.COMMENT) {
            throw new IllegalArgumentException("Not a comment: " + comment.toSexp());
        }

        pending.add(comment);
    }

    public List<SyntaxNode> drain() {
        var drained = List.copyOf(pending);
        pending.clear();

        return drained;
    }
}
