package turtlefmt.model;

import java.util.List;
import java.util.Optional;

/**
 * A node of the concrete syntax tree. Only named nodes are kept: punctuation is implied by the
 * kind. {@code field} is the role the node plays in its parent, or {@code null}.
 */
public record SyntaxNode(NodeKind kind, String field, Position start, Position end, String text,
        List<SyntaxNode> children) {
    public SyntaxNode {
        children = List.copyOf(children);
    }

    public boolean isError() {
        return kind == NodeKind.ERROR || kind == NodeKind.MISSING;
    }

    public Optional<SyntaxNode> childByFieldName(String name) {
        return children.stream().filter(child -> name.equals(child.field())).findFirst();
    }

    /**
     * Returns the first error or missing node of this subtree in document order.
     */
    public Optional<SyntaxNode> findError() {
        if (isError()) {
            return Optional.of(this);
        }

        for (var child : children) {
            var error = child.findError();

            if (error.isPresent()) {
                return error;
            }
        }

        return Optional.empty();
    }

    public String toSexp() {
        var sb = new StringBuilder();
        appendSexp(sb);

        return sb.toString();
    }

    private void appendSexp(StringBuilder sb) {
        if (field != null) {
            sb.append(field).append(": ");
        }

        sb.append('(').append(kind.sexpName());

        if (isError()) {
            sb.append(" \"").append(text.replace("\\", "\\\\").replace("\"", "\\\"")).append('"');
        }

        for (var child : children) {
            sb.append(' ');
            child.appendSexp(sb);
        }

        sb.append(')');
    }
}
