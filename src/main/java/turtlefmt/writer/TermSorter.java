package turtlefmt.writer;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;
import turtlefmt.model.NodeKind;
import turtlefmt.model.SyntaxNode;

/**
 * Reorders sibling nodes before they are written. Subjects are never reordered, collections
 * neither: only prefix directives, the predicate-object groups of a subject or blank node and
 * the objects of one predicate.
 */
final class TermSorter {
    static final Comparator<SyntaxNode> BY_PREFIX_LABEL =
            Comparator.comparing(TermSorter::prefixLabel);

    private TermSorter() {}

    static String prefixLabel(SyntaxNode prefix) {
        return prefix.childByFieldName("label").map(SyntaxNode::text).orElse("");
    }

    /**
     * Keeps the children that are not to be sorted in their order and appends the others, stably
     * sorted by the node {@code sortKey} extracts from each.
     */
    static List<SyntaxNode> sortChildren(List<SyntaxNode> children,
            Predicate<SyntaxNode> isToBeSorted,
            Function<SyntaxNode, Optional<SyntaxNode>> sortKey) {
        List<SyntaxNode> sorted = new ArrayList<>(children.size());
        List<SyntaxNode> toBeSorted = new ArrayList<>();

        for (var child : children) {
            if (isToBeSorted.test(child)) {
                toBeSorted.add(child);
            } else {
                sorted.add(child);
            }
        }

        toBeSorted.sort(Comparator.comparing(sortKey, TermOrder.BY_KIND_THEN_TEXT));
        sorted.addAll(toBeSorted);

        return sorted;
    }

    static List<SyntaxNode> sortPredicateObjects(List<SyntaxNode> children) {
        return sortChildren(children, child -> child.kind() == NodeKind.PREDICATE_OBJECTS,
                child -> child.childByFieldName("predicate"));
    }

    static List<SyntaxNode> sortObjects(List<SyntaxNode> children) {
        return sortChildren(children,
                child -> child.kind() != NodeKind.COMMENT && !"predicate".equals(child.field()),
                Optional::of);
    }
}
