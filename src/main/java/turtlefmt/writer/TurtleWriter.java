package turtlefmt.writer;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import turtlefmt.model.Comments;
import turtlefmt.model.NodeKind;
import turtlefmt.model.SyntaxNode;
import turtlefmt.writer.TurtleFormatException.ErrorKind;

/**
 * Writes a whole document: directives, statements and the comments between them. Consecutive
 * prefix directives are grouped and written together so that they can be sorted.
 */
public class TurtleWriter extends TermWriter {
    private static final Logger logger = LoggerFactory.getLogger(TurtleWriter.class);

    private record BufferedPrefix(SyntaxNode node, List<SyntaxNode> comments) {}

    private final List<BufferedPrefix> prefixBuffer = new ArrayList<>();

    private RootContext context = RootContext.START;

    public TurtleWriter(FormatOptions options) {
        super(options, new PrefixTable());
    }

    public String writeDocument(SyntaxNode document) {
        if (document.kind() != NodeKind.DOCUMENT) {
            throw unexpected("root", document);
        }

        var error = document.findError();

        if (error.isPresent()) {
            throw syntaxError(error.get());
        }

        int previousEndRow = document.start().row();

        for (var child : children(document)) {
            switch (child.kind()) {
                case COMMENT -> writeRootComment(previousEndRow, child);
                case BASE -> {
                    flushPrefixes();
                    lineBreaks(CommentLayout.lineBreaksBeforeDirectives(context));
                    writeBase(child);
                    context = RootContext.PREFIXES;
                }
                case PREFIX -> prefixBuffer.add(new BufferedPrefix(child, new ArrayList<>()));
                case TRIPLES -> {
                    flushPrefixes();
                    lineBreaks(CommentLayout.lineBreaksBeforeTriples(previousEndRow, child,
                            context));
                    writeTriples(child);
                    context = RootContext.TRIPLES;
                }
                default -> throw unexpected("turtle_doc", child);
            }

            previousEndRow = child.end().row();
        }

        flushPrefixes();
        output.append('\n');

        checkSortedComments();

        return output.toString();
    }

    private void writeRootComment(int previousEndRow, SyntaxNode comment) {
        if (CommentLayout.isTrailing(previousEndRow, comment, context)) {
            if (prefixBuffer.isEmpty()) {
                writeComments(List.of(comment), true);
            } else {
                prefixBuffer.get(prefixBuffer.size() - 1).comments().add(comment);
            }

            return;
        }

        flushPrefixes();
        lineBreaks(CommentLayout.lineBreaksBeforeComment(previousEndRow, comment, context));
        writeComments(List.of(comment), false);
        context = RootContext.COMMENT;
    }

    private void flushPrefixes() {
        if (prefixBuffer.isEmpty()) {
            return;
        }

        lineBreaks(CommentLayout.lineBreaksBeforeDirectives(context));

        if (options.sortTerms()) {
            prefixBuffer.sort(Comparator.comparing(BufferedPrefix::node,
                    TermSorter.BY_PREFIX_LABEL));
        }

        for (int i = 0; i < prefixBuffer.size(); i++) {
            if (i > 0) {
                output.append('\n');
            }

            var prefix = prefixBuffer.get(i);
            writePrefix(prefix.node(), prefix.comments());
        }

        prefixBuffer.clear();
        context = RootContext.PREFIXES;
    }

    private void writePrefix(SyntaxNode node, List<SyntaxNode> trailingComments) {
        List<SyntaxNode> comments = new ArrayList<>();
        var label = "";

        for (var child : children(node)) {
            switch (child.kind()) {
                case COMMENT -> comments.add(child);
                case PN_PREFIX -> label = child.text();
                case IRIREF -> {
                    var namespace = extractIri(child);
                    output.append("@prefix ").append(label).append(": <").append(namespace)
                            .append('>');
                    prefixes.declare(label, namespace);
                }
                default -> throw unexpected("prefix", child);
            }
        }

        output.append(" .");

        comments.addAll(trailingComments);
        writeComments(comments, true);
    }

    private void writeBase(SyntaxNode node) {
        List<SyntaxNode> comments = new ArrayList<>();

        for (var child : children(node)) {
            switch (child.kind()) {
                case COMMENT -> comments.add(child);
                case IRIREF -> output.append("@base <").append(extractIri(child)).append('>');
                default -> throw unexpected("base", child);
            }
        }

        output.append(" .");
        writeComments(comments, true);
    }

    private void writeTriples(SyntaxNode node) {
        var comments = new Comments();
        var children = children(node);

        if (options.sortTerms()) {
            children = TermSorter.sortPredicateObjects(children);
        }

        boolean isFirstPredicateObjects = true;

        for (var child : children) {
            switch (child.kind()) {
                case COMMENT -> comments.add(child);
                case PREDICATE_OBJECTS -> {
                    boolean onNewLine;

                    if (isFirstPredicateObjects) {
                        isFirstPredicateObjects = false;
                        onNewLine = options.diffMinimizingLayout();
                    } else {
                        output.append(" ;");
                        onNewLine = true;
                    }

                    if (onNewLine) {
                        writeComments(comments.drain(), true);
                        newIndentedLine(1);
                    } else {
                        output.append(' ');
                    }

                    writePredicateObjects(child, comments, 1);
                }
                default -> {
                    if (!"subject".equals(child.field())) {
                        throw unexpected("triples", child);
                    }

                    writeTerm(child, comments, false, 0);
                }
            }
        }

        if (options.diffMinimizingLayout() && !isFirstPredicateObjects) {
            output.append(" ;");
            newIndentedLine(1);
            output.append('.');
        } else {
            output.append(" .");
        }

        writeComments(comments.drain(), true);
    }

    private void checkSortedComments() {
        if (!options.sortTerms() || !seenComments) {
            return;
        }

        logger.warn("Terms are sorted while the document contains comments. Comments are not "
                + "moved along with the terms they belong to and may end up in the wrong place.");

        if (options.force()) {
            logger.warn("Writing the result anyway as it has been forced.");
        } else {
            logger.error("Not writing the result as it has not been forced.");

            throw new TurtleFormatException(ErrorKind.SORT_WITH_COMMENTS,
                    "Terms may not be sorted while comments are present unless writing is forced");
        }
    }
}
