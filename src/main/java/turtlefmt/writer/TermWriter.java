package turtlefmt.writer;

import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import org.eclipse.rdf4j.model.vocabulary.RDF;
import org.eclipse.rdf4j.model.vocabulary.XSD;
import turtlefmt.model.Comments;
import turtlefmt.model.NodeKind;
import turtlefmt.model.SyntaxNode;
import turtlefmt.writer.LexicalNormalizer.QuotedString;
import turtlefmt.writer.TurtleFormatException.ErrorKind;

/**
 * Writes predicate-object groups and the terms inside them.
 */
class TermWriter {
    private static final String RDF_TYPE = RDF.TYPE.stringValue();

    private static final Map<String, Predicate<String>> BARE_LITERAL_FORMS =
            Map.of(XSD.BOOLEAN.stringValue(), LexicalNormalizer::isBoolean,
                    XSD.INTEGER.stringValue(), LexicalNormalizer::isInteger,
                    XSD.DECIMAL.stringValue(), LexicalNormalizer::isDecimal,
                    XSD.DOUBLE.stringValue(), LexicalNormalizer::isDouble);

    record PrefixedName(String prefix, String local, String resolved) {
        @Override
        public String toString() {
            return prefix + ":" + local;
        }
    }

    protected final StringBuilder output = new StringBuilder();

    protected final FormatOptions options;

    protected final PrefixTable prefixes;

    protected boolean seenComments;

    protected TermWriter(FormatOptions options, PrefixTable prefixes) {
        this.options = options;
        this.prefixes = prefixes;
    }

    /**
     * Writes a predicate and its objects. {@code indentLevel} is the level of the line the
     * predicate is on; objects moved onto their own line go one level deeper.
     */
    protected void writePredicateObjects(SyntaxNode node, Comments comments, int indentLevel) {
        var children = children(node);
        long objectCount =
                children.stream().filter(child -> child.kind() != NodeKind.COMMENT).count() - 1;

        if (options.sortTerms()) {
            children = TermSorter.sortObjects(children);
        }

        boolean isPredicate = true;
        boolean isFirstObject = true;
        int objectLevel = indentLevel;

        for (var child : children) {
            if (child.kind() == NodeKind.COMMENT) {
                comments.add(child);
            } else if (isPredicate) {
                writeTerm(child, comments, true, indentLevel);
                isPredicate = false;
            } else {
                if (isFirstObject) {
                    if ((options.singleObjectOnNewLine() && objectCount == 1)
                            || (objectCount > 1 && options.diffMinimizingLayout())) {
                        objectLevel = indentLevel + 1;
                        newIndentedLine(objectLevel);
                    } else {
                        output.append(' ');
                    }

                    isFirstObject = false;
                } else if (options.diffMinimizingLayout()) {
                    output.append(" ,");
                    newIndentedLine(objectLevel);
                } else {
                    output.append(" , ");
                }

                writeTerm(child, comments, false, objectLevel);
            }
        }
    }

    /**
     * Writes a single term. {@code indentLevel} is the level of the line the term starts on,
     * nested property lists and collections indent their content one level deeper.
     */
    protected void writeTerm(SyntaxNode node, Comments comments, boolean isPredicate,
            int indentLevel) {
        switch (node.kind()) {
            case IRIREF -> {
                var iri = extractIri(node);

                if (isPredicate && RDF_TYPE.equals(iri)) {
                    output.append('a');
                } else {
                    output.append('<').append(iri).append('>');
                }
            }
            case PREFIXED_NAME -> {
                var name = extractPrefixedName(node);

                if (isPredicate && RDF_TYPE.equals(name.resolved())) {
                    output.append('a');
                } else {
                    output.append(name);
                }
            }
            case A -> output.append('a');
            case ANON -> output.append("[]");
            case BLANK_NODE_LABEL -> output.append("_:").append(node.text());
            case BLANK_NODE_PROPERTY_LIST -> writeBlankNodePropertyList(node, comments,
                    indentLevel);
            case COLLECTION -> writeCollection(node, comments, indentLevel);
            case LITERAL -> writeLiteral(node, comments);
            // The parser only produces numeric and boolean tokens that match their grammar.
            case BOOLEAN -> {
                assert LexicalNormalizer.isBoolean(node.text()) : node.text()
                        + " should be true or false";
                output.append(node.text());
            }
            case INTEGER -> {
                assert LexicalNormalizer.isInteger(node.text()) : node.text()
                        + " should be an integer";
                output.append(node.text());
            }
            case DECIMAL -> {
                assert LexicalNormalizer.isDecimal(node.text()) : node.text()
                        + " should be a decimal";
                output.append(node.text());
            }
            case DOUBLE -> {
                assert LexicalNormalizer.isDouble(node.text()) : node.text()
                        + " should be a double";
                output.append(node.text());
            }
            default -> throw unexpected("term", node);
        }
    }

    private void writeBlankNodePropertyList(SyntaxNode node, Comments comments,
            int indentLevel) {
        var children = children(node);

        if (options.sortTerms()) {
            children = TermSorter.sortPredicateObjects(children);
        }

        output.append('[');

        boolean isFirstPredicateObjects = true;

        for (var child : children) {
            if (child.kind() == NodeKind.COMMENT) {
                comments.add(child);
                continue;
            } else if (child.kind() != NodeKind.PREDICATE_OBJECTS) {
                throw unexpected("blank_node_property_list", child);
            }

            if (isFirstPredicateObjects) {
                isFirstPredicateObjects = false;
            } else {
                output.append(" ;");
            }

            if (options.diffMinimizingLayout()) {
                writeComments(comments.drain(), true);
                newIndentedLine(indentLevel + 1);
            } else {
                output.append(' ');
            }

            writePredicateObjects(child, comments, indentLevel + 1);
        }

        if (options.diffMinimizingLayout()) {
            output.append(" ;");
            newIndentedLine(indentLevel);
        } else {
            output.append(' ');
        }

        output.append(']');
    }

    private void writeCollection(SyntaxNode node, Comments comments, int indentLevel) {
        output.append('(');

        for (var child : children(node)) {
            if (child.kind() == NodeKind.COMMENT) {
                comments.add(child);
                continue;
            }

            if (options.diffMinimizingLayout()) {
                newIndentedLine(indentLevel + 1);
            } else {
                output.append(' ');
            }

            writeTerm(child, comments, false, indentLevel + 1);
        }

        if (options.diffMinimizingLayout()) {
            newIndentedLine(indentLevel);
        } else {
            output.append(' ');
        }

        output.append(')');
    }

    private void writeLiteral(SyntaxNode node, Comments comments) {
        QuotedString value = null;
        String annotation = "";
        String datatype = XSD.STRING.stringValue();

        for (var child : children(node)) {
            switch (child.kind()) {
                case COMMENT -> comments.add(child);
                case STRING -> value = extractString(child);
                case LANGTAG -> {
                    annotation = "@" + child.text();
                    datatype = RDF.LANGSTRING.stringValue();
                }
                case IRIREF -> {
                    var iri = extractIri(child);
                    annotation = "^^<" + iri + ">";
                    datatype = iri;
                }
                case PREFIXED_NAME -> {
                    var name = extractPrefixedName(child);
                    annotation = "^^" + name;
                    datatype = name.resolved();
                }
                default -> throw unexpected("literal", child);
            }
        }

        if (value == null) {
            throw TurtleFormatException.at(node, ErrorKind.UNEXPECTED_NODE,
                    "Literal without a value: " + node.toSexp());
        }

        var bareForm = BARE_LITERAL_FORMS.get(datatype);

        if (bareForm != null && bareForm.test(value.body())) {
            output.append(value.body());
        } else {
            output.append(value).append(annotation);
        }
    }

    protected String extractIri(SyntaxNode node) {
        try {
            return LexicalNormalizer.normalizeIri(node.text());
        } catch (TurtleFormatException e) {
            throw e.locatedAt(node);
        }
    }

    protected PrefixedName extractPrefixedName(SyntaxNode node) {
        var text = node.text();
        int colon = text.indexOf(':');
        var prefix = text.substring(0, colon);
        var namespace = prefixes.lookup(prefix)
                .orElseThrow(() -> TurtleFormatException.at(node, ErrorKind.UNDEFINED_PREFIX,
                        "The prefix " + prefix + ": is not defined"));

        String local;

        try {
            local = LexicalNormalizer.normalizeLocalName(text.substring(colon + 1));
        } catch (TurtleFormatException e) {
            throw e.locatedAt(node);
        }

        return new PrefixedName(prefix, local, namespace + local);
    }

    private QuotedString extractString(SyntaxNode node) {
        try {
            return LexicalNormalizer.normalizeString(node.text());
        } catch (TurtleFormatException e) {
            throw e.locatedAt(node);
        }
    }

    protected void writeComments(List<SyntaxNode> comments, boolean inline) {
        if (comments.isEmpty()) {
            return;
        }

        if (options.sortTerms()) {
            seenComments = true;
        }

        if (inline) {
            output.append(' ');
        }

        output.append('#').append(comments.stream()
                .map(comment -> comment.text().substring(1).stripTrailing())
                .collect(Collectors.joining(" ")));
    }

    protected void newIndentedLine(int indentLevel) {
        output.append('\n').append(" ".repeat(options.indentation() * indentLevel));
    }

    protected void lineBreaks(int count) {
        output.append("\n".repeat(count));
    }

    /**
     * The named children of {@code node}, failing on the first syntax error among them.
     */
    protected static List<SyntaxNode> children(SyntaxNode node) {
        for (var child : node.children()) {
            if (child.isError()) {
                throw syntaxError(child);
            }
        }

        return node.children();
    }

    protected static TurtleFormatException syntaxError(SyntaxNode node) {
        return TurtleFormatException.at(node, ErrorKind.SYNTAX_ERROR,
                "Syntax error: " + node.toSexp());
    }

    protected static TurtleFormatException unexpected(String parent, SyntaxNode child) {
        return TurtleFormatException.at(child, ErrorKind.UNEXPECTED_NODE,
                "Unexpected " + parent + " child: " + child.toSexp());
    }
}
