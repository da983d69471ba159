package turtlefmt.writer;

import org.eclipse.rdf4j.rio.RDFParseException;
import turtlefmt.model.SyntaxNode;

/**
 * The single failure of a format invocation. Line and column numbers are 1-based, {@code -1}
 * when unknown.
 */
public class TurtleFormatException extends RDFParseException {
    private static final long serialVersionUID = -2911480537262133406L;

    public enum ErrorKind {
        SYNTAX_ERROR,
        UNEXPECTED_NODE,
        UNDEFINED_PREFIX,
        ILLEGAL_IRI_CHARACTER,
        ILLEGAL_LOCAL_NAME_ESCAPE,
        INVALID_STRING_ESCAPE,
        INVALID_UNICODE_ESCAPE,
        SORT_WITH_COMMENTS
    }

    private final ErrorKind kind;

    private final String detail;

    private final long endColumnNumber;

    public TurtleFormatException(ErrorKind kind, String msg) {
        this(kind, msg, -1, -1, -1);
    }

    public TurtleFormatException(ErrorKind kind, String msg, long lineNo, long columnNo,
            long endColumnNo) {
        super(msg, lineNo, columnNo);
        this.kind = kind;
        this.detail = msg;
        this.endColumnNumber = endColumnNo;
    }

    /**
     * Locates a failure at {@code node}. The column range is only given when the node starts and
     * ends on the same line.
     */
    public static TurtleFormatException at(SyntaxNode node, ErrorKind kind, String msg) {
        var start = node.start();
        var end = node.end();

        if (start.row() == end.row()) {
            return new TurtleFormatException(kind, msg, start.row() + 1, start.column() + 1,
                    end.column() + 1);
        }

        return new TurtleFormatException(kind, msg, start.row() + 1, -1, -1);
    }

    public TurtleFormatException locatedAt(SyntaxNode node) {
        var located = at(node, kind, detail);
        located.initCause(this);

        return located;
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * The message without location information.
     */
    public String getDetail() {
        return detail;
    }

    public long getEndColumnNumber() {
        return endColumnNumber;
    }
}
