package turtlefmt.parser;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.eclipse.rdf4j.common.text.ASCIIUtil;
import org.eclipse.rdf4j.rio.turtle.TurtleUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import turtlefmt.model.NodeKind;
import turtlefmt.model.Position;
import turtlefmt.model.SyntaxNode;

/**
 * Reads a Turtle document into a concrete syntax tree. Malformed input does not raise an
 * exception: reading stops at the first violation and the document ends with an
 * {@link NodeKind#ERROR} or {@link NodeKind#MISSING} node.
 */
public class TurtleParser {
	private static final Logger logger = LoggerFactory.getLogger(TurtleParser.class);

	private String input;

	private int position;

	private int[] lineStarts;

	public SyntaxNode parse(String document) {
		if (document == null) {
			throw new IllegalArgumentException("Document must not be 'null'");
		}

		input = document;
		position = 0;
		lineStarts = computeLineStarts(document);

		List<SyntaxNode> statements = new ArrayList<>();

		try {
			int c = skipWSC(statements);

			while (c != -1) {
				statements.add(parseStatement());
				c = skipWSC(statements);
			}
		} catch (SyntaxError e) {
			logger.debug("Syntax error on line {}: {}", e.node.start().row() + 1, e.getMessage());
			statements.add(e.node);
		}

		return new SyntaxNode(NodeKind.DOCUMENT, null, positionAt(0), positionAt(input.length()),
				input, statements);
	}

	protected SyntaxNode parseStatement() {
		int start = position;
		int c = peekCodePoint();

		if (c == '@') {
			readCodePoint();

			StringBuilder directive = new StringBuilder(8);

			while (isAsciiLetter(peekCodePoint())) {
				appendCodepoint(directive, readCodePoint());
			}

			if ("prefix".equals(directive.toString())) {
				return parsePrefixID(start, true);
			} else if ("base".equals(directive.toString())) {
				return parseBase(start, true);
			} else if (directive.length() == 0) {
				reportFatalError("Directive name is missing, expected @prefix or @base", start);
			} else {
				reportFatalError("Unknown directive \"@" + directive + "\"", start);
			}
		}

		if (startsWithKeyword("PREFIX")) {
			position += 6;

			return parsePrefixID(start, false);
		} else if (startsWithKeyword("BASE")) {
			position += 4;

			return parseBase(start, false);
		}

		return parseTriples(start);
	}

	private boolean startsWithKeyword(String keyword) {
		if (!input.regionMatches(true, position, keyword, 0, keyword.length())) {
			return false;
		}

		int next = position + keyword.length();

		if (next >= input.length()) {
			return true;
		}

		char c = input.charAt(next);

		return TurtleUtil.isWhitespace(c) || c == '#' || c == '<';
	}

	protected SyntaxNode parsePrefixID(int start, boolean atForm) {
		List<SyntaxNode> children = new ArrayList<>();

		skipWSC(children);

		int labelStart = position;
		int c = readCodePoint();

		if (c != ':') {
			if (!TurtleUtil.isPrefixStartChar(c)) {
				verifyCharacterOrFail(c, ":");
			}

			while (TurtleUtil.isPrefixChar(peekCodePoint())) {
				readCodePoint();
			}

			if (input.charAt(position - 1) == '.') {
				reportFatalError("A prefix name must not end with '.'", position - 1);
			}

			children.add(leaf(NodeKind.PN_PREFIX, "label", labelStart));

			verifyCharacterOrFail(readCodePoint(), ":");
		}

		skipWSC(children);

		children.add(parseURI("iri"));

		if (atForm) {
			skipWSC(children);
			verifyCharacterOrFail(readCodePoint(), ".");
		}

		return node(NodeKind.PREFIX, null, start, children);
	}

	protected SyntaxNode parseBase(int start, boolean atForm) {
		List<SyntaxNode> children = new ArrayList<>();

		skipWSC(children);

		children.add(parseURI("iri"));

		if (atForm) {
			skipWSC(children);
			verifyCharacterOrFail(readCodePoint(), ".");
		}

		return node(NodeKind.BASE, null, start, children);
	}

	protected SyntaxNode parseTriples(int start) {
		List<SyntaxNode> children = new ArrayList<>();

		if (peekCodePoint() == '[' && !isAnon()) {
			children.add(parseBlankNodePropertyList("subject"));

			if (skipWSC(children) != '.') {
				parsePredicateObjectList(children);
			}
		} else {
			children.add(parseSubject());
			skipWSC(children);
			parsePredicateObjectList(children);
		}

		skipWSC(children);
		verifyCharacterOrFail(readCodePoint(), ".");

		return node(NodeKind.TRIPLES, null, start, children);
	}

	protected void parsePredicateObjectList(List<SyntaxNode> parent) {
		parent.add(parsePredicateObjects());

		while (skipWSC(parent) == ';') {
			readCodePoint();

			int c = skipWSC(parent);

			if (c == '.' || c == ']' || c == -1) {
				break;
			} else if (c == ';') {
				continue;
			}

			parent.add(parsePredicateObjects());
		}
	}

	protected SyntaxNode parsePredicateObjects() {
		int start = position;
		List<SyntaxNode> children = new ArrayList<>();

		children.add(parsePredicate());
		skipWSC(children);
		children.add(parseObject());

		int end = position;

		while (skipWSC(children) == ',') {
			readCodePoint();
			skipWSC(children);
			children.add(parseObject());
			end = position;
		}

		return node(NodeKind.PREDICATE_OBJECTS, null, start, end, children);
	}

	protected SyntaxNode parseSubject() {
		int c = peekCodePoint();

		if (c == '(') {
			return parseCollection("subject");
		} else if (c == '[') {
			return parseAnon("subject");
		} else if (c == '_') {
			return parseNodeID("subject");
		} else if (c == '<' || c == ':' || TurtleUtil.isPrefixStartChar(c)) {
			SyntaxNode subject = parseIri("subject");

			if (subject.kind() == NodeKind.BOOLEAN) {
				reportFatalError("Illegal subject value: " + subject.text(), subject.start().offset());
			}

			return subject;
		} else if (c == -1) {
			throwEOFException("subject");
		}

		reportFatalError("Expected a subject here, found '" + new String(Character.toChars(c)) + "'",
				position);

		return null;
	}

	protected SyntaxNode parsePredicate() {
		int c1 = peekCodePoint();

		if (c1 == 'a') {
			int c2 = position + 1 < input.length() ? input.codePointAt(position + 1) : -1;

			if (c2 != ':' && !TurtleUtil.isPrefixChar(c2)) {
				int start = position;
				readCodePoint();

				return leaf(NodeKind.A, "predicate", start);
			}
		}

		if (c1 == '<' || c1 == ':' || TurtleUtil.isPrefixStartChar(c1)) {
			SyntaxNode predicate = parseIri("predicate");

			if (predicate.kind() == NodeKind.BOOLEAN) {
				reportFatalError("Illegal predicate value: " + predicate.text(),
						predicate.start().offset());
			}

			return predicate;
		} else if (c1 == -1) {
			throwEOFException("predicate");
		}

		reportFatalError("Expected a predicate here, found '" + new String(Character.toChars(c1))
				+ "'", position);

		return null;
	}

	protected SyntaxNode parseObject() {
		int c = peekCodePoint();

		switch (c) {
			case '(':
				return parseCollection(null);
			case '[':
				return isAnon() ? parseAnon(null) : parseBlankNodePropertyList(null);
			default:
				return parseValue();
		}
	}

	protected SyntaxNode parseValue() {
		int c = peekCodePoint();

		if (c == '<' || c == ':' || TurtleUtil.isPrefixStartChar(c)) {
			return parseIri(null);
		} else if (c == '_') {
			return parseNodeID(null);
		} else if (c == '"' || c == '\'') {
			return parseQuotedLiteral();
		} else if (ASCIIUtil.isNumber(c) || c == '.' || c == '+' || c == '-') {
			return parseNumber();
		} else if (c == -1) {
			throwEOFException("object");
		}

		reportFatalError(
				"Expected an RDF value here, found '" + new String(Character.toChars(c)) + "'",
				position);

		return null;
	}

	protected SyntaxNode parseIri(String field) {
		if (peekCodePoint() == '<') {
			return parseURI(field);
		}

		return parseQNameOrBoolean(field);
	}

	protected SyntaxNode parseCollection(String field) {
		int start = position;
		List<SyntaxNode> children = new ArrayList<>();

		verifyCharacterOrFail(readCodePoint(), "(");

		int c = skipWSC(children);

		while (c != ')') {
			if (c == -1) {
				throwEOFException(")");
			}

			children.add(parseObject());
			c = skipWSC(children);
		}

		readCodePoint();

		return node(NodeKind.COLLECTION, field, start, children);
	}

	protected SyntaxNode parseBlankNodePropertyList(String field) {
		int start = position;
		List<SyntaxNode> children = new ArrayList<>();

		verifyCharacterOrFail(readCodePoint(), "[");
		skipWSC(children);
		parsePredicateObjectList(children);
		skipWSC(children);
		verifyCharacterOrFail(readCodePoint(), "]");

		return node(NodeKind.BLANK_NODE_PROPERTY_LIST, field, start, children);
	}

	private boolean isAnon() {
		int i = position + 1;

		while (i < input.length() && TurtleUtil.isWhitespace(input.charAt(i))) {
			i++;
		}

		return i < input.length() && input.charAt(i) == ']';
	}

	protected SyntaxNode parseAnon(String field) {
		int start = position;

		verifyCharacterOrFail(readCodePoint(), "[");

		while (TurtleUtil.isWhitespace(peekCodePoint())) {
			readCodePoint();
		}

		verifyCharacterOrFail(readCodePoint(), "]");

		return leaf(NodeKind.ANON, field, start);
	}

	protected SyntaxNode parseQuotedLiteral() {
		int start = position;
		List<SyntaxNode> children = new ArrayList<>();

		children.add(parseQuotedString());

		int c = peekCodePoint();

		if (c == '@') {
			readCodePoint();

			int langStart = position;

			c = readCodePoint();

			if (c == -1) {
				throwEOFException("language tag");
			} else if (!TurtleUtil.isLanguageStartChar(c)) {
				reportFatalError("Expected a letter, found '" + new String(Character.toChars(c)) + "'",
						langStart);
			}

			while (TurtleUtil.isLanguageChar(peekCodePoint())) {
				readCodePoint();
			}

			if (input.charAt(position - 1) == '-') {
				reportFatalError("A language tag must not end with '-'", position - 1);
			}

			children.add(leaf(NodeKind.LANGTAG, "language", langStart));
		} else if (c == '^') {
			readCodePoint();

			verifyCharacterOrFail(readCodePoint(), "^");

			c = skipWSC(children);

			if (c != '<' && c != ':' && !TurtleUtil.isPrefixStartChar(c)) {
				verifyCharacterOrFail(readCodePoint(), "<");
			}

			SyntaxNode datatype = parseIri("datatype");

			if (datatype.kind() == NodeKind.BOOLEAN) {
				reportFatalError("Illegal datatype value: " + datatype.text(),
						datatype.start().offset());
			}

			children.add(datatype);
		}

		return node(NodeKind.LITERAL, null, start, children);
	}

	protected SyntaxNode parseQuotedString() {
		int start = position;

		int c1 = readCodePoint();

		verifyCharacterOrFail(c1, "\"'");

		if (peekCodePoint() == c1 && position + 1 < input.length()
				&& input.charAt(position + 1) == c1) {
			readCodePoint();
			readCodePoint();

			parseLongString(c1);
		} else {
			parseString(c1);
		}

		return leaf(NodeKind.STRING, "value", start);
	}

	protected void parseString(int closingCharacter) {
		while (true) {
			int c = readCodePoint();

			if (c == closingCharacter) {
				break;
			} else if (c == -1) {
				throwEOFException(new String(Character.toChars(closingCharacter)));
			} else if (c == '\r' || c == '\n') {
				reportFatalError("Illegal carriage return or new line in literal", position - 1);
			} else if (c == '\\') {
				verifyStringEscape();
			}
		}
	}

	protected void parseLongString(int closingCharacter) {
		int quoteCount = 0;

		while (quoteCount < 3) {
			int c = readCodePoint();

			if (c == -1) {
				throwEOFException(new String(Character.toChars(closingCharacter)).repeat(3));
			} else if (c == closingCharacter) {
				quoteCount++;
			} else {
				quoteCount = 0;

				if (c == '\\') {
					verifyStringEscape();
				}
			}
		}
	}

	private void verifyStringEscape() {
		int start = position - 1;
		int c = readCodePoint();

		if (c == -1) {
			throwEOFException("escape sequence");
		} else if (c == 'u' || c == 'U') {
			verifyHexDigits(c == 'u' ? 4 : 8, start);
		} else if ("tbnrf\"'\\".indexOf(c) == -1) {
			reportFatalError("Illegal escape sequence '\\" + new String(Character.toChars(c)) + "'",
					start);
		}
	}

	private void verifyHexDigits(int count, int escapeStart) {
		for (int i = 0; i < count; i++) {
			int c = readCodePoint();

			if (c == -1 || !ASCIIUtil.isHex(c)) {
				reportFatalError("Incomplete unicode escape sequence", escapeStart);
			}
		}
	}

	protected SyntaxNode parseNumber() {
		int start = position;

		int c = peekCodePoint();

		if (c == '+' || c == '-') {
			readCodePoint();
		}

		boolean digitsBefore = readDigits() > 0;
		boolean digitsAfter = false;
		NodeKind kind = NodeKind.INTEGER;

		if (peekCodePoint() == '.') {
			int dot = position;

			readCodePoint();
			digitsAfter = readDigits() > 0;

			if (digitsAfter) {
				kind = NodeKind.DECIMAL;
			} else if (!(digitsBefore && isExponentAhead())) {
				// the '.' ends the statement
				position = dot;
			}
		}

		if (!digitsBefore && !digitsAfter) {
			reportFatalError("Expected a number", start);
		}

		if (isExponentAhead()) {
			readCodePoint();

			c = peekCodePoint();

			if (c == '+' || c == '-') {
				readCodePoint();
			}

			readDigits();
			kind = NodeKind.DOUBLE;
		}

		return leaf(kind, null, start);
	}

	private int readDigits() {
		int count = 0;

		while (ASCIIUtil.isNumber(peekCodePoint())) {
			readCodePoint();
			count++;
		}

		return count;
	}

	private boolean isExponentAhead() {
		int i = position;

		if (i >= input.length() || (input.charAt(i) != 'e' && input.charAt(i) != 'E')) {
			return false;
		}

		i++;

		if (i < input.length() && (input.charAt(i) == '+' || input.charAt(i) == '-')) {
			i++;
		}

		return i < input.length() && ASCIIUtil.isNumber(input.charAt(i));
	}

	protected SyntaxNode parseURI(String field) {
		verifyCharacterOrFail(readCodePoint(), "<");

		int start = position;

		while (true) {
			int c = readCodePoint();

			if (c == '>') {
				break;
			} else if (c == -1) {
				throwEOFException(">");
			} else if (c <= 0x20 || "<\"{}|^`".indexOf(c) != -1) {
				reportFatalError("IRI includes an illegal character: '"
						+ new String(Character.toChars(c)) + "'", position - Character.charCount(c));
			} else if (c == '\\') {
				int escapeStart = position - 1;

				c = readCodePoint();

				if (c != 'u' && c != 'U') {
					reportFatalError("IRI includes string escapes: '\\"
							+ (c == -1 ? "" : new String(Character.toChars(c))) + "'", escapeStart);
				}

				verifyHexDigits(c == 'u' ? 4 : 8, escapeStart);
			}
		}

		return new SyntaxNode(NodeKind.IRIREF, field, positionAt(start), positionAt(position - 1),
				input.substring(start, position - 1), List.of());
	}

	protected SyntaxNode parseQNameOrBoolean(String field) {
		int start = position;

		int c = readCodePoint();

		if (c == -1) {
			throwEOFException("prefixed name");
		}

		if (c != ':') {
			if (!TurtleUtil.isPrefixStartChar(c)) {
				reportFatalError("Expected a ':' or a letter, found '"
						+ new String(Character.toChars(c)) + "'", start);
			}

			while (TurtleUtil.isPrefixChar(peekCodePoint())) {
				readCodePoint();
			}

			while (input.charAt(position - 1) == '.') {
				position--;
			}

			if (peekCodePoint() != ':') {
				String value = input.substring(start, position);

				if ("true".equals(value) || "false".equals(value)) {
					return leaf(NodeKind.BOOLEAN, field, start);
				}
			}

			verifyCharacterOrFail(readCodePoint(), ":");
		}

		if (TurtleUtil.isNameStartChar(peekCodePoint())) {
			int end = position;

			while (TurtleUtil.isNameChar(peekCodePoint())) {
				int charStart = position;

				c = readCodePoint();

				if (c == '\\') {
					readLocalEscapedChar(charStart);
				} else if (c == '%') {
					verifyHexDigits(2, charStart);
				}

				if (c != '.') {
					end = position;
				}
			}

			// a local name never ends with an unescaped '.'
			position = end;
		}

		return leaf(NodeKind.PREFIXED_NAME, field, start);
	}

	private void readLocalEscapedChar(int escapeStart) {
		int c = readCodePoint();

		if (!TurtleUtil.isLocalEscapedChar(c)) {
			reportFatalError("found '" + (c == -1 ? "" : new String(Character.toChars(c)))
					+ "', expected one of: " + Arrays.toString(TurtleUtil.LOCAL_ESCAPED_CHARS),
					escapeStart);
		}
	}

	protected SyntaxNode parseNodeID(String field) {
		verifyCharacterOrFail(readCodePoint(), "_");
		verifyCharacterOrFail(readCodePoint(), ":");

		int start = position;
		int c = readCodePoint();

		if (c == -1) {
			throwEOFException("blank node label");
		} else if (!TurtleUtil.isBLANK_NODE_LABEL_StartChar(c)) {
			reportFatalError("Expected a letter, found '" + new String(Character.toChars(c)) + "'",
					start);
		}

		int end = position;

		while (TurtleUtil.isBLANK_NODE_LABEL_Char(peekCodePoint())) {
			c = readCodePoint();

			if (c != '.') {
				end = position;
			}
		}

		position = end;

		return leaf(NodeKind.BLANK_NODE_LABEL, field, start);
	}

	protected void verifyCharacterOrFail(int codePoint, String expected) {
		if (codePoint == -1) {
			throwEOFException(expected.substring(0, 1));
		}

		final String supplied = new String(Character.toChars(codePoint));

		if (expected.indexOf(supplied) == -1) {
			StringBuilder msg = new StringBuilder(32);
			msg.append("Expected ");

			for (int i = 0; i < expected.length(); i++) {
				if (i > 0) {
					msg.append(" or ");
				}

				msg.append('\'');
				msg.append(expected.charAt(i));
				msg.append('\'');
			}

			msg.append(", found '");
			msg.append(supplied);
			msg.append("'");

			reportFatalError(msg.toString(), position - supplied.length());
		}
	}

	protected int skipWSC(List<SyntaxNode> comments) {
		int c = peekCodePoint();

		while (TurtleUtil.isWhitespace(c) || c == '#') {
			if (c == '#') {
				comments.add(processComment());
			} else {
				readCodePoint();
			}

			c = peekCodePoint();
		}

		return c;
	}

	protected SyntaxNode processComment() {
		int start = position;
		int c = peekCodePoint();

		while (c != -1 && c != 0xD && c != 0xA) {
			readCodePoint();
			c = peekCodePoint();
		}

		return leaf(NodeKind.COMMENT, null, start);
	}

	protected int readCodePoint() {
		if (position >= input.length()) {
			return -1;
		}

		int next = input.codePointAt(position);
		position += Character.charCount(next);

		return next;
	}

	protected int peekCodePoint() {
		if (position >= input.length()) {
			return -1;
		}

		return input.codePointAt(position);
	}

	protected void reportFatalError(String msg, int errorStart) {
		int lineEnd = errorStart;

		while (lineEnd < input.length() && input.charAt(lineEnd) != '\n'
				&& input.charAt(lineEnd) != '\r') {
			lineEnd++;
		}

		SyntaxNode error = new SyntaxNode(NodeKind.ERROR, null, positionAt(errorStart),
				positionAt(lineEnd), input.substring(errorStart, lineEnd), List.of());

		throw new SyntaxError(msg, error);
	}

	protected void throwEOFException(String expected) {
		Position end = positionAt(input.length());
		SyntaxNode missing = new SyntaxNode(NodeKind.MISSING, null, end, end, expected, List.of());

		throw new SyntaxError("Unexpected end of file, expected " + expected, missing);
	}

	private SyntaxNode leaf(NodeKind kind, String field, int start) {
		return new SyntaxNode(kind, field, positionAt(start), positionAt(position),
				input.substring(start, position), List.of());
	}

	private SyntaxNode node(NodeKind kind, String field, int start, List<SyntaxNode> children) {
		return node(kind, field, start, position, children);
	}

	private SyntaxNode node(NodeKind kind, String field, int start, int end,
			List<SyntaxNode> children) {
		return new SyntaxNode(kind, field, positionAt(start), positionAt(end),
				input.substring(start, end), children);
	}

	private Position positionAt(int offset) {
		int row = Arrays.binarySearch(lineStarts, offset);

		if (row < 0) {
			row = -row - 2;
		}

		return new Position(offset, row, offset - lineStarts[row]);
	}

	private static int[] computeLineStarts(String document) {
		List<Integer> starts = new ArrayList<>();
		starts.add(0);

		for (int i = 0; i < document.length(); i++) {
			if (document.charAt(i) == '\n') {
				starts.add(i + 1);
			}
		}

		return starts.stream().mapToInt(Integer::intValue).toArray();
	}

	private static boolean isAsciiLetter(int c) {
		return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
	}

	private static void appendCodepoint(StringBuilder dst, int codePoint) {
		if (Character.isBmpCodePoint(codePoint)) {
			dst.append((char) codePoint);
		} else if (Character.isValidCodePoint(codePoint)) {
			dst.append(Character.highSurrogate(codePoint));
			dst.append(Character.lowSurrogate(codePoint));
		} else {
			throw new IllegalArgumentException("Invalid codepoint " + codePoint);
		}
	}

	private static class SyntaxError extends RuntimeException {
		private static final long serialVersionUID = 3530212460463520451L;

		private final transient SyntaxNode node;

		SyntaxError(String message, SyntaxNode node) {
			super(message);
			this.node = node;
		}
	}
}
