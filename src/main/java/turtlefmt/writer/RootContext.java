package turtlefmt.writer;

/**
 * What was last written at the top level of the document.
 */
enum RootContext {
    START, PREFIXES, TRIPLES, COMMENT
}
