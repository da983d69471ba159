package turtlefmt.model;

/**
 * A location in the source document. {@code offset} counts UTF-16 chars from the start of the
 * document, {@code row} and {@code column} are zero-based.
 */
public record Position(int offset, int row, int column) {
}
