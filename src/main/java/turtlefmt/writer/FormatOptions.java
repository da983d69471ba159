package turtlefmt.writer;

/**
 * The style applied by one format invocation.
 *
 * @param indentation number of spaces per indentation level
 * @param sortTerms sort prefixes, and predicates and objects within a subject
 * @param diffMinimizingLayout put every predicate, every object, every collection item and the
 *        finalizing dot of a statement onto its own line
 * @param singleObjectOnNewLine move the object of a predicate with exactly one object onto its
 *        own line
 * @param force write the result even when sorting may have moved comments
 */
public record FormatOptions(int indentation, boolean sortTerms, boolean diffMinimizingLayout,
        boolean singleObjectOnNewLine, boolean force) {
    public static final int DEFAULT_INDENTATION = 4;

    public FormatOptions {
        if (indentation < 0) {
            throw new IllegalArgumentException(
                    "Indentation must not be negative, found " + indentation);
        }
    }

    public static FormatOptions defaults() {
        return new FormatOptions(DEFAULT_INDENTATION, false, false, false, false);
    }

    public static FormatOptions diffOptimized(int indentation) {
        return new FormatOptions(indentation, true, true, false, false);
    }

    public FormatOptions withIndentation(int indentation) {
        return new FormatOptions(indentation, sortTerms, diffMinimizingLayout,
                singleObjectOnNewLine, force);
    }

    public FormatOptions withSortTerms(boolean sortTerms) {
        return new FormatOptions(indentation, sortTerms, diffMinimizingLayout,
                singleObjectOnNewLine, force);
    }

    public FormatOptions withDiffMinimizingLayout(boolean diffMinimizingLayout) {
        return new FormatOptions(indentation, sortTerms, diffMinimizingLayout,
                singleObjectOnNewLine, force);
    }

    public FormatOptions withSingleObjectOnNewLine(boolean singleObjectOnNewLine) {
        return new FormatOptions(indentation, sortTerms, diffMinimizingLayout,
                singleObjectOnNewLine, force);
    }

    public FormatOptions withForce(boolean force) {
        return new FormatOptions(indentation, sortTerms, diffMinimizingLayout,
                singleObjectOnNewLine, force);
    }
}
