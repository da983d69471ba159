package turtlefmt.writer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import turtlefmt.parser.TurtleParser;

/**
 * Formats Turtle documents. Instances hold nothing but their options and can be shared.
 *
 * <p>
 * When terms are sorted, the output of a first pass is formatted once more: normalization may
 * change the text terms are compared by, and only the second pass sorts by the written form.
 */
public class TurtleFormatter {
    private static final Logger logger = LoggerFactory.getLogger(TurtleFormatter.class);

    static final int SORTING_PASSES = 2;

    private final FormatOptions options;

    public TurtleFormatter() {
        this(FormatOptions.defaults());
    }

    public TurtleFormatter(FormatOptions options) {
        if (options == null) {
            throw new IllegalArgumentException("Options must not be 'null'");
        }

        this.options = options;
    }

    /**
     * @throws TurtleFormatException if the document is not valid Turtle, or if it contains
     *         comments while terms are sorted without forcing
     */
    public String format(String document) {
        int passes = options.sortTerms() ? SORTING_PASSES : 1;
        var result = document;

        for (int pass = 1; pass <= passes; pass++) {
            result = formatOnce(result);
            logger.debug("Pass {} of {} produced {} characters", pass, passes, result.length());
        }

        return result;
    }

    String formatOnce(String document) {
        var tree = new TurtleParser().parse(document);

        return new TurtleWriter(options).writeDocument(tree);
    }
}
