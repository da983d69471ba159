package turtlefmt;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.Callable;
import org.apache.commons.io.IOUtils;
import org.apache.commons.io.input.BOMInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.IVersionProvider;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import turtlefmt.writer.FormatOptions;
import turtlefmt.writer.TurtleFormatException;
import turtlefmt.writer.TurtleFormatter;

@Command(name = "turtlefmt", versionProvider = Main.ManifestVersionProvider.class,
        description = "A deterministic Turtle formatter", mixinStandardHelpOptions = true,
        usageHelpAutoWidth = true, abbreviateSynopsis = true, descriptionHeading = "%n",
        parameterListHeading = "%nParameters:%n", optionListHeading = "%nOptions:%n")
public class Main implements Callable<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    static final int EXIT_NOT_FORMATTED = 65;

    static final int EXIT_FAILURE = 1;

    @Parameters(defaultValue = ".", paramLabel = "<files>",
            description = "List of files or directories to format [default: ${DEFAULT-VALUE}]")
    private Set<Path> paths;

    @Option(names = {"-H", "--hidden"}, description = "Search hidden files and directories")
    private boolean searchHidden;

    @Option(names = "--exclude", paramLabel = "<pattern>",
            description = "List of patterns, used to omit files and/or directories from analysis")
    private Set<String> excludedPatterns;

    @Option(names = "--check",
            description = "Do not write files, report those that are not formatted and exit with "
                    + EXIT_NOT_FORMATTED + " if there are any")
    private boolean check;

    @Option(names = "--indentation", defaultValue = "" + FormatOptions.DEFAULT_INDENTATION,
            paramLabel = "<width>",
            description = "Number of spaces per indentation level [default: ${DEFAULT-VALUE}]")
    private int indentation;

    @Option(names = "--diffOptimized",
            description = "Sort terms and put every term on its own line to keep diffs small")
    private boolean diffOptimized;

    @Option(names = "--singleObjectOnNewLine",
            description = "Put the object of a predicate with a single object on a new line")
    private boolean singleObjectOnNewLine;

    @Option(names = "--force",
            description = "Write the result even when sorting may have moved comments")
    private boolean force;

    @Override
    public Integer call() throws IOException {
        var formatter = new TurtleFormatter(toOptions());
        int notFormatted = 0;
        int failed = 0;

        for (var file : findFiles()) {
            var source = read(file);
            String formatted;

            try {
                formatted = formatter.format(source);
            } catch (TurtleFormatException e) {
                logger.error("Failed to format {}: {}", file, e.getMessage());
                failed++;
                continue;
            }

            if (formatted.equals(source)) {
                continue;
            }

            if (check) {
                logger.warn("{} is not formatted", file);
                notFormatted++;
            } else {
                Files.writeString(file, formatted, StandardCharsets.UTF_8);
                logger.info("Formatted {}", file);
            }
        }

        if (failed > 0) {
            return EXIT_FAILURE;
        }

        return notFormatted > 0 ? EXIT_NOT_FORMATTED : 0;
    }

    FormatOptions toOptions() {
        var options = diffOptimized ? FormatOptions.diffOptimized(indentation)
                : FormatOptions.defaults().withIndentation(indentation);

        return options.withSingleObjectOnNewLine(singleObjectOnNewLine).withForce(force);
    }

    Set<Path> findFiles() throws IOException {
        Set<Path> files = new TreeSet<>();
        var excludedMatcher = Optional.ofNullable(excludedPatterns).map(patterns -> FileSystems
                .getDefault().getPathMatcher("glob:{" + String.join(",", patterns) + "}"));

        for (var path : paths) {
            Files.walkFileTree(path.normalize(), new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs)
                        throws IOException {
                    if (!dir.equals(path.normalize()) && !searchHidden && Files.isHidden(dir)
                            || excludedMatcher.map(matcher -> matcher.matches(dir)).orElse(false)) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }

                    return super.preVisitDirectory(dir, attrs);
                };

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs)
                        throws IOException {
                    if (attrs.isRegularFile() && file.toString().endsWith(".ttl")
                            && !(!searchHidden && Files.isHidden(file)) && !excludedMatcher
                                    .map(matcher -> matcher.matches(file)).orElse(false)) {
                        files.add(file);
                    }

                    return super.visitFile(file, attrs);
                };
            });
        }

        return files;
    }

    static String read(Path file) throws IOException {
        try (var in = BOMInputStream.builder().setInputStream(Files.newInputStream(file)).get()) {
            return IOUtils.toString(in, StandardCharsets.UTF_8);
        }
    }

    public static void main(String[] args) {
        System.exit(new CommandLine(new Main()).execute(args));
    }

    static class ManifestVersionProvider implements IVersionProvider {
        @Override
        public String[] getVersion() {
            var version = getClass().getPackage().getImplementationVersion();

            return new String[] {"${ROOT-COMMAND-NAME} " + version};
        }
    }
}
