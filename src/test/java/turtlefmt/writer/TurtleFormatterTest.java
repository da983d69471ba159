package turtlefmt.writer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.io.StringReader;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.eclipse.rdf4j.model.Literal;
import org.eclipse.rdf4j.model.Model;
import org.eclipse.rdf4j.model.Value;
import org.eclipse.rdf4j.model.util.Models;
import org.eclipse.rdf4j.rio.RDFFormat;
import org.eclipse.rdf4j.rio.Rio;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import turtlefmt.writer.TurtleFormatException.ErrorKind;

class TurtleFormatterTest {
    private static final String BASE = "http://example.com/base/";

    private static final String DOCUMENT = """
            @base <http://example.com/base/> .
            PREFIX ex: <http://example.com/>
            @prefix : <urn:default:> .
            @prefix xsd: <http://www.w3.org/2001/XMLSchema#> .
            ex:s a ex:C ;
                ex:p [ ex:q 1 ; ex:r ( 1 2.5 3e1 "x"@en ) ] ;
                ex:t \"""long
            string "quoted\\"\""" , 'single' , "007"^^xsd:integer , true ;
                :u <rel> , _:b1 , [] , "x"^^xsd:string .
            _:b1 ex:p "\\u0041" , ex:z\\.y , ex:a\\_b .
            [ ex:p ex:o ] .
            ( 1 2 ) ex:p ex:o ; ex:p () .
            <http://example.com/s2> <http://www.w3.org/1999/02/22-rdf-syntax-ns#type> ex:D .
            """;

    private static final String COMMENTED_DOCUMENT = """
            # A document
            @prefix ex: <http://example.com/> . # namespace

            # about s
            ex:s ex:p ex:o ; # first
                ex:q [ ex:r 1 # inner
                ] .
            ex:t ex:p ex:o . # last
            """;

    static List<FormatOptions> allOptions() {
        return List.of(FormatOptions.defaults(), FormatOptions.defaults().withIndentation(2),
                FormatOptions.defaults().withSingleObjectOnNewLine(true),
                FormatOptions.defaults().withDiffMinimizingLayout(true),
                FormatOptions.defaults().withSortTerms(true), FormatOptions.diffOptimized(4),
                FormatOptions.diffOptimized(0).withSingleObjectOnNewLine(true));
    }

    static List<FormatOptions> unsortedOptions() {
        return List.of(FormatOptions.defaults(), FormatOptions.defaults().withIndentation(1),
                FormatOptions.defaults().withSingleObjectOnNewLine(true),
                FormatOptions.defaults().withDiffMinimizingLayout(true));
    }

    private static String format(String document) {
        return new TurtleFormatter().format(document);
    }

    private static String format(String document, FormatOptions options) {
        return new TurtleFormatter(options).format(document);
    }

    private static Model parse(String document) throws IOException {
        return Rio.parse(new StringReader(document), BASE, RDFFormat.TURTLE);
    }

    private static Set<String> literalLabels(String document) throws IOException {
        return parse(document).objects().stream().filter(Literal.class::isInstance)
                .map(Value::stringValue).collect(Collectors.toSet());
    }

    @Test
    void format_shouldWriteDefaultLayout() {
        var input = """
                @prefix ex: <http://example.com/> .
                @prefix rdf: <http://www.w3.org/1999/02/22-rdf-syntax-ns#> .
                ex:s rdf:type ex:C ; ex:p ex:o1, ex:o2 ; ex:q "x" .
                """;

        assertThat(format(input)).isEqualTo("""
                @prefix ex: <http://example.com/> .
                @prefix rdf: <http://www.w3.org/1999/02/22-rdf-syntax-ns#> .

                ex:s a ex:C ;
                    ex:p ex:o1 , ex:o2 ;
                    ex:q "x" .
                """);
    }

    @Test
    void format_shouldWriteDiffOptimizedLayout() {
        var input = """
                @prefix ex: <http://example.com/> .
                ex:s ex:q "x" ; ex:p ex:o2, ex:o1 .
                """;

        assertThat(format(input, FormatOptions.diffOptimized(4))).isEqualTo("""
                @prefix ex: <http://example.com/> .

                ex:s
                    ex:p
                        ex:o1 ,
                        ex:o2 ;
                    ex:q "x" ;
                    .
                """);
    }

    @Test
    void format_shouldWriteNestedBlankNodesInDiffLayout() {
        var input = "<urn:s> <urn:p> [ <urn:q> ( 1 2 ) ] .";

        assertThat(format(input, FormatOptions.defaults().withDiffMinimizingLayout(true)))
                .isEqualTo("""
                        <urn:s>
                            <urn:p> [
                                <urn:q> (
                                    1
                                    2
                                ) ;
                            ] ;
                            .
                        """);
    }

    @Test
    void format_shouldWriteBlankNodeStatement() {
        assertThat(format("[ <urn:p> <urn:o> ; <urn:q> 1 ] ."))
                .isEqualTo("[ <urn:p> <urn:o> ; <urn:q> 1 ] .\n");
    }

    @Test
    void format_shouldHonourIndentationAndSingleObjectOnNewLine() {
        var options = FormatOptions.defaults().withIndentation(2).withSingleObjectOnNewLine(true);

        assertThat(format("<urn:s> <urn:p> <urn:o> ; <urn:q> <urn:a>, <urn:b> .", options))
                .isEqualTo("""
                        <urn:s> <urn:p>
                            <urn:o> ;
                          <urn:q> <urn:a> , <urn:b> .
                        """);
    }

    @Test
    void format_shouldWriteEmptyDocumentAsSingleNewLine() {
        assertThat(format("")).isEqualTo("\n");
        assertThat(format("  \n\n")).isEqualTo("\n");
    }

    @Test
    void format_shouldSeparateStatementsWithBlankLine() {
        assertThat(format("<urn:s> <urn:p> <urn:o> .\n<urn:t> <urn:p> <urn:o> ."))
                .isEqualTo("<urn:s> <urn:p> <urn:o> .\n\n<urn:t> <urn:p> <urn:o> .\n");
    }

    @Test
    void format_shouldKeepCommentsInPlace() {
        assertThat(format(COMMENTED_DOCUMENT)).isEqualTo("""
                # A document
                @prefix ex: <http://example.com/> . # namespace

                # about s
                ex:s ex:p ex:o ; # first
                    ex:q [ ex:r 1 ] . # inner

                ex:t ex:p ex:o . # last
                """);
    }

    @Test
    void format_shouldLimitBlankLinesBeforeComments() {
        assertThat(format("<urn:s> <urn:p> <urn:o> .\n\n\n\n\n\n# far\n# next"))
                .isEqualTo("<urn:s> <urn:p> <urn:o> .\n\n\n\n# far\n# next\n");
    }

    @Test
    void format_shouldMergeCommentsWaitingForTheSameLine() {
        var input = "<urn:s> # one\n <urn:p> # two\n <urn:o> .";

        assertThat(format(input)).isEqualTo("<urn:s> <urn:p> <urn:o> . # one  two\n");
    }

    @Test
    void format_shouldGroupPrefixesAndRewriteSparqlForms() {
        var input = """
                PREFIX b: <urn:b:>
                prefix a: <urn:a:>
                BASE <http://example.com/>
                @prefix c: <urn:c:> .
                a:s b:p c:o .
                """;

        assertThat(format(input)).isEqualTo("""
                @prefix b: <urn:b:> .
                @prefix a: <urn:a:> .
                @base <http://example.com/> .
                @prefix c: <urn:c:> .

                a:s b:p c:o .
                """);
    }

    @Test
    void format_shouldGroupPrefixesSeparatedByBlankLine() {
        var input = "@prefix b: <urn:b:> .\n\n@prefix a: <urn:a:> .\n<urn:s> a:p b:o .";

        assertThat(format(input)).isEqualTo("""
                @prefix b: <urn:b:> .
                @prefix a: <urn:a:> .

                <urn:s> a:p b:o .
                """);
    }

    @Test
    void format_shouldSortPrefixesWhenSorting() {
        var input = "@prefix b: <urn:b:> .\n@prefix : <urn:d:> .\n@prefix a: <urn:a:> .\n";

        assertThat(format(input, FormatOptions.defaults().withSortTerms(true))).isEqualTo("""
                @prefix : <urn:d:> .
                @prefix a: <urn:a:> .
                @prefix b: <urn:b:> .
                """);
    }

    @Test
    void format_shouldNotReorderSubjects() {
        var input = "<urn:z> <urn:p> <urn:o> .\n<urn:a> <urn:p> <urn:o> .\n";

        assertThat(format(input, FormatOptions.defaults().withSortTerms(true)))
                .isEqualTo("<urn:z> <urn:p> <urn:o> .\n\n<urn:a> <urn:p> <urn:o> .\n");
    }

    @Test
    void format_shouldSortPredicatesAndObjects() {
        var input = "<urn:s> <urn:q> \"b\", 2, <urn:x> ; a <urn:C> ; <urn:p> 1, 1.0 .";

        assertThat(format(input, FormatOptions.defaults().withSortTerms(true))).isEqualTo("""
                <urn:s> a <urn:C> ;
                    <urn:p> 1 , 1.0 ;
                    <urn:q> <urn:x> , "b" , 2 .
                """);
    }

    @Test
    void format_shouldSortByNormalizedForm() {
        var input = """
                @prefix xsd: <http://www.w3.org/2001/XMLSchema#> .
                <urn:s> <urn:p> 3, "2"^^xsd:integer, "x" .
                """;

        assertThat(format(input, FormatOptions.defaults().withSortTerms(true))).isEqualTo("""
                @prefix xsd: <http://www.w3.org/2001/XMLSchema#> .

                <urn:s> <urn:p> "x" , 2 , 3 .
                """);
    }

    @Test
    void format_shouldWriteMatchingLiteralsBare() {
        var input = """
                @prefix xsd: <http://www.w3.org/2001/XMLSchema#> .
                <urn:s> <urn:p> "007"^^xsd:integer , "1.5e"^^xsd:decimal , "true"^^xsd:boolean ,
                    "1e3"^^<http://www.w3.org/2001/XMLSchema#double> , "x"^^xsd:string ,
                    "2"^^xsd:double .
                """;

        assertThat(format(input)).isEqualTo("""
                @prefix xsd: <http://www.w3.org/2001/XMLSchema#> .

                <urn:s> <urn:p> 007 , "1.5e"^^xsd:decimal , true , 1e3 , "x"^^xsd:string , "2"^^xsd:double .
                """);
    }

    @Test
    void format_shouldNormalizeStrings() throws IOException {
        var input = "<urn:s> <urn:p> 'it\\'s' , \"\\u0041\\t\" , '''a \"\"\"b\"'''@en .";
        var output = format(input);

        assertThat(output)
                .isEqualTo("<urn:s> <urn:p> \"it's\" , \"A\\t\" , \"\"\"a \"\"\\\"b\\\"\"\"\"@en .\n");
        assertThat(literalLabels(output)).isEqualTo(literalLabels(input))
                .containsExactlyInAnyOrder("it's", "A\t", "a \"\"\"b\"");
    }

    @Test
    void format_shouldNormalizeIrisAndLocalNames() {
        var input = """
                @prefix ex: <http://example.com/> .
                <http://example.com/\\u00E9> ex:p ex:a\\_b , ex:c\\. ,
                    <http://www.w3.org/1999/02/22-rdf-syntax-ns#type> .
                <urn:s> <http://www.w3.org/1999/02/22-rdf-syntax-ns#type> ex:C .
                """;

        assertThat(format(input)).isEqualTo("""
                @prefix ex: <http://example.com/> .

                <http://example.com/é> ex:p ex:a_b , ex:c\\. , <http://www.w3.org/1999/02/22-rdf-syntax-ns#type> .

                <urn:s> a ex:C .
                """);
    }

    @Test
    void format_shouldRejectSyntaxErrors() {
        assertThatThrownBy(() -> format("<urn:s> <urn:p> <urn:o> .\n<urn:s> <urn:p> ?x ."))
                .isInstanceOfSatisfying(TurtleFormatException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(ErrorKind.SYNTAX_ERROR);
                    assertThat(e.getLineNumber()).isEqualTo(2);
                    assertThat(e.getColumnNumber()).isEqualTo(17);
                    assertThat(e.getDetail()).contains("(ERROR \"?x .\")");
                });
    }

    @Test
    void format_shouldRejectTruncatedDocuments() {
        assertThatThrownBy(() -> format("<urn:s> <urn:p> [ <urn:q> <urn:o> "))
                .isInstanceOfSatisfying(TurtleFormatException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.SYNTAX_ERROR));
    }

    @Test
    void format_shouldRejectUndefinedPrefix() {
        var input = "@prefix a: <urn:a:> .\n\na:s a:p ex:o .";

        assertThatThrownBy(() -> format(input))
                .hasMessageContaining("ex:")
                .isInstanceOfSatisfying(TurtleFormatException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(ErrorKind.UNDEFINED_PREFIX);
                    assertThat(e.getLineNumber()).isEqualTo(3);
                    assertThat(e.getColumnNumber()).isEqualTo(9);
                    assertThat(e.getEndColumnNumber()).isEqualTo(13);
                });
    }

    @Test
    void format_shouldRejectPrefixUsedBeforeDeclaration() {
        var input = "ex:s ex:p ex:o .\n@prefix ex: <urn:ex:> .";

        assertThatThrownBy(() -> format(input))
                .isInstanceOfSatisfying(TurtleFormatException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.UNDEFINED_PREFIX));
    }

    @Test
    void format_shouldRejectEscapedIllegalIriCharacter() {
        assertThatThrownBy(() -> format("<urn:s> <urn:p> <urn:a\\u0020b> ."))
                .isInstanceOfSatisfying(TurtleFormatException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(ErrorKind.ILLEGAL_IRI_CHARACTER);
                    assertThat(e.getLineNumber()).isEqualTo(1);
                    assertThat(e.getCause()).isInstanceOf(TurtleFormatException.class);
                });
    }

    @Test
    void format_shouldRejectInvalidUnicodeEscape() {
        assertThatThrownBy(() -> format("<urn:s> <urn:p> \"\\uD800\" ."))
                .isInstanceOfSatisfying(TurtleFormatException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.INVALID_UNICODE_ESCAPE));
    }

    @Test
    void format_shouldRefuseToSortCommentedDocument() {
        assertThatThrownBy(() -> format(COMMENTED_DOCUMENT, FormatOptions.diffOptimized(4)))
                .isInstanceOfSatisfying(TurtleFormatException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.SORT_WITH_COMMENTS));
    }

    @Test
    void format_shouldSortCommentedDocumentWhenForced() {
        var formatted = format(COMMENTED_DOCUMENT, FormatOptions.diffOptimized(4).withForce(true));

        assertThat(formatted).contains("# A document", "# namespace", "# about s", "# first",
                "# inner", "# last");
    }

    @Test
    void format_shouldSortDocumentWithoutComments() {
        assertThat(format(DOCUMENT, FormatOptions.diffOptimized(4))).isNotBlank();
    }

    @ParameterizedTest
    @MethodSource("allOptions")
    void format_shouldBeIdempotent(FormatOptions options) {
        var once = format(DOCUMENT, options);

        assertThat(format(once, options)).isEqualTo(once);
    }

    @ParameterizedTest
    @MethodSource("unsortedOptions")
    void format_shouldBeIdempotentWithComments(FormatOptions options) {
        var once = format(COMMENTED_DOCUMENT, options);

        assertThat(format(once, options)).isEqualTo(once);
    }

    @ParameterizedTest
    @MethodSource("allOptions")
    void format_shouldPreserveGraph(FormatOptions options) throws IOException {
        var formatted = format(DOCUMENT, options);

        assertThat(Models.isomorphic(parse(DOCUMENT), parse(formatted))).isTrue();
    }

    @ParameterizedTest
    @MethodSource("unsortedOptions")
    void format_shouldPreserveGraphWithComments(FormatOptions options) throws IOException {
        var formatted = format(COMMENTED_DOCUMENT, options);

        assertThat(Models.isomorphic(parse(COMMENTED_DOCUMENT), parse(formatted))).isTrue();
    }

    @Test
    void format_shouldEndWithSingleNewLine() {
        assertThat(format(DOCUMENT)).endsWith(" .\n").doesNotEndWith("\n\n");
    }
}
