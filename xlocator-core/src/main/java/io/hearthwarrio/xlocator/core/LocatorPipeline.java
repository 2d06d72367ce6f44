package io.hearthwarrio.xlocator.core;

import java.util.List;
import java.util.Objects;

/**
 * Composition of the four conversion stages: tokenize, parse, convert, render.
 * <p>
 * Every stage is supplied at construction, so each one can be replaced independently in tests. An invocation runs
 * the stages strictly in sequence; a failure in any stage propagates and no partial output is produced.
 * <p>
 * The pipeline keeps no state between invocations. Callers that want the last records retained can wrap it in a
 * {@link RetainingLocatorPipeline}.
 *
 * @param <R> rendered output type
 */
public final class LocatorPipeline<R> {

    private final Tokenizer tokenizer;
    private final StepParser parser;
    private final LocatorSynthesizer synthesizer;
    private final DeclarationRenderer<R> renderer;
    private final WidgetClassifier classifier;

    public LocatorPipeline(
            Tokenizer tokenizer,
            StepParser parser,
            LocatorSynthesizer synthesizer,
            DeclarationRenderer<R> renderer,
            WidgetClassifier classifier
    ) {
        this.tokenizer = Objects.requireNonNull(tokenizer, "tokenizer must not be null");
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
        this.synthesizer = Objects.requireNonNull(synthesizer, "synthesizer must not be null");
        this.renderer = Objects.requireNonNull(renderer, "renderer must not be null");
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
    }

    /**
     * Creates a pipeline with {@link XPathLexer}, {@link XPathParser} and a {@link DefaultLocatorSynthesizer} using the
     * default {@link HeuristicWidgetClassifier}.
     *
     * @param renderer output stage
     * @param <R>      rendered output type
     * @return pipeline
     */
    public static <R> LocatorPipeline<R> defaults(DeclarationRenderer<R> renderer) {
        return defaults(new HeuristicWidgetClassifier(), renderer);
    }

    /**
     * Creates a pipeline with the default lexer and parser, and a {@link DefaultLocatorSynthesizer} that uses
     * {@code classifier}.
     *
     * @param classifier widget classifier
     * @param renderer   output stage
     * @param <R>        rendered output type
     * @return pipeline
     */
    public static <R> LocatorPipeline<R> defaults(WidgetClassifier classifier, DeclarationRenderer<R> renderer) {
        Objects.requireNonNull(classifier, "classifier must not be null");
        return new LocatorPipeline<>(
                new XPathLexer(),
                new XPathParser(),
                new DefaultLocatorSynthesizer(classifier),
                renderer,
                classifier
        );
    }

    /**
     * Runs all four stages.
     *
     * @param xpath path expression
     * @return rendered declarations
     * @throws XPathSyntaxException if lexing or parsing fails
     */
    public R apply(String xpath) {
        return renderer.render(convert(xpath));
    }

    /**
     * Runs tokenize, parse and convert, without rendering.
     *
     * @param xpath path expression
     * @return locator records in step order
     * @throws XPathSyntaxException if lexing or parsing fails
     */
    public List<LocatorRecord> convert(String xpath) {
        Objects.requireNonNull(xpath, "xpath must not be null");
        List<Token> tokens = tokenizer.tokenize(xpath);
        List<PathStep> steps = parser.parse(tokens);
        return synthesizer.convert(steps);
    }

    /**
     * Renders records produced elsewhere with this pipeline's renderer.
     */
    public R render(List<LocatorRecord> records) {
        return renderer.render(records);
    }

    public Tokenizer getTokenizer() {
        return tokenizer;
    }

    public StepParser getParser() {
        return parser;
    }

    public LocatorSynthesizer getSynthesizer() {
        return synthesizer;
    }

    public DeclarationRenderer<R> getRenderer() {
        return renderer;
    }

    public WidgetClassifier getClassifier() {
        return classifier;
    }
}
