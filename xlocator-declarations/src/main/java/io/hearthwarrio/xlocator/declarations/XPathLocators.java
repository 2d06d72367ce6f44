package io.hearthwarrio.xlocator.declarations;

import io.hearthwarrio.xlocator.core.ArchetypeRule;
import io.hearthwarrio.xlocator.core.ArchetypeRules;
import io.hearthwarrio.xlocator.core.HeuristicWidgetClassifier;
import io.hearthwarrio.xlocator.core.LocatorPipeline;
import io.hearthwarrio.xlocator.core.LocatorRecord;
import io.hearthwarrio.xlocator.core.WidgetClassifier;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * High-level entry point: XPath in, locator records or Python-style declarations out.
 * <p>
 * Wraps a {@link LocatorPipeline} built from the default lexer and parser, a {@link WidgetClassifier} and a
 * {@link PythonDeclarationRenderer}. Every call is an independent conversion; nothing is cached between calls.
 * <p>
 * Configuration is fluent and mutable; an instance is meant to be configured once and then used from one thread.
 *
 * <pre>
 * String py = new XPathLocators()
 *         .logConversions()
 *         .declarations("/form/textfield[@name='username']");
 * </pre>
 */
public class XPathLocators {

    private final PythonDeclarationRenderer renderer;

    private WidgetClassifier classifier;
    private LocatorPipeline<String> pipeline;

    /**
     * Mutable to support runtime overrides and DSL sugar.
     */
    private ConversionLogger conversionLogger;

    public XPathLocators() {
        this(new HeuristicWidgetClassifier(), null);
    }

    public XPathLocators(ConversionLogger logger) {
        this(new HeuristicWidgetClassifier(), logger);
    }

    public XPathLocators(WidgetClassifier classifier, ConversionLogger logger) {
        this.renderer = new PythonDeclarationRenderer();
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.pipeline = LocatorPipeline.defaults(classifier, renderer);
        this.conversionLogger = logger;
    }

    // ----------- configuration (low-level) -----------

    /**
     * Replaces the classifier and rebuilds the pipeline around it.
     *
     * @param classifier widget classifier
     * @return this instance for fluent chaining
     */
    public XPathLocators withClassifier(WidgetClassifier classifier) {
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.pipeline = LocatorPipeline.defaults(classifier, renderer);
        return this;
    }

    /**
     * Replaces the classification table of the current classifier.
     *
     * @param rules complete rule table (may be null/empty)
     * @return this instance for fluent chaining
     * @throws IllegalStateException if the configured classifier is not a {@link HeuristicWidgetClassifier}
     */
    public XPathLocators withArchetypeRules(List<? extends ArchetypeRule> rules) {
        heuristicClassifier().withRules(rules == null ? Collections.emptyList() : rules);
        return this;
    }

    /**
     * Installs the default table extended with project-specific rules.
     *
     * @param rules rules to add to {@link ArchetypeRules#defaults()}
     * @return this instance for fluent chaining
     * @throws IllegalStateException if the configured classifier is not a {@link HeuristicWidgetClassifier}
     */
    public XPathLocators withExtraArchetypeRules(ArchetypeRule... rules) {
        List<ArchetypeRule> extra = rules == null ? Collections.emptyList() : Arrays.asList(rules);
        heuristicClassifier().withRules(ArchetypeRules.defaultsWith(extra));
        return this;
    }

    /**
     * Returns the rule table of the current classifier, or an empty list when it is not rule based.
     *
     * @return ordered rules
     */
    public List<ArchetypeRule> getArchetypeRules() {
        if (classifier instanceof HeuristicWidgetClassifier) {
            return ((HeuristicWidgetClassifier) classifier).getRules();
        }
        return Collections.emptyList();
    }

    public XPathLocators withLogger(ConversionLogger logger) {
        this.conversionLogger = logger;
        return this;
    }

    public XPathLocators withLoggingToStdOut(ConversionLogDetail detail) {
        this.conversionLogger = new StdOutConversionLogger(detail);
        return this;
    }

    // ----------- configuration (sugar) -----------

    public XPathLocators logConversions() {
        return withLoggingToStdOut(ConversionLogDetail.FULL);
    }

    public XPathLocators disableLogging() {
        this.conversionLogger = null;
        return this;
    }

    public ConversionLogger getConversionLogger() {
        return conversionLogger;
    }

    public WidgetClassifier getClassifier() {
        return classifier;
    }

    public LocatorPipeline<String> pipeline() {
        return pipeline;
    }

    // ----------- conversion -----------

    /**
     * Converts a path expression to locator records.
     *
     * @param xpath path expression
     * @return records in step order
     * @throws io.hearthwarrio.xlocator.core.XPathSyntaxException on malformed input
     */
    public List<LocatorRecord> locators(String xpath) {
        List<LocatorRecord> records = pipeline.convert(xpath);
        if (conversionLogger != null) {
            String declarations = currentLogDetail() == ConversionLogDetail.FULL ? pipeline.render(records) : null;
            conversionLogger.logConversion(xpath, records, declarations);
        }
        return records;
    }

    /**
     * Converts a path expression to Python-style declarations.
     *
     * @param xpath path expression
     * @return declarations, one assignment per step; empty for an empty expression
     * @throws io.hearthwarrio.xlocator.core.XPathSyntaxException on malformed input
     */
    public String declarations(String xpath) {
        List<LocatorRecord> records = pipeline.convert(xpath);
        String declarations = pipeline.render(records);
        if (conversionLogger != null) {
            conversionLogger.logConversion(xpath, records, declarations);
        }
        return declarations;
    }

    private ConversionLogDetail currentLogDetail() {
        ConversionLogDetail d;
        try {
            d = conversionLogger.detail();
        } catch (RuntimeException e) {
            d = ConversionLogDetail.FULL;
        }
        return d == null ? ConversionLogDetail.FULL : d;
    }

    private HeuristicWidgetClassifier heuristicClassifier() {
        if (classifier instanceof HeuristicWidgetClassifier) {
            return (HeuristicWidgetClassifier) classifier;
        }
        throw new IllegalStateException(
                "WidgetClassifier does not support archetype rules: " + classifier.getClass().getName()
        );
    }
}
