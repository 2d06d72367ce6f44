package io.hearthwarrio.xlocator.core;

/**
 * Maps a node-test tag to a widget archetype label.
 * <p>
 * Implementations must be total: every input, including {@code null}, yields a label.
 */
@FunctionalInterface
public interface WidgetClassifier {

    /**
     * Classify the given tag.
     *
     * @param tag tag name as written in the path (may be {@code "*"})
     * @return archetype label, never null
     */
    String classify(String tag);
}
