package io.hearthwarrio.xlocator.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Locator descriptor produced for one path step.
 * <p>
 * Metadata keeps insertion order; values are {@link String} or {@link Integer}.
 */
public final class LocatorRecord {

    private final String identifier;
    private final Map<String, Object> metadata;
    private final String container;

    public LocatorRecord(String identifier, Map<String, ?> metadata, String container) {
        this.identifier = Objects.requireNonNull(identifier, "identifier must not be null");
        this.metadata = metadata == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        this.container = container == null ? "" : container;
    }

    public String getIdentifier() {
        return identifier;
    }

    /**
     * @return ordered, unmodifiable metadata
     */
    public Map<String, Object> getMetadata() {
        return metadata;
    }

    /**
     * Identifier of the previous record in the chain, or empty for the first record.
     */
    public String getContainer() {
        return container;
    }

    public boolean hasContainer() {
        return !container.isEmpty();
    }

    public String getArchetype() {
        Object a = metadata.get(DefaultLocatorSynthesizer.ARCHETYPE_KEY);
        return a == null ? "" : a.toString();
    }

    @Override
    public String toString() {
        return "LocatorRecord{" +
                "identifier='" + identifier + '\'' +
                ", metadata=" + metadata +
                ", container='" + container + '\'' +
                '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LocatorRecord)) return false;
        LocatorRecord that = (LocatorRecord) o;
        return identifier.equals(that.identifier) &&
                metadata.equals(that.metadata) &&
                container.equals(that.container);
    }

    @Override
    public int hashCode() {
        return Objects.hash(identifier, metadata, container);
    }
}
