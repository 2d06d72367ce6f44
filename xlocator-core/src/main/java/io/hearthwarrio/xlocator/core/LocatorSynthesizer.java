package io.hearthwarrio.xlocator.core;

import java.util.List;

/**
 * Third pipeline stage: path steps to chained locator records.
 */
@FunctionalInterface
public interface LocatorSynthesizer {

    /**
     * Converts steps into records, one per step, in order.
     *
     * @param steps parsed steps
     * @return records whose containers form a chain (immutable)
     */
    List<LocatorRecord> convert(List<PathStep> steps);
}
