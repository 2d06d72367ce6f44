package io.hearthwarrio.xlocator.core;

import java.util.List;

/**
 * Last pipeline stage: turns locator records into the caller's output form.
 *
 * @param <R> rendered output type
 */
@FunctionalInterface
public interface DeclarationRenderer<R> {

    R render(List<LocatorRecord> records);
}
