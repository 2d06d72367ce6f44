package io.hearthwarrio.xlocator.core;

import java.util.List;
import java.util.Objects;

/**
 * Opt-in wrapper that keeps the records of the last successful invocation for inspection.
 * <p>
 * The retained list is replaced by a single volatile write after the whole run succeeds; a failed run keeps the
 * previous value. The retained value belongs to this instance and is meaningful for one caller at a time: concurrent
 * callers must use separate instances or rely on the returned values.
 *
 * @param <R> rendered output type
 */
public final class RetainingLocatorPipeline<R> {

    private final LocatorPipeline<R> delegate;

    private volatile List<LocatorRecord> lastRecords = List.of();

    public RetainingLocatorPipeline(LocatorPipeline<R> delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
    }

    public R apply(String xpath) {
        List<LocatorRecord> records = delegate.convert(xpath);
        R rendered = delegate.render(records);
        lastRecords = List.copyOf(records);
        return rendered;
    }

    /**
     * @return records of the last successful {@link #apply(String)}, empty before the first one
     */
    public List<LocatorRecord> lastRecords() {
        return lastRecords;
    }

    public LocatorPipeline<R> delegate() {
        return delegate;
    }
}
