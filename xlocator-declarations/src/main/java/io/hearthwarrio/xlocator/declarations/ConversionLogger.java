package io.hearthwarrio.xlocator.declarations;

import io.hearthwarrio.xlocator.core.LocatorRecord;

import java.util.List;

/**
 * Receives the result of a successful conversion.
 * <p>
 * Implementations may log to stdout, Allure, files, etc.
 * <p>
 * Note: {@link #detail()} is used by {@link XPathLocators} to decide whether it should render declarations for the
 * logger when the caller only asked for records.
 */
@FunctionalInterface
public interface ConversionLogger {

    /**
     * Called after a path expression was converted.
     *
     * @param xpath        source path expression
     * @param records      generated records, in step order
     * @param declarations rendered declarations (may be null if not requested and not needed)
     */
    void logConversion(String xpath, List<LocatorRecord> records, String declarations);

    /**
     * Declares how much output this logger needs. Default is {@link ConversionLogDetail#FULL}.
     */
    default ConversionLogDetail detail() {
        return ConversionLogDetail.FULL;
    }
}
