package io.hearthwarrio.xlocator.allure;

import io.hearthwarrio.xlocator.declarations.ConversionLogDetail;
import io.hearthwarrio.xlocator.declarations.ConversionLogger;

/**
 * Factory methods for Allure-related XLocator loggers.
 */
public final class XLocatorAllureLoggers {

    private XLocatorAllureLoggers() {
        // utility class
    }

    /**
     * Creates an Allure logger that attaches identifiers and declarations.
     */
    public static ConversionLogger conversions() {
        return new AllureConversionLogger(ConversionLogDetail.FULL);
    }

    /**
     * Creates an Allure logger with explicit detail.
     */
    public static ConversionLogger conversions(ConversionLogDetail detail) {
        return new AllureConversionLogger(detail);
    }
}
