package io.hearthwarrio.xlocator.allure;

import io.hearthwarrio.xlocator.core.LocatorRecord;
import io.hearthwarrio.xlocator.declarations.ConversionLogDetail;
import io.hearthwarrio.xlocator.declarations.ConversionLogger;
import io.qameta.allure.Allure;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Allure logger for conversions.
 * <p>
 * Each conversion becomes a step {@code XLocator: <xpath>} carrying a "Locator declarations" text attachment.
 * Lives in xlocator-allure to avoid leaking the Allure dependency into core/declarations.
 */
public final class AllureConversionLogger implements ConversionLogger {

    static final String STEP_PREFIX = "XLocator: ";
    static final String ATTACHMENT_NAME = "Locator declarations";

    private final ConversionLogDetail detail;

    public AllureConversionLogger(ConversionLogDetail detail) {
        this.detail = detail == null ? ConversionLogDetail.NONE : detail;
    }

    @Override
    public ConversionLogDetail detail() {
        return detail;
    }

    @Override
    public void logConversion(String xpath, List<LocatorRecord> records, String declarations) {
        String title = STEP_PREFIX + safe(xpath);

        Allure.step(title, () -> {
            StringBuilder sb = new StringBuilder(512);

            sb.append("xpath: ").append(safe(xpath)).append('\n')
                    .append("steps: ").append(records == null ? 0 : records.size()).append('\n');

            if (detail != ConversionLogDetail.NONE && records != null) {
                for (LocatorRecord r : records) {
                    sb.append("id: ").append(r.getIdentifier()).append('\n');
                }
            }
            if (detail == ConversionLogDetail.FULL && declarations != null && !declarations.isEmpty()) {
                sb.append('\n').append(declarations);
            }

            byte[] txt = sb.toString().getBytes(StandardCharsets.UTF_8);
            Allure.addAttachment(
                    ATTACHMENT_NAME,
                    "text/plain",
                    new ByteArrayInputStream(txt),
                    ".txt"
            );
        });
    }

    private static String safe(String s) {
        return s == null ? "" : s;
    }
}
