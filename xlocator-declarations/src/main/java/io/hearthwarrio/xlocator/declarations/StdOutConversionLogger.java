package io.hearthwarrio.xlocator.declarations;

import io.hearthwarrio.xlocator.core.LocatorRecord;

import java.io.PrintStream;
import java.util.List;
import java.util.Objects;

/**
 * Default stdout logger for conversions.
 * <p>
 * Output shape:
 * <pre>
 * [XLocator] xpath='/form/button', steps=2, ids=[form_ModuleQT, form_ModuleQT_button_PushButtonQT]
 * </pre>
 * followed by the declarations when the detail is {@link ConversionLogDetail#FULL}.
 */
public final class StdOutConversionLogger implements ConversionLogger {

    private final ConversionLogDetail detail;
    private final PrintStream out;

    public StdOutConversionLogger(ConversionLogDetail detail) {
        this(detail, System.out);
    }

    public StdOutConversionLogger(ConversionLogDetail detail, PrintStream out) {
        this.detail = Objects.requireNonNull(detail, "detail must not be null");
        this.out = Objects.requireNonNull(out, "out must not be null");
    }

    @Override
    public ConversionLogDetail detail() {
        return detail;
    }

    @Override
    public void logConversion(String xpath, List<LocatorRecord> records, String declarations) {
        int steps = records == null ? 0 : records.size();

        StringBuilder sb = new StringBuilder(256);
        sb.append("[XLocator] xpath='").append(safe(xpath)).append('\'')
                .append(", steps=").append(steps);

        if (detail == ConversionLogDetail.NONE) {
            out.println(sb);
            return;
        }

        sb.append(", ids=[");
        if (records != null) {
            for (int i = 0; i < records.size(); i++) {
                if (i > 0) {
                    sb.append(", ");
                }
                sb.append(records.get(i).getIdentifier());
            }
        }
        sb.append(']');

        if (detail == ConversionLogDetail.FULL && declarations != null && !declarations.isEmpty()) {
            sb.append(System.lineSeparator()).append(declarations.stripTrailing());
        }

        out.println(sb);
    }

    private static String safe(String s) {
        return s == null ? "" : s;
    }
}
