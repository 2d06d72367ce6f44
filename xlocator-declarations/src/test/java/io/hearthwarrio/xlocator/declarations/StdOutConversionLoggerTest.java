package io.hearthwarrio.xlocator.declarations;

import io.hearthwarrio.xlocator.core.LocatorRecord;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class StdOutConversionLoggerTest {

    private final List<LocatorRecord> records = List.of(
            new LocatorRecord("form_ModuleQT", Map.of("archetype", "ModuleQT"), ""),
            new LocatorRecord("form_ModuleQT_button_PushButtonQT", Map.of("archetype", "PushButtonQT"), "form_ModuleQT")
    );

    private String log(ConversionLogDetail detail, String declarations) {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
        new StdOutConversionLogger(detail, out).logConversion("/form/button", records, declarations);
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    void noneLogsOnlyTargetAndStepCount() {
        String line = log(ConversionLogDetail.NONE, "ignored");
        assertTrue(line.startsWith("[XLocator] xpath='/form/button', steps=2"));
        assertFalse(line.contains("ids="));
        assertFalse(line.contains("ignored"));
    }

    @Test
    void identifiersOnlyListsIds() {
        String line = log(ConversionLogDetail.IDENTIFIERS_ONLY, "ignored");
        assertTrue(line.contains("ids=[form_ModuleQT, form_ModuleQT_button_PushButtonQT]"));
        assertFalse(line.contains("ignored"));
    }

    @Test
    void fullAppendsDeclarations() {
        String line = log(ConversionLogDetail.FULL, "form_ModuleQT = {}\n");
        assertTrue(line.contains("ids=[form_ModuleQT, form_ModuleQT_button_PushButtonQT]"));
        assertTrue(line.contains("form_ModuleQT = {}"));
    }
}
