package io.hearthwarrio.xlocator.testkit;

import io.hearthwarrio.xlocator.core.LocatorRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Reusable JUnit assertions for locator record chains.
 */
public final class LocatorAssertions {

    private static final Pattern CANONICAL = Pattern.compile("[A-Za-z0-9]+(_[A-Za-z0-9]+)*");

    private LocatorAssertions() {
        // utility class
    }

    /**
     * Each record after the first names its predecessor as container and extends the predecessor's identifier;
     * the first record has no container.
     */
    public static void assertChain(List<LocatorRecord> records) {
        assertNotNull(records, "records");
        for (int i = 0; i < records.size(); i++) {
            LocatorRecord r = records.get(i);
            if (i == 0) {
                assertEquals("", r.getContainer(), "first record must not have a container");
                continue;
            }
            String parent = records.get(i - 1).getIdentifier();
            assertEquals(parent, r.getContainer(), "container of record " + i);
            assertTrue(r.getIdentifier().startsWith(parent + "_"),
                    () -> "identifier '" + r.getIdentifier() + "' does not extend '" + parent + "'");
        }
    }

    /**
     * Every non-empty identifier consists of ASCII alphanumeric runs joined by single underscores.
     */
    public static void assertCanonicalIdentifiers(List<LocatorRecord> records) {
        assertNotNull(records, "records");
        for (LocatorRecord r : records) {
            String id = r.getIdentifier();
            assertTrue(id.isEmpty() || CANONICAL.matcher(id).matches(),
                    () -> "identifier is not canonical: '" + id + "'");
        }
    }

    /**
     * Compares identifiers in order.
     */
    public static void assertIdentifiers(List<LocatorRecord> records, String... expected) {
        assertNotNull(records, "records");
        List<String> actual = new ArrayList<>(records.size());
        for (LocatorRecord r : records) {
            actual.add(r.getIdentifier());
        }
        assertEquals(List.of(expected), actual);
    }
}
