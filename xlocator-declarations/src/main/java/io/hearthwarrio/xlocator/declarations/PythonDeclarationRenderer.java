package io.hearthwarrio.xlocator.declarations;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.core.util.Separators;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.util.RawValue;
import io.hearthwarrio.xlocator.core.DeclarationRenderer;
import io.hearthwarrio.xlocator.core.LocatorRecord;

import java.util.List;
import java.util.Map;

/**
 * Renders locator records as Python-style assignments, one per record:
 * <pre>
 * form_ModuleQT = {
 *     "archetype": "ModuleQT",
 *     "visible": 1
 * }
 * form_ModuleQT_button_PushButtonQT = {
 *     "archetype": "PushButtonQT",
 *     "visible": 1,
 *     "container": form_ModuleQT
 * }
 * </pre>
 * The container is written unquoted: it refers to the variable declared just before.
 */
public final class PythonDeclarationRenderer implements DeclarationRenderer<String> {

    static final String CONTAINER_KEY = "container";

    private static final String INDENT = "    ";
    private static final String EOL = "\n";

    private final ObjectMapper mapper;
    private final ObjectWriter writer;

    public PythonDeclarationRenderer() {
        this(new ObjectMapper());
    }

    public PythonDeclarationRenderer(ObjectMapper mapper) {
        this.mapper = mapper;
        DefaultPrettyPrinter printer = new DefaultPrettyPrinter()
                .withObjectIndenter(new DefaultIndenter(INDENT, EOL))
                .withSeparators(Separators.createDefaultInstance()
                        .withObjectFieldValueSpacing(Separators.Spacing.AFTER));
        this.writer = mapper.writer(printer);
    }

    @Override
    public String render(List<LocatorRecord> records) {
        if (records == null || records.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder(records.size() * 96);
        for (LocatorRecord r : records) {
            sb.append(declaration(r));
        }
        return sb.toString();
    }

    /**
     * Renders a single record, including the trailing line break.
     */
    public String declaration(LocatorRecord record) {
        return record.getIdentifier() + " = " + body(record) + EOL;
    }

    private String body(LocatorRecord record) {
        ObjectNode node = mapper.createObjectNode();
        for (Map.Entry<String, Object> e : record.getMetadata().entrySet()) {
            Object v = e.getValue();
            if (v instanceof Integer) {
                node.put(e.getKey(), (Integer) v);
            } else {
                node.put(e.getKey(), String.valueOf(v));
            }
        }
        if (record.hasContainer()) {
            // variable reference, written unquoted and always last
            node.remove(CONTAINER_KEY);
            node.putRawValue(CONTAINER_KEY, new RawValue(record.getContainer()));
        }
        try {
            return writer.writeValueAsString(node);
        } catch (JsonProcessingException ex) {
            throw new DeclarationRenderingException("Cannot render metadata of " + record.getIdentifier(), ex);
        }
    }
}
