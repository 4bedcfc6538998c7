package com.registry.reconciliation.normalize;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.registry.reconciliation.core.model.CanonicalField;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Loads {@link ColumnMapping}s from JSON.
 *
 * <pre>
 * {
 *   "name": "mca-state",
 *   "identifier": ["CIN"],
 *   "upperCase": ["NAME", "STATUS"],
 *   "datePatterns": ["uuuu-MM-dd", "dd-MM-uuuu"],
 *   "fields": {
 *     "NAME": ["CompanyName"],
 *     "STATUS": ["CompanyStatus"]
 *   },
 *   "constants": { "STATE": "Maharashtra" }
 * }
 * </pre>
 *
 * <p>Field keys are {@link CanonicalField} names or labels. Unknown keys fail the load.
 * {@code "upperCaseText": true} upper-cases every text field; {@code "upperCase"} names
 * individual fields.</p>
 */
public class ColumnMappingLoader {
    private static final Logger log = LoggerFactory.getLogger(ColumnMappingLoader.class);

    private final ObjectMapper objectMapper;

    public ColumnMappingLoader() {
        this(new ObjectMapper());
    }

    public ColumnMappingLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ColumnMapping load(InputStream input) throws IOException {
        JsonNode root = objectMapper.readTree(input);
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("column mapping must be a JSON object");
        }
        return parse(root);
    }

    public ColumnMapping load(String json) throws IOException {
        JsonNode root = objectMapper.readTree(json);
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("column mapping must be a JSON object");
        }
        return parse(root);
    }

    /**
     * Loads a mapping from the classpath.
     *
     * @throws IllegalArgumentException if the resource does not exist
     * @throws UncheckedIOException     if the resource cannot be read
     */
    public ColumnMapping loadResource(String resourcePath) {
        try (InputStream in = ColumnMappingLoader.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (in == null) {
                throw new IllegalArgumentException("column mapping resource not found: " + resourcePath);
            }
            ColumnMapping mapping = load(in);
            log.info("mapping.loaded resource={} mapping={}", resourcePath, mapping);
            return mapping;
        } catch (IOException e) {
            throw new UncheckedIOException("failed to read column mapping " + resourcePath, e);
        }
    }

    private ColumnMapping parse(JsonNode root) {
        ColumnMapping.Builder builder = ColumnMapping.builder();

        if (root.hasNonNull("name")) {
            builder.name(root.get("name").asText());
        }
        builder.identifierColumns(textList(root.get("identifier"), "identifier").toArray(new String[0]));
        if (root.hasNonNull("upperCaseText")) {
            builder.upperCaseText(root.get("upperCaseText").asBoolean());
        }
        for (String key : textList(root.get("upperCase"), "upperCase")) {
            builder.upperCase(resolveField(key));
        }
        if (root.hasNonNull("datePatterns")) {
            builder.datePatterns(textList(root.get("datePatterns"), "datePatterns"));
        }

        JsonNode fields = root.get("fields");
        if (fields != null && fields.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> it = fields.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> entry = it.next();
                CanonicalField field = resolveField(entry.getKey());
                builder.map(field, textList(entry.getValue(), entry.getKey()).toArray(new String[0]));
            }
        }

        JsonNode constants = root.get("constants");
        if (constants != null && constants.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> it = constants.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> entry = it.next();
                builder.constant(resolveField(entry.getKey()), entry.getValue().asText());
            }
        }

        return builder.build();
    }

    private static CanonicalField resolveField(String key) {
        return CanonicalField.fromName(key)
                .orElseThrow(() -> new IllegalArgumentException("unknown canonical field: " + key));
    }

    private static List<String> textList(JsonNode node, String name) {
        List<String> values = new ArrayList<>();
        if (node == null || node.isNull()) {
            return values;
        }
        if (node.isTextual()) {
            values.add(node.asText());
        } else if (node.isArray()) {
            node.forEach(element -> values.add(element.asText()));
        } else {
            throw new IllegalArgumentException(name + " must be a string or an array of strings");
        }
        return values;
    }
}
