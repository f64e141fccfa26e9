package io.github.cyfko.metricql.core.entity;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reads an entity list from its JSON form:
 * <pre>{@code
 * [
 *   { "entity": "age", "value": "40", "role": "lower" },
 *   { "entity": "age", "value": 60,   "role": "upper" },
 *   { "entity": "kpi", "value": "door to needle" }
 * ]
 * }</pre>
 * <p>
 * Scalar values of any JSON type are read as text. Fields other than {@code entity},
 * {@code value} and {@code role} are ignored.
 * </p>
 *
 * @since 1.0.0
 */
public class EntityListReader {

    private final ObjectMapper mapper;

    public EntityListReader() {
        this(new ObjectMapper());
    }

    public EntityListReader(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "ObjectMapper is required");
    }

    /**
     * @param json the JSON array
     * @return the entities in document order
     * @throws IllegalArgumentException if the text is not a JSON array of entity objects
     */
    public List<Entity> read(String json) {
        Objects.requireNonNull(json, "JSON cannot be null");
        try {
            return toEntities(mapper.readTree(json));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed entity JSON: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * @param source the JSON array, not closed by this method
     * @return the entities in document order
     * @throws IllegalArgumentException if the content is not a JSON array of entity objects
     * @throws UncheckedIOException     if the stream cannot be read
     */
    public List<Entity> read(InputStream source) {
        Objects.requireNonNull(source, "Source cannot be null");
        try {
            return toEntities(mapper.readTree(source));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed entity JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static List<Entity> toEntities(JsonNode root) {
        if (root == null || !root.isArray()) {
            throw new IllegalArgumentException("Entity JSON must be an array");
        }

        List<Entity> entities = new ArrayList<>();
        int index = 0;
        for (JsonNode node : root) {
            JsonNode type = node.get("entity");
            if (!node.isObject() || type == null || !type.isTextual()) {
                throw new IllegalArgumentException("Entity at index " + index + " has no textual 'entity' field");
            }
            entities.add(new Entity(type.asText(), scalar(node.get("value")), scalar(node.get("role"))));
            index++;
        }
        return entities;
    }

    private static String scalar(JsonNode node) {
        return node == null || node.isNull() ? null : node.asText();
    }
}
