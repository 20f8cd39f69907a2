package com.docbridge.core.reader;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;

import java.util.ArrayList;
import java.util.List;

/**
 * Base class for readers built on Jackson.
 *
 * <p>Holds one XML and one JSON mapper per reader instance. XML readers use the StAX input
 * factory configured by {@link XmlMapper}; JSON readers use the tree model of
 * {@link ObjectMapper}.
 */
public abstract class AbstractJacksonReader implements DocumentReader {

    /**
     * XML mapper whose StAX factory parses XML trees.
     */
    protected final XmlMapper xmlMapper;

    /**
     * JSON mapper for parsing JSON trees.
     */
    protected final ObjectMapper objectMapper;

    protected AbstractJacksonReader() {
        this.xmlMapper = new XmlMapper();
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Renders a JSON value as an attribute string. Arrays become whitespace-separated
     * lists, the way docutils serializes {@code classes} and {@code ids}.
     *
     * @param value JSON value, may be null
     * @return attribute string, or null for null and object values
     */
    protected String attributeText(JsonNode value) {
        if (value == null || value.isNull() || value.isObject()) {
            return null;
        }
        if (value.isArray()) {
            List<String> items = new ArrayList<>();
            value.forEach(item -> {
                if (item.isValueNode() && !item.isNull()) {
                    items.add(item.asText());
                }
            });
            return String.join(" ", items);
        }
        return value.asText();
    }
}
