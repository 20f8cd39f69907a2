package com.docbridge.core.reader;

import com.docbridge.core.model.DocNode;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads a document tree serialized as JSON.
 *
 * <p>An element is an object with a {@code tag}, optional {@code attributes} and optional
 * {@code children}. A text leaf is either a JSON string or an object with a {@code text}
 * field. Array attribute values are joined with spaces:
 * <pre>{@code
 * {
 *   "tag": "section",
 *   "attributes": {"ids": ["intro"], "names": ["intro"]},
 *   "children": [
 *     {"tag": "title", "children": ["Intro"]},
 *     {"tag": "paragraph", "children": [{"text": "Hello"}]}
 *   ]
 * }
 * }</pre>
 */
public class JsonTreeReader extends AbstractJacksonReader {

    private static final Logger log = LoggerFactory.getLogger(JsonTreeReader.class);

    private static final String TAG_FIELD = "tag";
    private static final String ATTRIBUTES_FIELD = "attributes";
    private static final String CHILDREN_FIELD = "children";
    private static final String TEXT_FIELD = "text";

    @Override
    public String getId() {
        return "json-tree";
    }

    @Override
    public Set<String> getSupportedExtensions() {
        return Set.of("json");
    }

    @Override
    public DocNode parse(String content, String origin) {
        JsonNode root;
        try {
            root = objectMapper.readTree(content);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed JSON tree in " + origin + ": " + e.getOriginalMessage(), e);
        }
        if (root == null || root.isMissingNode() || !root.isObject()) {
            throw new IllegalArgumentException("JSON tree in " + origin + " must have an object root");
        }
        DocNode document = toNode(root, origin, "$");
        log.debug("Read JSON tree from {} (root element '{}')", origin, document.tagName());
        return document;
    }

    private DocNode toNode(JsonNode json, String origin, String path) {
        if (json.isTextual()) {
            return DocNode.text(json.asText());
        }
        if (!json.isObject()) {
            throw new IllegalArgumentException("Unexpected " + json.getNodeType() + " at " + path + " in " + origin);
        }
        if (json.has(TEXT_FIELD) && !json.has(TAG_FIELD)) {
            return DocNode.text(json.get(TEXT_FIELD).asText());
        }
        JsonNode tag = json.get(TAG_FIELD);
        if (tag == null || !tag.isTextual() || tag.asText().isBlank()) {
            throw new IllegalArgumentException("Element without tag at " + path + " in " + origin);
        }

        Map<String, String> attributes = new LinkedHashMap<>();
        JsonNode attributesNode = json.get(ATTRIBUTES_FIELD);
        if (attributesNode != null && attributesNode.isObject()) {
            attributesNode.fields().forEachRemaining(entry -> {
                String value = attributeText(entry.getValue());
                if (value != null) {
                    attributes.put(entry.getKey(), value);
                }
            });
        }

        List<DocNode> children = new ArrayList<>();
        JsonNode childrenNode = json.get(CHILDREN_FIELD);
        if (childrenNode != null && childrenNode.isArray()) {
            for (int i = 0; i < childrenNode.size(); i++) {
                children.add(toNode(childrenNode.get(i), origin, path + "." + CHILDREN_FIELD + "[" + i + "]"));
            }
        }
        return DocNode.element(tag.asText(), attributes, children);
    }
}
