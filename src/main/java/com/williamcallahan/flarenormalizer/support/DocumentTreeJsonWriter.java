package com.williamcallahan.flarenormalizer.support;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.Comment;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.springframework.stereotype.Component;

/**
 * Serializes a normalized tree as ordered JSON for consumers on the other side of a process
 * boundary.
 *
 * Elements become {@code {"type":"element","tag":..,"attributes":{..},"children":[..]}}, text and
 * comments become {@code {"type":"text"|"comment","content":..}}. Attribute order follows the
 * tree.
 */
@Component
public class DocumentTreeJsonWriter {

    private final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * @param document normalized document; its body is the root of the JSON tree
     * @return pretty-printed JSON
     */
    public String write(Document document) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(toJson(document.body()));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize document tree", e);
        }
    }

    /**
     * Converts one node and its subtree. Node types other than element, text and comment are skipped
     * by the caller.
     */
    public ObjectNode toJson(Node node) {
        ObjectNode json = objectMapper.createObjectNode();
        if (node instanceof TextNode textNode) {
            json.put("type", "text");
            json.put("content", textNode.getWholeText());
            return json;
        }
        if (node instanceof Comment comment) {
            json.put("type", "comment");
            json.put("content", comment.getData());
            return json;
        }
        Element element = (Element) node;
        json.put("type", "element");
        json.put("tag", element.tagName());
        ObjectNode attributes = json.putObject("attributes");
        for (Attribute attribute : element.attributes()) {
            attributes.put(attribute.getKey(), attribute.getValue());
        }
        ArrayNode children = json.putArray("children");
        for (Node child : element.childNodes()) {
            if (child instanceof Element || child instanceof TextNode || child instanceof Comment) {
                children.add(toJson(child));
            }
        }
        return json;
    }
}
