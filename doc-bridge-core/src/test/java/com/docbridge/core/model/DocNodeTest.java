package com.docbridge.core.model;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link DocNode}.
 */
class DocNodeTest {

    @Test
    void element_unknownTagName_keepsNameWithUnknownKind() {
        DocNode node = DocNode.element("pending_xref", null, null);

        assertThat(node.kind()).isEqualTo(NodeKind.UNKNOWN);
        assertThat(node.tagName()).isEqualTo("pending_xref");
        assertThat(node.attributes()).isEmpty();
        assertThat(node.children()).isEmpty();
    }

    @Test
    void element_attributesAndChildren_areDefensivelyCopied() {
        Map<String, String> attributes = new HashMap<>();
        attributes.put("ids", "a");
        DocNode node = DocNode.element(NodeKind.SECTION, attributes, List.of());

        attributes.put("ids", "b");

        assertThat(node.attribute("ids")).contains("a");
        assertThatThrownBy(() -> node.attributes().put("x", "y")).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void text_nullPayload_throwsException() {
        assertThatThrownBy(() -> DocNode.text(null)).isInstanceOf(NullPointerException.class);
    }

    @Test
    void attributeValues_whitespaceSeparated_splitsEntries() {
        DocNode node = DocNode.builder(NodeKind.TOPIC).attribute("classes", "  contents  local ").build();

        assertThat(node.attributeValues("classes")).containsExactly("contents", "local");
        assertThat(node.attributeValues("ids")).isEmpty();
    }

    @Test
    void nonBlankAttribute_blankValue_returnsEmpty() {
        DocNode node = DocNode.builder(NodeKind.REFERENCE).attribute("refuri", " ").build();

        assertThat(node.hasAttribute("refuri")).isTrue();
        assertThat(node.nonBlankAttribute("refuri")).isEmpty();
    }

    @Test
    void flag_truthyValues_returnTrue() {
        assertThat(withAttribute("linenos", "True").flag("linenos")).isTrue();
        assertThat(withAttribute("linenos", "1").flag("linenos")).isTrue();
        assertThat(withAttribute("linenos", "False").flag("linenos")).isFalse();
        assertThat(withAttribute("other", "1").flag("linenos")).isFalse();
    }

    @Test
    void intAttribute_numbers_parsesAndRounds() {
        assertThat(withAttribute("colwidth", "30").intAttribute("colwidth")).hasValue(30);
        assertThat(withAttribute("colwidth", "12.6").intAttribute("colwidth")).hasValue(13);
        assertThat(withAttribute("colwidth", "wide").intAttribute("colwidth")).isEmpty();
    }

    @Test
    void asText_nestedElements_concatenatesTextLeaves() {
        DocNode paragraph = DocNode.builder(NodeKind.PARAGRAPH)
            .text("a ")
            .child(DocNode.builder(NodeKind.STRONG).text("b"))
            .text(" c")
            .build();

        assertThat(paragraph.asText()).isEqualTo("a b c");
    }

    @Test
    void descendants_tree_listsNodesInPreOrder() {
        DocNode leaf = DocNode.text("x");
        DocNode strong = DocNode.builder(NodeKind.STRONG).child(leaf).build();
        DocNode paragraph = DocNode.builder(NodeKind.PARAGRAPH).child(strong).build();

        assertThat(paragraph.descendants()).containsExactly(strong, leaf);
    }

    @Test
    void lastDescendant_followsLastChildren() {
        DocNode image = DocNode.builder(NodeKind.IMAGE).build();
        DocNode reference = DocNode.builder(NodeKind.REFERENCE)
            .text("label")
            .child(image)
            .build();

        assertThat(reference.lastDescendant()).contains(image);
        assertThat(image.lastDescendant()).isEmpty();
    }

    private static DocNode withAttribute(String name, String value) {
        return DocNode.builder(NodeKind.LITERAL_BLOCK).attribute(name, value).build();
    }
}
