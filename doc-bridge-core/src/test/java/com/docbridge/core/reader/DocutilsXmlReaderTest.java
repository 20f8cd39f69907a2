package com.docbridge.core.reader;

import com.docbridge.core.model.DocNode;
import com.docbridge.core.model.NodeKind;
import com.docbridge.core.translator.TranslatorOptions;
import com.docbridge.core.translator.impl.AsciiDocTranslator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link DocutilsXmlReader}.
 */
class DocutilsXmlReaderTest {

    private DocutilsXmlReader reader;

    @BeforeEach
    void setUp() {
        reader = new DocutilsXmlReader();
    }

    @Test
    void getId_returnsDocutilsXml() {
        assertThat(reader.getId()).isEqualTo("docutils-xml");
        assertThat(reader.getSupportedExtensions()).containsExactly("xml");
    }

    @Test
    void read_docutilsFixture_buildsTreeWithoutIndentation() throws Exception {
        DocNode document = reader.read(fixture("guide.xml"));

        assertThat(document.kind()).isEqualTo(NodeKind.DOCUMENT);
        assertThat(document.attribute("source")).contains("/docs/guide.rst");
        assertThat(document.children()).extracting(DocNode::kind).containsExactly(NodeKind.TITLE, NodeKind.SECTION);

        DocNode section = document.children().get(1);
        assertThat(section.children()).extracting(DocNode::kind)
            .containsExactly(NodeKind.TITLE, NodeKind.PARAGRAPH, NodeKind.LITERAL_BLOCK);
        assertThat(section.children().get(1).children()).extracting(DocNode::kind)
            .containsExactly(NodeKind.TEXT, NodeKind.REFERENCE, NodeKind.TEXT, NodeKind.STRONG, NodeKind.TEXT);
    }

    @Test
    void read_preservedSpace_keepsLiteralTextVerbatim() throws Exception {
        DocNode document = reader.read(fixture("guide.xml"));

        DocNode literal = document.children().get(1).children().get(2);
        assertThat(literal.attribute("xml:space")).contains("preserve");
        assertThat(literal.asText()).isEqualTo("def f():\n    return 1");
    }

    @Test
    void read_docutilsFixture_translatesToAsciiDoc() throws Exception {
        DocNode document = reader.read(fixture("guide.xml"));

        String result = new AsciiDocTranslator().translate(document, TranslatorOptions.defaults());

        assertThat(result).isEqualTo(
            "\n\n= User Guide\n"
                + "\n== Intro\n"
                + "\nSee https://python.org[Python] for *details*.\n"
                + "\n[source,python]\n----\ndef f():\n    return 1\n----\n");
    }

    @Test
    void parse_whitespaceBetweenInlineElements_isKept() {
        DocNode paragraph = reader.parse(
            "<paragraph><strong>a</strong> <emphasis>b</emphasis></paragraph>", "inline.xml");

        assertThat(paragraph.asText()).isEqualTo("a b");
    }

    @Test
    void parse_unknownElement_keepsTagName() {
        DocNode node = reader.parse("<pending_xref reftarget=\"x\">X</pending_xref>", "unknown.xml");

        assertThat(node.kind()).isEqualTo(NodeKind.UNKNOWN);
        assertThat(node.tagName()).isEqualTo("pending_xref");
        assertThat(node.attribute("reftarget")).contains("x");
        assertThat(node.asText()).isEqualTo("X");
    }

    @Test
    void parse_malformedXml_throwsExceptionNamingOrigin() {
        assertThatThrownBy(() -> reader.parse("<document><section></document>", "broken.xml"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("broken.xml");
    }

    @Test
    void parse_emptyContent_throwsException() {
        assertThatThrownBy(() -> reader.parse("", "empty.xml"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("empty.xml");
    }

    static Path fixture(String name) throws IOException {
        try {
            return Path.of(DocutilsXmlReaderTest.class.getResource("/fixtures/" + name).toURI());
        } catch (URISyntaxException e) {
            throw new IOException("Invalid fixture location: " + name, e);
        }
    }
}
