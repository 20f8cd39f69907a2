package com.docbridge.core.reader;

import com.docbridge.core.model.DocNode;
import com.docbridge.core.model.NodeKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import java.io.StringReader;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads docutils XML, as written by {@code rst2xml} or the Sphinx {@code xml} builder.
 *
 * <p>Elements become {@link DocNode} elements with their attributes in document order;
 * character data becomes text leaves. Indentation between block elements is dropped, while
 * whitespace inside text-bearing elements (paragraphs, titles, inline markup, literal
 * blocks) is kept as written.
 *
 * <p>DTDs are not loaded: the DOCTYPE docutils writes points to a remote file.
 */
public class DocutilsXmlReader extends AbstractJacksonReader {

    private static final Logger log = LoggerFactory.getLogger(DocutilsXmlReader.class);

    private static final String PRESERVE_SPACE_ATTRIBUTE = "xml:space";

    /** Elements whose whitespace-only text is content, not indentation. */
    private static final Set<NodeKind> TEXT_BEARING = EnumSet.of(
        NodeKind.PARAGRAPH, NodeKind.COMPACT_PARAGRAPH, NodeKind.TITLE, NodeKind.SUBTITLE,
        NodeKind.RUBRIC, NodeKind.TERM, NodeKind.CLASSIFIER, NodeKind.LINE, NodeKind.CAPTION,
        NodeKind.ATTRIBUTION, NodeKind.FIELD_NAME, NodeKind.LABEL, NodeKind.LITERAL_BLOCK,
        NodeKind.DOCTEST_BLOCK, NodeKind.MATH_BLOCK, NodeKind.RAW, NodeKind.COMMENT,
        NodeKind.SUBSTITUTION_DEFINITION, NodeKind.AUTHOR, NodeKind.VERSION, NodeKind.DATE,
        NodeKind.REVISION, NodeKind.COPYRIGHT, NodeKind.OPTION_STRING, NodeKind.OPTION_ARGUMENT,
        NodeKind.STRONG, NodeKind.EMPHASIS, NodeKind.LITERAL, NodeKind.LITERAL_STRONG,
        NodeKind.LITERAL_EMPHASIS, NodeKind.TITLE_REFERENCE, NodeKind.SUBSCRIPT,
        NodeKind.SUPERSCRIPT, NodeKind.MANPAGE, NodeKind.INLINE, NodeKind.ABBREVIATION,
        NodeKind.REFERENCE, NodeKind.FOOTNOTE_REFERENCE, NodeKind.CITATION_REFERENCE,
        NodeKind.PROBLEMATIC, NodeKind.DOWNLOAD_REFERENCE, NodeKind.GENERATED,
        NodeKind.DESC_SIGNATURE, NodeKind.DESC_NAME, NodeKind.DESC_ADDNAME, NodeKind.DESC_TYPE,
        NodeKind.DESC_RETURNS, NodeKind.DESC_PARAMETER, NodeKind.DESC_ANNOTATION);

    private final XMLInputFactory inputFactory;

    public DocutilsXmlReader() {
        super();
        this.inputFactory = xmlMapper.getFactory().getXMLInputFactory();
        inputFactory.setProperty(XMLInputFactory.SUPPORT_DTD, Boolean.FALSE);
        inputFactory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, Boolean.FALSE);
    }

    @Override
    public String getId() {
        return "docutils-xml";
    }

    @Override
    public Set<String> getSupportedExtensions() {
        return Set.of("xml");
    }

    @Override
    public DocNode parse(String content, String origin) {
        XMLStreamReader reader = null;
        try {
            reader = inputFactory.createXMLStreamReader(new StringReader(content));
            DocNode root = readTree(reader);
            if (root == null) {
                throw new IllegalArgumentException("No document element in " + origin);
            }
            log.debug("Read docutils XML tree from {} (root element '{}')", origin, root.tagName());
            return root;
        } catch (XMLStreamException e) {
            throw new IllegalArgumentException("Malformed docutils XML in " + origin + ": " + e.getMessage(), e);
        } finally {
            close(reader, origin);
        }
    }

    private DocNode readTree(XMLStreamReader reader) throws XMLStreamException {
        Deque<PendingElement> open = new ArrayDeque<>();
        DocNode root = null;
        while (reader.hasNext()) {
            switch (reader.next()) {
                case XMLStreamConstants.START_ELEMENT -> {
                    if (!open.isEmpty()) {
                        open.peek().flushText();
                    }
                    open.push(new PendingElement(qualifiedName(reader.getPrefix(), reader.getLocalName()),
                        attributes(reader)));
                }
                case XMLStreamConstants.CHARACTERS, XMLStreamConstants.CDATA, XMLStreamConstants.SPACE -> {
                    if (!open.isEmpty()) {
                        open.peek().text.append(reader.getText());
                    }
                }
                case XMLStreamConstants.END_ELEMENT -> {
                    DocNode node = open.pop().build();
                    if (open.isEmpty()) {
                        root = node;
                    } else {
                        open.peek().children.add(node);
                    }
                }
                default -> {
                    // comments, processing instructions and the DOCTYPE carry no content
                }
            }
        }
        return root;
    }

    private static Map<String, String> attributes(XMLStreamReader reader) {
        Map<String, String> attributes = new LinkedHashMap<>();
        for (int i = 0; i < reader.getAttributeCount(); i++) {
            attributes.put(
                qualifiedName(reader.getAttributePrefix(i), reader.getAttributeLocalName(i)),
                reader.getAttributeValue(i));
        }
        return attributes;
    }

    private static String qualifiedName(String prefix, String localName) {
        return prefix == null || prefix.isEmpty() ? localName : prefix + ":" + localName;
    }

    private static void close(XMLStreamReader reader, String origin) {
        if (reader == null) {
            return;
        }
        try {
            reader.close();
        } catch (XMLStreamException e) {
            log.warn("Failed to close XML reader for {}: {}", origin, e.getMessage());
        }
    }

    /**
     * Element whose end tag has not been read yet.
     */
    private static final class PendingElement {
        private final String tagName;
        private final Map<String, String> attributes;
        private final List<DocNode> children = new ArrayList<>();
        private final StringBuilder text = new StringBuilder();

        private PendingElement(String tagName, Map<String, String> attributes) {
            this.tagName = tagName;
            this.attributes = attributes;
        }

        private void flushText() {
            if (text.length() > 0) {
                children.add(DocNode.text(text.toString()));
                text.setLength(0);
            }
        }

        private DocNode build() {
            flushText();
            NodeKind kind = NodeKind.fromTagName(tagName);
            boolean keepWhitespace = TEXT_BEARING.contains(kind)
                || "preserve".equals(attributes.get(PRESERVE_SPACE_ATTRIBUTE))
                || children.stream().anyMatch(child -> child.isText() && !child.text().isBlank());
            List<DocNode> kept = keepWhitespace
                ? children
                : children.stream().filter(child -> !child.isText() || !child.text().isBlank()).toList();
            return DocNode.element(tagName, attributes, kept);
        }
    }
}
