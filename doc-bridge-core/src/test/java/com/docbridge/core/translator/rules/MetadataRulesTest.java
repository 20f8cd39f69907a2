package com.docbridge.core.translator.rules;

import com.docbridge.core.model.DocNode;
import com.docbridge.core.model.NodeKind;
import com.docbridge.core.translator.TranslatorTestBase;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link MetadataRules}.
 */
class MetadataRulesTest extends TranslatorTestBase {

    @Test
    void translate_docinfo_rendersLabelledFields() {
        DocNode docinfo = node(NodeKind.DOCINFO)
            .child(textNode(NodeKind.AUTHOR, "Ada"))
            .child(textNode(NodeKind.VERSION, "1.0"))
            .child(textNode(NodeKind.DATE, "2024-05-01"))
            .child(textNode(NodeKind.COPYRIGHT, "ACME"))
            .child(textNode(NodeKind.REVISION, "r42"))
            .build();

        assertThat(translateBody(docinfo)).isEqualTo(
            "Author: Ada\n\n"
                + "Document version: 1.0\n\n"
                + ":date: 2024-05-01\n"
                + "Copyright: ACME\n\n"
                + "Revision: r42\n\n"
                + "\n\n");
    }

    @Test
    void translate_meta_rendersAttributeEntry() {
        DocNode meta = node(NodeKind.META).attribute("name", "description").attribute("content", "Guide").build();

        assertThat(translateBody(meta)).isEqualTo(":description: Guide\n");
        assertThat(translateBody(node(NodeKind.META).attribute("content", "x").build())).isEmpty();
    }

    @Test
    void translate_substitutionDefinition_rendersAttributeEntryForFirstName() {
        DocNode definition = node(NodeKind.SUBSTITUTION_DEFINITION)
            .attribute("names", "release version")
            .text("1.2")
            .build();

        assertThat(translateBody(definition)).isEqualTo("\n:release: 1.2\n");
    }

    @Test
    void translate_substitutionDefinitionWithoutName_rendersTextOnly() {
        DocNode definition = node(NodeKind.SUBSTITUTION_DEFINITION).text("1.2").build();

        assertThat(translateBody(definition)).isEqualTo("1.2");
    }
}
