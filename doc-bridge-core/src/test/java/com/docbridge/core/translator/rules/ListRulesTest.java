package com.docbridge.core.translator.rules;

import com.docbridge.core.model.DocNode;
import com.docbridge.core.model.NodeKind;
import com.docbridge.core.translator.TranslatorTestBase;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ListRules}.
 */
class ListRulesTest extends TranslatorTestBase {

    @Test
    void translate_bulletList_prefixesEachItem() {
        DocNode list = node(NodeKind.BULLET_LIST).child(item("a")).child(item("b")).build();

        assertThat(translateBody(list)).isEqualTo("\n* a\n\n* b\n\n\n");
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 2, 3, 4, 5})
    void translate_nestedBulletLists_repeatMarkerPerDepth(int depth) {
        String result = translateBody(nestedBulletList(depth, "x"));

        assertThat(result).contains("*".repeat(depth) + " x");
        assertThat(result).doesNotContain(ListRules.INDENTATION_ERROR);
    }

    @Test
    void translate_listBeyondDeepestLevel_keepsDeepestMarkerAndFlagsError() {
        String result = translateBody(nestedBulletList(6, "x"));

        assertThat(result).contains("***** List indentation error! x");
    }

    @Test
    void translate_enumeratedListWithType_emitsStyleLine() {
        DocNode list = node(NodeKind.ENUMERATED_LIST)
            .attribute("enumtype", "arabic")
            .child(item("a"))
            .build();

        assertThat(translateBody(list)).isEqualTo("\n[arabic]\n. a\n\n");
    }

    @Test
    void translate_enumeratedInsideBullet_usesInnermostMarkerAtCombinedDepth() {
        DocNode list = node(NodeKind.BULLET_LIST)
            .child(node(NodeKind.LIST_ITEM)
                .child(paragraph("a"))
                .child(node(NodeKind.ENUMERATED_LIST).attribute("enumtype", "loweralpha").child(item("b"))))
            .build();

        String result = translateBody(list);

        assertThat(result).isEqualTo("\n* a\n.. b\n\n\n\n");
        assertThat(result).doesNotContain("[loweralpha]");
    }

    @Test
    void translate_listItemOutsideList_emitsIndentationError() {
        assertThat(translateBody(item("x"))).isEqualTo("\nList indentation error!\n\nx\n\n");
    }

    @Test
    void translate_toctreeItem_omitsMarker() {
        DocNode list = node(NodeKind.BULLET_LIST)
            .child(node(NodeKind.LIST_ITEM).attribute("classes", "toctree-l1").child(paragraph("x")))
            .build();

        assertThat(translateBody(list)).isEqualTo("\nx\n\n\n");
    }

    @Test
    void translate_definitionList_rendersTermWithDoubleColon() {
        DocNode list = node(NodeKind.DEFINITION_LIST)
            .child(node(NodeKind.DEFINITION_LIST_ITEM)
                .child(textNode(NodeKind.TERM, "T"))
                .child(node(NodeKind.DEFINITION).child(paragraph("D"))))
            .build();

        assertThat(translateBody(list)).isEqualTo("\nT:: \n\nD\n\n\n\n\n");
    }

    @Test
    void translate_termClassifier_rendersItalicSuffix() {
        DocNode term = node(NodeKind.TERM)
            .text("count")
            .child(textNode(NodeKind.CLASSIFIER, "int"))
            .build();

        assertThat(translateBody(term)).isEqualTo("count _int_:: ");
    }

    @Test
    void translate_glossaryTerm_rendersHeadingAndRestoresSectionDepth() {
        DocNode glossary = node(NodeKind.GLOSSARY)
            .child(node(NodeKind.DEFINITION_LIST)
                .child(node(NodeKind.DEFINITION_LIST_ITEM)
                    .child(textNode(NodeKind.TERM, "API"))
                    .child(node(NodeKind.DEFINITION).child(paragraph("Interface")))))
            .build();
        DocNode next = node(NodeKind.SECTION).child(textNode(NodeKind.TITLE, "Next")).build();

        String result = translateBody(glossary, next);

        assertThat(result).contains("\n\n== API\n\n");
        assertThat(result).doesNotContain("API:: ");
        assertThat(result).endsWith("\n== Next\n");
    }

    @Test
    void translate_fieldList_rendersTableOfFields() {
        DocNode fields = node(NodeKind.FIELD_LIST)
            .child(node(NodeKind.FIELD)
                .child(textNode(NodeKind.FIELD_NAME, "Author"))
                .child(node(NodeKind.FIELD_BODY).child(paragraph("Me"))))
            .build();

        assertThat(translateBody(fields)).isEqualTo("\n|===\n:Author: Me\n|===\n");
    }

    @Test
    void translate_optionList_rendersOptionThenDescription() {
        DocNode options = node(NodeKind.OPTION_LIST)
            .child(node(NodeKind.OPTION_LIST_ITEM)
                .child(node(NodeKind.OPTION_GROUP)
                    .child(node(NodeKind.OPTION)
                        .child(textNode(NodeKind.OPTION_STRING, "-o"))
                        .child(textNode(NodeKind.OPTION_ARGUMENT, "FILE"))))
                .child(node(NodeKind.DESCRIPTION).child(paragraph("output"))))
            .build();

        assertThat(translateBody(options)).isEqualTo("-o FILE :: \noutput\n\n\n");
    }

    private static DocNode nestedBulletList(int depth, String text) {
        DocNode current = node(NodeKind.BULLET_LIST).child(item(text)).build();
        for (int level = depth; level > 1; level--) {
            current = node(NodeKind.BULLET_LIST)
                .child(node(NodeKind.LIST_ITEM).child(current))
                .build();
        }
        return current;
    }
}
