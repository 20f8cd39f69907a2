package com.docbridge.core.translator.rules;

import com.docbridge.core.model.DocNode;
import com.docbridge.core.model.NodeKind;
import com.docbridge.core.translator.TranslatorTestBase;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link AdmonitionRules} and {@link AdmonitionKind}.
 */
class AdmonitionRulesTest extends TranslatorTestBase {

    @Test
    void translate_note_rendersLabelledExampleBlock() {
        DocNode note = node(NodeKind.NOTE).child(paragraph("Careful")).build();

        assertThat(translateBody(note)).isEqualTo("\n[NOTE]\n====\n\nCareful\n====\n");
    }

    @ParameterizedTest
    @CsvSource({
        "HINT, TIP",
        "ATTENTION, IMPORTANT",
        "DANGER, CAUTION",
        "ERROR, WARNING",
        "TIP, TIP",
        "CAUTION, CAUTION"
    })
    void translate_admonitionKind_usesAsciiDocLabel(NodeKind kind, String label) {
        DocNode admonition = node(kind).child(paragraph("x")).build();

        assertThat(translateBody(admonition)).startsWith("\n[" + label + "]\n====\n");
    }

    @Test
    void translate_noteInsideListItem_attachesWithContinuation() {
        DocNode list = node(NodeKind.BULLET_LIST)
            .child(node(NodeKind.LIST_ITEM)
                .child(paragraph("a"))
                .child(node(NodeKind.NOTE).child(paragraph("b"))))
            .build();

        String result = translateBody(list);

        assertThat(result).isEqualTo("\n* a\n+\n[NOTE]\n====\nb\n====\n\n\n\n");
    }

    @Test
    void translate_nestedAdmonitions_lengthenInnerDelimiter() {
        DocNode warning = node(NodeKind.WARNING)
            .child(node(NodeKind.NOTE).child(paragraph("x")))
            .build();

        String result = translateBody(warning);

        assertThat(result).isEqualTo("\n[WARNING]\n====\n\n[NOTE]\n=====\n\nx\n=====\n====\n");
    }

    @Test
    void delimiter_level_addsOneMarkerPerNestingLevel() {
        assertThat(AdmonitionRules.delimiter(1)).isEqualTo("====");
        assertThat(AdmonitionRules.delimiter(3)).isEqualTo("======");
    }

    @Test
    void of_nonAdmonitionKind_throwsException() {
        assertThatThrownBy(() -> AdmonitionKind.of(NodeKind.PARAGRAPH))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
