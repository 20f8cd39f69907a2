package com.docbridge.core.translator.table;

import com.docbridge.core.model.DocNode;
import com.docbridge.core.model.NodeKind;
import com.docbridge.core.translator.ColumnAlignment;
import com.docbridge.core.translator.TranslatorOptions;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link TableLayout}.
 */
class TableLayoutTest {

    private static final TranslatorOptions WITH_WIDTHS =
        TranslatorOptions.defaults().withComputeColumnWidthPercentages(true);

    @Test
    void of_colspecWidths_convertsToRoundedPercentages() {
        DocNode tgroup = tgroup(null, "1", "2");

        TableLayout layout = TableLayout.of(tgroup, List.of(), WITH_WIDTHS);

        assertThat(layout.widthPercentages()).containsExactly(33, 67);
        assertThat(layout.alignments()).containsExactly(ColumnAlignment.UNSPECIFIED, ColumnAlignment.UNSPECIFIED);
    }

    @Test
    void of_floatWidths_areAccepted() {
        TableLayout layout = TableLayout.of(tgroup(null, "30.0", "70.0"), List.of(), WITH_WIDTHS);

        assertThat(layout.widthPercentages()).containsExactly(30, 70);
    }

    @Test
    void of_zeroTotalWidth_leavesWidthsOut() {
        TableLayout layout = TableLayout.of(tgroup(null, "0", "0"), List.of(), WITH_WIDTHS);

        assertThat(layout.widthPercentages()).isEmpty();
        assertThat(layout.headerLine()).isEqualTo("[options=\"header\"]\n");
    }

    @Test
    void of_widthsDisabled_ignoresColspecWidths() {
        TableLayout layout = TableLayout.of(tgroup(null, "30", "70"), List.of(), TranslatorOptions.defaults());

        assertThat(layout.widthPercentages()).isEmpty();
    }

    @Test
    void of_fewerSpecsThanColumns_padsWithDefaultAlignment() {
        TranslatorOptions options = TranslatorOptions.defaults().withDefaultColumnAlignment(ColumnAlignment.CENTER);

        TableLayout layout = TableLayout.of(tgroup("3"), List.of("r"), options);

        assertThat(layout.alignments())
            .containsExactly(ColumnAlignment.RIGHT, ColumnAlignment.CENTER, ColumnAlignment.CENTER);
        assertThat(layout.headerLine()).isEqualTo("[cols=\">,^,^\",options=\"header\"]\n");
    }

    @Test
    void parseColumnSpec_pipeSeparatedCodes_returnsCodesInOrder() {
        assertThat(TableLayout.parseColumnSpec("|l|r|c|")).containsExactly("l", "r", "c");
        assertThat(TableLayout.parseColumnSpec(" |p{3cm}|r| ")).containsExactly("p{3cm}", "r");
    }

    @Test
    void parseColumnSpec_missingOrUnframedSpec_returnsEmpty() {
        assertThat(TableLayout.parseColumnSpec(null)).isEmpty();
        assertThat(TableLayout.parseColumnSpec("lrc")).isEmpty();
    }

    @Test
    void alignmentOf_unknownCode_fallsBackToDefault() {
        assertThat(TableLayout.alignmentOf("r", ColumnAlignment.LEFT)).isEqualTo(ColumnAlignment.RIGHT);
        assertThat(TableLayout.alignmentOf("c", ColumnAlignment.LEFT)).isEqualTo(ColumnAlignment.CENTER);
        assertThat(TableLayout.alignmentOf("l", ColumnAlignment.RIGHT)).isEqualTo(ColumnAlignment.RIGHT);
    }

    @Test
    void headerLine_widthsAndAlignments_prefixesEachWidthWithSymbol() {
        TableLayout layout = new TableLayout(
            List.of(ColumnAlignment.LEFT, ColumnAlignment.UNSPECIFIED),
            List.of(25, 75));

        assertThat(layout.headerLine()).isEqualTo("[cols=\"<25%,75%\",options=\"header\"]\n");
    }

    @Test
    void headerLine_partialAlignment_fillsUnspecifiedWithLeft() {
        TableLayout layout = new TableLayout(
            List.of(ColumnAlignment.UNSPECIFIED, ColumnAlignment.RIGHT),
            List.of());

        assertThat(layout.headerLine()).isEqualTo("[cols=\"<,>\",options=\"header\"]\n");
    }

    private static DocNode tgroup(String cols, String... widths) {
        DocNode.Builder tgroup = DocNode.builder(NodeKind.TGROUP);
        if (cols != null) {
            tgroup.attribute("cols", cols);
        }
        for (String width : widths) {
            tgroup.child(DocNode.builder(NodeKind.COLSPEC).attribute("colwidth", width));
        }
        return tgroup.build();
    }
}
