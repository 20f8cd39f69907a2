package com.docbridge.core.translator.table;

import com.docbridge.core.model.DocNode;
import com.docbridge.core.model.NodeKind;
import com.docbridge.core.translator.ColumnAlignment;
import com.docbridge.core.translator.TranslatorOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.OptionalInt;
import java.util.stream.Collectors;

/**
 * Column layout of a table group and the AsciiDoc header line derived from it.
 *
 * @param alignments per-column alignment
 * @param widthPercentages per-column width in percent, empty when widths are not computed
 */
public record TableLayout(List<ColumnAlignment> alignments, List<Integer> widthPercentages) {

    private static final Logger log = LoggerFactory.getLogger(TableLayout.class);

    private static final String HEADER_OPTION = "options=\"header\"";

    /**
     * Compact constructor with validation.
     */
    public TableLayout {
        alignments = alignments == null ? List.of() : List.copyOf(alignments);
        widthPercentages = widthPercentages == null ? List.of() : List.copyOf(widthPercentages);
    }

    /**
     * Computes the layout of a {@code tgroup}.
     *
     * @param tgroup table group node
     * @param columnSpecs alignment codes from a preceding column spec, may be empty
     * @param options translator options
     * @return column layout
     */
    public static TableLayout of(DocNode tgroup, List<String> columnSpecs, TranslatorOptions options) {
        List<Integer> widths = options.computeColumnWidthPercentages()
            ? widthPercentages(tgroup)
            : List.of();
        int columns = Math.max(columnCount(tgroup), widths.size());

        List<ColumnAlignment> alignments = new ArrayList<>();
        for (int i = 0; i < columns; i++) {
            alignments.add(i < columnSpecs.size()
                ? alignmentOf(columnSpecs.get(i), options.defaultColumnAlignment())
                : options.defaultColumnAlignment());
        }
        return new TableLayout(alignments, widths);
    }

    /**
     * Parses a column spec such as {@code |l|r|c|} into its alignment codes.
     *
     * @param spec column spec, may be null
     * @return codes between the outer separators
     */
    public static List<String> parseColumnSpec(String spec) {
        if (spec == null) {
            return List.of();
        }
        String[] parts = spec.strip().split("\\|", -1);
        if (parts.length < 2) {
            return List.of();
        }
        return Arrays.stream(parts, 1, parts.length - 1)
            .map(String::strip)
            .collect(Collectors.toList());
    }

    /**
     * Maps an alignment code: {@code r} is right, {@code c} is centered, anything else
     * falls back to the default.
     *
     * @param code alignment code
     * @param fallback default alignment
     * @return column alignment
     */
    public static ColumnAlignment alignmentOf(String code, ColumnAlignment fallback) {
        if ("r".equals(code)) {
            return ColumnAlignment.RIGHT;
        }
        if ("c".equals(code)) {
            return ColumnAlignment.CENTER;
        }
        return fallback;
    }

    /**
     * Renders the block attribute line that opens the table.
     *
     * @return header line including its trailing line break
     */
    public String headerLine() {
        if (!widthPercentages.isEmpty()) {
            List<String> columns = new ArrayList<>();
            for (int i = 0; i < widthPercentages.size(); i++) {
                ColumnAlignment alignment = i < alignments.size() ? alignments.get(i) : ColumnAlignment.UNSPECIFIED;
                columns.add(alignment.symbol() + widthPercentages.get(i) + "%");
            }
            return "[cols=\"" + String.join(",", columns) + "\"," + HEADER_OPTION + "]\n";
        }
        boolean aligned = alignments.stream().anyMatch(alignment -> alignment != ColumnAlignment.UNSPECIFIED);
        if (aligned) {
            // an empty column spec is not valid AsciiDoc; left is the AsciiDoc default
            String columns = alignments.stream()
                .map(alignment -> alignment == ColumnAlignment.UNSPECIFIED ? ColumnAlignment.LEFT : alignment)
                .map(ColumnAlignment::symbol)
                .collect(Collectors.joining(","));
            return "[cols=\"" + columns + "\"," + HEADER_OPTION + "]\n";
        }
        return "[" + HEADER_OPTION + "]\n";
    }

    private static int columnCount(DocNode tgroup) {
        OptionalInt cols = tgroup.intAttribute("cols");
        if (cols.isPresent()) {
            return cols.getAsInt();
        }
        return (int) tgroup.children().stream().filter(child -> child.is(NodeKind.COLSPEC)).count();
    }

    private static List<Integer> widthPercentages(DocNode tgroup) {
        List<Integer> widths = tgroup.descendants().stream()
            .filter(node -> node.is(NodeKind.COLSPEC))
            .map(node -> node.intAttribute("colwidth"))
            .filter(OptionalInt::isPresent)
            .map(OptionalInt::getAsInt)
            .collect(Collectors.toList());
        int total = widths.stream().mapToInt(Integer::intValue).sum();
        if (total <= 0) {
            log.warn("Table has no usable column widths, leaving column layout to AsciiDoc");
            return List.of();
        }
        return widths.stream()
            .map(width -> (int) Math.round(width * 100.0 / total))
            .collect(Collectors.toList());
    }
}
