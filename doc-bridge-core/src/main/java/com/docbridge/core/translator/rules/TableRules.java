package com.docbridge.core.translator.rules;

import com.docbridge.core.model.DocNode;
import com.docbridge.core.model.NodeKind;
import com.docbridge.core.translator.engine.NodeRule;
import com.docbridge.core.translator.engine.RuleFamily;
import com.docbridge.core.translator.engine.RuleRegistry;
import com.docbridge.core.translator.state.Mode;
import com.docbridge.core.translator.state.OutputBuffer;
import com.docbridge.core.translator.state.TranslationContext;
import com.docbridge.core.translator.table.TableLayout;

/**
 * Rules for tables. The table group opens the {@code |===} block with a header line
 * computed by {@link TableLayout}; rows end with a line break and cells start with {@code |}.
 */
public final class TableRules implements RuleFamily {

    static final String TABLE_DELIMITER = "|===\n";

    @Override
    public String name() {
        return "tables";
    }

    @Override
    public void registerInto(RuleRegistry registry) {
        registry.register(NodeKind.TABLE, NodeRule.of(
            (node, context, out) -> context.set(Mode.TABLE, true),
            (node, context, out) -> {
                context.set(Mode.TABLE, false);
                context.clearPendingColumnSpecs();
            }));
        registry.register(NodeKind.TABULAR_COL_SPEC, NodeRule.of(
            (node, context, out) -> context.setPendingColumnSpecs(
                TableLayout.parseColumnSpec(node.attribute("spec").orElse(null))),
            NodeRule.Step.NONE));
        registry.register(NodeKind.TGROUP, NodeRule.of(TableRules::enterTableGroup,
            (node, context, out) -> out.append(TABLE_DELIMITER)));
        registry.register(NodeKind.ROW, NodeRule.delimited("", "\n"));
        registry.register(NodeKind.ENTRY, NodeRule.delimited("|", ""));
    }

    private static void enterTableGroup(DocNode node, TranslationContext context, OutputBuffer out) {
        TableLayout layout = TableLayout.of(node, context.pendingColumnSpecs(), context.options());
        out.append(layout.headerLine());
        out.append(TABLE_DELIMITER);
    }
}
