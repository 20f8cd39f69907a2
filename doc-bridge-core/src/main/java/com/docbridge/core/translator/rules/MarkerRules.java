package com.docbridge.core.translator.rules;

import com.docbridge.core.model.NodeKind;
import com.docbridge.core.translator.engine.NodeRule;
import com.docbridge.core.translator.engine.RuleFamily;
import com.docbridge.core.translator.engine.RuleRegistry;
import com.docbridge.core.translator.state.Mode;

import java.util.EnumMap;
import java.util.Map;

/**
 * Rules for Sphinx constructs that have no AsciiDoc counterpart yet.
 *
 * <p>Object descriptions and a few directives are wrapped in visible {@code NAME:} ...
 * {@code :NAME} markers so their content survives and is easy to find in the output.
 */
public final class MarkerRules implements RuleFamily {

    private static final Map<NodeKind, String> MARKERS = new EnumMap<>(NodeKind.class);

    static {
        MARKERS.put(NodeKind.DESC_SIGNATURE_LINE, "DESCSIGLINE");
        MARKERS.put(NodeKind.DESC_NAME, "DESCNAME");
        MARKERS.put(NodeKind.DESC_ADDNAME, "DESCADDNAME");
        MARKERS.put(NodeKind.DESC_TYPE, "DESCTYPE");
        MARKERS.put(NodeKind.DESC_RETURNS, "DESCRETURNS");
        MARKERS.put(NodeKind.DESC_PARAMETERLIST, "DESCPARALIST");
        MARKERS.put(NodeKind.DESC_PARAMETER, "DESCPARAMETER");
        MARKERS.put(NodeKind.DESC_OPTIONAL, "DESCOPTIONAL");
        MARKERS.put(NodeKind.DESC_ANNOTATION, "DESCANNOTATION");
        MARKERS.put(NodeKind.DESC_CONTENT, "DESCCONTENT");
        MARKERS.put(NodeKind.CENTERED, "CENTER");
        MARKERS.put(NodeKind.PRODUCTIONLIST, "PRODUCTIONLIST");
    }

    @Override
    public String name() {
        return "markers";
    }

    @Override
    public void registerInto(RuleRegistry registry) {
        registry.register(NodeKind.DESC, NodeRule.of(
            (node, context, out) -> {
                out.append("\n");
                context.set(Mode.DESCRIPTION, true);
            },
            (node, context, out) -> {
                out.append("\n");
                context.set(Mode.DESCRIPTION, false);
            }));
        registry.register(NodeKind.DESC_SIGNATURE, NodeRule.delimited("DESCSIGNATURE: ", ":DESCSIGNATURE"));
        MARKERS.forEach((kind, marker) -> registry.register(kind, NodeRule.delimited(marker + ":", ":" + marker)));

        registry.register(NodeKind.SEEALSO, NodeRule.delimited("\nSee also: \n", ""));
        registry.register(NodeKind.TODO_NODE, NodeRule.delimited("To do: ", ""));
        registry.register(NodeKind.GRAPHVIZ, NodeRule.delimited("Graphviz: ", ""));
    }
}
