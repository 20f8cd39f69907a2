package com.docbridge.core.translator.rules;

import com.docbridge.core.model.NodeKind;
import com.docbridge.core.translator.engine.NodeRule;
import com.docbridge.core.translator.engine.RuleFamily;
import com.docbridge.core.translator.engine.RuleRegistry;

import java.util.EnumSet;
import java.util.Set;

/**
 * Containers that render nothing themselves; only their children produce output.
 */
public final class PassThroughRules implements RuleFamily {

    static final Set<NodeKind> PASS_THROUGH = EnumSet.of(
        NodeKind.INLINE,
        NodeKind.ABBREVIATION,
        NodeKind.BLOCK_QUOTE,
        NodeKind.CONTAINER,
        NodeKind.OPTION_LIST_ITEM,
        NodeKind.OPTION_GROUP,
        NodeKind.OPTION,
        NodeKind.THEAD,
        NodeKind.TBODY,
        NodeKind.COLSPEC,
        NodeKind.TOCTREE,
        NodeKind.HLIST,
        NodeKind.HLISTCOL,
        NodeKind.VERSIONMODIFIED,
        NodeKind.GENERATED);

    @Override
    public String name() {
        return "pass-through";
    }

    @Override
    public void registerInto(RuleRegistry registry) {
        registry.register(PASS_THROUGH, NodeRule.NO_OP);
    }
}
