package com.docbridge.core.translator.rules;

import com.docbridge.core.model.DocNode;
import com.docbridge.core.model.NodeKind;
import com.docbridge.core.translator.engine.NodeRule;
import com.docbridge.core.translator.engine.RuleFamily;
import com.docbridge.core.translator.engine.RuleRegistry;
import com.docbridge.core.translator.state.OutputBuffer;
import com.docbridge.core.translator.state.TranslationContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rules for footnotes and citations.
 */
public final class FootnoteRules implements RuleFamily {

    private static final Logger log = LoggerFactory.getLogger(FootnoteRules.class);

    static final String MISSING_TARGET = "Warning: footnote reference without target!";

    @Override
    public String name() {
        return "footnotes";
    }

    @Override
    public void registerInto(RuleRegistry registry) {
        registry.register(NodeKind.FOOTNOTE_REFERENCE, NodeRule.of(
            FootnoteRules::enterFootnoteReference,
            (node, context, out) -> {
                if (node.nonBlankAttribute("refid").isPresent()) {
                    out.append("] ");
                }
            }));
        registry.register(NodeKind.FOOTNOTE, NodeRule.delimited("", "\n"));
        registry.register(NodeKind.LABEL, NodeRule.delimited("[[*", "*]]"));
        registry.register(NodeKind.CITATION, NodeRule.NO_OP);
        registry.register(NodeKind.CITATION_REFERENCE, NodeRule.of(
            (node, context, out) -> node.nonBlankAttribute("refid")
                .ifPresent(refid -> out.append("xref:" + refid + "[")),
            (node, context, out) -> {
                if (node.nonBlankAttribute("refid").isPresent()) {
                    out.append("]");
                }
            }));
    }

    private static void enterFootnoteReference(DocNode node, TranslationContext context, OutputBuffer out) {
        node.nonBlankAttribute("refid").ifPresentOrElse(
            refid -> out.append("footnoteref:[" + refid + ","),
            () -> {
                log.warn("Footnote reference without target in '{}'", context.sourceName());
                out.append(MISSING_TARGET);
            });
    }
}
