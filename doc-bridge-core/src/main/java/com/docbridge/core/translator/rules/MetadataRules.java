package com.docbridge.core.translator.rules;

import com.docbridge.core.model.DocNode;
import com.docbridge.core.model.NodeKind;
import com.docbridge.core.translator.engine.NodeRule;
import com.docbridge.core.translator.engine.RuleFamily;
import com.docbridge.core.translator.engine.RuleRegistry;
import com.docbridge.core.translator.state.OutputBuffer;
import com.docbridge.core.translator.state.TranslationContext;

import java.util.List;

/**
 * Rules for bibliographic fields, meta tags and substitution definitions.
 */
public final class MetadataRules implements RuleFamily {

    @Override
    public String name() {
        return "metadata";
    }

    @Override
    public void registerInto(RuleRegistry registry) {
        registry.register(NodeKind.DOCINFO, NodeRule.delimited("", "\n\n"));
        registry.register(NodeKind.AUTHOR, NodeRule.delimited("Author: ", "\n\n"));
        registry.register(NodeKind.VERSION, NodeRule.delimited("Document version: ", "\n\n"));
        registry.register(NodeKind.COPYRIGHT, NodeRule.delimited("Copyright: ", "\n\n"));
        registry.register(NodeKind.DATE, NodeRule.delimited(":date: ", "\n"));
        registry.register(NodeKind.REVISION, NodeRule.delimited("Revision: ", "\n\n"));
        registry.register(NodeKind.META, NodeRule.of(MetadataRules::enterMeta, (node, context, out) -> {
            if (node.nonBlankAttribute("name").isPresent()) {
                out.append("\n");
            }
        }));
        registry.register(NodeKind.SUBSTITUTION_DEFINITION, NodeRule.of(
            (node, context, out) -> {
                List<String> names = node.attributeValues("names");
                if (!names.isEmpty()) {
                    out.append("\n:" + names.get(0) + ": ");
                }
            },
            (node, context, out) -> {
                if (!node.attributeValues("names").isEmpty()) {
                    out.append("\n");
                }
            }));
    }

    private static void enterMeta(DocNode node, TranslationContext context, OutputBuffer out) {
        node.nonBlankAttribute("name").ifPresent(
            name -> out.append(":" + name + ": " + node.attribute("content").orElse("")));
    }
}
