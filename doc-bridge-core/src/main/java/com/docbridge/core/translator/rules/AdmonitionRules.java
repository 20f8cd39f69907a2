package com.docbridge.core.translator.rules;

import com.docbridge.core.model.DocNode;
import com.docbridge.core.translator.engine.NodeRule;
import com.docbridge.core.translator.engine.RuleFamily;
import com.docbridge.core.translator.engine.RuleRegistry;
import com.docbridge.core.translator.state.OutputBuffer;
import com.docbridge.core.translator.state.TranslationContext;

/**
 * Rules for admonition blocks ({@code [NOTE]}, {@code [TIP]}, ...).
 *
 * <p>Each admonition opens an example block. Nested admonitions get a delimiter one
 * {@code =} longer than their parent so the inner block does not close the outer one.
 * Inside a list the block is attached to the item with a {@code +} continuation.
 */
public final class AdmonitionRules implements RuleFamily {

    private static final String BASE_DELIMITER = "====";

    @Override
    public String name() {
        return "admonitions";
    }

    @Override
    public void registerInto(RuleRegistry registry) {
        NodeRule rule = NodeRule.of(AdmonitionRules::enter, AdmonitionRules::exit);
        for (AdmonitionKind kind : AdmonitionKind.values()) {
            registry.register(kind.nodeKind(), rule);
        }
    }

    /**
     * Returns the block delimiter for an admonition nesting level.
     *
     * @param level nesting level, 1 for an outermost admonition
     * @return delimiter line content
     */
    static String delimiter(int level) {
        return BASE_DELIMITER + "=".repeat(Math.max(0, level - 1));
    }

    private static void enter(DocNode node, TranslationContext context, OutputBuffer out) {
        context.pushAdmonition(node.kind());
        String label = AdmonitionKind.of(node.kind()).label();
        out.append((context.inList() ? "+\n" : "\n")
            + "[" + label + "]\n"
            + delimiter(context.admonitionDepth()) + "\n");
    }

    private static void exit(DocNode node, TranslationContext context, OutputBuffer out) {
        out.append(delimiter(context.admonitionDepth()) + (context.inList() ? "\n\n" : "\n"));
        context.popAdmonition();
    }
}
