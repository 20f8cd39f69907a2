package com.docbridge.core.translator.rules;

import com.docbridge.core.model.DocNode;
import com.docbridge.core.model.NodeKind;
import com.docbridge.core.translator.engine.NodeRule;
import com.docbridge.core.translator.engine.RuleFamily;
import com.docbridge.core.translator.engine.RuleRegistry;
import com.docbridge.core.translator.state.Mode;
import com.docbridge.core.translator.state.OutputBuffer;
import com.docbridge.core.translator.state.TranslationContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Rules for paragraphs, literal and line blocks, comments and other body blocks.
 */
public final class BlockRules implements RuleFamily {

    static final String LISTING_DELIMITER = "----";
    static final String LISTING_CLOSE = "\n----\n";

    private static final String LIST_CONTINUATION = "+";
    private static final String CODE_CLASS = "code";

    @Override
    public String name() {
        return "blocks";
    }

    @Override
    public void registerInto(RuleRegistry registry) {
        registry.register(NodeKind.PARAGRAPH, NodeRule.of(BlockRules::enterParagraph, BlockRules::exitParagraph));
        registry.register(NodeKind.COMPACT_PARAGRAPH, NodeRule.delimited("", "\n"));
        registry.register(NodeKind.ATTRIBUTION, NodeRule.delimited("-- ", "\n"));
        registry.register(NodeKind.LINE_BLOCK, NodeRule.of(
            (node, context, out) -> {
                out.append("\n");
                context.set(Mode.LINE_BLOCK, true);
            },
            (node, context, out) -> {
                out.append(" ");
                // a nested line block hands the mode back to its enclosing block
                context.set(Mode.LINE_BLOCK, context.parentIs(NodeKind.LINE_BLOCK));
            }));
        registry.register(NodeKind.LINE, NodeRule.delimited("", "\n"));
        registry.register(NodeKind.COMMENT, NodeRule.delimited("\n////\n", "\n////\n\n"));
        registry.register(NodeKind.LITERAL_BLOCK, NodeRule.of(
            BlockRules::enterLiteralBlock,
            (node, context, out) -> {
                out.append(LISTING_CLOSE);
                context.set(Mode.LITERAL_BLOCK, false);
            }));
        registry.register(NodeKind.DOCTEST_BLOCK, NodeRule.of(
            (node, context, out) -> {
                out.append("\n[source,pycon]\n" + LISTING_DELIMITER + "\n");
                context.set(Mode.LITERAL_BLOCK, true);
            },
            (node, context, out) -> {
                out.append(LISTING_CLOSE);
                context.set(Mode.LITERAL_BLOCK, false);
            }));
        registry.register(NodeKind.MATH_BLOCK, NodeRule.delimited("\n[stem]\n++++\n", "\n++++\n"));
        registry.register(NodeKind.RAW, NodeRule.delimited("\n++++\n", "\n++++\n"));
        registry.register(NodeKind.PROBLEMATIC, NodeRule.delimited("*Problematic*, check error messages! : ", ""));
        registry.register(NodeKind.SYSTEM_MESSAGE, NodeRule.delimited("\n// System message: ", ""));
    }

    /**
     * Builds the attribute list of a listing block: {@code source,<language>} and
     * {@code linenums}.
     *
     * @param node literal block node
     * @return attribute entries, empty when the block has none
     */
    static List<String> listingAttributes(DocNode node) {
        List<String> attributes = new ArrayList<>();
        language(node).ifPresent(language -> {
            attributes.add("source");
            attributes.add(language);
        });
        if (node.flag("linenos")) {
            attributes.add("linenums");
        }
        return attributes;
    }

    private static Optional<String> language(DocNode node) {
        Optional<String> language = node.nonBlankAttribute("language");
        if (language.isPresent()) {
            return language;
        }
        // "code python" is how docutils marks highlighted code
        List<String> classes = node.attributeValues("classes");
        if (classes.size() >= 2 && CODE_CLASS.equals(classes.get(0))) {
            return Optional.of(classes.get(1));
        }
        return Optional.empty();
    }

    private static void enterParagraph(DocNode node, TranslationContext context, OutputBuffer out) {
        if (context.isIn(Mode.DESCRIPTION) || context.isIn(Mode.FIELD) || context.isIn(Mode.TABLE)
            || context.inList() || context.suppressingContents()) {
            return;
        }
        out.append("\n");
    }

    private static void exitParagraph(DocNode node, TranslationContext context, OutputBuffer out) {
        if (context.isIn(Mode.TABLE) || context.isIn(Mode.FIELD) || context.suppressingContents()) {
            return;
        }
        out.append("\n");
    }

    private static void enterLiteralBlock(DocNode node, TranslationContext context, OutputBuffer out) {
        context.set(Mode.LITERAL_BLOCK, true);
        List<String> attributes = listingAttributes(node);
        out.append(attributes.isEmpty() ? "\n" : "\n[" + String.join(",", attributes) + "]\n");

        String delimiter;
        if (context.inAdmonition()) {
            delimiter = LISTING_DELIMITER;
        } else if (context.inList()) {
            delimiter = LIST_CONTINUATION + LISTING_DELIMITER;
        } else {
            delimiter = LISTING_DELIMITER;
        }
        out.append(delimiter + "\n");
    }
}
