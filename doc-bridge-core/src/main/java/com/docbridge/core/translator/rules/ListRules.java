package com.docbridge.core.translator.rules;

import com.docbridge.core.model.DocNode;
import com.docbridge.core.model.NodeKind;
import com.docbridge.core.translator.engine.NodeRule;
import com.docbridge.core.translator.engine.RuleFamily;
import com.docbridge.core.translator.engine.RuleRegistry;
import com.docbridge.core.translator.state.ListKind;
import com.docbridge.core.translator.state.Mode;
import com.docbridge.core.translator.state.OutputBuffer;
import com.docbridge.core.translator.state.TranslationContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rules for bulleted, enumerated, definition, field and option lists.
 *
 * <p>List items take their marker from the innermost open list, repeated once per nesting
 * level. AsciiDoc stops at five levels; deeper items are clamped and flagged in the output.
 */
public final class ListRules implements RuleFamily {

    private static final Logger log = LoggerFactory.getLogger(ListRules.class);

    static final int DEEPEST_LIST_LEVEL = 5;
    static final String INDENTATION_ERROR = "List indentation error!";

    private static final String TOCTREE_CLASS_PREFIX = "toctree";

    @Override
    public String name() {
        return "lists";
    }

    @Override
    public void registerInto(RuleRegistry registry) {
        registry.register(NodeKind.BULLET_LIST, NodeRule.of(ListRules::enterBulletList, ListRules::exitBulletList));
        registry.register(NodeKind.ENUMERATED_LIST, NodeRule.of(
            ListRules::enterEnumeratedList,
            (node, context, out) -> context.popList()));
        registry.register(NodeKind.LIST_ITEM, NodeRule.of(ListRules::enterListItem, ListRules::exitListItem));

        registry.register(NodeKind.DEFINITION_LIST, NodeRule.delimited("\n", "\n"));
        registry.register(NodeKind.DEFINITION_LIST_ITEM, NodeRule.delimited("", "\n"));
        registry.register(NodeKind.TERM, NodeRule.of(ListRules::enterTerm, ListRules::exitTerm));
        registry.register(NodeKind.DEFINITION, NodeRule.delimited("\n", "\n\n"));
        registry.register(NodeKind.CLASSIFIER, NodeRule.delimited(" _", "_"));

        registry.register(NodeKind.FIELD_LIST, NodeRule.delimited("\n|===\n", "|===\n"));
        registry.register(NodeKind.FIELD, NodeRule.delimited("", "\n"));
        registry.register(NodeKind.FIELD_NAME, NodeRule.delimited(":", ": "));
        registry.register(NodeKind.FIELD_BODY, NodeRule.of(
            (node, context, out) -> context.set(Mode.FIELD, true),
            (node, context, out) -> context.set(Mode.FIELD, false)));

        registry.register(NodeKind.OPTION_LIST, NodeRule.delimited("", "\n"));
        registry.register(NodeKind.OPTION_STRING, NodeRule.delimited("", " "));
        registry.register(NodeKind.OPTION_ARGUMENT, NodeRule.delimited("", " "));
        registry.register(NodeKind.DESCRIPTION, NodeRule.delimited(":: ", "\n"));
    }

    /**
     * Builds the visible prefix of a list item at the current nesting.
     *
     * @param context translation state
     * @return item prefix, possibly carrying an indentation diagnostic
     */
    static String itemPrefix(TranslationContext context) {
        int depth = context.listDepth();
        if (depth == 0) {
            log.warn("List item outside of any list in '{}'", context.sourceName());
            return "\n" + INDENTATION_ERROR + "\n";
        }
        ListKind kind = context.currentList().orElseThrow();
        if (depth > DEEPEST_LIST_LEVEL) {
            log.warn("List nesting depth {} exceeds the deepest AsciiDoc level {} in '{}'",
                depth, DEEPEST_LIST_LEVEL, context.sourceName());
            return kind.prefix(DEEPEST_LIST_LEVEL) + INDENTATION_ERROR + " ";
        }
        return kind.prefix(depth);
    }

    private static void enterBulletList(DocNode node, TranslationContext context, OutputBuffer out) {
        if (context.suppressingContents()) {
            return;
        }
        if (!context.inList()) {
            out.append("\n");
        }
        context.pushList(ListKind.BULLETED);
    }

    private static void exitBulletList(DocNode node, TranslationContext context, OutputBuffer out) {
        if (context.suppressingContents()) {
            return;
        }
        out.append("\n");
        context.popList();
    }

    private static void enterEnumeratedList(DocNode node, TranslationContext context, OutputBuffer out) {
        if (!context.inList()) {
            node.nonBlankAttribute("enumtype").ifPresent(type -> out.append("\n[" + type + "]\n"));
        }
        context.pushList(ListKind.ENUMERATED);
    }

    private static void enterListItem(DocNode node, TranslationContext context, OutputBuffer out) {
        if (context.suppressingContents()) {
            return;
        }
        boolean navigationEntry = node.attributeValues("classes").stream()
            .anyMatch(cls -> cls.startsWith(TOCTREE_CLASS_PREFIX));
        if (!navigationEntry) {
            out.append(itemPrefix(context));
        }
    }

    private static void exitListItem(DocNode node, TranslationContext context, OutputBuffer out) {
        if (context.suppressingContents() || context.isIn(Mode.TABLE)) {
            return;
        }
        out.append("\n");
    }

    private static void enterTerm(DocNode node, TranslationContext context, OutputBuffer out) {
        if (context.isIn(Mode.GLOSSARY)) {
            context.enterSection();
            out.append("\n\n" + StructuralRules.headingPrefix(context.sectionDepth()));
        }
    }

    private static void exitTerm(DocNode node, TranslationContext context, OutputBuffer out) {
        if (context.isIn(Mode.GLOSSARY)) {
            out.append("\n\n");
            context.leaveSection();
        } else {
            out.append(":: ");
        }
    }
}
