package com.docbridge.core.translator.engine;

import com.docbridge.core.model.DocNode;
import com.docbridge.core.model.NodeKind;
import com.docbridge.core.translator.state.OutputBuffer;
import com.docbridge.core.translator.state.TranslationContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Depth-first traversal that dispatches each node to its rule.
 *
 * <p>Every node is entered before its children and exited after them, in document order.
 * The walker keeps the ancestor chain in the {@link TranslationContext} so rules can ask for
 * the parent. It never filters or reorders nodes; that is left to the rules.
 */
public final class DocumentWalker {

    private static final Logger log = LoggerFactory.getLogger(DocumentWalker.class);

    private final RuleRegistry registry;

    public DocumentWalker(RuleRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    /**
     * Walks a tree, rendering into the given buffer.
     *
     * @param root root node
     * @param context translation state
     * @param out output buffer
     */
    public void walk(DocNode root, TranslationContext context, OutputBuffer out) {
        Objects.requireNonNull(root, "root must not be null");
        visit(root, context, out);
    }

    private void visit(DocNode node, TranslationContext context, OutputBuffer out) {
        if (node.kind() == NodeKind.UNKNOWN && context.reportUnknown(node.tagName())) {
            log.warn("No rendering rules for element '{}', rendering its content only", node.tagName());
        }

        NodeRule rule = registry.ruleFor(node.kind());
        VisitAction action = rule.enter(node, context, out);

        if (action == VisitAction.CONTINUE && !node.children().isEmpty()) {
            context.pushAncestor(node);
            for (DocNode child : node.children()) {
                visit(child, context, out);
            }
            context.popAncestor();
        }

        rule.exit(node, context, out);
    }
}
