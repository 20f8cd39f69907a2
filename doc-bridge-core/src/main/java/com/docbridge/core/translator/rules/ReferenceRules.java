package com.docbridge.core.translator.rules;

import com.docbridge.core.model.DocNode;
import com.docbridge.core.model.NodeKind;
import com.docbridge.core.translator.engine.NodeRule;
import com.docbridge.core.translator.engine.RuleFamily;
import com.docbridge.core.translator.engine.RuleRegistry;
import com.docbridge.core.translator.state.OutputBuffer;
import com.docbridge.core.translator.state.ReferenceBranch;
import com.docbridge.core.translator.state.TranslationContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rules for references, link targets and index anchors.
 *
 * <p>A reference records the branch it opened with on the context, and its exit closes
 * exactly that branch. See {@link ReferenceClassifier} for the branch order.
 */
public final class ReferenceRules implements RuleFamily {

    private static final Logger log = LoggerFactory.getLogger(ReferenceRules.class);

    static final String TARGET_PROBLEM = "Warning: Problem with targets!";

    /** Third field of the first {@code (type, value, target-id, main, key)} index tuple. */
    private static final Pattern INDEX_TARGET = Pattern.compile(
        "\\(\\s*['\"][^'\"]*['\"]\\s*,\\s*['\"][^'\"]*['\"]\\s*,\\s*['\"]([^'\"]*)['\"]");

    @Override
    public String name() {
        return "references";
    }

    @Override
    public void registerInto(RuleRegistry registry) {
        registry.register(NodeKind.REFERENCE, NodeRule.of(ReferenceRules::enterReference, ReferenceRules::exitReference));
        registry.register(NodeKind.TARGET, NodeRule.of(ReferenceRules::enterTarget, NodeRule.Step.NONE));
        registry.register(NodeKind.INDEX, NodeRule.of(ReferenceRules::enterIndex, NodeRule.Step.NONE));
        registry.register(NodeKind.DOWNLOAD_REFERENCE, NodeRule.delimited("Download reference: ", ""));
    }

    /**
     * Extracts the target identifier from a serialized index entry list.
     *
     * @param entries value of the {@code entries} attribute
     * @return target identifier of the first entry, or empty
     */
    static Optional<String> indexTarget(String entries) {
        if (entries == null) {
            return Optional.empty();
        }
        Matcher matcher = INDEX_TARGET.matcher(entries);
        if (matcher.find() && !matcher.group(1).isBlank()) {
            return Optional.of(matcher.group(1));
        }
        return Optional.empty();
    }

    private static void enterReference(DocNode node, TranslationContext context, OutputBuffer out) {
        ReferenceClassifier.Opening opening = ReferenceClassifier.classify(node, context);
        context.pushReference(opening.branch());
        out.append(opening.text());
        if (opening.branch() == ReferenceBranch.SELF_ANCHOR) {
            out.mute();
        }
    }

    private static void exitReference(DocNode node, TranslationContext context, OutputBuffer out) {
        ReferenceBranch branch = context.popReference();
        if (branch == ReferenceBranch.SELF_ANCHOR) {
            out.unmute();
        }
        if (branch.closedWithBracket()) {
            out.append("]");
        }
    }

    private static void enterTarget(DocNode node, TranslationContext context, OutputBuffer out) {
        // a muted declaration never reaches the output, so its id stays free
        if (out.isMuted()) {
            return;
        }
        Optional<String> refid = node.nonBlankAttribute("refid");
        if (refid.isPresent()) {
            context.declareIdentifier(refid.get())
                .forEach(identifier -> out.append("[id=\"" + identifier + "\"]"));
            return;
        }
        if (!node.attributeValues("ids").isEmpty() && node.nonBlankAttribute("refuri").isPresent()) {
            return;
        }
        log.warn("Target without identifier or address in '{}': {}", context.sourceName(), node.attributes());
        out.append(TARGET_PROBLEM);
    }

    private static void enterIndex(DocNode node, TranslationContext context, OutputBuffer out) {
        if (out.isMuted()) {
            return;
        }
        indexTarget(node.attribute("entries").orElse(null))
            .ifPresent(target -> out.append(" [[" + context.registerIdentifier(target) + "]]"));
    }
}
