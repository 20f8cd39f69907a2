package com.docbridge.core.translator.rules;

import com.docbridge.core.model.DocNode;
import com.docbridge.core.model.NodeKind;
import com.docbridge.core.translator.engine.NodeRule;
import com.docbridge.core.translator.engine.RuleFamily;
import com.docbridge.core.translator.engine.RuleRegistry;
import com.docbridge.core.translator.state.Mode;
import com.docbridge.core.translator.state.OutputBuffer;
import com.docbridge.core.translator.state.TranslationContext;
import com.docbridge.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rules for the document skeleton: document, sections, titles, topics and other
 * section-level containers.
 *
 * <p>Section depth decides the heading marker: depth 0 is the document title ({@code =}),
 * depth {@code n} in 1..5 gets {@code n+1} equals signs. AsciiDoc has no deeper level, so
 * deeper headings fall back to a single marker preceded by a diagnostic comment.
 */
public final class StructuralRules implements RuleFamily {

    private static final Logger log = LoggerFactory.getLogger(StructuralRules.class);

    static final int DEEPEST_HEADING_LEVEL = 5;

    private static final String HEADING_MARKER = "=";
    private static final String DOCUMENT_TITLE_PREFIX = "\n\n= ";
    private static final String TABLE_TITLE_PREFIX = "\n.";
    private static final String TOC_DIRECTIVE = ":toc:";
    private static final String CONTENTS_CLASS = "contents";

    @Override
    public String name() {
        return "structural";
    }

    @Override
    public void registerInto(RuleRegistry registry) {
        registry.register(NodeKind.DOCUMENT, NodeRule.of(StructuralRules::enterDocument, NodeRule.Step.NONE));
        registry.register(NodeKind.SECTION, NodeRule.of(
            (node, context, out) -> context.enterSection(),
            (node, context, out) -> context.leaveSection()));
        registry.register(NodeKind.TITLE, NodeRule.of(StructuralRules::enterTitle, StructuralRules::exitTitle));
        registry.register(NodeKind.SUBTITLE, NodeRule.delimited("SUBTITLE: ", ""));
        registry.register(NodeKind.TOPIC, NodeRule.of(StructuralRules::enterTopic, StructuralRules::exitTopic));
        registry.register(NodeKind.SIDEBAR, NodeRule.delimited("\n****\n", "****\n"));
        registry.register(NodeKind.RUBRIC, NodeRule.delimited("\n.", "\n"));
        registry.register(NodeKind.COMPOUND, NodeRule.of(
            (node, context, out) -> context.set(Mode.TOCTREE, true),
            (node, context, out) -> {
                out.append("\n");
                context.set(Mode.TOCTREE, false);
            }));
        registry.register(NodeKind.GLOSSARY, NodeRule.of(
            (node, context, out) -> context.set(Mode.GLOSSARY, true),
            (node, context, out) -> context.set(Mode.GLOSSARY, false)));
        registry.register(NodeKind.TRANSITION, NodeRule.delimited("\n* * *", "\n"));
    }

    /**
     * Builds the heading prefix for a section depth, without the leading line break.
     *
     * @param depth section depth, 0 for the document title
     * @return heading prefix such as {@code "=== "}
     */
    static String headingPrefix(int depth) {
        if (depth > DEEPEST_HEADING_LEVEL) {
            log.warn("Heading depth {} exceeds the deepest AsciiDoc level {}", depth, DEEPEST_HEADING_LEVEL);
            return "// heading depth " + depth + " exceeds level " + DEEPEST_HEADING_LEVEL + "\n"
                + HEADING_MARKER + " ";
        }
        return HEADING_MARKER.repeat(depth + 1) + " ";
    }

    private static void enterDocument(DocNode node, TranslationContext context, OutputBuffer out) {
        context.setSourceName(FileUtils.stemOf(node.attribute("source").orElse(null)));
        log.debug("Translating document '{}'", context.sourceName());
    }

    private static void enterTitle(DocNode node, TranslationContext context, OutputBuffer out) {
        if (context.suppressingContents()) {
            return;
        }
        if (context.parentIs(NodeKind.DOCUMENT)) {
            out.append(DOCUMENT_TITLE_PREFIX);
        } else if (context.parentIs(NodeKind.SECTION)) {
            out.append("\n" + headingPrefix(context.sectionDepth()));
        } else if (context.parentIs(NodeKind.TABLE)) {
            out.append(TABLE_TITLE_PREFIX);
        }
    }

    private static void exitTitle(DocNode node, TranslationContext context, OutputBuffer out) {
        if (!context.suppressingContents()) {
            out.append("\n");
        }
    }

    private static void enterTopic(DocNode node, TranslationContext context, OutputBuffer out) {
        if (!isContentsTopic(node)) {
            return;
        }
        context.set(Mode.TOPIC_CONTENTS, true);
        if (!context.options().emitRenderedToc()) {
            out.append(TOC_DIRECTIVE);
            out.mute();
        }
    }

    private static void exitTopic(DocNode node, TranslationContext context, OutputBuffer out) {
        if (isContentsTopic(node)) {
            if (!context.options().emitRenderedToc()) {
                out.unmute();
            }
            context.set(Mode.TOPIC_CONTENTS, false);
        }
        out.append("\n");
    }

    private static boolean isContentsTopic(DocNode node) {
        return node.attributeValues("classes").contains(CONTENTS_CLASS);
    }
}
