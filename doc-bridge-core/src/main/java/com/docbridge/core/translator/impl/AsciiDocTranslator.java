package com.docbridge.core.translator.impl;

import com.docbridge.core.model.DocNode;
import com.docbridge.core.translator.DocumentTranslator;
import com.docbridge.core.translator.TranslatorOptions;
import com.docbridge.core.translator.engine.DocumentWalker;
import com.docbridge.core.translator.engine.RuleFamily;
import com.docbridge.core.translator.engine.RuleRegistry;
import com.docbridge.core.translator.rules.AdmonitionRules;
import com.docbridge.core.translator.rules.BlockRules;
import com.docbridge.core.translator.rules.FigureRules;
import com.docbridge.core.translator.rules.FootnoteRules;
import com.docbridge.core.translator.rules.InlineRules;
import com.docbridge.core.translator.rules.ListRules;
import com.docbridge.core.translator.rules.MarkerRules;
import com.docbridge.core.translator.rules.MetadataRules;
import com.docbridge.core.translator.rules.PassThroughRules;
import com.docbridge.core.translator.rules.ReferenceRules;
import com.docbridge.core.translator.rules.StructuralRules;
import com.docbridge.core.translator.rules.TableRules;
import com.docbridge.core.translator.state.OutputBuffer;
import com.docbridge.core.translator.state.TranslationContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Translates docutils/Sphinx document trees to AsciiDoc.
 *
 * <p>The translator walks the tree depth-first and lets the rule registered for each node
 * kind emit text on entry and exit. Rules are grouped into families; see
 * {@link #defaultFamilies()} for the installed set.
 *
 * <h2>Output Layout</h2>
 * <ul>
 *   <li><b>Headings:</b> {@code =} for the document title, {@code ==} to {@code ======} for sections</li>
 *   <li><b>Lists:</b> {@code *} and {@code .} markers repeated per nesting level</li>
 *   <li><b>Blocks:</b> delimited listing, example, passthrough and table blocks</li>
 *   <li><b>Figures:</b> title line, optional link attribute, then the image macro</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * DocumentTranslator translator = new AsciiDocTranslator();
 * DocNode document = new DocutilsXmlReader().read(Path.of("build/xml/index.xml"));
 * String asciidoc = translator.translate(document, TranslatorOptions.defaults());
 * }</pre>
 *
 * @see <a href="https://docs.asciidoctor.org/asciidoc/latest/">AsciiDoc Language Documentation</a>
 */
public class AsciiDocTranslator implements DocumentTranslator {

    private static final Logger log = LoggerFactory.getLogger(AsciiDocTranslator.class);

    private final RuleRegistry registry;

    /**
     * Creates a translator with the default rule families.
     */
    public AsciiDocTranslator() {
        this(RuleRegistry.of(defaultFamilies()));
    }

    /**
     * Creates a translator with a custom rule registry.
     *
     * @param registry rules to apply
     */
    public AsciiDocTranslator(RuleRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    /**
     * Returns the rule families installed by the default constructor, in installation order.
     *
     * @return default rule families
     */
    public static List<RuleFamily> defaultFamilies() {
        return List.of(
            new StructuralRules(),
            new InlineRules(),
            new ListRules(),
            new BlockRules(),
            new AdmonitionRules(),
            new ReferenceRules(),
            new TableRules(),
            new FigureRules(),
            new FootnoteRules(),
            new MetadataRules(),
            new MarkerRules(),
            new PassThroughRules()
        );
    }

    @Override
    public String getId() {
        return "asciidoc";
    }

    @Override
    public String getDisplayName() {
        return "AsciiDoc Translator";
    }

    @Override
    public String getFileExtension() {
        return "adoc";
    }

    public RuleRegistry registry() {
        return registry;
    }

    @Override
    public String translate(DocNode document, TranslatorOptions options) {
        Objects.requireNonNull(document, "document must not be null");
        Objects.requireNonNull(options, "options must not be null");

        TranslationContext context = new TranslationContext(options);
        OutputBuffer out = new OutputBuffer();
        new DocumentWalker(registry).walk(document, context, out);

        warnIfUnbalanced(context, out);
        String text = out.assemble();
        log.debug("Translated '{}': {} fragments, {} characters, {} anchors",
            context.sourceName(), out.fragments().size(), text.length(), context.anchors().identifiers().size());
        return text;
    }

    private static void warnIfUnbalanced(TranslationContext context, OutputBuffer out) {
        if (context.listDepth() != 0 || context.sectionDepth() != 0 || context.admonitionDepth() != 0
            || out.isMuted()) {
            log.warn("Translation of '{}' ended with unbalanced state: lists={}, sections={}, admonitions={}, muted={}",
                context.sourceName(), context.listDepth(), context.sectionDepth(), context.admonitionDepth(),
                out.isMuted());
        }
    }
}
