package com.docbridge.core.translator.rules;

import com.docbridge.core.model.DocNode;
import com.docbridge.core.model.NodeKind;
import com.docbridge.core.translator.state.Mode;
import com.docbridge.core.translator.state.ReferenceBranch;
import com.docbridge.core.translator.state.TranslationContext;

import java.util.List;
import java.util.Optional;

/**
 * Decides how a {@code reference} node opens.
 *
 * <p>The checks run in a fixed priority order and the first match wins:
 * <ol>
 *   <li>muted contents topic or figure: silent</li>
 *   <li>reference wrapping an image: link attribute line</li>
 *   <li>inside a literal block: silent</li>
 *   <li>internal navigation entry without anchor: {@code include::} directive</li>
 *   <li>named external address: bare or {@code link:} macro</li>
 *   <li>identifier: {@code xref:} (silent in a navigation collection)</li>
 *   <li>address only: document xref, web link, self anchor or fragment xref</li>
 *   <li>nothing usable: silent</li>
 * </ol>
 */
final class ReferenceClassifier {

    private static final String ADOC_SUFFIX = ".adoc";
    private static final List<String> LINK_MACRO_MARKERS = List.of(" ", "^", "__");
    private static final List<String> LINK_MACRO_PREFIXES = List.of("{filename}", "/");

    private ReferenceClassifier() {
        // Utility class
    }

    /**
     * Opening of a reference: the branch taken and the text emitted on entry.
     *
     * @param branch branch taken
     * @param text text emitted on entry, empty for silent branches
     */
    record Opening(ReferenceBranch branch, String text) {

        static final Opening SILENT = new Opening(ReferenceBranch.SILENT, "");
    }

    /**
     * Classifies a reference in the current context.
     *
     * @param node reference node
     * @param context translation state
     * @return opening to emit
     */
    static Opening classify(DocNode node, TranslationContext context) {
        if (context.suppressingContents() || context.isIn(Mode.FIGURE)) {
            return Opening.SILENT;
        }

        Optional<String> refuri = node.nonBlankAttribute("refuri");
        if (wrapsImage(node)) {
            return refuri
                .map(uri -> new Opening(ReferenceBranch.IMAGE_LINK, "\n[link=" + uri + "]"))
                .orElse(Opening.SILENT);
        }
        if (context.isIn(Mode.LITERAL_BLOCK)) {
            return Opening.SILENT;
        }

        String anchorName = node.attribute("anchorname").orElse("");
        if (refuri.isPresent() && context.isIn(Mode.TOCTREE) && node.flag("internal") && anchorName.isEmpty()) {
            return new Opening(ReferenceBranch.INCLUDE, "include::" + refuri.get() + "[leveloffset=+1][");
        }
        if (refuri.isPresent() && node.nonBlankAttribute("name").isPresent()) {
            return new Opening(ReferenceBranch.LINK, linkOpening(refuri.get()));
        }

        Optional<String> refid = node.nonBlankAttribute("refid");
        if (refid.isPresent()) {
            return context.isIn(Mode.TOCTREE)
                ? Opening.SILENT
                : new Opening(ReferenceBranch.CROSS_REFERENCE, "xref:" + refid.get() + "[");
        }
        if (refuri.isPresent()) {
            return addressOpening(refuri.get(), anchorName);
        }
        return Opening.SILENT;
    }

    static boolean wrapsImage(DocNode node) {
        return node.lastDescendant().map(last -> last.is(NodeKind.IMAGE)).orElse(false);
    }

    static boolean needsLinkMacro(String uri) {
        return LINK_MACRO_MARKERS.stream().anyMatch(uri::contains)
            || LINK_MACRO_PREFIXES.stream().anyMatch(uri::startsWith);
    }

    private static String linkOpening(String uri) {
        return needsLinkMacro(uri) ? "link:++" + uri + "++[" : uri + "[";
    }

    private static Opening addressOpening(String uri, String anchorName) {
        int hash = uri.indexOf('#');
        String address = hash < 0 ? uri : uri.substring(0, hash);
        String fragment = hash < 0 ? uri : uri.substring(hash + 1);

        if (address.endsWith(ADOC_SUFFIX)) {
            String target = hash < 0 ? address : address + "#" + fragment;
            return new Opening(ReferenceBranch.CROSS_REFERENCE, "xref:" + target + "[");
        }
        if (uri.startsWith("mailto") || uri.startsWith("http")) {
            return new Opening(ReferenceBranch.LINK, uri + "[");
        }
        if (anchorName.equals("#" + fragment)) {
            return new Opening(ReferenceBranch.SELF_ANCHOR, "\n//");
        }
        return new Opening(ReferenceBranch.CROSS_REFERENCE, "xref:" + fragment + "[");
    }
}
