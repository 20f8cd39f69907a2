package com.docbridge.core.translator.state;

import com.docbridge.core.model.DocNode;
import com.docbridge.core.model.NodeKind;
import com.docbridge.core.translator.TranslatorOptions;
import com.docbridge.core.translator.figure.FigureParts;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Mutable state of one translation run.
 *
 * <p>Created fresh for every document and discarded with it. Rendering rules read and change
 * it in matched entry/exit pairs; the context does not rebalance itself, so a rule that
 * pushes on entry must pop on exit.
 *
 * <p>List depth is the list-stack size and "in a list" is a non-empty list stack; admonition
 * nesting works the same way. Neither is tracked by a separate counter.
 */
public final class TranslationContext {

    private final TranslatorOptions options;
    private final Deque<ListKind> lists = new ArrayDeque<>();
    private final Deque<NodeKind> admonitions = new ArrayDeque<>();
    private final Deque<ReferenceBranch> references = new ArrayDeque<>();
    private final Deque<DocNode> ancestors = new ArrayDeque<>();
    private final Set<Mode> modes = EnumSet.noneOf(Mode.class);
    private final AnchorRegistry anchors = new AnchorRegistry();
    private final Set<String> reportedUnknownTags = new HashSet<>();

    private int sectionDepth;
    private FigureParts figure = FigureParts.empty();
    private List<String> pendingColumnSpecs = List.of();
    private String sourceName = "";

    public TranslationContext(TranslatorOptions options) {
        this.options = Objects.requireNonNull(options, "options must not be null");
    }

    public TranslatorOptions options() {
        return options;
    }

    // ==================== Lists ====================

    public void pushList(ListKind kind) {
        lists.push(Objects.requireNonNull(kind, "kind must not be null"));
    }

    /**
     * Closes the innermost list.
     *
     * @return kind of the closed list
     * @throws IllegalStateException if no list is open
     */
    public ListKind popList() {
        if (lists.isEmpty()) {
            throw new IllegalStateException("No open list to close");
        }
        return lists.pop();
    }

    /**
     * Returns the kind of the innermost open list.
     *
     * @return innermost list kind, or empty outside lists
     */
    public Optional<ListKind> currentList() {
        return Optional.ofNullable(lists.peek());
    }

    public int listDepth() {
        return lists.size();
    }

    public boolean inList() {
        return !lists.isEmpty();
    }

    // ==================== Sections ====================

    public void enterSection() {
        sectionDepth++;
    }

    /**
     * Leaves the innermost section.
     *
     * @throws IllegalStateException if no section is open
     */
    public void leaveSection() {
        if (sectionDepth == 0) {
            throw new IllegalStateException("No open section to leave");
        }
        sectionDepth--;
    }

    public int sectionDepth() {
        return sectionDepth;
    }

    // ==================== Modes ====================

    public void set(Mode mode, boolean active) {
        if (active) {
            modes.add(mode);
        } else {
            modes.remove(mode);
        }
    }

    public boolean isIn(Mode mode) {
        return modes.contains(mode);
    }

    /**
     * Whether the table-of-contents topic is being suppressed, i.e. the parser's rendered
     * contents are replaced by the {@code :toc:} directive.
     *
     * @return true inside a contents topic when rendered contents are not requested
     */
    public boolean suppressingContents() {
        return modes.contains(Mode.TOPIC_CONTENTS) && !options.emitRenderedToc();
    }

    // ==================== Admonitions ====================

    public void pushAdmonition(NodeKind kind) {
        admonitions.push(Objects.requireNonNull(kind, "kind must not be null"));
    }

    /**
     * Closes the innermost admonition.
     *
     * @return kind of the closed admonition
     * @throws IllegalStateException if no admonition is open
     */
    public NodeKind popAdmonition() {
        if (admonitions.isEmpty()) {
            throw new IllegalStateException("No open admonition to close");
        }
        return admonitions.pop();
    }

    public boolean inAdmonition() {
        return !admonitions.isEmpty();
    }

    public int admonitionDepth() {
        return admonitions.size();
    }

    // ==================== References ====================

    public void pushReference(ReferenceBranch branch) {
        references.push(Objects.requireNonNull(branch, "branch must not be null"));
    }

    /**
     * Closes the innermost reference.
     *
     * @return the branch the reference was opened with
     * @throws IllegalStateException if no reference is open
     */
    public ReferenceBranch popReference() {
        if (references.isEmpty()) {
            throw new IllegalStateException("No open reference to close");
        }
        return references.pop();
    }

    // ==================== Anchors ====================

    /**
     * Registers an anchor identifier, disambiguating collisions.
     *
     * @param candidate requested identifier
     * @return unique identifier to emit
     */
    public String registerIdentifier(String candidate) {
        return anchors.register(candidate);
    }

    public List<String> declareIdentifier(String candidate) {
        return anchors.declare(candidate);
    }

    public AnchorRegistry anchors() {
        return anchors;
    }

    // ==================== Figures ====================

    public FigureParts figure() {
        return figure;
    }

    public void stageFigure(FigureParts parts) {
        this.figure = Objects.requireNonNull(parts, "parts must not be null");
    }

    public void clearFigure() {
        this.figure = FigureParts.empty();
    }

    // ==================== Tables ====================

    /**
     * Stores the column alignment codes declared for the next table group.
     *
     * @param specs alignment codes such as {@code l}, {@code r}, {@code c}
     */
    public void setPendingColumnSpecs(List<String> specs) {
        this.pendingColumnSpecs = specs == null ? List.of() : List.copyOf(specs);
    }

    public List<String> pendingColumnSpecs() {
        return pendingColumnSpecs;
    }

    public void clearPendingColumnSpecs() {
        this.pendingColumnSpecs = List.of();
    }

    // ==================== Traversal ====================

    public void pushAncestor(DocNode node) {
        ancestors.push(node);
    }

    public void popAncestor() {
        ancestors.pop();
    }

    /**
     * Returns the parent of the node currently being entered or exited.
     *
     * @return parent node, or empty for the root
     */
    public Optional<DocNode> parent() {
        return Optional.ofNullable(ancestors.peek());
    }

    public boolean parentIs(NodeKind kind) {
        return parent().map(parent -> parent.is(kind)).orElse(false);
    }

    /**
     * Records an unknown element name.
     *
     * @param tagName element name
     * @return true the first time the name is seen in this run
     */
    public boolean reportUnknown(String tagName) {
        return reportedUnknownTags.add(tagName);
    }

    public String sourceName() {
        return sourceName;
    }

    public void setSourceName(String sourceName) {
        this.sourceName = sourceName == null ? "" : sourceName;
    }
}
