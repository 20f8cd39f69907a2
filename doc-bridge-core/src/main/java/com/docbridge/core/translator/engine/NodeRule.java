package com.docbridge.core.translator.engine;

import com.docbridge.core.model.DocNode;
import com.docbridge.core.translator.state.OutputBuffer;
import com.docbridge.core.translator.state.TranslationContext;

/**
 * Entry/exit rendering rule for one node kind.
 *
 * <p>{@link #enter} runs before the node's children are visited and {@link #exit} after.
 * Both default to doing nothing, so a rule only overrides the side it needs.
 */
public interface NodeRule {

    /** Rule that renders nothing; used for kinds without registered rules. */
    NodeRule NO_OP = new NodeRule() { };

    default VisitAction enter(DocNode node, TranslationContext context, OutputBuffer out) {
        return VisitAction.CONTINUE;
    }

    default void exit(DocNode node, TranslationContext context, OutputBuffer out) {
    }

    /**
     * Builds a rule from an entry and an exit step. The entry always continues into children.
     *
     * @param onEnter entry step
     * @param onExit exit step
     * @return rule
     */
    static NodeRule of(Step onEnter, Step onExit) {
        return new NodeRule() {
            @Override
            public VisitAction enter(DocNode node, TranslationContext context, OutputBuffer out) {
                onEnter.apply(node, context, out);
                return VisitAction.CONTINUE;
            }

            @Override
            public void exit(DocNode node, TranslationContext context, OutputBuffer out) {
                onExit.apply(node, context, out);
            }
        };
    }

    /**
     * Builds a rule that emits fixed text on entry and on exit.
     *
     * @param open text emitted on entry
     * @param close text emitted on exit
     * @return rule
     */
    static NodeRule delimited(String open, String close) {
        return of((node, context, out) -> out.append(open), (node, context, out) -> out.append(close));
    }

    /**
     * One side of a rule.
     */
    @FunctionalInterface
    interface Step {
        /** Step that does nothing. */
        Step NONE = (node, context, out) -> { };

        void apply(DocNode node, TranslationContext context, OutputBuffer out);
    }
}
