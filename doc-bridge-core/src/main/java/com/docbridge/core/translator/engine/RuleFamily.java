package com.docbridge.core.translator.engine;

/**
 * A group of related rendering rules (lists, tables, references, ...) installed together.
 */
public interface RuleFamily {

    /**
     * Returns a short name for the family, used in listings and logs.
     *
     * @return family name
     */
    String name();

    /**
     * Registers the family's rules.
     *
     * @param registry registry to install into
     */
    void registerInto(RuleRegistry registry);
}
