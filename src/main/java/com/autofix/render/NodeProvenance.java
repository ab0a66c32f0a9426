package com.autofix.render;

/**
 * Where an AST node of the fixed tree was lifted from, unchanged.
 * Nodes with no provenance came from neither source and must be synthesized.
 */
public enum NodeProvenance {
    /** Reached through a metavariable binding, so its text lives in the target file. */
    TARGET,
    /** Part of the rule's fix pattern, so its text lives in the pattern source. */
    FIX_PATTERN
}
