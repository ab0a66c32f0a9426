package com.autofix.render;

import java.util.regex.Pattern;

/**
 * Spelling rules for metavariables as they appear in rules and in parsed fix
 * patterns.
 * <p>
 * A single-value metavariable is written {@code $NAME} and is already a legal
 * Java identifier. A sequence metavariable is written {@code $...NAME}, which
 * Java cannot parse, so fix-pattern text is parsed with every {@code $...}
 * rewritten to {@code $___}. The rewrite has the same length, so offsets in the
 * parsed tree still index the original text.
 */
public final class Metavariables {

    private static final Pattern SINGLE = Pattern.compile("\\$[A-Z_][A-Z0-9_]*");
    private static final Pattern VARIADIC = Pattern.compile("\\$\\.\\.\\.[A-Z_][A-Z0-9_]*");

    static final String VARIADIC_PREFIX = "$...";
    static final String PLACEHOLDER_PREFIX = "$___";

    private Metavariables() {
    }

    public static boolean isSingle(String name) {
        return name != null && SINGLE.matcher(name).matches() && !isPlaceholder(name);
    }

    public static boolean isVariadic(String name) {
        return name != null && VARIADIC.matcher(name).matches();
    }

    public static boolean isValidName(String name) {
        return isSingle(name) || isVariadic(name);
    }

    /** Whether a parsed identifier stands for a metavariable of either kind. */
    public static boolean isMetavariableIdentifier(String identifier) {
        return isSingle(identifier) || isPlaceholder(identifier);
    }

    /** Whether a parsed identifier is the parsable spelling of {@code $...NAME}. */
    public static boolean isPlaceholder(String identifier) {
        return identifier != null
                && identifier.startsWith(PLACEHOLDER_PREFIX)
                && isVariadic(VARIADIC_PREFIX + identifier.substring(PLACEHOLDER_PREFIX.length()));
    }

    /**
     * Maps a parsed identifier back to the metavariable name used in bindings,
     * e.g. {@code $___ARGS} to {@code $...ARGS}.
     */
    public static String bindingName(String identifier) {
        if (isPlaceholder(identifier))
            return VARIADIC_PREFIX + identifier.substring(PLACEHOLDER_PREFIX.length());
        return identifier;
    }

    /** Rewrites rule text so the Java parser accepts sequence metavariables. */
    public static String toParsableText(String patternText) {
        return patternText.replace(VARIADIC_PREFIX, PLACEHOLDER_PREFIX);
    }
}
