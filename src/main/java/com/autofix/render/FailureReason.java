package com.autofix.render;

/** Why a fix could not be rendered. */
public enum FailureReason {
    /** No structural printer is registered for the target language. */
    UNSUPPORTED_LANGUAGE,
    /** The printer met a node it could not synthesize. */
    PRINTER_FAILED,
    /** The fix pattern references a metavariable that is unbound or bound to the wrong kind of value. */
    SUBSTITUTION_FAILED
}
