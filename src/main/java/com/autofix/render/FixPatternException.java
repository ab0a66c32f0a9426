package com.autofix.render;

/** Thrown when the replacement snippet of a rule is not valid source for its language. */
public class FixPatternException extends Exception {

    public FixPatternException(String message) {
        super(message);
    }
}
