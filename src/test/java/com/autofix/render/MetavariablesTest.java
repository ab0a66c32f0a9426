package com.autofix.render;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MetavariablesTest {

    @Test
    void recognizesBothKindsOfNames() {
        assertTrue(Metavariables.isSingle("$X"));
        assertTrue(Metavariables.isSingle("$FOO_2"));
        assertTrue(Metavariables.isVariadic("$...ARGS"));
        assertFalse(Metavariables.isSingle("$...ARGS"));
        assertFalse(Metavariables.isVariadic("$X"));
        assertFalse(Metavariables.isValidName("x"));
        assertFalse(Metavariables.isValidName("$lower"));
        assertFalse(Metavariables.isValidName(null));
    }

    @Test
    void parsableTextKeepsEveryOffset() {
        String rule = "foo($...ARGS, $X, bar($...REST))";
        String parsable = Metavariables.toParsableText(rule);

        assertEquals("foo($___ARGS, $X, bar($___REST))", parsable);
        assertEquals(rule.length(), parsable.length());
        assertEquals(rule.indexOf("$X"), parsable.indexOf("$X"));
    }

    @Test
    void placeholdersMapBackToBindingNames() {
        assertTrue(Metavariables.isPlaceholder("$___ARGS"));
        assertFalse(Metavariables.isPlaceholder("$___"));
        assertTrue(Metavariables.isMetavariableIdentifier("$___ARGS"));
        assertTrue(Metavariables.isMetavariableIdentifier("$X"));
        assertFalse(Metavariables.isMetavariableIdentifier("value"));

        assertEquals("$...ARGS", Metavariables.bindingName("$___ARGS"));
        assertEquals("$X", Metavariables.bindingName("$X"));
    }
}
