package com.autofix.render;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/** Languages a rule can target. Not all of them can be rendered. */
public enum Language {
    JAVA("java"),
    PYTHON("python"),
    JAVASCRIPT("javascript"),
    TYPESCRIPT("typescript"),
    GO("go"),
    C("c"),
    KOTLIN("kotlin");

    private final String id;

    Language(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }

    public static Optional<Language> fromId(String id) {
        if (id == null)
            return Optional.empty();
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).filter(l -> l.id.equals(normalized)).findFirst();
    }

    @Override
    public String toString() {
        return id;
    }
}
