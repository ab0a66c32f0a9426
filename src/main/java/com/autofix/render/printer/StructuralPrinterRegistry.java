package com.autofix.render.printer;

import com.autofix.render.Language;
import com.autofix.render.PrintHook;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The languages fixes can be rendered for, each with the factory of its printer.
 * There is no generic fallback: a language without a printer cannot be rendered.
 */
public final class StructuralPrinterRegistry {

    private final ImmutableMap<Language, PrinterFactory> factories;

    private StructuralPrinterRegistry(Map<Language, PrinterFactory> factories) {
        this.factories = ImmutableMap.copyOf(factories);
    }

    /** Registry with every printer shipped in this library. */
    public static StructuralPrinterRegistry defaults() {
        return builder()
                .register(Language.JAVA, JavaStructuralPrinter::new)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<StructuralPrinter> printerFor(Language language, PrintHook hook) {
        Preconditions.checkNotNull(hook, "hook");
        return Optional.ofNullable(factories.get(language)).map(factory -> factory.create(hook));
    }

    public boolean supports(Language language) {
        return factories.containsKey(language);
    }

    public Set<Language> getLanguages() {
        return factories.keySet();
    }

    public static final class Builder {
        private final Map<Language, PrinterFactory> factories = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder register(Language language, PrinterFactory factory) {
            factories.put(Preconditions.checkNotNull(language, "language"),
                    Preconditions.checkNotNull(factory, "factory"));
            return this;
        }

        public StructuralPrinterRegistry build() {
            return new StructuralPrinterRegistry(factories);
        }
    }
}
