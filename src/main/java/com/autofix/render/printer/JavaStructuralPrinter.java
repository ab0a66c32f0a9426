package com.autofix.render.printer;

import com.autofix.render.PrintHook;
import com.github.javaparser.ast.Node;
import com.github.javaparser.printer.configuration.DefaultPrinterConfiguration;
import com.github.javaparser.printer.configuration.PrinterConfiguration;
import com.google.common.base.Preconditions;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Optional;

/** Prints Java trees with JavaParser's pretty printer, asking the hook first at every node. */
public class JavaStructuralPrinter implements StructuralPrinter {

    private static final Logger logger = LogManager.getLogger(JavaStructuralPrinter.class);

    private final PrintHook hook;
    private final PrinterConfiguration configuration;

    public JavaStructuralPrinter(PrintHook hook) {
        this(hook, new DefaultPrinterConfiguration());
    }

    public JavaStructuralPrinter(PrintHook hook, PrinterConfiguration configuration) {
        this.hook = Preconditions.checkNotNull(hook, "hook");
        this.configuration = Preconditions.checkNotNull(configuration, "configuration");
    }

    @Override
    public Optional<String> print(Node root) {
        HybridPrettyPrinterVisitor visitor = new HybridPrettyPrinterVisitor(configuration, hook);
        try {
            root.accept(visitor, null);
        } catch (SynthesisException e) {
            logger.debug("Cannot synthesize {} ({}): {}",
                    e.getNode().getClass().getSimpleName(), e.getNode().getRange().orElse(null), e.getMessage());
            return Optional.empty();
        }
        return Optional.of(visitor.toString());
    }
}
