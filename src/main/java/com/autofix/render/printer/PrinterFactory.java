package com.autofix.render.printer;

import com.autofix.render.PrintHook;

/** Creates a printer bound to the hook of one fix attempt. */
@FunctionalInterface
public interface PrinterFactory {

    StructuralPrinter create(PrintHook hook);
}
