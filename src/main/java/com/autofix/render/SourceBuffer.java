package com.autofix.render;

import com.github.javaparser.Position;
import com.google.common.base.Preconditions;
import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;

import java.util.Arrays;
import java.util.Optional;

/**
 * Immutable source text that verbatim slices are cut from.
 * <p>
 * A lazy buffer asks its loader at most once, on the first slice, and reuses the
 * result for every later slice. Line starts are indexed on first use as well.
 */
public final class SourceBuffer {

    private final Supplier<String> contents;
    private final Supplier<int[]> lineStarts;

    private SourceBuffer(Supplier<String> contents) {
        this.contents = contents;
        this.lineStarts = Suppliers.memoize(() -> indexLines(this.contents.get()));
    }

    public static SourceBuffer of(String text) {
        Preconditions.checkNotNull(text, "text");
        return new SourceBuffer(Suppliers.ofInstance(text));
    }

    public static SourceBuffer lazy(java.util.function.Supplier<String> loader) {
        Preconditions.checkNotNull(loader, "loader");
        return new SourceBuffer(Suppliers.memoize(loader::get));
    }

    public String getText() {
        return contents.get();
    }

    /**
     * Returns the text from {@code begin} through {@code end}, both inclusive, or
     * empty when either position falls outside the buffer or they are out of order.
     */
    public Optional<String> slice(Position begin, Position end) {
        Optional<Integer> from = offsetOf(begin);
        Optional<Integer> to = offsetOf(end).map(o -> o + 1);
        if (from.isEmpty() || to.isEmpty() || from.get() >= to.get())
            return Optional.empty();
        String text = contents.get();
        if (to.get() > text.length())
            return Optional.empty();
        return Optional.of(text.substring(from.get(), to.get()));
    }

    /** Character offset of a 1-based line/column position. */
    Optional<Integer> offsetOf(Position position) {
        int[] starts = lineStarts.get();
        if (position.line < 1 || position.line > starts.length || position.column < 1)
            return Optional.empty();
        int offset = starts[position.line - 1] + position.column - 1;
        int lineEnd = position.line < starts.length ? starts[position.line] : contents.get().length();
        if (offset >= lineEnd)
            return Optional.empty();
        return Optional.of(offset);
    }

    private static int[] indexLines(String text) {
        int[] starts = new int[16];
        int count = 0;
        starts[count++] = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            boolean newline = c == '\n' || (c == '\r' && (i + 1 >= text.length() || text.charAt(i + 1) != '\n'));
            if (newline) {
                if (count == starts.length)
                    starts = Arrays.copyOf(starts, count * 2);
                starts[count++] = i + 1;
            }
        }
        return Arrays.copyOf(starts, count);
    }
}
