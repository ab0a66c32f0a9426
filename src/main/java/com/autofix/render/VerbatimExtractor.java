package com.autofix.render;

import com.github.javaparser.Position;
import com.github.javaparser.Range;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.comments.Comment;
import com.google.common.base.Preconditions;

import java.util.Optional;

/**
 * Recovers the exact original text of a node from the buffer its provenance
 * names. The slice is returned as-is: whitespace, comments and line breaks inside
 * it are kept.
 */
public class VerbatimExtractor {

    private final SourceBuffer target;
    private final SourceBuffer fixPattern;

    public VerbatimExtractor(SourceBuffer target, SourceBuffer fixPattern) {
        this.target = Preconditions.checkNotNull(target, "target");
        this.fixPattern = Preconditions.checkNotNull(fixPattern, "fixPattern");
    }

    /**
     * Returns the original text of {@code node}, widened to cover its attached
     * comment on whichever side it sits, or empty when the node carries no usable
     * position.
     */
    public Optional<String> extract(Node node, NodeProvenance provenance) {
        Optional<Range> range = node.getRange();
        if (range.isEmpty())
            return Optional.empty();
        Position begin = range.get().begin;
        Position end = range.get().end;
        Optional<Range> comment = node.getComment().flatMap(Comment::getRange);
        if (comment.isPresent()) {
            if (comment.get().begin.isBefore(begin))
                begin = comment.get().begin;
            // same-line trailing comments are attached after the node
            if (comment.get().end.isAfter(end))
                end = comment.get().end;
        }
        return bufferFor(provenance).slice(begin, end);
    }

    private SourceBuffer bufferFor(NodeProvenance provenance) {
        switch (provenance) {
            case TARGET:
                return target;
            case FIX_PATTERN:
                return fixPattern;
            default:
                throw new IllegalArgumentException("Unknown provenance: " + provenance);
        }
    }
}
