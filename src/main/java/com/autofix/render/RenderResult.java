package com.autofix.render;

import com.google.common.base.Preconditions;

import java.util.Optional;

/** Outcome of rendering one fix: the replacement text, or the reason there is none. */
public final class RenderResult {

    private final String text;
    private final FailureReason failureReason;
    private final String message;

    private RenderResult(String text, FailureReason failureReason, String message) {
        this.text = text;
        this.failureReason = failureReason;
        this.message = message;
    }

    public static RenderResult success(String text) {
        return new RenderResult(Preconditions.checkNotNull(text, "text"), null, null);
    }

    public static RenderResult failure(FailureReason reason, String message) {
        return new RenderResult(null, Preconditions.checkNotNull(reason, "reason"),
                Preconditions.checkNotNull(message, "message"));
    }

    public boolean isSuccess() {
        return failureReason == null;
    }

    public String getText() {
        Preconditions.checkState(isSuccess(), "render failed (%s): %s", failureReason, message);
        return text;
    }

    public Optional<FailureReason> getFailureReason() {
        return Optional.ofNullable(failureReason);
    }

    public Optional<String> getMessage() {
        return Optional.ofNullable(message);
    }

    public Optional<String> toOptional() {
        return Optional.ofNullable(text);
    }

    @Override
    public String toString() {
        return isSuccess() ? "RenderResult[success: " + text + "]"
                : "RenderResult[" + failureReason + ": " + message + "]";
    }
}
