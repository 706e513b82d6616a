package io.endsession.core.pipeline;

/**
 * Outcome signaled by a handler for the current stage.
 *
 * <ul>
 * <li>{@link #CONTINUE}: nothing signaled; the stage's default logic runs.
 * <li>{@link #SKIPPED}: the current stage's default logic is skipped; the next stage runs
 * normally.
 * <li>{@link #HANDLED}: all remaining default logic is bypassed; the response is transmitted as
 * populated.
 * <li>{@link #REJECTED}: all remaining default logic is bypassed; an error response is
 * transmitted.
 * </ul>
 */
public enum Disposition {
    CONTINUE,
    SKIPPED,
    HANDLED,
    REJECTED;

    /** True for dispositions that end default processing for the rest of the pipeline. */
    public boolean isTerminal() {
        return this == HANDLED || this == REJECTED;
    }
}
