package io.cronrunner.core;

/**
 * One item that could not be terminated.
 *
 * @param view   which view the item belongs to
 * @param target entry id, run id or pid
 * @param reason failure description
 */
public record TerminationFailure(
        TerminationView view,
        String target,
        String reason
) {
}
