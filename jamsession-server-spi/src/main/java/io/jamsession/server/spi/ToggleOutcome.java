package io.jamsession.server.spi;

/**
 * Result of a vote toggle.
 *
 * @param voted state after the toggle
 * @param voteCount number of vote rows for the song after the toggle
 */
public record ToggleOutcome(boolean voted, int voteCount) {}
