package io.jamsession.server.core;

import java.util.List;

/**
 * Full state a client refetches after any push event.
 *
 * @param status lower-case jam status
 * @param currentSongId song last marked played, or null
 */
public record QueueSnapshot(String jamId, String status, String currentSongId, List<RankedSong> queue) {}
