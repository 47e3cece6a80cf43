package io.jamsession.server.core;

import java.util.List;

/**
 * Authoritative state returned to the voter: its vote, the song's count and the re-ranked queue.
 */
public record VoteResult(String songId, boolean voted, int voteCount, List<RankedSong> queue) {}
