package io.jamsession.server.core;

import io.jamsession.server.spi.JamSong;

/**
 * One entry of the authoritative queue.
 *
 * @param order performance order, 1-based
 */
public record RankedSong(int order, String songId, String title, String artist, int voteCount, boolean played) {

    static RankedSong of(int order, JamSong song) {
        return new RankedSong(order, song.songId(), song.title(), song.song().artist(), song.voteCount(), song.played());
    }
}
