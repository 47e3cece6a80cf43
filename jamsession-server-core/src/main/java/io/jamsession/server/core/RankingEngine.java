package io.jamsession.server.core;

import io.jamsession.server.spi.JamSong;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Orders a jam's queue: most votes first, then title ignoring case.
 *
 * <p>Ties on the case-folded title fall back to the exact title and finally the song id, so the order is
 * total and two servers given the same facts agree. Played songs keep their place.
 */
public final class RankingEngine {

    public static final Comparator<JamSong> PERFORMANCE_ORDER = Comparator
            .comparingInt(JamSong::voteCount).reversed()
            .thenComparing(s -> s.title().toLowerCase(Locale.ROOT))
            .thenComparing(JamSong::title)
            .thenComparing(JamSong::songId);

    public List<RankedSong> rank(List<JamSong> songs) {
        List<JamSong> sorted = new ArrayList<>(songs);
        sorted.sort(PERFORMANCE_ORDER);
        List<RankedSong> out = new ArrayList<>(sorted.size());
        for (int i = 0; i < sorted.size(); i++) {
            out.add(RankedSong.of(i + 1, sorted.get(i)));
        }
        return List.copyOf(out);
    }
}
