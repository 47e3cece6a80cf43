package io.jamsession.server.core;

import java.util.List;

public record AddSongResult(String songId, List<RankedSong> queue) {}
