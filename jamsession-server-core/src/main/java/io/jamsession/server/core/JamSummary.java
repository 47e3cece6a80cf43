package io.jamsession.server.core;

import io.jamsession.server.spi.Jam;

/**
 * What a client needs to open a jam it only knows by slug.
 */
public record JamSummary(String jamId, String name, String slug, String status) {

    static JamSummary of(Jam jam) {
        return new JamSummary(jam.id(), jam.name(), jam.slug(), jam.status().wireName());
    }
}
