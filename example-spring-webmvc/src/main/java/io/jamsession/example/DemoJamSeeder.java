package io.jamsession.example;

import io.jamsession.server.spi.Jam;
import io.jamsession.server.spi.JamStore;
import io.jamsession.server.spi.Song;
import io.jamsession.server.spi.StoreConflictException;
import io.jamsession.server.spi.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Creates a demo jam with a small queue at startup so the API can be tried right away.
 */
@Component
@ConditionalOnProperty(prefix = "example.demo", name = "enabled", havingValue = "true", matchIfMissing = true)
public class DemoJamSeeder implements CommandLineRunner {
    private static final Logger logger = LoggerFactory.getLogger(DemoJamSeeder.class);

    static final String SLUG = "friday-night-jam";

    static final List<String[]> SONGS = List.of(
            new String[] {"Wagon Wheel", "Old Crow Medicine Show"},
            new String[] {"Jolene", "Dolly Parton"},
            new String[] {"Folsom Prison Blues", "Johnny Cash"},
            new String[] {"Take It Easy", "Eagles"},
            new String[] {"Ring of Fire", "Johnny Cash"});

    private final JamStore store;
    private volatile String jamId;

    public DemoJamSeeder(JamStore store) {
        this.store = store;
    }

    @Override
    public void run(String... args) throws StoreException {
        Optional<Jam> existing = store.findJamBySlug(SLUG);
        if (existing.isPresent()) {
            adopt(existing.get());
            return;
        }
        Instant now = Instant.now();
        Jam jam;
        try {
            jam = store.createJam("Friday Night Jam", SLUG, now);
        } catch (StoreConflictException e) {
            // another instance seeded it first
            Jam seeded = store.findJamBySlug(SLUG).orElseThrow(() -> e);
            adopt(seeded);
            return;
        }
        for (String[] song : SONGS) {
            Song created = store.createSong(song[0], song[1]);
            store.addSong(jam.id(), created.id(), now);
        }
        jamId = jam.id();
        logger.info("Demo jam '{}' ready: GET /jams/{}/songs, live feed at /ws/{}", jam.name(), jamId, jamId);
    }

    private void adopt(Jam jam) {
        jamId = jam.id();
        logger.info("Demo jam '{}' already exists as {}, skipping seed data", jam.name(), jamId);
    }

    /** Id of the demo jam once the seeder ran, whether it created the jam or found it. */
    public String jamId() {
        return jamId;
    }
}
