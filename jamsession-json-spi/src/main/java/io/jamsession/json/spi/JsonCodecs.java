package io.jamsession.json.spi;

import java.util.Iterator;
import java.util.Objects;
import java.util.ServiceLoader;

/**
 * {@link JsonCodec} lookup backed by {@link java.util.ServiceLoader}.
 */
public final class JsonCodecs {

    private JsonCodecs() {}

    /**
     * Returns the first installed codec visible to the context class loader.
     *
     * @throws IllegalStateException if no JSON module is on the classpath
     */
    public static JsonCodec load() {
        return load(Thread.currentThread().getContextClassLoader());
    }

    public static JsonCodec load(ClassLoader cl) {
        Objects.requireNonNull(cl, "cl");
        Iterator<JsonCodecProvider> it = ServiceLoader.load(JsonCodecProvider.class, cl).iterator();
        if (!it.hasNext()) {
            throw new IllegalStateException("no JsonCodecProvider installed; add jamsession-json-jackson to the classpath");
        }
        return it.next().codec();
    }
}
