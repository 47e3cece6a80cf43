package io.jamsession.server.core;

import io.jamsession.server.spi.StoreException;

/**
 * A single attempt at a {@link io.jamsession.server.spi.JamStore} operation.
 */
@FunctionalInterface
interface StoreCall<T> {
    T call() throws StoreException;
}
