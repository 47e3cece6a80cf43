package io.jamsession.client;

import java.io.IOException;

/**
 * Pluggable HTTP transport used by {@link JdkJamSessionClient}.
 */
public interface JamSessionTransport {

    TransportResponse send(TransportRequest request) throws IOException, InterruptedException;
}
