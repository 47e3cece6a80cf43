package io.jamsession.client;

import java.util.List;
import java.util.Map;

public record TransportResponse(int status, Map<String, List<String>> headers, byte[] body) {}
