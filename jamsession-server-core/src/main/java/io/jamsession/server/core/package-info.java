/**
 * Framework-neutral jam session server: identity resolution, the retrying vote and registration store,
 * ranking, the broadcast hub and the HTTP mutation API.
 *
 * <p>Framework integrations adapt {@link io.jamsession.server.core.ServerRequest} and
 * {@link io.jamsession.server.core.ServerResponse} and feed live connections into
 * {@link io.jamsession.server.core.BroadcastHub}.
 */
package io.jamsession.server.core;
