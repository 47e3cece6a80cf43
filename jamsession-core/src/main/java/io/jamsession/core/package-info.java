/**
 * Wire-level core for jam sessions.
 *
 * <p>This module is deliberately framework-neutral. It contains only:
 * <ul>
 *   <li>Path, field and event-name constants</li>
 *   <li>The {@link io.jamsession.core.ActorId} vote key and the {@link io.jamsession.core.JamEvent} envelope</li>
 *   <li>The {@link io.jamsession.core.JamSessionException} error taxonomy</li>
 * </ul>
 *
 * <p>HTTP, WebSocket and persistence bindings live in other modules.
 */
package io.jamsession.core;
