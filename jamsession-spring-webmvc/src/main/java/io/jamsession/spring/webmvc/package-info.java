/**
 * Servlet and Spring WebSocket bindings for the jam session server.
 */
package io.jamsession.spring.webmvc;
