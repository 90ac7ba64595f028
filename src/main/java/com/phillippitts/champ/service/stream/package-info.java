/**
 * Resilient inbound stream: a single read loop that reconnects with exponential backoff behind a
 * circuit breaker, tracks connection health, and feeds trades into {@link
 * com.phillippitts.champ.service.stream.MarketStateHolder MarketStateHolder}.
 *
 * <p>The transport is pluggable through {@link com.phillippitts.champ.service.stream.StreamConnector
 * StreamConnector}; production uses the websocket implementation in {@code stream.websocket}.
 */
package com.phillippitts.champ.service.stream;
