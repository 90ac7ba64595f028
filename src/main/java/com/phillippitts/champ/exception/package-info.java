/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.champ.exception.ChampException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.champ.exception.EndpointException} - Thrown when a model
 *       endpoint call fails (transport error, non-2xx, malformed body, retries exhausted)</li>
 *   <li>{@link com.phillippitts.champ.exception.LedgerException} - Thrown when a round
 *       record cannot be persisted; fatal for that round's logging step</li>
 *   <li>{@link com.phillippitts.champ.exception.StreamException} - Thrown by stream
 *       transports on open/read failure; contained by the stream manager</li>
 * </ul>
 *
 * <p>All exceptions are unchecked, support cause chaining, and map to HTTP status codes
 * via {@code GlobalExceptionHandler}.
 *
 * @see com.phillippitts.champ.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.champ.exception;
