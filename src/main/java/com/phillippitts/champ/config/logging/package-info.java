/**
 * Logging infrastructure and ThreadContext (MDC) keys.
 *
 * <p>MDC Keys:
 * <ul>
 *   <li>{@code requestId} - per HTTP request, from {@code X-Request-ID} or a fresh UUID</li>
 *   <li>{@code roundId} - set by the round scheduler and carried onto dispatch threads</li>
 * </ul>
 *
 * @see com.phillippitts.champ.config.logging.MdcFilter
 */
package com.phillippitts.champ.config.logging;
