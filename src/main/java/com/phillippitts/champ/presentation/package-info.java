/**
 * Presentation layer (REST status endpoints and exception handling).
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code presentation.controller} - read-only status and liveness endpoints</li>
 *   <li>{@code presentation.exception} - maps domain exceptions to HTTP responses</li>
 * </ul>
 *
 * @see com.phillippitts.champ.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.champ.presentation;
