/**
 * Application-specific exception hierarchy.
 *
 * <p>All exceptions extend {@link com.phillippitts.cvtailor.exception.CvTailorException} and are
 * unchecked. {@code GlobalExceptionHandler} maps them to HTTP responses:
 * <ul>
 *   <li>{@link com.phillippitts.cvtailor.exception.InputInvalidException} - 400</li>
 *   <li>{@link com.phillippitts.cvtailor.exception.SessionLockedException} - 403</li>
 *   <li>{@link com.phillippitts.cvtailor.exception.SessionNotFoundException},
 *       {@link com.phillippitts.cvtailor.exception.ArtifactNotFoundException} - 404</li>
 *   <li>{@link com.phillippitts.cvtailor.exception.ConcurrentSessionModificationException} - 409</li>
 *   <li>{@link com.phillippitts.cvtailor.exception.CompileException} - 422</li>
 *   <li>{@link com.phillippitts.cvtailor.exception.UpstreamFetchException} - 502</li>
 *   <li>{@link com.phillippitts.cvtailor.exception.GenerationBackendException} - 503</li>
 * </ul>
 *
 * @see com.phillippitts.cvtailor.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.cvtailor.exception;
