/**
 * Exception-to-HTTP mapping for the REST API.
 *
 * <p>Response format:
 * <pre>
 * {
 *   "errorCode": "SESSION_LOCKED",
 *   "message": "Session is approved and locked",
 *   "details": "Start a new session to make further changes",
 *   "timestamp": "2025-10-17T15:42:32.529Z"
 * }
 * </pre>
 *
 * <p>{@code errorCode} values are the same codes used on the progress stream
 * ({@link com.phillippitts.cvtailor.exception.ErrorCodes}).
 */
package com.phillippitts.cvtailor.presentation.exception;
