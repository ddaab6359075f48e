/**
 * REST API controllers.
 *
 * <ul>
 *   <li>{@link com.phillippitts.cvtailor.presentation.controller.GenerationController}
 *       - {@code POST /api/generate}, progress as server-sent events</li>
 *   <li>{@link com.phillippitts.cvtailor.presentation.controller.SessionController}
 *       - {@code /api/sessions/**}: history, log and status polling, approval, refine,
 *       document edit, delete and download</li>
 * </ul>
 *
 * <p>Controllers are thin adapters; exceptions are left to {@code GlobalExceptionHandler}.
 */
package com.phillippitts.cvtailor.presentation.controller;
