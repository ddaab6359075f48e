/**
 * Generation workflow.
 *
 * <p>Key components:
 * <ul>
 *   <li>{@link com.phillippitts.cvtailor.service.orchestration.GenerationService} - entry point;
 *       synchronous prechecks, then one run per task on the {@code generationExecutor}</li>
 *   <li>{@link com.phillippitts.cvtailor.service.orchestration.DefaultGenerationOrchestrator} - the
 *       per-request workflow from job context to terminal session state</li>
 *   <li>{@link com.phillippitts.cvtailor.service.orchestration.PageCountRetryLoop} - generate,
 *       compile, measure and correct the CV until it hits the page target</li>
 *   <li>{@link com.phillippitts.cvtailor.service.orchestration.SecondaryDocumentGenerator} - cover
 *       letter and cold email, each independent of the other</li>
 * </ul>
 *
 * <p>Runs on different sessions proceed concurrently; steps within one run are sequential.
 * Same-session races are settled by the compare-and-swap in
 * {@link com.phillippitts.cvtailor.service.session.SessionStateMachine}.
 */
package com.phillippitts.cvtailor.service.orchestration;
