/**
 * Service layer. Outbound adapters (backend, compiler, link, storage) sit behind interfaces;
 * the orchestration and session packages hold the workflow and lifecycle rules.
 */
package com.phillippitts.cvtailor.service;
