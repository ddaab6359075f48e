/**
 * Immutable domain model: sessions, job context, generated artifacts and run results.
 *
 * <p>Everything here is a record or enum with no framework dependencies, so the same types are
 * persisted as JSON, streamed to clients and used in tests.
 */
package com.phillippitts.cvtailor.domain;
