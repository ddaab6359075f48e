/**
 * Request-scoped logging context.
 */
package com.phillippitts.cvtailor.config.logging;
