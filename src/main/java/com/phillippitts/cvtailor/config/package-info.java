/**
 * Spring configuration: typed properties, thread pools, bean wiring and logging context.
 */
package com.phillippitts.cvtailor.config;
