/**
 * Progress of a generation run: an ordered, replayable event log per run with push
 * delivery to observers and a pull path for reconnecting clients.
 */
package com.phillippitts.cvtailor.service.progress;
