/**
 * HTTP boundary: controllers, request bodies and exception mapping. Presentation depends on
 * the service layer, never the other way around.
 */
package com.phillippitts.cvtailor.presentation;
