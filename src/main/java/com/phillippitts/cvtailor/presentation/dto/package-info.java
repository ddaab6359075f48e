/**
 * Request bodies of the REST API. Responses reuse the domain records directly.
 */
package com.phillippitts.cvtailor.presentation.dto;
