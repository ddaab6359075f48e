package com.phillippitts.cvtailor.service.link;

import com.phillippitts.cvtailor.exception.UpstreamFetchException;

/**
 * Fetches the readable text of a job posting page.
 */
public interface LinkResolver {

    /**
     * @throws UpstreamFetchException if the page cannot be fetched or has no text
     */
    String fetchText(String url);
}
