package com.phillippitts.cvtailor.exception;

/**
 * Thrown when a job posting link cannot be fetched or yields no usable text.
 */
public class UpstreamFetchException extends CvTailorException {

    private final String url;

    public UpstreamFetchException(String url, String reason) {
        super("Failed to fetch job posting from " + url + ": " + reason);
        this.url = url;
    }

    public UpstreamFetchException(String url, String reason, Throwable cause) {
        super("Failed to fetch job posting from " + url + ": " + reason, cause);
        this.url = url;
    }

    public String getUrl() {
        return url;
    }
}
