package com.phillippitts.cvtailor.exception;

/**
 * Thrown when the content store cannot read or write a path.
 */
public class StorageException extends CvTailorException {

    private final String path;

    public StorageException(String message, String path, Throwable cause) {
        super(message + ": " + path, cause);
        this.path = path;
    }

    public String getPath() {
        return path;
    }
}
