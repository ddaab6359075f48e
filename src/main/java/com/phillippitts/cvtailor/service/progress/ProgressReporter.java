package com.phillippitts.cvtailor.service.progress;

/**
 * Narrow logging view of a run, handed to collaborators that only report progress.
 */
public interface ProgressReporter {

    void info(String message);

    void success(String message);

    void warn(String message);

    void error(String message);

    /**
     * Discards everything. Used for operations that run outside a streamed generation.
     */
    ProgressReporter SILENT = new ProgressReporter() {
        @Override
        public void info(String message) {
        }

        @Override
        public void success(String message) {
        }

        @Override
        public void warn(String message) {
        }

        @Override
        public void error(String message) {
        }
    };
}
