package com.cardpack.workflow;

/**
 * Receives status text and completion fraction (0 to 1) while a conversion runs.
 */
public interface ProgressListener {
    ProgressListener NONE = new ProgressListener() {
        @Override
        public void status(String message) {
        }

        @Override
        public void progress(double fraction) {
        }
    };

    void status(String message);

    void progress(double fraction);
}
