package com.nilsson.photostamper.service;

/**
 Rejects a batch before any file is touched: missing input directory, unusable font,
 or an output directory that cannot be created.
 */
public class BatchConfigurationException extends Exception {

    public BatchConfigurationException(String message) {
        super(message);
    }

    public BatchConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
