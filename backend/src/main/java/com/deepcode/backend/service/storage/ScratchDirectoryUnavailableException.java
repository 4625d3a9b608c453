package com.deepcode.backend.service.storage;

import java.io.IOException;

/** The scratch directory could not be created, so nothing from the upload was read. */
public class ScratchDirectoryUnavailableException extends IOException {

    public ScratchDirectoryUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
