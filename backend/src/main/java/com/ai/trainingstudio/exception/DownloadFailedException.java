package com.ai.trainingstudio.exception;

import lombok.Getter;

/**
 * The generated file was received but could not be saved locally.
 */
@Getter
public class DownloadFailedException extends RuntimeException {

    private final String fileName;

    public DownloadFailedException(String fileName, Throwable cause) {
        super("Could not save '" + fileName + "': " + cause.getMessage(), cause);
        this.fileName = fileName;
    }
}
