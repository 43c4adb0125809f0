package com.ai.trainingstudio.download;

import java.nio.file.Path;

/**
 * Saves a generated file for the user without leaving the current view.
 *
 * Implementations release every temporary resource they allocate before
 * returning, including when the save itself fails.
 */
public interface DownloadTrigger {

    /**
     * @param fileName resolved bare file name, never blank
     * @param content  file bytes
     * @param mimeType media type reported by the generation service
     * @return where the file ended up
     * @throws com.ai.trainingstudio.exception.DownloadFailedException if the file could not be saved
     */
    Path save(String fileName, byte[] content, String mimeType);
}
