package com.ai.trainingstudio.download;

import com.ai.trainingstudio.exception.DownloadFailedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Writes generated files into the local downloads folder.
 *
 * <p>
 * Bytes go to a hidden temp file first and are then moved into place, so a
 * half-written document never shows up under its real name. The temp file is
 * deleted on every path out of {@link #save}. An existing file with the same
 * name is kept; the new one becomes {@code name (1).ext}, {@code name (2).ext}…
 */
@Slf4j
@Component
public class FileSystemDownloadTrigger implements DownloadTrigger {

    private static final int MAX_NAME_ATTEMPTS = 1000;

    private final Path downloadDir;

    private final int maxNameAttempts;

    @Autowired
    public FileSystemDownloadTrigger(
            @Value("${studio.downloads.dir:${user.home}/Downloads/training-studio}") String downloadDir) {
        this(Paths.get(downloadDir));
    }

    public FileSystemDownloadTrigger(Path downloadDir) {
        this(downloadDir, MAX_NAME_ATTEMPTS);
    }

    FileSystemDownloadTrigger(Path downloadDir, int maxNameAttempts) {
        this.downloadDir = downloadDir;
        this.maxNameAttempts = maxNameAttempts;
    }

    @Override
    public Path save(String fileName, byte[] content, String mimeType) {
        Path temp = null;
        try {
            Files.createDirectories(downloadDir);
            temp = Files.createTempFile(downloadDir, ".studio-", ".part");
            Files.write(temp, content);

            Path target = moveIntoPlace(temp, fileName);
            log.info("Saved {} ({} bytes, {}) to {}", fileName, content.length, mimeType, target);
            return target;

        } catch (IOException e) {
            log.error("Saving '{}' into {} failed: {}", fileName, downloadDir, e.getMessage());
            throw new DownloadFailedException(fileName, e);

        } finally {
            deleteQuietly(temp);
        }
    }

    private Path moveIntoPlace(Path temp, String fileName) throws IOException {
        for (int attempt = 0; attempt < maxNameAttempts; attempt++) {
            Path candidate = downloadDir.resolve(numbered(fileName, attempt));
            try {
                return Files.move(temp, candidate);
            } catch (FileAlreadyExistsException taken) {
                log.debug("{} already exists, trying next name", candidate.getFileName());
            }
        }
        throw new IOException("No free file name for " + fileName + " after " + maxNameAttempts + " attempts");
    }

    static String numbered(String fileName, int attempt) {
        if (attempt == 0) {
            return fileName;
        }
        int dot = fileName.lastIndexOf('.');
        if (dot <= 0) {
            return fileName + " (" + attempt + ")";
        }
        return fileName.substring(0, dot) + " (" + attempt + ")" + fileName.substring(dot);
    }

    private void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            // already gone when the move succeeded
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Could not delete temporary file {}: {}", temp, e.getMessage());
        }
    }
}
