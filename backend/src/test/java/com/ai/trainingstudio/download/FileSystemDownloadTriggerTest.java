package com.ai.trainingstudio.download;

import com.ai.trainingstudio.exception.DownloadFailedException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

class FileSystemDownloadTriggerTest {

    @TempDir
    Path downloads;

    @Test
    void should_WriteBytesUnderResolvedName() throws IOException {
        FileSystemDownloadTrigger trigger = new FileSystemDownloadTrigger(downloads);
        byte[] pdf = "%PDF-1.7".getBytes(StandardCharsets.US_ASCII);

        Path saved = trigger.save("assessment_front_desk.pdf", pdf, "application/pdf");

        assertEquals(downloads.resolve("assessment_front_desk.pdf"), saved);
        assertArrayEquals(pdf, Files.readAllBytes(saved));
    }

    @Test
    void should_KeepExistingFile_When_NameIsTaken() throws IOException {
        FileSystemDownloadTrigger trigger = new FileSystemDownloadTrigger(downloads);
        Files.writeString(downloads.resolve("plan.docx"), "older");

        Path saved = trigger.save("plan.docx", new byte[] { 7 }, "application/octet-stream");
        Path third = trigger.save("plan.docx", new byte[] { 8 }, "application/octet-stream");

        assertEquals("plan (1).docx", saved.getFileName().toString());
        assertEquals("plan (2).docx", third.getFileName().toString());
        assertEquals("older", Files.readString(downloads.resolve("plan.docx")));
    }

    @Test
    void should_LeaveNoTemporaryFiles() throws IOException {
        FileSystemDownloadTrigger trigger = new FileSystemDownloadTrigger(downloads);

        trigger.save("a.pdf", new byte[] { 1 }, "application/pdf");
        trigger.save("a.pdf", new byte[] { 2 }, "application/pdf");

        try (Stream<Path> files = Files.list(downloads)) {
            assertFalse(files.anyMatch(file -> file.getFileName().toString().endsWith(".part")));
        }
    }

    @Test
    void should_CreateMissingDownloadsFolder() {
        FileSystemDownloadTrigger trigger = new FileSystemDownloadTrigger(downloads.resolve("nested/studio"));

        Path saved = trigger.save("notes.pdf", new byte[] { 1 }, "application/pdf");

        assertEquals(downloads.resolve("nested/studio/notes.pdf"), saved);
    }

    @Test
    void should_FailWithFileName_When_FolderCannotBeUsed() throws IOException {
        Path notAFolder = Files.writeString(downloads.resolve("occupied"), "x");
        FileSystemDownloadTrigger trigger = new FileSystemDownloadTrigger(notAFolder);

        DownloadFailedException error = assertThrows(DownloadFailedException.class,
                () -> trigger.save("plan.pdf", new byte[] { 1 }, "application/pdf"));

        assertEquals("plan.pdf", error.getFileName());
    }

    @Test
    void should_NumberNamesBeforeExtension() {
        assertEquals("report.pdf", FileSystemDownloadTrigger.numbered("report.pdf", 0));
        assertEquals("report (3).pdf", FileSystemDownloadTrigger.numbered("report.pdf", 3));
        assertEquals("download-17 (1)", FileSystemDownloadTrigger.numbered("download-17", 1));
        assertEquals(".hidden (1)", FileSystemDownloadTrigger.numbered(".hidden", 1));
    }

    @Test
    void should_RemoveTemporaryFile_When_NoFreeNameIsLeft() throws IOException {
        FileSystemDownloadTrigger trigger = new FileSystemDownloadTrigger(downloads, 2);
        Files.writeString(downloads.resolve("plan.pdf"), "first");
        Files.writeString(downloads.resolve("plan (1).pdf"), "second");

        DownloadFailedException error = assertThrows(DownloadFailedException.class,
                () -> trigger.save("plan.pdf", new byte[] { 1, 2, 3 }, "application/pdf"));

        assertEquals("plan.pdf", error.getFileName());
        try (Stream<Path> files = Files.list(downloads)) {
            assertEquals(2, files.filter(file -> !file.getFileName().toString().endsWith(".part")).count());
        }
        try (Stream<Path> files = Files.list(downloads)) {
            assertFalse(files.anyMatch(file -> file.getFileName().toString().endsWith(".part")));
        }
        assertEquals("first", Files.readString(downloads.resolve("plan.pdf")));
    }
}
