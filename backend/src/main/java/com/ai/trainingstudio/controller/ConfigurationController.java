package com.ai.trainingstudio.controller;

import com.ai.trainingstudio.dto.ConfigurationOverview;
import com.ai.trainingstudio.dto.OperationView;
import com.ai.trainingstudio.service.ConfigurationStatusTracker;
import com.ai.trainingstudio.service.UploadType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;
import reactor.core.publisher.Mono;

import java.io.IOException;

/**
 * Dataset uploads (courses, holidays, guidelines) and the readiness they
 * unlock.
 */
@Slf4j
@RestController
@RequestMapping("/api/configuration")
@RequiredArgsConstructor
@CrossOrigin(origins = { "http://localhost:5173", "http://localhost:3000" })
public class ConfigurationController {

    private final ConfigurationStatusTracker tracker;

    @GetMapping
    public ConfigurationOverview overview() {
        return tracker.overview();
    }

    @PostMapping(value = "/{type}", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public Mono<OperationView> upload(
            @PathVariable String type,
            @RequestParam("file") MultipartFile file) throws IOException {

        UploadType uploadType = UploadType.fromKey(type);
        log.info("Received {} upload: file='{}', size={}KB",
                uploadType.getKey(), file.getOriginalFilename(), file.getSize() / 1024);

        return tracker.upload(uploadType, file.getOriginalFilename(), file.getBytes());
    }
}
