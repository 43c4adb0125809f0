package com.ai.trainingstudio.controller;

import com.ai.trainingstudio.dto.OperationView;
import com.ai.trainingstudio.service.AssessmentEmailService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;
import reactor.core.publisher.Mono;

import java.io.IOException;

@Slf4j
@RestController
@RequestMapping("/api/personalized")
@RequiredArgsConstructor
@CrossOrigin(origins = { "http://localhost:5173", "http://localhost:3000" })
public class PersonalizedLearningController {

    private final AssessmentEmailService assessmentEmailService;

    @GetMapping
    public OperationView current() {
        return assessmentEmailService.current();
    }

    @PostMapping(value = "/process", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public Mono<OperationView> process(@RequestParam(value = "file", required = false) MultipartFile file)
            throws IOException {
        if (file == null) {
            return assessmentEmailService.process(null, null);
        }
        log.info("Received assessment sheet: file='{}', size={}KB",
                file.getOriginalFilename(), file.getSize() / 1024);
        return assessmentEmailService.process(file.getOriginalFilename(), file.getBytes());
    }
}
