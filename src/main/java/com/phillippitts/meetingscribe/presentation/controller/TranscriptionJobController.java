package com.phillippitts.meetingscribe.presentation.controller;

import com.phillippitts.meetingscribe.domain.TranscriptionJob;
import com.phillippitts.meetingscribe.service.paths.TranscriptionDependencies;
import com.phillippitts.meetingscribe.service.storage.StoredTranscript;
import com.phillippitts.meetingscribe.service.transcription.TranscriptionService;
import jakarta.validation.Valid;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST surface of the transcription queue.
 *
 * <p>Submission and retry return {@code 202 Accepted} with the queued job; progress is observed by
 * polling the job.
 */
@RestController
@RequestMapping("/api/transcriptions")
class TranscriptionJobController {

    private static final Logger LOG = LogManager.getLogger(TranscriptionJobController.class);

    private final TranscriptionService service;

    TranscriptionJobController(TranscriptionService service) {
        this.service = service;
    }

    @PostMapping
    ResponseEntity<TranscriptionJob> submit(@Valid @RequestBody SubmitTranscriptionRequest request) {
        TranscriptionJob job = service.submit(request.eventId(), request.systemAudioPath(),
                request.micAudioPath(), request.modelName());
        LOG.info("Accepted transcription job {} for event {}", job.jobId(), job.eventId());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(job);
    }

    @GetMapping
    List<TranscriptionJob> list(@RequestParam(required = false) String eventId) {
        return eventId == null ? service.listJobs() : service.getJobsForEvent(eventId);
    }

    @GetMapping("/{jobId}")
    TranscriptionJob get(@PathVariable String jobId) {
        return service.getJob(jobId);
    }

    @PostMapping("/retry")
    ResponseEntity<TranscriptionJob> retry(@Valid @RequestBody RetryTranscriptionRequest request) {
        TranscriptionJob job = service.retry(request.eventId(), request.jobId());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(job);
    }

    @DeleteMapping("/terminal")
    Map<String, Object> purgeTerminal() {
        return Map.of("removed", service.purgeTerminal());
    }

    @PostMapping("/pause")
    Map<String, Object> pause(@RequestParam(defaultValue = "false") boolean terminate) {
        service.pause(terminate);
        return Map.of("state", service.pipelineState().name());
    }

    @PostMapping("/resume")
    Map<String, Object> resume() {
        service.resume();
        return Map.of("state", service.pipelineState().name());
    }

    @GetMapping("/events/{eventId}/transcript")
    ResponseEntity<StoredTranscript> transcript(@PathVariable String eventId) {
        return service.loadTranscript(eventId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/setup")
    Map<String, Object> setup() {
        TranscriptionDependencies deps = service.checkSetup();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("ready", deps.ready());
        body.put("whisper", deps.whisper());
        body.put("ffmpeg", deps.ffmpeg());
        body.put("models", deps.models());
        body.put("state", service.pipelineState().name());
        return body;
    }
}
