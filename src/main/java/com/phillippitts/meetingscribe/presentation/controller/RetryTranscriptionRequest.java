package com.phillippitts.meetingscribe.presentation.controller;

import jakarta.validation.constraints.NotBlank;

/**
 * Body of {@code POST /api/transcriptions/retry}.
 *
 * @param eventId meeting to transcribe again
 * @param jobId previous job to repeat (optional)
 */
public record RetryTranscriptionRequest(
        @NotBlank(message = "eventId is required") String eventId,
        String jobId
) {
}
