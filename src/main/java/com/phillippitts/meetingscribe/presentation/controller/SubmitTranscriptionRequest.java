package com.phillippitts.meetingscribe.presentation.controller;

import jakarta.validation.constraints.NotBlank;

/**
 * Body of {@code POST /api/transcriptions}.
 *
 * @param eventId meeting identifier
 * @param systemAudioPath system track on the local disk
 * @param micAudioPath microphone track on the local disk
 * @param modelName optional model override
 */
public record SubmitTranscriptionRequest(
        @NotBlank(message = "eventId is required") String eventId,
        @NotBlank(message = "systemAudioPath is required") String systemAudioPath,
        @NotBlank(message = "micAudioPath is required") String micAudioPath,
        String modelName
) {
}
