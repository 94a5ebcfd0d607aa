package com.phillippitts.meetingscribe.service.stt.whisper;

import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts percentages from whisper.cpp {@code --print-progress} lines such as
 * {@code whisper_print_progress_callback: progress =  42%}.
 */
public final class WhisperProgressParser {

    private static final Pattern PROGRESS = Pattern.compile("progress\\s*=\\s*(\\d+)%");

    private WhisperProgressParser() {
    }

    /**
     * @param line one stderr line (may be null)
     * @return the percentage, or empty if the line is not a progress line
     */
    public static OptionalInt parse(String line) {
        if (line == null || line.isEmpty()) {
            return OptionalInt.empty();
        }
        Matcher m = PROGRESS.matcher(line);
        if (!m.find()) {
            return OptionalInt.empty();
        }
        try {
            return OptionalInt.of(Integer.parseInt(m.group(1)));
        } catch (NumberFormatException e) {
            // digits overflowing int are not a percentage
            return OptionalInt.empty();
        }
    }
}
