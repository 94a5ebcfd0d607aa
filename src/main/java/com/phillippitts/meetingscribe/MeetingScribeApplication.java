package com.phillippitts.meetingscribe;

import com.phillippitts.meetingscribe.config.properties.StorageProperties;
import com.phillippitts.meetingscribe.config.properties.TranscriptionPathsProperties;
import com.phillippitts.meetingscribe.config.properties.TranscriptionQueueProperties;
import com.phillippitts.meetingscribe.config.properties.WhisperProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        TranscriptionQueueProperties.class,
        WhisperProperties.class,
        TranscriptionPathsProperties.class,
        StorageProperties.class
})
@EnableScheduling
public class MeetingScribeApplication {

    public static void main(String[] args) {
        SpringApplication.run(MeetingScribeApplication.class, args);
    }

}
