package com.openforge.meetingmemory;

import com.openforge.meetingmemory.config.TemporalProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(TemporalProperties.class)
public class MeetingMemoryApplication {

    public static void main(String[] args) {
        SpringApplication.run(MeetingMemoryApplication.class, args);
    }
}
