package com.audioflow;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class AudioFlowApplication {

    public static void main(String[] args) {
        SpringApplication.run(AudioFlowApplication.class, args);
    }
}
