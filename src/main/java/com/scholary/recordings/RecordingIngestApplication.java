package com.scholary.recordings;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class RecordingIngestApplication {

  public static void main(String[] args) {
    SpringApplication.run(RecordingIngestApplication.class, args);
  }
}
