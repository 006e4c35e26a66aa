package com.scholary.audio.ingest;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AudioIngestApplication {

  public static void main(String[] args) {
    SpringApplication.run(AudioIngestApplication.class, args);
  }
}
