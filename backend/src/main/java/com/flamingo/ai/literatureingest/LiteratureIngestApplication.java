package com.flamingo.ai.literatureingest;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LiteratureIngestApplication {

  public static void main(String[] args) {
    SpringApplication.run(LiteratureIngestApplication.class, args);
  }
}
