package com.flamingo.ai.researchtwin;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point for the research twin backend. */
@SpringBootApplication
public class ResearchTwinApplication {

  public static void main(String[] args) {
    SpringApplication.run(ResearchTwinApplication.class, args);
  }
}
