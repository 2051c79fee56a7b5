package com.flamingo.ai.agenticrag;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point for the ingestion and hybrid retrieval service. */
@SpringBootApplication
public class AgenticRagApplication {

  public static void main(String[] args) {
    SpringApplication.run(AgenticRagApplication.class, args);
  }
}
