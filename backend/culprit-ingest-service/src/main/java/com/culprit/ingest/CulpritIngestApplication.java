package com.culprit.ingest;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CulpritIngestApplication {
  public static void main(String[] args) {
    SpringApplication.run(CulpritIngestApplication.class, args);
  }
}
