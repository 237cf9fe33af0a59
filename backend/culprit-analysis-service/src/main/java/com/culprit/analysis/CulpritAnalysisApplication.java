package com.culprit.analysis;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CulpritAnalysisApplication {
  public static void main(String[] args) {
    SpringApplication.run(CulpritAnalysisApplication.class, args);
  }
}
