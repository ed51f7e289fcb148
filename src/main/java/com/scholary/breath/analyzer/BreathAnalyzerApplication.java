package com.scholary.breath.analyzer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class BreathAnalyzerApplication {

  public static void main(String[] args) {
    SpringApplication.run(BreathAnalyzerApplication.class, args);
  }
}
