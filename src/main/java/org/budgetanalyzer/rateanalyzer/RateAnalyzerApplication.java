package org.budgetanalyzer.rateanalyzer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RateAnalyzerApplication {

  public static void main(String[] args) {
    SpringApplication.run(RateAnalyzerApplication.class, args);
  }
}
