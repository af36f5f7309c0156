package com.mk.fx.qa.stress;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class StressMetricsApplication {

  public static void main(String[] args) {
    SpringApplication.run(StressMetricsApplication.class, args);
  }
}
