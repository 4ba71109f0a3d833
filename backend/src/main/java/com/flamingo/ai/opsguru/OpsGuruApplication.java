package com.flamingo.ai.opsguru;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point for the OpsGuru turbine operations assistant. */
@SpringBootApplication
public class OpsGuruApplication {

  public static void main(String[] args) {
    SpringApplication.run(OpsGuruApplication.class, args);
  }
}
