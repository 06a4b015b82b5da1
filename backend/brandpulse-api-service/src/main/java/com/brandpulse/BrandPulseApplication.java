package com.brandpulse;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class BrandPulseApplication {
  public static void main(String[] args) {
    SpringApplication.run(BrandPulseApplication.class, args);
  }
}
