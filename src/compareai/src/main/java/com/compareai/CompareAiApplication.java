package com.compareai;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CompareAiApplication {
  public static void main(String[] args) {
    SpringApplication.run(CompareAiApplication.class, args);
  }
}
