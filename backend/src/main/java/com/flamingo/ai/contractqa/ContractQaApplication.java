package com.flamingo.ai.contractqa;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ContractQaApplication {

  public static void main(String[] args) {
    SpringApplication.run(ContractQaApplication.class, args);
  }
}
