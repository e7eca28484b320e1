package com.botcore.toolgate.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.botcore.toolgate.api")
public class ToolGateApiApplication {
  public static void main(String[] args) {
    SpringApplication.run(ToolGateApiApplication.class, args);
  }
}
