package com.monotrack;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class MonotrackApplication {
  public static void main(String[] args) {
    SpringApplication.run(MonotrackApplication.class, args);
  }
}
