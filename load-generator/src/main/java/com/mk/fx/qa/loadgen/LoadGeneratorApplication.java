package com.mk.fx.qa.loadgen;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LoadGeneratorApplication {

  public static void main(String[] args) {
    System.exit(SpringApplication.exit(SpringApplication.run(LoadGeneratorApplication.class, args)));
  }
}
