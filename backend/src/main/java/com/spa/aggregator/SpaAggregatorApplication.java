package com.spa.aggregator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class SpaAggregatorApplication {

  public static void main(String[] args) {
    SpringApplication.run(SpaAggregatorApplication.class, args);
  }
}
