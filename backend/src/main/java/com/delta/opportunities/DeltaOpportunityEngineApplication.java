package com.delta.opportunities;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class DeltaOpportunityEngineApplication {

  public static void main(String[] args) {
    SpringApplication.run(DeltaOpportunityEngineApplication.class, args);
  }
}
