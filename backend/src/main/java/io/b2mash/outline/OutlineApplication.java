package io.b2mash.outline;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class OutlineApplication {

  public static void main(String[] args) {
    SpringApplication.run(OutlineApplication.class, args);
  }
}
