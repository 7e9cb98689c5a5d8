package io.b2mash.teamboard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class TeamboardApplication {

  public static void main(String[] args) {
    SpringApplication.run(TeamboardApplication.class, args);
  }
}
