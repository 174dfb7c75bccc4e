package com.example.aggregator;

import com.example.aggregator.api.response.WelcomeResponse;
import com.example.common.config.TimeConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.security.servlet.UserDetailsServiceAutoConfiguration;
import org.springframework.context.annotation.Import;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@SpringBootApplication(exclude = UserDetailsServiceAutoConfiguration.class)
@Import(TimeConfig.class)
@RestController
public class GatewayApplication {

  public static void main(String[] args) {
    SpringApplication.run(GatewayApplication.class, args);
  }

  @GetMapping("/")
  public WelcomeResponse home() {
    return new WelcomeResponse("Welcome to the Aggregator API! All services are running.");
  }
}
