package io.timezz.backend.config;

import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(TimezzProperties.class)
public class TimezzConfig {

  @Bean
  Clock clock() {
    return Clock.systemUTC();
  }
}
