package io.b2mash.forecast.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tools.jackson.databind.json.JsonMapper;

@Configuration
@EnableConfigurationProperties(ForecastEngineProperties.class)
public class ForecastEngineConfig {

  /** JSON mapper used to read actuals fixtures. */
  @Bean
  public JsonMapper forecastJsonMapper() {
    return JsonMapper.builder().build();
  }
}
