package com.mk.fx.qa.stress.cfg;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiCfg {

  @Bean
  public OpenAPI openApi() {
    return new OpenAPI()
        .info(
            new Info()
                .title("Storage Stress Metrics API")
                .description(
                    "Live metrics, snapshot ingest and run control for storage stress runs."));
  }
}
