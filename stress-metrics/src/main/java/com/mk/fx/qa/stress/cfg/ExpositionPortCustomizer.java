package com.mk.fx.qa.stress.cfg;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.server.ConfigurableWebServerFactory;
import org.springframework.boot.web.server.WebServerFactoryCustomizer;

/**
 * Binds the embedded server to the configured exposition port. A port that cannot be bound fails
 * the application context, which aborts the run before any load is generated.
 */
@Slf4j
public class ExpositionPortCustomizer
    implements WebServerFactoryCustomizer<ConfigurableWebServerFactory> {

  private final int port;

  public ExpositionPortCustomizer(int port) {
    this.port = port;
  }

  @Override
  public void customize(ConfigurableWebServerFactory factory) {
    log.info("Metrics exposition will listen on port {}", port == 0 ? "(ephemeral)" : port);
    factory.setPort(port);
  }
}
