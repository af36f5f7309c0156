package com.mk.fx.qa.stress.metrics;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import javax.net.ssl.SSLException;
import org.junit.jupiter.api.Test;

class FailureKindsTest {

  @Test
  void classify_mapsNetworkRootCauses() {
    assertEquals("CONNECTION_REFUSED", FailureKinds.classify(new ConnectException()));
    assertEquals("SOCKET_TIMEOUT", FailureKinds.classify(new SocketTimeoutException()));
    assertEquals("UNKNOWN_HOST", FailureKinds.classify(new UnknownHostException()));
    assertEquals("SSL_ERROR", FailureKinds.classify(new SSLException("x")));
    assertEquals("HTTP_TIMEOUT", FailureKinds.classify(new HttpTimeoutException("x")));
  }

  @Test
  void classify_usesRootCause() {
    var wrapped = new RuntimeException(new IOException(new SocketTimeoutException()));
    assertEquals("SOCKET_TIMEOUT", FailureKinds.classify(wrapped));
  }

  @Test
  void classify_fallsBackToClassName() {
    assertEquals("ILLEGALSTATEEXCEPTION", FailureKinds.classify(new IllegalStateException()));
    assertEquals(FailureKinds.UNKNOWN, FailureKinds.classify(null));
  }

  @Test
  void normalise_upperCasesAndDefaultsBlank() {
    assertEquals("NO_SUCH_KEY", FailureKinds.normalise(" no_such_key "));
    assertEquals(FailureKinds.UNKNOWN, FailureKinds.normalise(""));
    assertEquals(FailureKinds.UNKNOWN, FailureKinds.normalise(null));
  }
}
