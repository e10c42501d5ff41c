package com.gentoro.onellm.model;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.onellm.exception.OneLlmErrorCode;
import com.gentoro.onellm.exception.PermanentProviderException;
import com.gentoro.onellm.exception.ProviderException;
import com.gentoro.onellm.exception.TransientProviderException;
import java.io.IOException;
import java.util.concurrent.TimeoutException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class ProviderErrorsTest {

  @ParameterizedTest
  @ValueSource(ints = {408, 409, 429, 500, 502, 503, 529})
  @DisplayName("Rate limits, conflicts, timeouts and server errors are transient")
  void transientStatuses(int status) {
    ProviderException e = ProviderErrors.fromStatus("p", status, "x", null);

    assertInstanceOf(TransientProviderException.class, e);
    assertEquals(status, e.getStatusCode());
  }

  @ParameterizedTest
  @ValueSource(ints = {400, 401, 403, 404, 422})
  @DisplayName("Client errors are permanent")
  void permanentStatuses(int status) {
    assertInstanceOf(
        PermanentProviderException.class, ProviderErrors.fromStatus("p", status, "x", null));
  }

  @Test
  @DisplayName("Authentication failures are flagged")
  void authenticationFailure() {
    PermanentProviderException e =
        (PermanentProviderException) ProviderErrors.fromStatus("p", 401, "bad key", null);

    assertTrue(e.isAuthenticationFailure());
    assertEquals(OneLlmErrorCode.UNAUTHENTICATED, e.getCode());
    assertTrue(e.getMessage().contains("401"));
  }

  @Test
  @DisplayName("Network and timeout causes are transient, anything else permanent")
  void classifiesThrowables() {
    assertInstanceOf(
        TransientProviderException.class,
        ProviderErrors.fromThrowable("p", new RuntimeException(new IOException("reset"))));
    assertInstanceOf(
        TransientProviderException.class,
        ProviderErrors.fromThrowable("p", new IllegalStateException(new TimeoutException())));
    assertInstanceOf(
        PermanentProviderException.class,
        ProviderErrors.fromThrowable("p", new IllegalArgumentException("unknown model")));
  }

  @Test
  @DisplayName("Already classified exceptions are returned unchanged")
  void keepsProviderExceptions() {
    TransientProviderException original = new TransientProviderException("p", "down");

    assertSame(original, ProviderErrors.fromThrowable("p", original));
  }
}
