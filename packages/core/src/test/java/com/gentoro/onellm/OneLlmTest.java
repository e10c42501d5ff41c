package com.gentoro.onellm;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.onellm.exception.StateException;
import com.gentoro.onellm.breaker.ProviderCircuitBreakers;
import com.gentoro.onellm.orchestrator.FallbackResult;
import com.gentoro.onellm.status.CircuitState;
import com.gentoro.onellm.utility.JacksonUtility;
import java.util.concurrent.atomic.AtomicReference;
import org.apache.commons.configuration2.BaseConfiguration;
import org.apache.commons.configuration2.Configuration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class OneLlmTest {

  @Test
  @DisplayName("Accessing configuration before initialize() fails")
  void requiresInitialize() {
    OneLlm oneLlm = new OneLlm(BaseConfiguration::new);

    assertThrows(StateException.class, oneLlm::configuration);
    assertThrows(StateException.class, oneLlm::refresh);
  }

  @Test
  @DisplayName("Without providers every request fails fast with a clear error")
  void noProviders() {
    try (OneLlm oneLlm = new OneLlm(BaseConfiguration::new)) {
      oneLlm.initialize();

      FallbackResult result = oneLlm.orchestrator().generate("hello");

      assertEquals(FallbackResult.NO_PROVIDERS, result.error());
      assertTrue(JacksonUtility.toJson(result).contains(FallbackResult.NO_PROVIDERS));
    }
  }

  @Test
  @DisplayName("refresh() picks up newly configured providers")
  void refreshRebuildsRegistry() {
    AtomicReference<Configuration> current = new AtomicReference<>(new BaseConfiguration());
    try (OneLlm oneLlm = new OneLlm(current::get)) {
      oneLlm.initialize();
      assertTrue(oneLlm.registry().configuredNames().isEmpty());

      BaseConfiguration updated = new BaseConfiguration();
      updated.addProperty("llm.providers.openai.apiKey", "test-openai-key");
      current.set(updated);
      oneLlm.refresh();

      assertEquals(java.util.List.of("openai"), oneLlm.registry().configuredNames());
      assertTrue(oneLlm.availability().snapshot().isEmpty());
    }
  }

  @Test
  @DisplayName("refresh() rebuilds circuit breakers from the reloaded settings")
  void refreshResetsCircuitBreakers() {
    AtomicReference<Configuration> current = new AtomicReference<>(new BaseConfiguration());
    try (OneLlm oneLlm = new OneLlm(current::get)) {
      oneLlm.initialize();
      ProviderCircuitBreakers.Scope before = oneLlm.circuitBreakers().scope();
      assertEquals(CircuitState.CLOSED, before.state("openai"));

      BaseConfiguration updated = new BaseConfiguration();
      updated.addProperty("llm.circuit-breaker.enabled", false);
      current.set(updated);
      oneLlm.refresh();

      ProviderCircuitBreakers.Scope after = oneLlm.circuitBreakers().scope();
      assertNotSame(before, after);
      assertEquals(CircuitState.DISABLED, after.state("openai"));
    }
  }

  @Test
  @DisplayName("The bundled application.yaml loads with every provider declared")
  void loadsBundledConfiguration() {
    Configuration cfg = new ConfigurationProvider("classpath:application.yaml").config();
    var settings = com.gentoro.onellm.config.LlmSettings.from(cfg);

    assertEquals("anthropic", settings.defaultProvider());
    assertEquals(5, settings.providers().size());
    assertEquals("openrouter", settings.providers().get("openrouter").type());
  }
}
