package com.gentoro.onellm.registry;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.onellm.config.LlmSettings;
import com.gentoro.onellm.config.ProviderConfig;
import com.gentoro.onellm.exception.ProviderNotConfiguredException;
import com.gentoro.onellm.support.FakeLlmClient;
import com.gentoro.onellm.support.TestSettings;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ProviderRegistryTest {

  private final AtomicInteger builds = new AtomicInteger();

  private ProviderRegistry registry(LlmSettings settings) {
    return new ProviderRegistry(
        () -> settings,
        config -> {
          builds.incrementAndGet();
          return new FakeLlmClient(config.name(), config.modelOr("v1"));
        });
  }

  private static ProviderConfig withModel(String name, String model) {
    return new ProviderConfig(
        name, name, "key-" + name, model, null, null, 0.7, 2048, Duration.ofSeconds(60), Map.of());
  }

  @Test
  @DisplayName("Clients are built lazily, once, for every provider with a usable credential")
  void buildsLazilyOnce() {
    ProviderRegistry registry = registry(TestSettings.settings("a", "b"));
    assertEquals(0, builds.get());

    assertEquals(List.of("a", "b"), registry.configuredNames());
    registry.get("a");
    registry.get("b");

    assertEquals(2, builds.get());
  }

  @Test
  @DisplayName("Missing and placeholder credentials are excluded")
  void excludesPlaceholders() {
    LlmSettings settings =
        LlmSettings.builder()
            .provider(TestSettings.provider("a"))
            .provider(TestSettings.provider("b", "changeme"))
            .provider(TestSettings.provider("c", null))
            .provider(TestSettings.provider("d", "<your key>"))
            .build();

    ProviderRegistry.Snapshot snapshot = registry(settings).snapshot();

    assertEquals(List.of("a"), snapshot.configuredNames());
    assertEquals(List.of("b", "c", "d"), List.copyOf(snapshot.excluded().keySet()));
    assertEquals(1, builds.get());
  }

  @Test
  @DisplayName("A provider whose client cannot be built is excluded")
  void excludesFailingBuilds() {
    ProviderRegistry registry =
        new ProviderRegistry(
            () -> TestSettings.settings("a", "b"),
            config -> {
              if (config.name().equals("a")) {
                throw new IllegalArgumentException("unknown type");
              }
              return new FakeLlmClient(config.name());
            });

    assertFalse(registry.isConfigured("a"));
    assertTrue(registry.isConfigured("b"));
    assertEquals("unknown type", registry.snapshot().excluded().get("a"));
  }

  @Test
  @DisplayName("get() on an unknown provider fails with ProviderNotConfiguredException")
  void unknownProvider() {
    ProviderRegistry registry = registry(TestSettings.settings("a"));

    ProviderNotConfiguredException e =
        assertThrows(ProviderNotConfiguredException.class, () -> registry.get("zzz"));
    assertEquals("zzz", e.getProvider());
  }

  @Test
  @DisplayName("Priority is limited to configured providers, default provider first")
  void priorityFiltersToConfigured() {
    LlmSettings settings =
        LlmSettings.builder()
            .defaultProvider("c")
            .priority(List.of("a", "missing", "b", "c"))
            .provider(TestSettings.provider("a"))
            .provider(TestSettings.provider("b"))
            .provider(TestSettings.provider("c"))
            .build();

    assertEquals(List.of("c", "a", "b"), registry(settings).snapshot().priority());
  }

  @Test
  @DisplayName("refresh() swaps in a complete new client map")
  void refreshReplacesClients() {
    ProviderRegistry registry = registry(TestSettings.settings("a"));
    FakeLlmClient before = (FakeLlmClient) registry.get("a");

    registry.refresh(TestSettings.settings("b"));

    assertFalse(registry.isConfigured("a"));
    assertNotSame(before, registry.get("b"));
    assertEquals(List.of("b"), registry.configuredNames());
  }

  @Test
  @DisplayName("Readers never observe a mix of old and new clients during refresh")
  void concurrentRefreshIsAtomic() throws Exception {
    LlmSettings v1 =
        LlmSettings.builder().provider(withModel("a", "v1")).provider(withModel("b", "v1")).build();
    LlmSettings v2 =
        LlmSettings.builder().provider(withModel("a", "v2")).provider(withModel("b", "v2")).build();
    ProviderRegistry registry = registry(v1);
    registry.snapshot();

    AtomicBoolean running = new AtomicBoolean(true);
    AtomicReference<String> mismatch = new AtomicReference<>();
    ExecutorService pool = Executors.newFixedThreadPool(4);
    try {
      List<Future<?>> readers =
          List.of(
              pool.submit(() -> read(registry, running, mismatch)),
              pool.submit(() -> read(registry, running, mismatch)),
              pool.submit(() -> read(registry, running, mismatch)));
      for (int i = 0; i < 200; i++) {
        registry.refresh(i % 2 == 0 ? v2 : v1);
      }
      running.set(false);
      for (Future<?> reader : readers) {
        reader.get(5, TimeUnit.SECONDS);
      }
    } finally {
      pool.shutdownNow();
    }

    assertNull(mismatch.get());
  }

  private static void read(
      ProviderRegistry registry, AtomicBoolean running, AtomicReference<String> mismatch) {
    while (running.get()) {
      ProviderRegistry.Snapshot snapshot = registry.snapshot();
      String a = ((FakeLlmClient) snapshot.get("a")).tag();
      String b = ((FakeLlmClient) snapshot.get("b")).tag();
      if (!a.equals(b)) {
        mismatch.set(a + "/" + b);
      }
    }
  }
}
