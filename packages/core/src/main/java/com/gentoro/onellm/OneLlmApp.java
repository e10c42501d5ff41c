package com.gentoro.onellm;

import com.gentoro.onellm.exception.ExceptionUtil;
import com.gentoro.onellm.model.RequestSpec;
import com.gentoro.onellm.orchestrator.FallbackResult;
import com.gentoro.onellm.utility.JacksonUtility;

/** Command line front end: one prompt, a probe of every provider, or the status board. */
public class OneLlmApp {

  private static final org.slf4j.Logger log =
      com.gentoro.onellm.logging.LoggingService.getLogger(OneLlmApp.class);

  public static void main(String[] args) {
    System.exit(run(args));
  }

  static int run(String[] args) {
    StartupParameters parameters;
    try {
      parameters = new StartupParameters(args);
    } catch (IllegalArgumentException e) {
      System.err.println(e.getMessage());
      System.err.println(StartupParameters.usage());
      return 2;
    }
    if ("help".equals(parameters.mode())) {
      System.out.println(StartupParameters.usage());
      return 0;
    }

    OneLlm app = new OneLlm(parameters.configFile());
    try {
      app.initialize();
      switch (parameters.mode()) {
        case "prompt" -> {
          FallbackResult result = app.orchestrator().generate(toRequest(parameters));
          System.out.println(JacksonUtility.toJson(result));
          return result.isSuccess() ? 0 : 1;
        }
        case "probe" -> {
          System.out.println(JacksonUtility.toJson(app.probeAll()));
          return 0;
        }
        case "status" -> {
          app.probeAll();
          System.out.println(JacksonUtility.toJson(app.statusBoard().healthAll()));
          return 0;
        }
        default -> throw new IllegalArgumentException("Invalid mode: " + parameters.mode());
      }
    } catch (Exception e) {
      log.error("Application failed", e);
      System.out.println(JacksonUtility.toJson(ExceptionUtil.toErrorDetails(e)));
      return 1;
    } finally {
      app.shutdown();
    }
  }

  static RequestSpec toRequest(StartupParameters parameters) {
    RequestSpec.Builder builder =
        RequestSpec.builder()
            .prompt(parameters.getParameter("prompt", String.class))
            .systemPrompt(parameters.getOptionalParameter("system", String.class).orElse(null))
            .provider(parameters.getOptionalParameter("provider", String.class).orElse(null));
    parameters.temperature().ifPresent(builder::temperature);
    parameters.maxTokens().ifPresent(builder::maxTokens);
    return builder.build();
  }
}
