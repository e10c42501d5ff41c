package com.gentoro.onellm.model;

import com.gentoro.onellm.config.ProviderConfig;
import com.gentoro.onellm.exception.ExceptionUtil;
import com.gentoro.onellm.exception.ProviderException;
import com.google.genai.Client;
import com.google.genai.errors.ApiException;
import com.google.genai.types.Content;
import com.google.genai.types.GenerateContentConfig;
import com.google.genai.types.GenerateContentResponse;
import com.google.genai.types.Part;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

public class GeminiLlmClient extends AbstractLlmClient {
  static final String DEFAULT_MODEL = "gemini-2.5-flash";
  static final Set<String> SUPPORTED_OPTIONS =
      Set.of("stop_sequences", "top_p", "top_k", "candidate_count");

  private final Client client;

  public GeminiLlmClient(ProviderConfig config, Client client) {
    super(config, SUPPORTED_OPTIONS);
    this.client = client;
  }

  @Override
  protected String defaultModel() {
    return DEFAULT_MODEL;
  }

  @Override
  protected String runInference(InferenceRequest request) {
    GenerateContentResponse response =
        client.models.generateContent(
            request.model(), buildContents(request), buildConfig(request));
    return response.text();
  }

  List<Content> buildContents(InferenceRequest request) {
    List<Content> contents = new ArrayList<>();
    for (Message message : splitSystem(request.messages()).conversation()) {
      contents.add(
          Content.builder()
              .role(message.role() == Role.ASSISTANT ? "model" : "user")
              .parts(List.of(Part.fromText(message.content())))
              .build());
    }
    return contents;
  }

  GenerateContentConfig buildConfig(InferenceRequest request) {
    GenerateContentConfig.Builder builder =
        GenerateContentConfig.builder()
            .temperature((float) request.temperature())
            .maxOutputTokens(request.maxTokens());

    SystemSplit split = splitSystem(request.messages());
    if (split.system() != null) {
      builder.systemInstruction(
          Content.builder().role("user").parts(List.of(Part.fromText(split.system()))).build());
    }

    optionAsDouble(request.options(), "top_p").ifPresent(v -> builder.topP(v.floatValue()));
    optionAsDouble(request.options(), "top_k").ifPresent(v -> builder.topK(v.floatValue()));
    optionAsLong(request.options(), "candidate_count")
        .ifPresent(v -> builder.candidateCount(v.intValue()));
    optionAsStringList(request.options(), "stop_sequences").ifPresent(builder::stopSequences);
    return builder.build();
  }

  @Override
  protected ProviderException classify(RuntimeException failure) {
    if (failure instanceof ApiException apiException) {
      return ProviderErrors.fromStatus(
          providerName(), apiException.code(), ExceptionUtil.describe(apiException), apiException);
    }
    return ProviderErrors.fromThrowable(providerName(), failure);
  }
}
