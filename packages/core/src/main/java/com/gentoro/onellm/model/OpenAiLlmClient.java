package com.gentoro.onellm.model;

import com.gentoro.onellm.config.ProviderConfig;
import com.gentoro.onellm.exception.ExceptionUtil;
import com.gentoro.onellm.exception.PermanentProviderException;
import com.gentoro.onellm.exception.ProviderException;
import com.gentoro.onellm.exception.TransientProviderException;
import com.openai.client.OpenAIClient;
import com.openai.core.JsonValue;
import com.openai.errors.OpenAIIoException;
import com.openai.errors.OpenAIServiceException;
import com.openai.models.chat.completions.ChatCompletion;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import com.openai.models.chat.completions.ChatCompletionMessage;

/** Chat-completions client shared by OpenAI, OpenRouter and Z.AI. */
public class OpenAiLlmClient extends AbstractLlmClient {
  private static final org.slf4j.Logger log =
      com.gentoro.onellm.logging.LoggingService.getLogger(OpenAiLlmClient.class);

  private final OpenAIClient client;
  private final OpenAiDialect dialect;

  public OpenAiLlmClient(ProviderConfig config, OpenAIClient client, OpenAiDialect dialect) {
    super(config, dialect.supportedOptions());
    this.client = client;
    this.dialect = dialect;
  }

  @Override
  protected String defaultModel() {
    return dialect.defaultModel();
  }

  @Override
  protected String runInference(InferenceRequest request) {
    ChatCompletion completion = client.chat().completions().create(buildParams(request));
    return extractText(completion);
  }

  ChatCompletionCreateParams buildParams(InferenceRequest request) {
    ChatCompletionCreateParams.Builder builder =
        ChatCompletionCreateParams.builder()
            .model(request.model())
            .temperature(request.temperature());
    if (dialect.legacyMaxTokens()) {
      builder.maxTokens((long) request.maxTokens());
    } else {
      builder.maxCompletionTokens((long) request.maxTokens());
    }
    for (Message message : request.messages()) {
      switch (message.role()) {
        case SYSTEM -> builder.addSystemMessage(message.content());
        case USER -> builder.addUserMessage(message.content());
        case ASSISTANT -> builder.addAssistantMessage(message.content());
      }
    }
    request
        .options()
        .forEach((name, value) -> builder.putAdditionalBodyProperty(name, JsonValue.from(value)));
    return builder.build();
  }

  private String extractText(ChatCompletion completion) {
    if (completion.choices().isEmpty()) {
      throw new PermanentProviderException(providerName(), providerName() + " returned no choices");
    }
    ChatCompletionMessage message = completion.choices().get(0).message();
    String content = message.content().orElse("");
    if (content.isBlank() && dialect.reasoningFallback()) {
      JsonValue reasoning = message._additionalProperties().get("reasoning_content");
      if (reasoning != null) {
        log.debug("Provider {} returned empty content, using reasoning_content", providerName());
        content = (String) reasoning.asString().orElse("");
      }
    }
    return content;
  }

  @Override
  protected ProviderException classify(RuntimeException failure) {
    if (failure instanceof OpenAIServiceException serviceException) {
      return ProviderErrors.fromStatus(
          providerName(),
          serviceException.statusCode(),
          ExceptionUtil.describe(serviceException),
          serviceException);
    }
    if (failure instanceof OpenAIIoException) {
      return new TransientProviderException(
          providerName(),
          providerName() + " network failure: " + ExceptionUtil.describe(failure),
          failure);
    }
    return ProviderErrors.fromThrowable(providerName(), failure);
  }
}
