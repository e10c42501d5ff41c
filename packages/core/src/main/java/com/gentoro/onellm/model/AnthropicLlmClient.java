package com.gentoro.onellm.model;

import com.anthropic.client.AnthropicClient;
import com.anthropic.errors.AnthropicIoException;
import com.anthropic.errors.AnthropicServiceException;
import com.anthropic.models.messages.MessageCreateParams;
import com.anthropic.models.messages.TextBlock;
import com.gentoro.onellm.config.ProviderConfig;
import com.gentoro.onellm.exception.ExceptionUtil;
import com.gentoro.onellm.exception.ProviderException;
import com.gentoro.onellm.exception.TransientProviderException;
import java.util.Set;
import java.util.stream.Collectors;

public class AnthropicLlmClient extends AbstractLlmClient {
  static final String DEFAULT_MODEL = "claude-3-5-sonnet-20241022";
  static final Set<String> SUPPORTED_OPTIONS = Set.of("stop_sequences", "top_p", "top_k");

  private final AnthropicClient client;

  public AnthropicLlmClient(ProviderConfig config, AnthropicClient client) {
    super(config, SUPPORTED_OPTIONS);
    this.client = client;
  }

  @Override
  protected String defaultModel() {
    return DEFAULT_MODEL;
  }

  @Override
  protected String runInference(InferenceRequest request) {
    com.anthropic.models.messages.Message message = client.messages().create(buildParams(request));
    return message.content().stream()
        .flatMap(block -> block.text().stream())
        .map(TextBlock::text)
        .collect(Collectors.joining());
  }

  MessageCreateParams buildParams(InferenceRequest request) {
    MessageCreateParams.Builder builder =
        MessageCreateParams.builder()
            .model(request.model())
            .maxTokens((long) request.maxTokens())
            .temperature(request.temperature());

    SystemSplit split = splitSystem(request.messages());
    if (split.system() != null) {
      builder.system(split.system());
    }
    for (Message message : split.conversation()) {
      if (message.role() == Role.ASSISTANT) {
        builder.addAssistantMessage(message.content());
      } else {
        builder.addUserMessage(message.content());
      }
    }

    optionAsDouble(request.options(), "top_p").ifPresent(builder::topP);
    optionAsLong(request.options(), "top_k").ifPresent(builder::topK);
    optionAsStringList(request.options(), "stop_sequences").ifPresent(builder::stopSequences);
    return builder.build();
  }

  @Override
  protected ProviderException classify(RuntimeException failure) {
    if (failure instanceof AnthropicServiceException serviceException) {
      return ProviderErrors.fromStatus(
          providerName(),
          serviceException.statusCode(),
          ExceptionUtil.describe(serviceException),
          serviceException);
    }
    if (failure instanceof AnthropicIoException) {
      return new TransientProviderException(
          providerName(),
          providerName() + " network failure: " + ExceptionUtil.describe(failure),
          failure);
    }
    return ProviderErrors.fromThrowable(providerName(), failure);
  }
}
