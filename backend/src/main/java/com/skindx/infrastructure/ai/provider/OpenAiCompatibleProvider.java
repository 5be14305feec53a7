package com.skindx.infrastructure.ai.provider;

import com.openai.client.OpenAIClient;
import com.openai.models.chat.completions.ChatCompletion;
import com.openai.models.chat.completions.ChatCompletionAssistantMessageParam;
import com.openai.models.chat.completions.ChatCompletionContentPart;
import com.openai.models.chat.completions.ChatCompletionContentPartImage;
import com.openai.models.chat.completions.ChatCompletionContentPartText;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import com.skindx.domain.diagnosis.model.AiTask;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Base64;
import java.util.List;
import java.util.Map;

import static com.skindx.infrastructure.ai.TaskInputKeys.IMAGE_BYTES;
import static com.skindx.infrastructure.ai.TaskInputKeys.IMAGE_PATH;

/**
 * Adapter for any chat-completion API that speaks the OpenAI wire format
 * (OpenRouter, Groq, Gemini's OpenAI endpoint).
 * <p>
 * Vision-capable providers receive the image as a base64 data URL next to the task
 * prompt; text-only providers reason over the previous stage outputs in the prompt.
 */
@Slf4j
public class OpenAiCompatibleProvider implements AiProvider {

    private static final double TASK_TEMPERATURE = 0.3;
    private static final int TASK_MAX_TOKENS = 500;
    private static final double CHAT_TEMPERATURE = 0.7;
    private static final int CHAT_MAX_TOKENS = 1000;

    private final ProviderKind kind;
    private final OpenAIClient client;
    private final String model;
    private final Duration timeout;
    private final boolean vision;
    private final ProviderPromptBuilder promptBuilder;
    private final ProviderResponseParser responseParser;

    public OpenAiCompatibleProvider(ProviderKind kind, OpenAIClient client, String model, Duration timeout,
                                    boolean vision, ProviderPromptBuilder promptBuilder,
                                    ProviderResponseParser responseParser) {
        this.kind = kind;
        this.client = client;
        this.model = model;
        this.timeout = timeout;
        this.vision = vision;
        this.promptBuilder = promptBuilder;
        this.responseParser = responseParser;
    }

    @Override
    public ProviderKind kind() {
        return kind;
    }

    @Override
    public Duration timeout() {
        return timeout;
    }

    @Override
    public ProviderResponse execute(AiTask task, Map<String, Object> input) {
        String prompt = promptBuilder.build(task, input);
        try {
            var builder = ChatCompletionCreateParams.builder()
                    .model(model)
                    .temperature(TASK_TEMPERATURE)
                    .maxCompletionTokens(TASK_MAX_TOKENS);

            if (vision) {
                String imageUrl = imageDataUrl(input);
                if (imageUrl == null) {
                    return ProviderResponse.failure("No image provided");
                }
                builder.addUserMessageOfArrayOfContentParts(List.of(
                        ChatCompletionContentPart.ofText(ChatCompletionContentPartText.builder()
                                .text(prompt)
                                .build()),
                        ChatCompletionContentPart.ofImageUrl(ChatCompletionContentPartImage.builder()
                                .imageUrl(ChatCompletionContentPartImage.ImageUrl.builder()
                                        .url(imageUrl)
                                        .build())
                                .build())));
            } else {
                builder.addUserMessage(prompt);
            }

            String content = complete(builder.build());
            return ProviderResponse.ok(responseParser.parse(content));
        } catch (Exception e) {
            log.error("[{}] {} call failed: {}", kind.configName(), task, e.getMessage());
            return ProviderResponse.failure(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    @Override
    public String chat(List<ChatMessage> messages) {
        var builder = ChatCompletionCreateParams.builder()
                .model(model)
                .temperature(CHAT_TEMPERATURE)
                .maxCompletionTokens(CHAT_MAX_TOKENS);

        for (ChatMessage message : messages) {
            switch (message.role()) {
                case ChatMessage.SYSTEM -> builder.addSystemMessage(message.content());
                case ChatMessage.ASSISTANT -> builder.addMessage(ChatCompletionAssistantMessageParam.builder()
                        .content(message.content())
                        .build());
                default -> builder.addUserMessage(message.content());
            }
        }

        try {
            return complete(builder.build());
        } catch (ProviderCallException e) {
            throw e;
        } catch (Exception e) {
            throw new ProviderCallException(kind.configName() + " chat failed: " + e.getMessage(), e);
        }
    }

    private String complete(ChatCompletionCreateParams params) {
        ChatCompletion completion = client.chat().completions().create(params);

        completion.usage().ifPresent(usage ->
                log.debug("[{}] Token usage - prompt: {}, completion: {}, total: {}", kind.configName(),
                        usage.promptTokens(), usage.completionTokens(), usage.totalTokens()));

        return completion.choices().stream()
                .findFirst()
                .flatMap(choice -> choice.message().content())
                .map(String::trim)
                .orElseThrow(() -> new ProviderCallException(kind.configName() + " returned an empty response"));
    }

    private static String imageDataUrl(Map<String, Object> input) throws IOException {
        byte[] bytes = input.get(IMAGE_BYTES) instanceof byte[] b ? b : null;
        if (bytes == null && input.get(IMAGE_PATH) instanceof String path && !path.isBlank()) {
            bytes = Files.readAllBytes(Path.of(path));
        }
        if (bytes == null || bytes.length == 0) {
            return null;
        }
        return "data:image/jpeg;base64," + Base64.getEncoder().encodeToString(bytes);
    }
}
