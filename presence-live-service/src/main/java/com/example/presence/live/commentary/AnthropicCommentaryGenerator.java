package com.example.presence.live.commentary;

import com.example.presence.shared.config.AppProperties;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Calls the Anthropic Messages API. Disabled when no API key is configured.
 */
@Service
@Slf4j
public class AnthropicCommentaryGenerator implements CommentaryGenerator {

    private final WebClient webClient;
    private final AppProperties.Anthropic anthropic;

    public AnthropicCommentaryGenerator(WebClient.Builder webClientBuilder, AppProperties appProperties) {
        this.anthropic = appProperties.getAnthropic();
        this.webClient = webClientBuilder
                .baseUrl(anthropic.getBaseUrl())
                .defaultHeader("anthropic-version", anthropic.getApiVersion())
                .build();
    }

    @Override
    public boolean isEnabled() {
        return StringUtils.hasText(anthropic.getApiKey());
    }

    @Override
    public Mono<String> generate(CommentaryPrompt prompt) {
        Map<String, Object> request = Map.of(
                "model", anthropic.getModel(),
                "max_tokens", anthropic.getMaxTokens(),
                "system", prompt.system(),
                "messages", List.of(Map.of("role", "user", "content", prompt.user())));

        return webClient.post()
                .uri("/v1/messages")
                .header("x-api-key", anthropic.getApiKey())
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(request)
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> response.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .map(body -> new CommentaryGenerationException(
                                "Anthropic API " + response.statusCode().value() + ": " + abbreviate(body))))
                .bodyToMono(JsonNode.class)
                .flatMap(body -> {
                    String text = body.path("content").path(0).path("text").asText("").strip();
                    return text.isEmpty() ? Mono.empty() : Mono.just(text);
                });
    }

    private static String abbreviate(String body) {
        return body.length() > 200 ? body.substring(0, 200) : body;
    }
}
