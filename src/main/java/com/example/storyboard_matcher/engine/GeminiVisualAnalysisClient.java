package com.example.storyboard_matcher.engine;

import com.example.storyboard_matcher.config.GeminiProperties;
import com.example.storyboard_matcher.engine.Interfaces.VisualAnalysisClient;
import com.example.storyboard_matcher.exception.AnalysisServiceException;
import com.example.storyboard_matcher.model.AnalysisWindow;
import com.example.storyboard_matcher.util.MessageText;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.PrematureCloseException;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Calls {@code models/{model}:generateContent} with an optional uploaded video part and a JSON response schema.
 */
@Service
public class GeminiVisualAnalysisClient implements VisualAnalysisClient {
    private static final Logger LOGGER = LoggerFactory.getLogger(GeminiVisualAnalysisClient.class);
    private static final Duration RETRY_BACKOFF = Duration.ofMillis(500);
    private static final int RETRY_MAX_ATTEMPTS = 2;

    private final WebClient client;
    private final GeminiProperties props;
    private final ObjectMapper om;

    public GeminiVisualAnalysisClient(@Qualifier("geminiWebClient") WebClient client,
                                      GeminiProperties props,
                                      ObjectMapper om) {
        this.client = client;
        this.props = props;
        this.om = om;
    }

    @Override
    public Reply propose(Request request) {
        String model = modelFor(request.stage());
        Map<String, Object> body = buildBody(request);

        Mono<JsonNode> mono = client.post()
                .uri("/v1beta/models/{model}:generateContent", model)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .onStatus(HttpStatusCode::isError, resp ->
                        resp.bodyToMono(String.class).defaultIfEmpty("")
                                .map(err -> new AnalysisServiceException(
                                        "Gemini error " + resp.statusCode().value() + ": " + MessageText.truncate(err, 500),
                                        resp.statusCode().value(),
                                        null)))
                .bodyToMono(String.class)
                .map(this::parseJson)
                .retryWhen(Retry.backoff(RETRY_MAX_ATTEMPTS, RETRY_BACKOFF)
                        .filter(this::isRetryable)
                        .doBeforeRetry(signal -> {
                            Throwable failure = signal.failure();
                            Throwable root = rootCause(failure);
                            LOGGER.warn("Gemini retry attempt={} label={} stage={} type={} rootCause={}",
                                    signal.totalRetriesInARow() + 1,
                                    request.label(),
                                    request.stage(),
                                    failure == null ? "unknown" : failure.getClass().getSimpleName(),
                                    root == null ? "unknown" : root.getClass().getSimpleName());
                        })
                        .onRetryExhaustedThrow((spec, signal) -> signal.failure()));

        long started = System.nanoTime();
        JsonNode root;
        try {
            root = mono.block(Duration.ofSeconds(props.getTimeoutSeconds()));
        } catch (AnalysisServiceException e) {
            throw e;
        } catch (RuntimeException e) {
            Throwable cause = rootCause(e);
            throw new AnalysisServiceException("Gemini call failed: " + (cause == null ? e : cause).getMessage(), e);
        }
        long elapsedMs = (System.nanoTime() - started) / 1_000_000;

        if (root == null) {
            throw new AnalysisServiceException("Empty response from Gemini");
        }
        String text = extractText(root);
        JsonNode usage = root.path("usageMetadata");
        Integer promptTokens = usage.hasNonNull("promptTokenCount") ? usage.get("promptTokenCount").asInt() : null;
        Integer outputTokens = usage.hasNonNull("candidatesTokenCount") ? usage.get("candidatesTokenCount").asInt() : null;
        LOGGER.info("Gemini done label={} stage={} model={} latencyMs={} in={} out={} chars={}",
                request.label(), request.stage(), model, elapsedMs,
                promptTokens == null ? "?" : promptTokens,
                outputTokens == null ? "?" : outputTokens,
                text == null ? 0 : text.length());
        return new Reply(text, promptTokens, outputTokens);
    }

    String modelFor(Stage stage) {
        return switch (stage) {
            case SHORTLIST -> props.getShortlistModel();
            case DEEP -> props.getDeepModel();
            case SINGLE -> props.getModel();
        };
    }

    Map<String, Object> buildBody(Request request) {
        List<Map<String, Object>> parts = new ArrayList<>();
        if (request.media() != null) {
            Map<String, Object> videoPart = new LinkedHashMap<>();
            String mimeType = request.media().mimeType() == null ? "video/mp4" : request.media().mimeType();
            videoPart.put("fileData", Map.of("mimeType", mimeType, "fileUri", request.media().uri()));
            AnalysisWindow window = request.window();
            if (window != null) {
                videoPart.put("videoMetadata", Map.of(
                        "startOffset", offset(window.startSeconds()),
                        "endOffset", offset(window.endSeconds())));
            }
            parts.add(videoPart);
        }
        parts.add(Map.of("text", request.brief()));

        Map<String, Object> generationConfig = new LinkedHashMap<>();
        generationConfig.put("responseMimeType", "application/json");
        if (request.responseSchema() != null) {
            generationConfig.put("responseJsonSchema", request.responseSchema());
        }
        if (props.getThinkingBudget() >= 0) {
            generationConfig.put("thinkingConfig", Map.of("thinkingBudget", props.getThinkingBudget()));
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("contents", List.of(Map.of("role", "user", "parts", parts)));
        body.put("generationConfig", generationConfig);
        return body;
    }

    private static String offset(double seconds) {
        return String.format(Locale.ROOT, "%.3fs", seconds);
    }

    private JsonNode parseJson(String body) {
        try {
            return om.readTree(body == null ? "" : body);
        } catch (JsonProcessingException e) {
            LOGGER.warn("Gemini parse failure length={} snippet={}", body == null ? 0 : body.length(), MessageText.truncate(body, 500));
            throw new AnalysisServiceException("Gemini returned malformed JSON", e);
        }
    }

    private String extractText(JsonNode root) {
        JsonNode parts = root.path("candidates").path(0).path("content").path("parts");
        if (!parts.isArray()) {
            return null;
        }
        StringBuilder sb = new StringBuilder();
        for (JsonNode part : parts) {
            if (part.path("thought").asBoolean(false)) continue;
            String text = part.path("text").asText(null);
            if (text != null) sb.append(text);
        }
        return sb.length() == 0 ? null : sb.toString();
    }

    private boolean isRetryable(Throwable throwable) {
        if (throwable == null) return false;
        if (throwable instanceof AnalysisServiceException ase) return ase.isTransient();
        if (throwable instanceof WebClientRequestException) return true;
        return hasCause(throwable, PrematureCloseException.class);
    }

    private boolean hasCause(Throwable throwable, Class<? extends Throwable> type) {
        Throwable cursor = throwable;
        while (cursor != null) {
            if (type.isInstance(cursor)) return true;
            cursor = cursor.getCause();
        }
        return false;
    }

    private Throwable rootCause(Throwable throwable) {
        Throwable cursor = throwable;
        Throwable prev = null;
        while (cursor != null && cursor != prev) {
            prev = cursor;
            cursor = cursor.getCause();
        }
        return prev;
    }
}
