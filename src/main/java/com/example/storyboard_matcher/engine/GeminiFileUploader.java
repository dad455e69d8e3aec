package com.example.storyboard_matcher.engine;

import com.example.storyboard_matcher.config.GeminiProperties;
import com.example.storyboard_matcher.engine.Interfaces.MediaResourcePreparer;
import com.example.storyboard_matcher.exception.PreparationException;
import com.example.storyboard_matcher.util.MessageText;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.io.FileSystemResource;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

/**
 * Uploads local videos to the Gemini Files API and waits until they become {@code ACTIVE}.
 * Every call uploads again; reuse within a batch is the caller's {@code ResourceCache}.
 */
@Service
public class GeminiFileUploader implements MediaResourcePreparer {
    private static final Logger LOGGER = LoggerFactory.getLogger(GeminiFileUploader.class);

    private final WebClient client;
    private final GeminiProperties props;

    public GeminiFileUploader(@Qualifier("geminiWebClient") WebClient client, GeminiProperties props) {
        this.client = client;
        this.props = props;
    }

    @Override
    public MediaHandle prepare(String locator) {
        if (locator == null || locator.isBlank()) {
            throw new PreparationException("Media locator is blank");
        }
        Path input = Path.of(locator);
        if (!Files.exists(input)) {
            throw new PreparationException("Media file not found: " + locator);
        }
        String mimeType = guessMimeType(input);

        MultipartBodyBuilder builder = new MultipartBodyBuilder();
        builder.part("metadata", Map.of("file", Map.of("display_name", input.getFileName().toString())),
                MediaType.APPLICATION_JSON);
        builder.part("file", new FileSystemResource(input), MediaType.parseMediaType(mimeType));

        long started = System.nanoTime();
        JsonNode file;
        try {
            JsonNode created = client.post()
                    .uri("/upload/v1beta/files?uploadType=multipart")
                    .header("X-Goog-Upload-Protocol", "multipart")
                    .body(BodyInserters.fromMultipartData(builder.build()))
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, resp -> resp.bodyToMono(String.class).defaultIfEmpty("")
                            .map(err -> new PreparationException(
                                    "Upload rejected " + resp.statusCode().value() + ": " + MessageText.truncate(err, 500))))
                    .bodyToMono(JsonNode.class)
                    .block(Duration.ofSeconds(props.getTimeoutSeconds()));
            if (created == null || created.path("file").isMissingNode()) {
                throw new PreparationException("Upload returned no file metadata for " + input.getFileName());
            }
            file = awaitActive(created.path("file"));
        } catch (PreparationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new PreparationException("Failed to upload video: " + e.getMessage(), e);
        }

        MediaHandle handle = new MediaHandle(
                file.path("uri").asText(),
                file.path("mimeType").asText(mimeType),
                file.path("name").asText());
        LOGGER.info("Gemini upload done locator={} name={} latencyMs={} expirationTime={}",
                locator, handle.name(), (System.nanoTime() - started) / 1_000_000,
                file.path("expirationTime").asText("-"));
        return handle;
    }

    private JsonNode awaitActive(JsonNode file) {
        String name = file.path("name").asText();
        JsonNode current = file;
        for (int poll = 0; poll < props.getUploadMaxPolls(); poll++) {
            String state = current.path("state").asText("ACTIVE");
            if ("ACTIVE".equals(state)) {
                return current;
            }
            if ("FAILED".equals(state)) {
                throw new PreparationException("File processing failed for " + name);
            }
            sleep(props.getUploadPollIntervalMs());
            current = client.get()
                    .uri("/v1beta/{name}", name)
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .block(Duration.ofSeconds(props.getTimeoutSeconds()));
            if (current == null) {
                throw new PreparationException("Empty status response for " + name);
            }
        }
        throw new PreparationException("File " + name + " did not become ACTIVE after "
                + props.getUploadMaxPolls() + " polls");
    }

    private void sleep(long millis) {
        if (millis <= 0) return;
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PreparationException("Interrupted while waiting for file processing", e);
        }
    }

    private static String guessMimeType(Path input) {
        try {
            String probed = Files.probeContentType(input);
            if (probed != null) return probed;
        } catch (IOException e) {
            LOGGER.debug("Content type probe failed path={} error={}", input, e.toString());
        }
        return "video/mp4";
    }
}
