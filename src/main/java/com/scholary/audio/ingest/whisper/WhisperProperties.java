package com.scholary.audio.ingest.whisper;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the Whisper API client.
 *
 * <p>These control how we reach the Azure OpenAI Whisper deployment and the quota it imposes:
 * at most {@code rateLimit.maxRequests} calls per {@code rateLimit.window}, shared by every
 * ingestion in the process.
 */
@ConfigurationProperties(prefix = "whisper")
@Validated
public record WhisperProperties(
    @NotBlank String baseUrl,
    @NotBlank String deployment,
    @NotBlank String apiVersion,
    String apiKey,
    @Positive int connectTimeout,
    @Positive int readTimeout,
    @Valid @NotNull RateLimitProperties rateLimit) {

  public record RateLimitProperties(
      @Positive int maxRequests, @NotNull Duration window, @NotNull Duration padding) {}
}
