package com.scholary.audio.ingest.config;

import com.scholary.audio.ingest.ratelimit.RateLimiter;
import com.scholary.audio.ingest.ratelimit.Sleeper;
import com.scholary.audio.ingest.ratelimit.SlidingWindowRateLimiter;
import com.scholary.audio.ingest.whisper.WhisperProperties;
import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the Whisper client.
 *
 * <p>Enables the WhisperProperties and creates the one rate limiter that every ingestion in the
 * process shares.
 */
@Configuration
@EnableConfigurationProperties(WhisperProperties.class)
public class WhisperConfig {

  @Bean
  public RateLimiter whisperRateLimiter(WhisperProperties properties, Clock clock) {
    WhisperProperties.RateLimitProperties rateLimit = properties.rateLimit();
    return new SlidingWindowRateLimiter(
        rateLimit.maxRequests(), rateLimit.window(), rateLimit.padding(), clock, Sleeper.SYSTEM);
  }
}
