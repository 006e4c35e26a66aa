package com.scholary.audio.ingest.whisper;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublisher;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Locale;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * HTTP client for the Azure OpenAI Whisper transcription API.
 *
 * <p>This handles the low-level HTTP communication: building multipart requests, sending audio,
 * and parsing responses. Each call is a single attempt; rate limiting and failure policy belong
 * to the caller.
 */
@Component
public class WhisperClient implements WhisperService {

  private static final Logger LOGGER = LoggerFactory.getLogger(WhisperClient.class);

  private final HttpClient httpClient;
  private final WhisperProperties properties;
  private final ObjectMapper objectMapper;

  public WhisperClient(WhisperProperties properties, ObjectMapper objectMapper) {
    this.properties = properties;
    this.objectMapper = objectMapper;

    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build();

    LOGGER.info(
        "Initialized Whisper client: baseUrl={}, deployment={}",
        properties.baseUrl(),
        properties.deployment());
  }

  @Override
  public WhisperResponse transcribe(
      byte[] audioBytes, String fileName, TranscribeOptions options) {
    LOGGER.info(
        "Transcribing: file={}, size={} bytes, timestamps={}",
        fileName,
        audioBytes.length,
        options.wantTimestamps());

    String boundary = UUID.randomUUID().toString();
    HttpRequest request =
        HttpRequest.newBuilder()
            .uri(transcriptionUri())
            .timeout(Duration.ofSeconds(properties.readTimeout()))
            .header("Content-Type", "multipart/form-data; boundary=" + boundary)
            .headers(authHeaders())
            .POST(buildMultipartBody(audioBytes, fileName, options, boundary))
            .build();

    LOGGER.debug("Sending transcription request to {}", request.uri());

    HttpResponse<String> response;
    try {
      response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    } catch (IOException e) {
      throw new WhisperException("Whisper request failed: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new WhisperException("Transcription interrupted", e);
    }

    if (response.statusCode() != 200) {
      throw new WhisperException(
          String.format(
              "Whisper API returned status %d: %s", response.statusCode(), response.body()),
          response.statusCode());
    }

    WhisperResponse whisperResponse;
    try {
      whisperResponse = objectMapper.readValue(response.body(), WhisperResponse.class);
    } catch (IOException e) {
      throw new WhisperException("Unparseable Whisper response", e);
    }
    if (whisperResponse == null) {
      throw new WhisperException("Empty Whisper response");
    }

    LOGGER.info(
        "Transcription successful: {} segments, language={}",
        whisperResponse.segments().size(),
        whisperResponse.language());

    return whisperResponse;
  }

  private URI transcriptionUri() {
    String base = properties.baseUrl().replaceAll("/+$", "");
    return URI.create(
        String.format(
            "%s/openai/deployments/%s/audio/transcriptions?api-version=%s",
            base, properties.deployment(), properties.apiVersion()));
  }

  private String[] authHeaders() {
    String apiKey = properties.apiKey();
    if (apiKey == null || apiKey.isBlank()) {
      return new String[] {"Accept", "application/json"};
    }
    return new String[] {"Accept", "application/json", "api-key", apiKey};
  }

  /**
   * Build a multipart/form-data body for the transcription request.
   *
   * <p>Java's HttpClient has no built-in multipart support, so the format is written by hand:
   *
   * <pre>
   * --boundary
   * Content-Disposition: form-data; name="file"; filename="chunk_0000.flac"
   * Content-Type: audio/flac
   *
   * [binary data]
   * --boundary
   * Content-Disposition: form-data; name="response_format"
   *
   * verbose_json
   * --boundary--
   * </pre>
   */
  private BodyPublisher buildMultipartBody(
      byte[] audioBytes, String fileName, TranscribeOptions options, String boundary) {

    ByteArrayOutputStream body = new ByteArrayOutputStream(audioBytes.length + 1024);

    StringBuilder sb = new StringBuilder();
    sb.append("--").append(boundary).append("\r\n");
    sb.append("Content-Disposition: form-data; name=\"file\"; filename=\"")
        .append(fileName)
        .append("\"\r\n");
    sb.append("Content-Type: ").append(contentTypeFor(fileName)).append("\r\n\r\n");
    body.writeBytes(sb.toString().getBytes(StandardCharsets.UTF_8));
    body.writeBytes(audioBytes);
    body.writeBytes("\r\n".getBytes(StandardCharsets.UTF_8));

    sb = new StringBuilder();
    if (options.wantTimestamps()) {
      appendField(sb, boundary, "response_format", "verbose_json");
      appendField(sb, boundary, "timestamp_granularities[]", "segment");
    } else {
      appendField(sb, boundary, "response_format", "json");
    }
    if (options.language() != null) {
      appendField(sb, boundary, "language", options.language());
    }
    sb.append("--").append(boundary).append("--\r\n");
    body.writeBytes(sb.toString().getBytes(StandardCharsets.UTF_8));

    return BodyPublishers.ofByteArray(body.toByteArray());
  }

  private static void appendField(StringBuilder sb, String boundary, String name, String value) {
    sb.append("--").append(boundary).append("\r\n");
    sb.append("Content-Disposition: form-data; name=\"").append(name).append("\"\r\n\r\n");
    sb.append(value).append("\r\n");
  }

  static String contentTypeFor(String fileName) {
    String lower = fileName.toLowerCase(Locale.ROOT);
    int dot = lower.lastIndexOf('.');
    String extension = dot < 0 ? "" : lower.substring(dot + 1);
    return switch (extension) {
      case "flac" -> "audio/flac";
      case "wav" -> "audio/wav";
      case "mp3" -> "audio/mpeg";
      case "m4a" -> "audio/mp4";
      case "ogg" -> "audio/ogg";
      case "webm" -> "audio/webm";
      default -> "application/octet-stream";
    };
  }
}
