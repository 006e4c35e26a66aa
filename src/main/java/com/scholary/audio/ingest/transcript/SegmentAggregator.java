package com.scholary.audio.ingest.transcript;

import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Re-buckets fine-grained recognizer fragments into analysis-sized segments.
 *
 * <p>Whisper returns many short, often sub-sentence fragments. Downstream classification wants
 * segments of roughly a target duration instead, so fragments are walked in order and accumulated:
 *
 * <ul>
 *   <li>A fragment joins the open segment while {@code fragment.end - segment.start <= target}
 *   <li>Otherwise the open segment is closed and the fragment seeds a new one
 *   <li>Blank fragments are skipped
 *   <li>A segment with no duration yet (zero-length or inverted fragment timing) takes the next
 *       fragment regardless of the target, so it is never emitted empty
 *   <li>A fragment starting before the previous segment's end is clamped to that end, so
 *       boundaries never go backwards; one lying entirely before it joins that segment instead
 * </ul>
 */
@Component
public class SegmentAggregator {

  private static final Logger LOGGER = LoggerFactory.getLogger(SegmentAggregator.class);

  /**
   * Aggregate fragments into segments of at most {@code targetSeconds} where possible.
   *
   * <p>A single fragment longer than the target becomes a segment of its own.
   *
   * @param fragments fragments with global timestamps, in order
   * @param targetSeconds target segment duration
   * @return ordered, non-overlapping segments with trimmed text
   * @throws StitchInvariantViolationException if the result breaks ordering or overlap rules
   */
  public List<AnalysisSegment> aggregate(List<MergedSegment> fragments, double targetSeconds) {
    if (!(targetSeconds > 0)) {
      throw new IllegalArgumentException("Target segment duration must be positive");
    }

    List<AnalysisSegment> segments = new ArrayList<>();
    OpenSegment current = null;

    for (MergedSegment fragment : fragments) {
      String text = fragment.text() == null ? "" : fragment.text().strip();
      if (text.isEmpty()) {
        continue;
      }

      if (current != null
          && (!current.hasDuration() || fragment.end() - current.start <= targetSeconds)) {
        current.append(text, fragment.end());
        continue;
      }

      if (current != null) {
        segments.add(current.close());
        current = null;
      }

      double start = fragment.start();
      if (!segments.isEmpty()) {
        AnalysisSegment previous = segments.get(segments.size() - 1);
        start = Math.max(start, previous.end());
        if (fragment.end() <= start) {
          segments.set(
              segments.size() - 1,
              new AnalysisSegment(previous.start(), previous.end(), previous.text() + " " + text));
          continue;
        }
      }
      current = new OpenSegment(start, Math.max(start, fragment.end()), text);
    }

    if (current != null) {
      if (current.hasDuration()) {
        segments.add(current.close());
      } else {
        LOGGER.warn(
            "Dropping text without duration at {}s: no fragment extends it", current.start);
      }
    }

    validate(segments);

    LOGGER.info(
        "Aggregated {} fragments into {} segments of <= {}s",
        fragments.size(),
        segments.size(),
        targetSeconds);
    return List.copyOf(segments);
  }

  /**
   * Check segment invariants: positive duration, trimmed non-empty text, strictly ascending
   * starts, no overlap.
   */
  public void validate(List<AnalysisSegment> segments) {
    for (int i = 0; i < segments.size(); i++) {
      AnalysisSegment segment = segments.get(i);
      if (!(segment.end() > segment.start())) {
        throw new StitchInvariantViolationException(
            String.format(
                "Segment %d has non-positive duration: %.3f-%.3f",
                i, segment.start(), segment.end()));
      }
      if (segment.text().isEmpty() || !segment.text().equals(segment.text().strip())) {
        throw new StitchInvariantViolationException(
            String.format("Segment %d text is empty or untrimmed", i));
      }
      if (i > 0) {
        AnalysisSegment previous = segments.get(i - 1);
        if (segment.start() <= previous.start() || segment.start() < previous.end()) {
          throw new StitchInvariantViolationException(
              String.format(
                  "Segment %d (%.3f-%.3f) overlaps or precedes segment %d (%.3f-%.3f)",
                  i,
                  segment.start(),
                  segment.end(),
                  i - 1,
                  previous.start(),
                  previous.end()));
        }
      }
    }
  }

  private static final class OpenSegment {
    private final double start;
    private double end;
    private final StringBuilder text;

    OpenSegment(double start, double end, String text) {
      this.start = start;
      this.end = end;
      this.text = new StringBuilder(text);
    }

    boolean hasDuration() {
      return end > start;
    }

    void append(String fragmentText, double fragmentEnd) {
      text.append(' ').append(fragmentText);
      end = Math.max(end, fragmentEnd);
    }

    AnalysisSegment close() {
      return new AnalysisSegment(start, end, text.toString());
    }
  }
}
