package com.scholary.audio.ingest.transcript;

import com.scholary.audio.ingest.whisper.TranscriptSegment;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Derives timestamped fragments from plain text when the recognizer returned none.
 *
 * <p>Assumes an average speech rate of {@value #WORDS_PER_SECOND} words per second, sped up if
 * needed so the text fits in the audio it came from.
 */
@Component
public class EstimatedTimingSegmenter {

  static final double WORDS_PER_SECOND = 2.5;

  /**
   * Split text into fragments of about {@code fragmentSeconds} each.
   *
   * @param text the recognized text
   * @param audioSeconds duration of the audio the text came from
   * @param fragmentSeconds target fragment duration
   * @return chunk-local fragments within {@code [0, audioSeconds]}
   */
  public List<TranscriptSegment> segment(String text, double audioSeconds, double fragmentSeconds) {
    if (text == null || text.isBlank() || !(audioSeconds > 0)) {
      return List.of();
    }

    String[] words = text.strip().split("\\s+");
    double wordsPerSecond = Math.max(WORDS_PER_SECOND, words.length / audioSeconds);
    int wordsPerFragment = Math.max(1, (int) (fragmentSeconds * wordsPerSecond));

    List<TranscriptSegment> fragments = new ArrayList<>();
    for (int i = 0; i < words.length; i += wordsPerFragment) {
      int endWord = Math.min(i + wordsPerFragment, words.length);
      double start = i / wordsPerSecond;
      double end = Math.min(endWord / wordsPerSecond, audioSeconds);
      fragments.add(
          new TranscriptSegment(start, end, String.join(" ", List.of(words).subList(i, endWord))));
    }
    return fragments;
  }
}
