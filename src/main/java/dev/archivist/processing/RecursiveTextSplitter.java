package dev.archivist.processing;

import java.util.ArrayList;
import java.util.List;

/**
 * Deterministic sliding-window splitter with ordered break preferences.
 *
 * <p>Each window covers at most {@code chunkSize} characters. The window is cut after the last
 * occurrence of the most preferred separator ({@code "\n\n"}, {@code "\n"}, {@code ". "}, {@code "
 * "}) that lies more than {@code overlap} characters past the window start; when no separator
 * qualifies the window is cut at exactly {@code chunkSize} characters. The next window starts
 * {@code overlap} characters before the cut, moved forward past the first whitespace of that
 * overlap region when the cut was on a separator, so overlaps begin on a word boundary.
 *
 * <p>Chunks are whitespace-trimmed; blank chunks are dropped. Text with no separator splits into
 * exactly {@code ceil((L - overlap) / (chunkSize - overlap))} chunks.
 */
public class RecursiveTextSplitter {

  public static final int DEFAULT_CHUNK_SIZE = 700;
  public static final int DEFAULT_OVERLAP = 100;

  static final List<String> SEPARATORS = List.of("\n\n", "\n", ". ", " ");

  private final int chunkSize;
  private final int overlap;

  public RecursiveTextSplitter() {
    this(DEFAULT_CHUNK_SIZE, DEFAULT_OVERLAP);
  }

  public RecursiveTextSplitter(int chunkSize, int overlap) {
    if (chunkSize <= 0) {
      throw new IllegalArgumentException("chunkSize must be positive, got: " + chunkSize);
    }
    if (overlap < 0 || overlap >= chunkSize) {
      throw new IllegalArgumentException(
          "overlap must be in [0, chunkSize), got: " + overlap + " for chunkSize " + chunkSize);
    }
    this.chunkSize = chunkSize;
    this.overlap = overlap;
  }

  public int chunkSize() {
    return chunkSize;
  }

  public int overlap() {
    return overlap;
  }

  /** Splits {@code text} into trimmed, non-blank chunks in document order. */
  public List<String> split(String text) {
    return spans(text).stream().map(s -> text.substring(s.start(), s.end())).toList();
  }

  /** Character ranges of the chunks {@link #split(String)} would return. */
  public List<TextSpan> spans(String text) {
    List<TextSpan> spans = new ArrayList<>();
    int length = text.length();
    int pos = 0;
    while (pos < length) {
      if (length - pos <= chunkSize) {
        addTrimmed(text, pos, length, spans);
        break;
      }
      int windowEnd = pos + chunkSize;
      int cut = separatorCut(text, pos, windowEnd);
      boolean onSeparator = cut > 0;
      if (!onSeparator) {
        cut = windowEnd;
      }
      addTrimmed(text, pos, cut, spans);
      pos = nextStart(text, cut, onSeparator);
    }
    return spans;
  }

  /** Cut position just after the best qualifying separator, or -1. */
  private int separatorCut(String text, int pos, int windowEnd) {
    for (String separator : SEPARATORS) {
      int idx = text.lastIndexOf(separator, windowEnd - separator.length());
      if (idx < pos) {
        continue;
      }
      int cut = idx + separator.length();
      if (cut - pos > overlap) {
        return cut;
      }
    }
    return -1;
  }

  private int nextStart(String text, int cut, boolean onSeparator) {
    int start = cut - overlap;
    if (overlap == 0 || !onSeparator) {
      return start;
    }
    for (int i = start; i < cut; i++) {
      if (Character.isWhitespace(text.charAt(i))) {
        return i + 1;
      }
    }
    return start;
  }

  private static void addTrimmed(String text, int start, int end, List<TextSpan> spans) {
    int s = start;
    int e = end;
    while (s < e && Character.isWhitespace(text.charAt(s))) {
      s++;
    }
    while (e > s && Character.isWhitespace(text.charAt(e - 1))) {
      e--;
    }
    if (e > s) {
      spans.add(new TextSpan(s, e));
    }
  }
}
