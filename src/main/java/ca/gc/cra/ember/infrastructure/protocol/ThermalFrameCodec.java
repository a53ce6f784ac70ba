package ca.gc.cra.ember.infrastructure.protocol;

import ca.gc.cra.ember.domain.record.ThermalFrame;
import java.util.Locale;

/**
 * Hex word codec for thermal frames and calibration blocks. Each word is four hex digits (16 bits).
 */
public final class ThermalFrameCodec {
  static final int CHARS_PER_WORD = 4;
  /** Words in a frame that carries the 66-word device trailer after the grid. */
  static final int FRAME_WITH_TRAILER_WORDS = 834;

  private ThermalFrameCodec() {}

  /**
   * Parses the grid words of a frame payload. Whitespace between words is ignored; an 834-word payload has its
   * trailer dropped.
   *
   * @param payload frame payload between the location field and {@code !}
   * @return {@value ThermalFrame#CELLS} unsigned words
   * @throws IllegalArgumentException when the payload has the wrong size or a non-hex digit
   */
  public static int[] parseGrid(String payload) {
    String compact = stripWhitespace(payload);
    int words = compact.length() / CHARS_PER_WORD;
    if (compact.length() % CHARS_PER_WORD != 0
        || (words != ThermalFrame.CELLS && words != FRAME_WITH_TRAILER_WORDS)) {
      throw new IllegalArgumentException("expected " + ThermalFrame.CELLS + " cells ("
          + ThermalFrame.CELLS * CHARS_PER_WORD + " hex chars), got " + compact.length() + " hex chars");
    }
    return parseWords(compact, ThermalFrame.CELLS);
  }

  /**
   * Parses exactly {@code count} words from a payload.
   *
   * @param payload hex text, whitespace allowed between words
   * @param count required number of words
   * @return parsed words
   * @throws IllegalArgumentException on size mismatch or non-hex digit
   */
  public static int[] parseExact(String payload, int count) {
    String compact = stripWhitespace(payload);
    if (compact.length() != count * CHARS_PER_WORD) {
      throw new IllegalArgumentException("expected " + count + " words (" + count * CHARS_PER_WORD
          + " hex chars), got " + compact.length() + " hex chars");
    }
    return parseWords(compact, count);
  }

  /**
   * Renders words as one unbroken uppercase hex run.
   *
   * @param words unsigned 16-bit words
   * @return hex text
   */
  public static String toContinuousHex(int[] words) {
    StringBuilder builder = new StringBuilder(words.length * CHARS_PER_WORD);
    for (int word : words) {
      appendWord(builder, word);
    }
    return builder.toString();
  }

  /**
   * Renders words as space separated uppercase hex.
   *
   * @param words unsigned 16-bit words
   * @return hex text
   */
  public static String toSpacedHex(int[] words) {
    StringBuilder builder = new StringBuilder(words.length * (CHARS_PER_WORD + 1));
    for (int i = 0; i < words.length; i++) {
      if (i > 0) {
        builder.append(' ');
      }
      appendWord(builder, words[i]);
    }
    return builder.toString();
  }

  static boolean containsWhitespace(String payload) {
    for (int i = 0; i < payload.length(); i++) {
      if (Character.isWhitespace(payload.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static int[] parseWords(String compact, int count) {
    int[] words = new int[count];
    for (int i = 0; i < count; i++) {
      int value = 0;
      int base = i * CHARS_PER_WORD;
      for (int j = 0; j < CHARS_PER_WORD; j++) {
        int digit = Character.digit(compact.charAt(base + j), 16);
        if (digit < 0) {
          throw new IllegalArgumentException(
              "non-hex character '" + compact.charAt(base + j) + "' in word " + i);
        }
        value = (value << 4) | digit;
      }
      words[i] = value;
    }
    return words;
  }

  private static void appendWord(StringBuilder builder, int word) {
    if (word < 0 || word > 0xFFFF) {
      throw new IllegalArgumentException("word out of 16-bit range: " + word);
    }
    String hex = Integer.toHexString(word).toUpperCase(Locale.ROOT);
    for (int pad = hex.length(); pad < CHARS_PER_WORD; pad++) {
      builder.append('0');
    }
    builder.append(hex);
  }

  private static String stripWhitespace(String payload) {
    if (payload == null) {
      return "";
    }
    StringBuilder builder = new StringBuilder(payload.length());
    for (int i = 0; i < payload.length(); i++) {
      char c = payload.charAt(i);
      if (!Character.isWhitespace(c)) {
        builder.append(c);
      }
    }
    return builder.toString();
  }
}
