package dev.archivist.ingestion.wiki;

import java.util.regex.Pattern;

/**
 * Regex-based conversion of wiki storage-format HTML to plain text. Block elements become line
 * breaks so paragraph structure survives for chunking.
 */
public final class HtmlText {

  private static final Pattern BLOCK_END =
      Pattern.compile("(?i)</(p|div|h[1-6]|li|tr|table|ul|ol|pre|blockquote)>");
  private static final Pattern LINE_BREAK = Pattern.compile("(?i)<br\\s*/?>");
  private static final Pattern HTML_TAG = Pattern.compile("<[^>]+>");
  private static final Pattern SPACES = Pattern.compile("[ \\t\\x0B\\f\\r]+");
  private static final Pattern BLANK_LINES = Pattern.compile("\\n\\s*\\n+");

  private HtmlText() {
    // utility class
  }

  public static String toPlainText(String html) {
    String text = html.replaceAll("(?is)<script[^>]*>.*?</script>", " ");
    text = text.replaceAll("(?is)<style[^>]*>.*?</style>", " ");
    text = LINE_BREAK.matcher(text).replaceAll("\n");
    text = BLOCK_END.matcher(text).replaceAll("\n\n");
    text = HTML_TAG.matcher(text).replaceAll(" ");
    text = text.replace("&nbsp;", " ")
        .replace("&lt;", "<")
        .replace("&gt;", ">")
        .replace("&quot;", "\"")
        .replace("&#39;", "'")
        .replace("&hellip;", "...")
        .replace("&amp;", "&");
    text = SPACES.matcher(text).replaceAll(" ");
    text = text.replaceAll(" *\\n *", "\n");
    text = BLANK_LINES.matcher(text).replaceAll("\n\n");
    return text.strip();
  }
}
