package json.editor.schema;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Structured JUL lines for the schema subsystem: `event=NAME key=value ...`.
/// Per-node events are sampled so a large document does not flood the log.
final class StructuredLog {
  private static final int MAX_VALUE_LENGTH = 256;
  private static final Map<String, AtomicLong> COUNTERS = new ConcurrentHashMap<>();

  static void fine(Logger log, String event, Object... kv) {
    if (log.isLoggable(Level.FINE)) log.fine(() -> ev(event, kv));
  }

  static void warning(Logger log, String event, Object... kv) {
    if (log.isLoggable(Level.WARNING)) log.warning(() -> ev(event, kv));
  }

  /// Log at FINEST but only every Nth occurrence per event name.
  static void finestSampled(Logger log, String event, int everyN, Object... kv) {
    if (!log.isLoggable(Level.FINEST)) return;
    long n = COUNTERS.computeIfAbsent(event, k -> new AtomicLong()).incrementAndGet();
    if (everyN <= 1 || n % everyN == 0L) {
      log.finest(() -> ev(event, kv) + " sample=" + n);
    }
  }

  static String ev(String event, Object... kv) {
    StringBuilder sb = new StringBuilder(64);
    sb.append("event=").append(sanitize(event));
    for (int i = 0; i + 1 < kv.length; i += 2) {
      if (kv[i] == null) continue;
      String v = kv[i + 1] == null ? "null" : sanitize(kv[i + 1].toString());
      sb.append(' ').append(kv[i]).append('=');
      if (needsQuotes(v)) sb.append('"').append(v.replace("\"", "\\\"")).append('"'); else sb.append(v);
    }
    return sb.toString();
  }

  private static boolean needsQuotes(String s) {
    if (s.isEmpty()) return true;
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      if (Character.isWhitespace(c) || c == '"') return true;
    }
    return false;
  }

  private static String sanitize(String s) {
    String trimmed = s.length() > MAX_VALUE_LENGTH ? s.substring(0, MAX_VALUE_LENGTH) + "..." : s;
    // one event, one line
    return trimmed.replace('\n', ' ').replace('\r', ' ').replace('\t', ' ');
  }

  private StructuredLog() {}
}
