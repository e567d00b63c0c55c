package json.editor.schema;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.regex.Pattern;

/// Built-in format checks. Formats not listed here are not checked.
public enum Format implements FormatValidator {
  DATE {
    @Override
    public boolean test(String s) {
      // yyyy-MM-dd, calendar-valid
      try {
        LocalDate.parse(s);
        return true;
      } catch (DateTimeParseException e) {
        return false;
      }
    }
  },

  TIME {
    @Override
    public boolean test(String s) {
      return TIME_PATTERN.matcher(s).matches();
    }
  },

  DATE_TIME {
    @Override
    public boolean test(String s) {
      // ISO-8601 with an offset or Z
      try {
        OffsetDateTime.parse(s);
        return true;
      } catch (DateTimeParseException e) {
        return false;
      }
    }
  },

  EMAIL {
    @Override
    public boolean test(String s) {
      return EMAIL_PATTERN.matcher(s).matches();
    }
  },

  URI {
    @Override
    public boolean test(String s) {
      if (s.isBlank()) return false;
      try {
        new java.net.URI(s);
        return true;
      } catch (java.net.URISyntaxException e) {
        return false;
      }
    }
  },

  UUID {
    @Override
    public boolean test(String s) {
      return UUID_PATTERN.matcher(s).matches();
    }
  },

  IPV4 {
    @Override
    public boolean test(String s) {
      String[] parts = s.split("\\.", -1);
      if (parts.length != 4) return false;
      for (String part : parts) {
        if (part.isEmpty() || part.length() > 3) return false;
        for (int i = 0; i < part.length(); i++) {
          if (part.charAt(i) < '0' || part.charAt(i) > '9') return false;
        }
        // no leading zeros except for 0 itself
        if (part.length() > 1 && part.charAt(0) == '0') return false;
        if (Integer.parseInt(part) > 255) return false;
      }
      return true;
    }
  },

  HOSTNAME {
    @Override
    public boolean test(String s) {
      // labels a-zA-Z0-9-, no leading/trailing '-', label 1-63, total at most 255
      if (s.isEmpty() || s.length() > 255) return false;
      for (String label : s.split("\\.", -1)) {
        if (label.isEmpty() || label.length() > 63) return false;
        if (label.startsWith("-") || label.endsWith("-")) return false;
        if (!HOSTNAME_LABEL.matcher(label).matches()) return false;
      }
      return true;
    }
  };

  private static final Pattern TIME_PATTERN = Pattern.compile("^([01]\\d|2[0-3]):([0-5]\\d):([0-5]\\d)$");
  private static final Pattern EMAIL_PATTERN = Pattern.compile("[A-Z0-9a-z._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,64}");
  private static final Pattern UUID_PATTERN =
      Pattern.compile("[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}");
  private static final Pattern HOSTNAME_LABEL = Pattern.compile("[a-zA-Z0-9-]+");

  /// Get format validator by name (case-insensitive). `url` is an alias of `uri`.
  /// @return the validator, or null for a format this library does not check
  static FormatValidator byName(String name) {
    String key = name.toUpperCase(Locale.ROOT).replace('-', '_');
    if ("URL".equals(key)) return URI;
    try {
      return Format.valueOf(key);
    } catch (IllegalArgumentException e) {
      return null;
    }
  }
}
