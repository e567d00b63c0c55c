package json.editor.schema;

import java.util.logging.Logger;

/// Shared logger for the schema subsystem.
/// Classes in this package use it via:
///   import static json.editor.schema.SchemaLogging.LOG;
final class SchemaLogging {
  public static final Logger LOG = Logger.getLogger("json.editor.schema");
  private SchemaLogging() {}
}
