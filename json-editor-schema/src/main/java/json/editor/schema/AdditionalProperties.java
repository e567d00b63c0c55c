package json.editor.schema;

import java.util.Objects;

/// The `additionalProperties` keyword: either a plain yes/no, or a schema that
/// members not named in `properties` must satisfy.
public sealed interface AdditionalProperties
    permits AdditionalProperties.Allowed, AdditionalProperties.Constrained {

  AdditionalProperties ALLOWED = new Allowed(true);
  AdditionalProperties FORBIDDEN = new Allowed(false);

  /// {@return `true` unless extra members are forbidden outright}
  boolean allowsExtraMembers();

  record Allowed(boolean allowed) implements AdditionalProperties {
    @Override
    public boolean allowsExtraMembers() {
      return allowed;
    }
  }

  record Constrained(Schema schema) implements AdditionalProperties {
    public Constrained {
      Objects.requireNonNull(schema, "schema");
    }

    @Override
    public boolean allowsExtraMembers() {
      return true;
    }
  }
}
