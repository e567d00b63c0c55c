package json.editor.core;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/// A document that can be shown and edited as a JSON tree.
///
/// Implementations are immutable. Every edit returns a new instance and
/// leaves the receiver as it was, so a caller may keep earlier snapshots for
/// undo.
///
/// @param <D> the implementing type, returned by the edit methods
public interface JsonEditable<D extends JsonEditable<D>> {

    /// {@return where the document was loaded from or will be saved to}
    URI location();

    /// {@return the current tree}
    JsonObject content();

    /// {@return the text the document was loaded from} Empty for documents
    /// built in memory.
    Optional<String> originalText();

    /// {@return a copy with `value` written at `path`, or empty when `path`
    /// does not resolve}
    Optional<D> withUpdatedValue(JsonValue value, NodePath path);

    /// {@return a copy with `operation` applied, or empty when it does not apply}
    Optional<D> apply(EditOperation operation);

    /// {@return a copy holding `content` in place of the current tree}
    D withUpdatedContent(JsonObject content);

    /// {@return the UTF-8 text to save, or empty when the tree cannot be written}
    Optional<byte[]> serialize();

    /// {@return `true` when the serialized content differs from the original
    /// text} Always `false` without an original text. Computed on each call.
    default boolean hasChanges() {
        final Optional<String> original = originalText();
        if (original.isEmpty()) {
            return false;
        }
        return serialize()
                .map(bytes -> !new String(bytes, StandardCharsets.UTF_8).equals(original.get()))
                .orElse(false);
    }
}
