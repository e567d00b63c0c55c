package json.editor.core;

import java.net.URI;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.logging.Logger;

/// An editable JSON file: its location, current tree and the text it was
/// loaded from.
///
/// Instances are immutable. Edits return new documents that keep the same
/// id, location and original text, so {@link #hasChanges()} always compares
/// against what was loaded. Two documents are equal when their ids are.
///
/// ## Example Usage
/// ```java
/// JsonDocument doc = JsonDocument.parse(uri, Files.readAllBytes(file));
/// Optional<JsonDocument> edited = doc.withUpdatedValue(JsonString.of("hi"), NodePath.of("greeting"));
/// edited.flatMap(JsonDocument::serialize).ifPresent(bytes -> save(bytes));
/// ```
public final class JsonDocument implements JsonEditable<JsonDocument> {

    private static final Logger LOG = Logger.getLogger(JsonDocument.class.getName());

    private final UUID id;
    private final URI location;
    private final JsonObject content;
    private final String originalText;
    private final SourceTree source;
    private final Set<String> editedPaths;

    private JsonDocument(UUID id, URI location, JsonObject content, String originalText,
                         SourceTree source, Set<String> editedPaths) {
        this.id = id;
        this.location = location;
        this.content = content;
        this.originalText = originalText;
        this.source = source;
        this.editedPaths = Collections.unmodifiableSet(new LinkedHashSet<>(editedPaths));
    }

    /// Loads a document from UTF-8 bytes.
    ///
    /// @throws InvalidJsonException if the bytes are not UTF-8, not JSON, or
    ///         hold a root value other than an object
    public static JsonDocument parse(URI location, byte[] bytes) {
        Objects.requireNonNull(location, "location must not be null");
        Objects.requireNonNull(bytes, "bytes must not be null");
        final String text;
        try {
            text = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new InvalidJsonException("Failed to decode " + fileNameOf(location) + " as UTF-8", e);
        }
        return parse(location, text);
    }

    /// Loads a document from text.
    ///
    /// @throws InvalidJsonException if the text is not JSON or its root value
    ///         is not an object
    public static JsonDocument parse(URI location, String text) {
        Objects.requireNonNull(location, "location must not be null");
        Objects.requireNonNull(text, "text must not be null");
        final SourceTree source;
        try {
            source = JsonParser.parseTracked(text);
        } catch (JsonParseException e) {
            throw new InvalidJsonException("Failed to parse JSON from " + fileNameOf(location) + ": " + e.getMessage(), e);
        }
        if (!(source.root().value() instanceof JsonObject root)) {
            throw new InvalidJsonException("Root of " + fileNameOf(location) + " is "
                    + source.root().value().typeName() + ", expected object");
        }
        LOG.fine(() -> "Loaded " + location + " with " + root.members().size() + " top-level members");
        return new JsonDocument(UUID.randomUUID(), location, root, text, source, Set.of());
    }

    /// {@return a new document built in memory, without original text}
    public static JsonDocument create(URI location, JsonObject content) {
        return of(UUID.randomUUID(), location, content, null, Set.of());
    }

    /// {@return a document from explicit parts} An `originalText` that does not
    /// parse is kept for change detection, and writing falls back to the
    /// canonical form.
    public static JsonDocument of(UUID id, URI location, JsonObject content, String originalText,
                                  Set<String> editedPaths) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(location, "location must not be null");
        Objects.requireNonNull(content, "content must not be null");
        Objects.requireNonNull(editedPaths, "editedPaths must not be null");
        SourceTree source = null;
        if (originalText != null) {
            try {
                source = JsonParser.parseTracked(originalText);
            } catch (JsonParseException e) {
                LOG.warning(() -> "Original text of " + location + " does not parse: " + e.getMessage());
            }
        }
        return new JsonDocument(id, location, content, originalText, source, editedPaths);
    }

    public UUID id() {
        return id;
    }

    @Override
    public URI location() {
        return location;
    }

    @Override
    public JsonObject content() {
        return content;
    }

    @Override
    public Optional<String> originalText() {
        return Optional.ofNullable(originalText);
    }

    /// {@return dotted paths touched by successful edits since loading} For
    /// display only; change state is computed from serializations.
    public Set<String> editedPaths() {
        return editedPaths;
    }

    /// {@return the file name without its extension}
    public String name() {
        final String fileName = fileName();
        final int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    /// {@return the last segment of the location's path}
    public String fileName() {
        return fileNameOf(location);
    }

    @Override
    public Optional<JsonDocument> withUpdatedValue(JsonValue value, NodePath path) {
        return apply(new EditOperation.SetValue(path, value));
    }

    @Override
    public Optional<JsonDocument> apply(EditOperation operation) {
        Objects.requireNonNull(operation, "operation must not be null");
        final Optional<JsonValue> edited = operation.apply(content);
        if (edited.isEmpty() || !(edited.get() instanceof JsonObject root)) {
            LOG.fine(() -> operation.description() + " did not apply to " + fileName());
            return Optional.empty();
        }
        final var paths = new LinkedHashSet<>(editedPaths);
        paths.add(operation.targetPath().dotted());
        LOG.fine(() -> operation.description() + " applied to " + fileName());
        return Optional.of(new JsonDocument(id, location, root, originalText, source, paths));
    }

    /// {@inheritDoc} Edited paths are cleared since the origin of the new tree
    /// is unknown.
    @Override
    public JsonDocument withUpdatedContent(JsonObject newContent) {
        Objects.requireNonNull(newContent, "newContent must not be null");
        return new JsonDocument(id, location, newContent, originalText, source, Set.of());
    }

    /// {@return the current tree as text, laid out like the original text when
    /// there is one} Empty when the tree holds a non-finite number.
    public Optional<String> serializeContent() {
        if (source != null) {
            return OrderPreservingSerializer.serialize(content, source);
        }
        if (originalText != null) {
            LOG.warning(() -> "Writing " + fileName() + " in canonical form, its original text does not parse");
        }
        return OrderPreservingSerializer.canonical(content);
    }

    @Override
    public Optional<byte[]> serialize() {
        return serializeContent().map(s -> s.getBytes(StandardCharsets.UTF_8));
    }

    /// {@return per dotted path, how the current tree differs from the loaded
    /// one} Empty for documents without a parseable original text.
    public Map<String, ChangeStatus> changedPaths() {
        return ChangeDetector.compute(content, source == null ? null : source.root().value());
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof JsonDocument other && id.equals(other.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "JsonDocument[" + location + ", members=" + content.members().size()
                + ", edited=" + editedPaths.size() + "]";
    }

    private static String fileNameOf(URI location) {
        final String path = location.getPath() != null ? location.getPath() : location.getSchemeSpecificPart();
        if (path == null) {
            return location.toString();
        }
        final int slash = path.lastIndexOf('/');
        return slash >= 0 ? path.substring(slash + 1) : path;
    }
}
