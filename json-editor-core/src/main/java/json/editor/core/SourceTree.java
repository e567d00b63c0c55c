package json.editor.core;

import java.util.Objects;

/// The text a document was loaded from and the span tree of its root value.
record SourceTree(String text, SourceNode root) {

    SourceTree {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(root, "root must not be null");
    }

    /// Text before the root value: leading whitespace and an optional byte order mark.
    String prefix() {
        return text.substring(0, root.start());
    }

    /// Text after the root value, usually a final line break.
    String suffix() {
        return text.substring(root.end());
    }
}
