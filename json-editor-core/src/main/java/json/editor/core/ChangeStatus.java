package json.editor.core;

/// How a leaf of the current tree relates to the originally loaded tree.
public enum ChangeStatus {
    /// The path did not exist in the original tree.
    ADDED,
    /// The path existed and held a different value.
    MODIFIED,
    /// The path existed in the original tree and is gone.
    DELETED
}
