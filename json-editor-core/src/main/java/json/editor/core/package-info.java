/// Immutable JSON documents that can be edited and written back with their
/// original layout intact.
///
/// ## Values
/// {@link json.editor.core.JsonValue} is a closed family of records. Objects
/// keep member insertion order for writing but compare without regard to it.
///
/// ## Editing
/// An {@link json.editor.core.EditOperation} describes one structural change
/// at a {@link json.editor.core.NodePath}. Applying it never modifies its
/// input; it returns a new tree, or an empty `Optional` when the path does not
/// resolve.
///
/// ## Writing
/// {@link json.editor.core.OrderPreservingSerializer} compares an edited tree
/// with the text it was loaded from. Unchanged regions are copied byte for
/// byte and only the edited regions are written fresh, in the layout of the
/// surrounding text.
///
/// ## Documents
/// {@link json.editor.core.JsonDocument} ties a tree to its source location
/// and original text, and reports whether its serialization still equals what
/// was loaded.
package json.editor.core;
