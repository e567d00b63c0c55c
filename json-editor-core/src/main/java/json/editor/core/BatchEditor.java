package json.editor.core;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/// Applies one edit to many documents.
///
/// Documents are independent, so the edit runs on each of them in parallel.
/// Results come back in input order: the edited document, or empty where
/// the edit did not apply.
public final class BatchEditor {

    private static final Logger LOG = Logger.getLogger(BatchEditor.class.getName());

    private BatchEditor() {}

    public static <D extends JsonEditable<D>> List<Optional<D>> applyToAll(List<D> documents, EditOperation operation) {
        Objects.requireNonNull(documents, "documents must not be null");
        Objects.requireNonNull(operation, "operation must not be null");
        final List<Optional<D>> results = documents.parallelStream()
                .map(document -> document.apply(operation))
                .toList();
        LOG.fine(() -> operation.description() + ": applied to "
                + results.stream().filter(Optional::isPresent).count() + " of " + documents.size() + " documents");
        return results;
    }
}
