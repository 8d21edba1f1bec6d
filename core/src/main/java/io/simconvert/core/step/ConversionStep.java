package io.simconvert.core.step;

import io.simconvert.core.model.Node;

/**
 * One schema-version boundary: takes a document at version {@code v} to {@code v + 1}.
 *
 * <p>
 * Implementations mutate the tree in place and must be safe to run on documents that never had
 * the old shape: tags they do not recognise are left exactly as they are. A step never touches
 * the version marker; the driver owns it. Steps hold no mutable state and may be shared across
 * threads.
 */
@FunctionalInterface
public interface ConversionStep {

    /**
     * Applies the transformation.
     *
     * @param root the document root, owned by the caller for the duration of the call
     */
    void apply(Node root);
}
