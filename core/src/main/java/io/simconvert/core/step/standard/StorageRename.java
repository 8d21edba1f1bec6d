package io.simconvert.core.step.standard;

import io.simconvert.core.model.Node;
import io.simconvert.core.step.ConversionStep;
import io.simconvert.core.text.RenameRule;
import io.simconvert.core.text.TextRewriter;
import io.simconvert.core.tree.NodeOps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Version 10 to 11: the non-structural biomass pool is now called storage.
 *
 * <p>
 * Every script body and reference expression has its {@code .NonStructural*} members renamed to
 * {@code .Storage*}, and every element whose tag starts with {@code NonStructural} is renamed the
 * same way ({@code NonStructuralNReallocated} becomes {@code StorageNReallocated}). Identifiers
 * that merely contain the old name are not touched.
 */
public final class StorageRename implements ConversionStep {

    private static final Logger LOG = LoggerFactory.getLogger(StorageRename.class);

    static final String OLD_PREFIX = "NonStructural";
    static final String NEW_PREFIX = "Storage";

    static final TextRewriter RENAMES = TextRewriter.of(
            RenameRule.rename(".NonStructural", ".Storage"),
            RenameRule.rename(".NonStructuralDemand", ".StorageDemand"),
            RenameRule.rename(".TotalNonStructuralDemand", ".TotalStorageDemand"),
            RenameRule.rename(".NonStructuralN", ".StorageN"),
            RenameRule.rename(".NonStructuralFraction", ".StorageFraction"));

    @Override
    public void apply(Node root) {
        int rewritten = ReferenceSites.rewriteAll(root, RENAMES);
        int renamed = 0;
        for (Node node : NodeOps.findAll(root, n -> n.tag().startsWith(OLD_PREFIX))) {
            NodeOps.renameTag(node, NEW_PREFIX + node.tag().substring(OLD_PREFIX.length()));
            renamed++;
        }
        LOG.debug("Storage rename: text_sites={} elements={}", rewritten, renamed);
    }
}
