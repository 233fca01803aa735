package im.arun.taxonomy.tree;

import im.arun.taxonomy.model.MaterializedPathRow;
import im.arun.taxonomy.util.TreeUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Re-expands the tree into the flat materialized-path table, depth-first pre-order.
 */
public class TreeFlattener {

    public List<MaterializedPathRow> flatten(TaxonomyTree tree) {
        List<MaterializedPathRow> flatRows = new ArrayList<>(tree.size());
        TreeUtils.forEachPreOrder(tree.getRoots(), node -> flatRows.add(toRow(node)));
        return flatRows;
    }

    private static MaterializedPathRow toRow(TaxonomyNode node) {
        return MaterializedPathRow.builder()
            .fullPath(node.getFullPath())
            .excelRow(node.getExcelRow())
            .conceptName(node.getConceptName())
            .preferredLabel(node.getPreferredLabel())
            .label(node.getLabel())
            .groupCode(node.getGroupCode())
            .groupName(node.getGroupName())
            .type(node.getType())
            .attributes(node.getAttributes())
            .build();
    }
}
