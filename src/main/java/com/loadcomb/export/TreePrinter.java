package com.loadcomb.export;

import com.loadcomb.tree.LoadGroup;
import com.loadcomb.tree.LoadNode;
import com.loadcomb.tree.LoadTree;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Renders a tree as indented text, one node per line.
 * <pre>
 * LRFD2 [additive]
 * |-- Dead [additive, factor=1.2]
 * |   |-- DL (1.2)
 * |   `-- SDL (1.2)
 * `-- Live [exclusive]
 * </pre>
 * Explicit factors are shown as {@code factor=x}, inherited ones in parentheses.
 */
public class TreePrinter {

    public String render(LoadTree tree) {
        StringBuilder sb = new StringBuilder();
        appendNode(sb, tree.getRoot(), "", "");
        return sb.toString();
    }

    public List<String> renderLines(LoadTree tree) {
        return List.of(render(tree).split("\n"));
    }

    private void appendNode(StringBuilder sb, LoadNode node, String prefix, String childPrefix) {
        sb.append(prefix).append(node.getName()).append(describe(node)).append('\n');
        List<LoadNode> children = node.getChildren();
        for (int i = 0; i < children.size(); i++) {
            boolean last = i == children.size() - 1;
            appendNode(sb, children.get(i),
                    childPrefix + (last ? "`-- " : "|-- "),
                    childPrefix + (last ? "    " : "|   "));
        }
    }

    private String describe(LoadNode node) {
        List<String> attributes = new ArrayList<>();
        if (node instanceof LoadGroup group) {
            attributes.add(group.isAdditive() ? "additive" : "exclusive");
        }
        node.getExplicitLoadFactor().ifPresent(f -> attributes.add("factor=" + f));

        StringBuilder sb = new StringBuilder();
        if (!attributes.isEmpty()) {
            sb.append(" [").append(String.join(", ", attributes)).append(']');
        }
        OptionalDouble inherited = node.getLoadFactor();
        if (!node.hasExplicitLoadFactor() && inherited.isPresent()) {
            sb.append(" (").append(inherited.getAsDouble()).append(')');
        }
        return sb.toString();
    }
}
