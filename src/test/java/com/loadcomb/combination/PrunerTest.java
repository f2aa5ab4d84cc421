package com.loadcomb.combination;

import com.loadcomb.SampleDefinitions;
import com.loadcomb.config.CombinationDefinition;
import com.loadcomb.hierarchy.HierarchyBuilder;
import com.loadcomb.tree.LoadNode;
import com.loadcomb.tree.LoadTree;
import com.loadcomb.tree.TreeWalker;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for Pruner.
 */
class PrunerTest {

    private final CombinationInstantiator instantiator = new CombinationInstantiator();

    private LoadTree combination(CombinationDefinition definition, boolean withReferences) {
        LoadTree template = new HierarchyBuilder().build(withReferences
                ? SampleDefinitions.allGroups()
                : SampleDefinitions.basicGroups());
        return instantiator.instantiate(template, definition);
    }

    private static List<String> names(LoadNode node) {
        return node.getChildren().stream().map(LoadNode::getName).toList();
    }

    private static Set<String> paths(LoadTree tree) {
        Set<String> paths = new HashSet<>();
        for (LoadNode node : TreeWalker.preOrder(tree.getRoot())) {
            paths.add(node.getPath());
        }
        return paths;
    }

    @Test
    @DisplayName("Combination with only a Wind factor should keep only the Wind subtree")
    void shouldKeepWindOnly() {
        LoadTree tree = combination(SampleDefinitions.windOnly(), false);

        int removed = new Pruner().prune(tree);

        assertEquals(2, removed);
        assertEquals(List.of("Wind"), names(tree.getRoot()));
        assertEquals(List.of("Wind_North", "Wind_West"),
                names(tree.getRoot().getChildren().get(0)));
        assertEquals(4, TreeWalker.leaves(tree.getRoot()).size());
    }

    @Test
    @DisplayName("Sub-groups without factors should be dropped from a factored exclusive group")
    void shouldDropUnfactoredSubgroups() {
        LoadTree tree = combination(SampleDefinitions.lrfd4(), false);

        new Pruner().prune(tree);

        assertEquals(List.of("Dead", "Live", "Wind"), names(tree.getRoot()));
        assertEquals(List.of("Live_Perm", "Live_Pattern"), names(tree.getRoot().getChildren().get(1)));
    }

    @Test
    @DisplayName("Surviving nodes should be exactly those relevant on the intact tree")
    void survivorsFollowRelevanceRule() {
        for (CombinationDefinition definition : SampleDefinitions.allFactors().combinations()) {
            LoadTree tree = combination(definition, true);
            Pruner pruner = new Pruner();

            Set<String> expected = new HashSet<>();
            for (LoadNode node : TreeWalker.preOrder(tree.getRoot())) {
                if (allRelevant(pruner, tree, node)) {
                    expected.add(node.getPath());
                }
            }

            pruner.prune(tree);

            assertEquals(expected, paths(tree), "survivors of " + definition.name());
            for (LoadNode node : TreeWalker.preOrder(tree.getRoot())) {
                if (node != tree.getRoot()) {
                    assertTrue(pruner.isRelevant(node), node.getPath() + " should be relevant");
                }
            }
        }
    }

    private static boolean allRelevant(Pruner pruner, LoadTree tree, LoadNode node) {
        for (LoadNode n = node; n != tree.getRoot(); n = n.getParent()) {
            if (!pruner.isRelevant(n)) {
                return false;
            }
        }
        return true;
    }

    @ParameterizedTest
    @EnumSource(PruningMode.class)
    @DisplayName("A second pass should remove nothing")
    void pruningIsAFixedPoint(PruningMode mode) {
        for (CombinationDefinition definition : SampleDefinitions.allFactors().combinations()) {
            LoadTree tree = combination(definition, true);
            Pruner pruner = new Pruner(mode);

            pruner.prune(tree);
            Set<String> afterFirst = paths(tree);

            assertEquals(0, pruner.prune(tree), "second pass on " + definition.name());
            assertEquals(afterFirst, paths(tree));
        }
    }

    @Test
    @DisplayName("Direct-children rule should drop a factored group nested below an unfactored group")
    void directChildrenDropsNestedGroup() {
        LoadTree tree = combination(SampleDefinitions.lrfd4(), true);

        new Pruner(PruningMode.DIRECT_CHILDREN).prune(tree);

        assertEquals(List.of("Dead", "Live"), names(tree.getRoot()));
        assertTrue(TreeWalker.findByName(tree.getRoot(), "Wind").isEmpty());
    }

    @Test
    @DisplayName("Any-descendant rule should keep the path to a nested factored group")
    void anyDescendantKeepsNestedGroup() {
        LoadTree tree = combination(SampleDefinitions.lrfd4(), true);

        new Pruner(PruningMode.ANY_DESCENDANT).prune(tree);

        assertEquals(List.of("Dead", "Live", "Lateral"), names(tree.getRoot()));
        LoadNode lateral = tree.getRoot().getChildren().get(2);
        assertEquals(List.of("Lateral_Wind"), names(lateral));
        assertEquals("LRFD4/Lateral/Lateral_Wind/Wind",
                TreeWalker.findFirstByName(tree.getRoot(), "Wind").orElseThrow().getPath());
        assertTrue(TreeWalker.findByName(tree.getRoot(), "Seismic").isEmpty());
    }

    @Test
    @DisplayName("Combination without any matching factor should prune down to the root")
    void shouldPruneEverything() {
        LoadTree tree = combination(CombinationDefinition.of("Empty", Map.of()), false);

        new Pruner().prune(tree);

        assertTrue(tree.getRoot().isLeaf());
        assertEquals("Empty", tree.getName());
    }

    @Test
    @DisplayName("Leaves inheriting a factor should survive")
    void leavesWithInheritedFactorSurvive() {
        LoadTree tree = combination(SampleDefinitions.lrfd1(), false);

        new Pruner().prune(tree);

        List<String> leaves = new ArrayList<>();
        TreeWalker.leaves(tree.getRoot()).forEach(l -> leaves.add(l.getName()));
        assertEquals(List.of("DL", "SDL"), leaves);
    }
}
