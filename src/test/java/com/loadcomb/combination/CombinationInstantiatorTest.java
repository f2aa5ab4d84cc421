package com.loadcomb.combination;

import com.loadcomb.SampleDefinitions;
import com.loadcomb.config.CombinationDefinition;
import com.loadcomb.config.FactorOverride;
import com.loadcomb.export.TreePrinter;
import com.loadcomb.hierarchy.HierarchyBuilder;
import com.loadcomb.tree.LoadNode;
import com.loadcomb.tree.LoadTree;
import com.loadcomb.tree.TreeContext;
import com.loadcomb.tree.TreeWalker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CombinationInstantiator.
 */
class CombinationInstantiatorTest {

    private final CombinationInstantiator instantiator = new CombinationInstantiator();
    private LoadTree template;

    @BeforeEach
    void setUp() {
        template = new HierarchyBuilder().build(SampleDefinitions.basicGroups());
    }

    private static LoadNode find(LoadTree tree, String name) {
        return TreeWalker.findFirstByName(tree.getRoot(), name).orElseThrow();
    }

    @Test
    @DisplayName("Should clone template into a combination tree named after the combination")
    void shouldCloneTemplate() {
        LoadTree tree = instantiator.instantiate(template, SampleDefinitions.lrfd1());

        assertEquals("LRFD1", tree.getName());
        assertEquals(TreeContext.COMBINATION, tree.getContext());
        assertNotSame(template.getRoot(), tree.getRoot());
        assertEquals(TreeWalker.preOrder(template.getRoot()).size(), TreeWalker.preOrder(tree.getRoot()).size());
    }

    @Test
    @DisplayName("Group factor should be set on the group and inherited by its cases")
    void shouldApplyGroupFactor() {
        LoadTree tree = instantiator.instantiate(template, SampleDefinitions.lrfd1());

        assertEquals(OptionalDouble.of(1.4), find(tree, "Dead").getExplicitLoadFactor());
        assertEquals(OptionalDouble.of(1.4), find(tree, "DL").getLoadFactor());
        assertTrue(find(tree, "LL").getLoadFactor().isEmpty());
    }

    @Test
    @DisplayName("Sub-group factors should target qualified sub-group names")
    void shouldApplySubgroupFactors() {
        LoadTree tree = instantiator.instantiate(template, SampleDefinitions.lrfd2());

        assertTrue(find(tree, "Live").getExplicitLoadFactor().isEmpty());
        assertEquals(OptionalDouble.of(1.6), find(tree, "Live_Perm").getExplicitLoadFactor());
        assertEquals(OptionalDouble.of(1.0), find(tree, "LL_Construction").getLoadFactor());
        assertEquals(OptionalDouble.of(1.6), find(tree, "LL_Pattern").getLoadFactor());
    }

    @Test
    @DisplayName("Overrides naming absent groups should be ignored without error")
    void absentGroupIsIgnored() {
        CombinationDefinition definition = CombinationDefinition.of("LRFD1",
                Map.of("Soil", FactorOverride.of(1.4),
                        "Live", FactorOverride.ofSubgroups(Map.of("Roof", 1.0))));
        TreePrinter printer = new TreePrinter();
        LoadTree expected = instantiator.instantiate(template,
                CombinationDefinition.of("LRFD1", Map.of()));

        LoadTree tree = assertDoesNotThrow(() -> instantiator.instantiate(template, definition));

        assertEquals(printer.render(expected), printer.render(tree));
        assertTrue(TreeWalker.preOrder(tree.getRoot()).stream().noneMatch(LoadNode::hasExplicitLoadFactor));
    }

    @Test
    @DisplayName("Template should be left untouched")
    void templateIsUntouched() {
        instantiator.instantiate(template, SampleDefinitions.lrfd4());

        assertTrue(TreeWalker.preOrder(template.getRoot()).stream().noneMatch(LoadNode::hasExplicitLoadFactor));
    }

    @Test
    @DisplayName("Should instantiate every combination in declaration order")
    void shouldInstantiateAll() {
        Map<String, LoadTree> trees = instantiator.instantiateAll(template, SampleDefinitions.allFactors());

        assertEquals(List.of("LRFD1", "LRFD2", "LRFD4", "Lateral-Envelope"), List.copyOf(trees.keySet()));
        assertNotSame(trees.get("LRFD1").getRoot(), trees.get("LRFD2").getRoot());
    }
}
