package com.loadcomb.core;

import com.loadcomb.SampleDefinitions;
import com.loadcomb.combination.CombinationInstantiator;
import com.loadcomb.combination.Pruner;
import com.loadcomb.combination.PruningMode;
import com.loadcomb.config.CombinationDefinition;
import com.loadcomb.config.ConfigLoader;
import com.loadcomb.config.FactorOverride;
import com.loadcomb.config.LoadFactorsConfig;
import com.loadcomb.config.LoadGroupsConfig;
import com.loadcomb.exception.ConfigurationException;
import com.loadcomb.expansion.BranchExpander;
import com.loadcomb.export.CombinationRow;
import com.loadcomb.export.CombinationSerializer;
import com.loadcomb.export.LoadCombination;
import com.loadcomb.hierarchy.HierarchyBuilder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests for LoadCombinationGenerator.
 */
class LoadCombinationGeneratorTest {

    private static LoadCombinationGenerator generator(PruningMode mode, long maxCombinations) {
        return generator(mode, maxCombinations, true);
    }

    private static LoadCombinationGenerator generator(PruningMode mode, long maxCombinations, boolean prune) {
        return new LoadCombinationGenerator(
                new HierarchyBuilder(),
                new CombinationInstantiator(),
                new Pruner(mode),
                new BranchExpander(),
                new CombinationSerializer(),
                maxCombinations,
                prune);
    }

    private static List<String> names(GenerationResult result) {
        return result.combinations().stream().map(LoadCombination::name).toList();
    }

    @Test
    @DisplayName("Dead-only combination should yield one combination")
    void deadOnly() {
        GenerationResult result = new LoadCombinationGenerator().generate(
                SampleDefinitions.basicGroups(),
                new LoadFactorsConfig(List.of(SampleDefinitions.lrfd1())));

        assertEquals(List.of(new LoadCombination("LRFD1", Map.of("DL", 1.4, "SDL", 1.4))), result.combinations());
        assertFalse(result.hasFailures());
    }

    @Test
    @DisplayName("Should generate every combination from the sample files")
    void shouldGenerateFromFiles() {
        LoadGroupsConfig groups = ConfigLoader.loadGroups("classpath:fixtures/load_groups.yml");
        LoadFactorsConfig factors = ConfigLoader.loadFactors("classpath:fixtures/load_factors.yml");

        GenerationResult result = generator(PruningMode.ANY_DESCENDANT, 0).generate(groups, factors);

        assertEquals(List.of(
                "LRFD1",
                "LRFD2-Live_Perm",
                "LRFD2-Live_Construction",
                "LRFD2-Live_Pattern",
                "LRFD4-Live_Perm-Wind_North",
                "LRFD4-Live_Perm-Wind_West",
                "LRFD4-Live_Pattern-Wind_North",
                "LRFD4-Live_Pattern-Wind_West",
                "Lateral-Envelope-Lateral_Wind-Wind_North",
                "Lateral-Envelope-Lateral_Wind-Wind_West",
                "Lateral-Envelope-Lateral_Seismic-Seismic_North",
                "Lateral-Envelope-Lateral_Seismic-Seismic_West"), names(result));

        assertEquals(Map.of("DL", 1.2, "SDL", 1.2, "LL_Pattern", 1.0,
                        "WL_Frame_West", 1.0, "WL_Cladding_West", 1.0),
                result.getCombination("LRFD4-Live_Pattern-Wind_West").loadCases());
        assertEquals(result.combinations().size(), result.terminalTrees().size());
        assertFalse(result.hasFailures());
    }

    @Test
    @DisplayName("Direct-children pruning should drop Wind referenced from Lateral")
    void directChildrenPruningDropsNestedWind() {
        GenerationResult result = generator(PruningMode.DIRECT_CHILDREN, 0).generate(
                SampleDefinitions.allGroups(),
                new LoadFactorsConfig(List.of(SampleDefinitions.lrfd4())));

        assertEquals(List.of("LRFD4-Live_Perm", "LRFD4-Live_Pattern"), names(result));
    }

    @Test
    @DisplayName("Unknown group in overrides should have no effect")
    void unknownGroupHasNoEffect() {
        CombinationDefinition withSoil = CombinationDefinition.of("LRFD1",
                Map.of("Dead", FactorOverride.of(1.4), "Soil", FactorOverride.of(1.4)));

        GenerationResult result = new LoadCombinationGenerator().generate(
                SampleDefinitions.basicGroups(), new LoadFactorsConfig(List.of(withSoil)));

        assertEquals(Map.of("DL", 1.4, "SDL", 1.4), result.getCombination("LRFD1").loadCases());
    }

    @Test
    @DisplayName("A combination over the limit should fail without affecting the others")
    void failureIsIsolated() {
        GenerationResult result = generator(PruningMode.DIRECT_CHILDREN, 3).generate(
                SampleDefinitions.basicGroups(),
                new LoadFactorsConfig(List.of(
                        SampleDefinitions.lrfd1(),
                        SampleDefinitions.lrfd4(),
                        SampleDefinitions.lrfd2())));

        assertTrue(result.hasFailures());
        assertEquals(List.of("LRFD4"), List.copyOf(result.failures().keySet()));
        assertTrue(result.failures().get("LRFD4").contains("4"));
        assertEquals(List.of("LRFD1", "LRFD2-Live_Perm", "LRFD2-Live_Construction", "LRFD2-Live_Pattern"),
                names(result));
    }

    @Test
    @DisplayName("A definition repeating an already generated name should fail without replacing it")
    void duplicateFinalNameIsRecordedAsFailure() {
        CombinationDefinition clash = CombinationDefinition.of("LRFD2-Live_Perm",
                Map.of("Dead", FactorOverride.of(1.0)));

        GenerationResult result = generator(PruningMode.DIRECT_CHILDREN, 0).generate(
                SampleDefinitions.basicGroups(),
                new LoadFactorsConfig(List.of(SampleDefinitions.lrfd2(), clash)));

        assertEquals(List.of("LRFD2-Live_Perm"), List.copyOf(result.failures().keySet()));
        assertEquals(List.of("LRFD2-Live_Perm", "LRFD2-Live_Construction", "LRFD2-Live_Pattern"), names(result));
        assertEquals(result.combinations().size(), result.terminalTrees().size());
        assertEquals(Map.of("DL", 1.2, "SDL", 1.2, "LL", 1.6),
                result.getCombination("LRFD2-Live_Perm").loadCases());
    }

    @Test
    @DisplayName("Without pruning every exclusive group should be expanded")
    void unprunedTreesExpandEveryExclusiveGroup() {
        GenerationResult result = generator(PruningMode.DIRECT_CHILDREN, 0, false).generate(
                SampleDefinitions.basicGroups(),
                new LoadFactorsConfig(List.of(SampleDefinitions.lrfd1())));

        assertEquals(List.of(
                "LRFD1-Live_Perm-Wind_North",
                "LRFD1-Live_Perm-Wind_West",
                "LRFD1-Live_Construction-Wind_North",
                "LRFD1-Live_Construction-Wind_West",
                "LRFD1-Live_Pattern-Wind_North",
                "LRFD1-Live_Pattern-Wind_West"), names(result));
        for (LoadCombination combination : result.combinations()) {
            assertEquals(Map.of("DL", 1.4, "SDL", 1.4), combination.loadCases());
        }
    }

    @Test
    @DisplayName("Rows should flatten all combinations in order")
    void shouldProduceRows() {
        GenerationResult result = new LoadCombinationGenerator().generate(
                SampleDefinitions.basicGroups(),
                new LoadFactorsConfig(List.of(SampleDefinitions.lrfd1(), SampleDefinitions.windOnly())));

        List<CombinationRow> rows = result.rows();
        assertEquals(6, rows.size());
        assertEquals(new CombinationRow("LRFD1", "DL", 1.4), rows.get(0));
        assertEquals(new CombinationRow("LRFD4-Wind_West", "WL_Cladding_West", 1.0), rows.get(5));
    }

    @Test
    @DisplayName("Invalid group definitions should fail the whole run")
    void invalidGroupsFailFast() {
        LoadGroupsConfig duplicate = new LoadGroupsConfig(List.of(
                SampleDefinitions.dead(), SampleDefinitions.dead()));

        assertThrows(ConfigurationException.class, () -> new LoadCombinationGenerator().generate(
                duplicate, SampleDefinitions.allFactors()));
    }
}
