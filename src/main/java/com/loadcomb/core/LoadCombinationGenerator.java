package com.loadcomb.core;

import com.loadcomb.combination.CombinationInstantiator;
import com.loadcomb.combination.Pruner;
import com.loadcomb.config.CombinationDefinition;
import com.loadcomb.config.LoadFactorsConfig;
import com.loadcomb.config.LoadGroupsConfig;
import com.loadcomb.exception.CombinationLimitExceededException;
import com.loadcomb.exception.LoadCombException;
import com.loadcomb.exception.TreeStructureException;
import com.loadcomb.expansion.BranchExpander;
import com.loadcomb.export.CombinationSerializer;
import com.loadcomb.export.LoadCombination;
import com.loadcomb.hierarchy.HierarchyBuilder;
import com.loadcomb.tree.LoadTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the whole pipeline: build template, then per combination instantiate, prune, expand
 * and flatten.
 * <p>
 * Combinations are processed independently. A failure in one is logged and recorded in the
 * result, the others still complete. A definition whose final names clash with names
 * already generated fails the same way. Errors in the group definitions fail the whole run.
 */
public class LoadCombinationGenerator {

    private static final Logger log = LoggerFactory.getLogger(LoadCombinationGenerator.class);

    private final HierarchyBuilder hierarchyBuilder;
    private final CombinationInstantiator instantiator;
    private final Pruner pruner;
    private final BranchExpander expander;
    private final CombinationSerializer serializer;
    private final long maxCombinations;
    private final boolean prune;

    public LoadCombinationGenerator() {
        this(new HierarchyBuilder(), new CombinationInstantiator(), new Pruner(),
                new BranchExpander(), new CombinationSerializer(), 0);
    }

    /**
     * @param maxCombinations Maximum terminal combinations per definition, 0 for no limit
     */
    public LoadCombinationGenerator(HierarchyBuilder hierarchyBuilder,
                                    CombinationInstantiator instantiator,
                                    Pruner pruner,
                                    BranchExpander expander,
                                    CombinationSerializer serializer,
                                    long maxCombinations) {
        this(hierarchyBuilder, instantiator, pruner, expander, serializer, maxCombinations, true);
    }

    /**
     * @param maxCombinations Maximum terminal combinations per definition, 0 for no limit
     * @param prune           Whether to prune combination trees before expansion. Unpruned trees
     *                        expand every exclusive group, factored or not
     */
    public LoadCombinationGenerator(HierarchyBuilder hierarchyBuilder,
                                    CombinationInstantiator instantiator,
                                    Pruner pruner,
                                    BranchExpander expander,
                                    CombinationSerializer serializer,
                                    long maxCombinations,
                                    boolean prune) {
        this.hierarchyBuilder = hierarchyBuilder;
        this.instantiator = instantiator;
        this.pruner = pruner;
        this.expander = expander;
        this.serializer = serializer;
        this.maxCombinations = maxCombinations;
        this.prune = prune;
    }

    public GenerationResult generate(LoadGroupsConfig groups, LoadFactorsConfig factors) {
        LoadTree template = hierarchyBuilder.build(groups);

        Map<String, LoadTree> terminalTrees = new LinkedHashMap<>();
        List<LoadCombination> combinations = new ArrayList<>();
        Map<String, String> failures = new LinkedHashMap<>();

        for (CombinationDefinition definition : factors.combinations()) {
            try {
                Map<String, LoadTree> expanded = generate(template, definition);
                for (String name : expanded.keySet()) {
                    if (terminalTrees.containsKey(name)) {
                        throw new TreeStructureException(
                                "Combination '" + name + "' was already produced by an earlier definition");
                    }
                }
                List<LoadCombination> flattened = new ArrayList<>(expanded.size());
                for (LoadTree tree : expanded.values()) {
                    flattened.add(serializer.toFlatMapping(tree));
                }
                combinations.addAll(flattened);
                terminalTrees.putAll(expanded);
            } catch (LoadCombException e) {
                log.error("Failed to generate load combination '{}': {}", definition.name(), e.getMessage());
                failures.put(definition.name(), e.getMessage());
            }
        }

        log.info("Generated {} load combinations from {} definitions ({} failed)",
                combinations.size(), factors.combinations().size(), failures.size());
        return new GenerationResult(
                Collections.unmodifiableMap(terminalTrees),
                Collections.unmodifiableList(combinations),
                Collections.unmodifiableMap(failures));
    }

    /**
     * Terminal trees of one combination definition.
     *
     * @throws CombinationLimitExceededException if the expansion would exceed the configured limit
     */
    public Map<String, LoadTree> generate(LoadTree template, CombinationDefinition definition) {
        LoadTree tree = instantiator.instantiate(template, definition);
        int pruned = prune ? pruner.prune(tree) : 0;

        long predicted = BranchExpander.countTerminals(tree.getRoot());
        if (maxCombinations > 0 && predicted > maxCombinations) {
            throw new CombinationLimitExceededException(definition.name(), predicted, maxCombinations);
        }

        Map<String, LoadTree> expanded = expander.expand(tree);
        log.debug("Combination '{}': pruned {} branches, expanded into {}",
                definition.name(), pruned, expanded.keySet());
        return expanded;
    }
}
