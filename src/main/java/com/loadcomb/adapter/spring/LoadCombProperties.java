package com.loadcomb.adapter.spring;

import com.loadcomb.combination.PruningMode;
import com.loadcomb.export.ReportFormat;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for load combination generation.
 */
@ConfigurationProperties(prefix = "loadcomb")
public class LoadCombProperties {

    /**
     * Whether load combination generation is enabled.
     */
    private boolean enabled = true;

    /**
     * Path to the load groups file.
     * Supports classpath: prefix for classpath resources.
     */
    private String groupsPath = "classpath:load_groups.yml";

    /**
     * Path to the load factors file.
     * Supports classpath: prefix for classpath resources.
     */
    private String factorsPath = "classpath:load_factors.yml";

    /**
     * File the report is written to.
     */
    private String outputPath = "load_combinations.csv";

    private ReportFormat reportFormat = ReportFormat.CSV;

    /**
     * Prune combination trees before expansion.
     */
    private boolean prune = true;

    /**
     * Pruning rule. ANY_DESCENDANT keeps groups factored below an unfactored referencing group,
     * such as Wind under Lateral; {@link com.loadcomb.combination.Pruner}'s own default is
     * DIRECT_CHILDREN.
     */
    private PruningMode pruningMode = PruningMode.ANY_DESCENDANT;

    /**
     * Maximum terminal combinations per combination definition (0 = unlimited).
     */
    private long maxCombinations = 0;

    /**
     * Expand exclusive alternatives concurrently.
     */
    private boolean parallelExpansion = false;

    /**
     * Worker count of the expansion pool (0 = available processors).
     */
    private int parallelism = 0;

    /**
     * Log every terminal tree after generation.
     */
    private boolean printTrees = false;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getGroupsPath() {
        return groupsPath;
    }

    public void setGroupsPath(String groupsPath) {
        this.groupsPath = groupsPath;
    }

    public String getFactorsPath() {
        return factorsPath;
    }

    public void setFactorsPath(String factorsPath) {
        this.factorsPath = factorsPath;
    }

    public String getOutputPath() {
        return outputPath;
    }

    public void setOutputPath(String outputPath) {
        this.outputPath = outputPath;
    }

    public ReportFormat getReportFormat() {
        return reportFormat;
    }

    public void setReportFormat(ReportFormat reportFormat) {
        this.reportFormat = reportFormat;
    }

    public boolean isPrune() {
        return prune;
    }

    public void setPrune(boolean prune) {
        this.prune = prune;
    }

    public PruningMode getPruningMode() {
        return pruningMode;
    }

    public void setPruningMode(PruningMode pruningMode) {
        this.pruningMode = pruningMode;
    }

    public long getMaxCombinations() {
        return maxCombinations;
    }

    public void setMaxCombinations(long maxCombinations) {
        this.maxCombinations = maxCombinations;
    }

    public boolean isParallelExpansion() {
        return parallelExpansion;
    }

    public void setParallelExpansion(boolean parallelExpansion) {
        this.parallelExpansion = parallelExpansion;
    }

    public int getParallelism() {
        return parallelism;
    }

    public void setParallelism(int parallelism) {
        this.parallelism = parallelism;
    }

    public boolean isPrintTrees() {
        return printTrees;
    }

    public void setPrintTrees(boolean printTrees) {
        this.printTrees = printTrees;
    }
}
