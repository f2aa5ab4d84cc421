package com.loadcomb;

import com.loadcomb.adapter.spring.LoadCombProperties;
import com.loadcomb.config.LoadFactorsConfig;
import com.loadcomb.config.LoadGroupsConfig;
import com.loadcomb.core.GenerationResult;
import com.loadcomb.core.LoadCombinationGenerator;
import com.loadcomb.export.ReportWriter;
import com.loadcomb.export.TreePrinter;
import com.loadcomb.spring.EnableLoadComb;
import com.loadcomb.tree.LoadTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import java.nio.file.Path;

/**
 * Generates the load combinations defined by the configured group and factor files and
 * writes them to a report.
 */
@SpringBootApplication
@EnableLoadComb
public class LoadCombApplication {

    private static final Logger log = LoggerFactory.getLogger(LoadCombApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(LoadCombApplication.class, args);
    }

    @Bean
    public CommandLineRunner generateCombinations(LoadCombProperties properties,
                                                  LoadGroupsConfig groups,
                                                  LoadFactorsConfig factors,
                                                  LoadCombinationGenerator generator,
                                                  ReportWriter reportWriter) {
        return args -> {
            GenerationResult result = generator.generate(groups, factors);

            if (properties.isPrintTrees()) {
                TreePrinter printer = new TreePrinter();
                for (LoadTree tree : result.terminalTrees().values()) {
                    log.info("\n{}", printer.render(tree));
                }
            }

            Path output = Path.of(properties.getOutputPath());
            reportWriter.write(result.combinations(), output);
            log.info("Wrote {} load combinations ({} rows) to {}",
                    result.combinations().size(), result.rows().size(), output.toAbsolutePath());

            result.failures().forEach((name, message) ->
                    log.warn("Load combination '{}' was skipped: {}", name, message));
        };
    }
}
