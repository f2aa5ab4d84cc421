package com.loadcomb.config;

import com.loadcomb.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads load group and load factor definitions from YAML files.
 * <p>
 * Groups file:
 * <pre>
 * Dead: [DL, SDL]
 * Live:
 *   Perm: [LL]
 *   Pattern: [LL_Pattern]
 * </pre>
 * Factors file:
 * <pre>
 * LRFD2:
 *   Dead: 1.2
 *   Live:
 *     Perm: 1.6
 * </pre>
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    /**
     * Load group definitions from a path.
     * Supports classpath: prefix for classpath resources.
     */
    public static LoadGroupsConfig loadGroups(String path) {
        log.info("Loading load groups from: {}", path);
        LoadGroupsConfig config = parseGroups(read(path));
        log.info("Loaded {} load groups", config.groups().size());
        return config;
    }

    /**
     * Load combination factor definitions from a path.
     * Supports classpath: prefix for classpath resources.
     */
    public static LoadFactorsConfig loadFactors(String path) {
        log.info("Loading load factors from: {}", path);
        LoadFactorsConfig config = parseFactors(read(path));
        log.info("Loaded {} load combinations", config.combinations().size());
        return config;
    }

    public static LoadGroupsConfig parseGroups(InputStream inputStream) {
        return parseGroups(loadYaml(inputStream));
    }

    public static LoadFactorsConfig parseFactors(InputStream inputStream) {
        return parseFactors(loadYaml(inputStream));
    }

    private static Map<?, ?> read(String path) {
        try {
            Resource resource = getResource(path);
            try (InputStream inputStream = resource.getInputStream()) {
                return loadYaml(inputStream);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    private static Resource getResource(String path) {
        if (path.startsWith("classpath:")) {
            String resourcePath = path.substring("classpath:".length());
            return new ClassPathResource(resourcePath);
        }
        return new FileSystemResource(path);
    }

    private static Map<?, ?> loadYaml(InputStream inputStream) {
        Yaml yaml = new Yaml();
        Object root = yaml.load(inputStream);
        if (root == null) {
            throw new ConfigurationException("Configuration file is empty");
        }
        if (!(root instanceof Map)) {
            throw new ConfigurationException("Configuration root must be a mapping, found: "
                    + root.getClass().getSimpleName());
        }
        return (Map<?, ?>) root;
    }

    static LoadGroupsConfig parseGroups(Map<?, ?> root) {
        List<GroupDefinition> groups = new ArrayList<>();
        for (Map.Entry<?, ?> entry : root.entrySet()) {
            String groupName = String.valueOf(entry.getKey());
            Object body = entry.getValue();

            if (body instanceof List<?> list) {
                groups.add(GroupDefinition.additive(groupName, toNames(groupName, list)));
                log.debug("Parsed additive group: name={}, cases={}", groupName, list.size());
            } else if (body instanceof Map<?, ?> map) {
                Map<String, List<String>> subgroups = new LinkedHashMap<>();
                for (Map.Entry<?, ?> sub : map.entrySet()) {
                    String subName = String.valueOf(sub.getKey());
                    if (!(sub.getValue() instanceof List<?> subList)) {
                        throw new ConfigurationException("Sub-group '" + subName + "' of group '" + groupName
                                + "' must be a list of load case names");
                    }
                    subgroups.put(subName, toNames(groupName + "." + subName, subList));
                }
                groups.add(GroupDefinition.exclusive(groupName, subgroups));
                log.debug("Parsed exclusive group: name={}, subgroups={}", groupName, subgroups.keySet());
            } else {
                throw new ConfigurationException("Load group '" + groupName
                        + "' must be a list of load cases or a mapping of sub-groups");
            }
        }
        return new LoadGroupsConfig(List.copyOf(groups));
    }

    static LoadFactorsConfig parseFactors(Map<?, ?> root) {
        List<CombinationDefinition> combinations = new ArrayList<>();
        for (Map.Entry<?, ?> entry : root.entrySet()) {
            String combinationName = String.valueOf(entry.getKey());
            if (!(entry.getValue() instanceof Map<?, ?> body)) {
                throw new ConfigurationException("Load combination '" + combinationName
                        + "' must be a mapping of group names to factors");
            }

            Map<String, FactorOverride> overrides = new LinkedHashMap<>();
            for (Map.Entry<?, ?> groupEntry : body.entrySet()) {
                String groupName = String.valueOf(groupEntry.getKey());
                Object value = groupEntry.getValue();
                String where = combinationName + "." + groupName;

                if (value instanceof Map<?, ?> subMap) {
                    Map<String, Double> subFactors = new LinkedHashMap<>();
                    for (Map.Entry<?, ?> sub : subMap.entrySet()) {
                        String subName = String.valueOf(sub.getKey());
                        subFactors.put(subName, toFactor(where + "." + subName, sub.getValue()));
                    }
                    overrides.put(groupName, FactorOverride.ofSubgroups(subFactors));
                } else {
                    overrides.put(groupName, FactorOverride.of(toFactor(where, value)));
                }
            }
            combinations.add(CombinationDefinition.of(combinationName, overrides));
            log.debug("Parsed load combination: name={}, groups={}", combinationName, overrides.keySet());
        }
        return new LoadFactorsConfig(List.copyOf(combinations));
    }

    // Helper methods

    private static List<String> toNames(String where, List<?> list) {
        List<String> names = new ArrayList<>();
        for (Object item : list) {
            if (item == null || item instanceof Map || item instanceof List) {
                throw new ConfigurationException("Invalid load case entry in '" + where + "': " + item);
            }
            names.add(item.toString());
        }
        return names;
    }

    private static double toFactor(String where, Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value != null) {
            try {
                return Double.parseDouble(value.toString());
            } catch (NumberFormatException e) {
                throw new ConfigurationException("Load factor '" + where + "' is not a number: " + value, e);
            }
        }
        throw new ConfigurationException("Load factor '" + where + "' is missing");
    }
}
