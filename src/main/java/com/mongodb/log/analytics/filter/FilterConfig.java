package com.mongodb.log.analytics.filter;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Properties;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configuration for log filtering, loaded from a properties file.
 * <p>
 * Supported keys:
 * <ul>
 * <li>filter.ignore.patterns: comma-separated list (replaces defaults)</li>
 * <li>filter.ignore.add: comma-separated list (adds to defaults)</li>
 * <li>filter.ignore.remove: comma-separated list (removes from current set)</li>
 * <li>filter.slow.ms: minimum duration of kept lines</li>
 * <li>filter.namespaces: comma-separated namespaces to keep</li>
 * <li>filter.from, filter.to: time expressions</li>
 * </ul>
 */
public class FilterConfig {

    private static final Logger logger = LoggerFactory.getLogger(FilterConfig.class);

    private Set<String> ignorePatterns = new LinkedHashSet<>();
    private Long slowMs;
    private Set<String> namespaces = new LinkedHashSet<>();
    private String from;
    private String to;

    public FilterConfig() {
        initializeDefaults();
    }

    private void initializeDefaults() {
        ignorePatterns.addAll(Arrays.asList(
            // connection churn
            "connection accepted from",
            "end connection",
            "Successfully authenticated as",

            // health checks
            "isMaster: 1",
            "replSetHeartbeat",
            "serverStatus: 1"
        ));
    }

    public static FilterConfig load(String path) throws IOException {
        FilterConfig config = new FilterConfig();
        try (InputStream in = new FileInputStream(path)) {
            Properties props = new Properties();
            props.load(in);
            config.loadFromProperties(props);
        }
        logger.info("Loaded filter configuration from: {}", path);
        return config;
    }

    public void loadFromProperties(Properties props) {
        String ignoreList = props.getProperty("filter.ignore.patterns");
        if (ignoreList != null && !ignoreList.trim().isEmpty()) {
            ignorePatterns.clear();
            addPatterns(ignoreList);
        }

        String additionalPatterns = props.getProperty("filter.ignore.add");
        if (additionalPatterns != null && !additionalPatterns.trim().isEmpty()) {
            addPatterns(additionalPatterns);
        }

        String removePatterns = props.getProperty("filter.ignore.remove");
        if (removePatterns != null && !removePatterns.trim().isEmpty()) {
            for (String pattern : removePatterns.split(",")) {
                ignorePatterns.remove(pattern.trim());
            }
        }

        String slow = props.getProperty("filter.slow.ms");
        if (slow != null && !slow.trim().isEmpty()) {
            try {
                slowMs = Long.valueOf(slow.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("filter.slow.ms is not a number: " + slow, e);
            }
        }

        String ns = props.getProperty("filter.namespaces");
        if (ns != null) {
            for (String namespace : ns.split(",")) {
                if (!namespace.trim().isEmpty()) {
                    namespaces.add(namespace.trim());
                }
            }
        }

        from = props.getProperty("filter.from", from);
        to = props.getProperty("filter.to", to);
    }

    private void addPatterns(String patternList) {
        for (String pattern : patternList.split(",")) {
            String trimmed = pattern.trim();
            if (!trimmed.isEmpty()) {
                ignorePatterns.add(trimmed);
            }
        }
    }

    public Set<String> getIgnorePatterns() {
        return new LinkedHashSet<>(ignorePatterns);
    }

    public void addPattern(String pattern) {
        ignorePatterns.add(pattern);
    }

    public void removePattern(String pattern) {
        ignorePatterns.remove(pattern);
    }

    public boolean shouldIgnore(String line) {
        return ignorePatterns.stream().anyMatch(line::contains);
    }

    public Long getSlowMs() {
        return slowMs;
    }

    public void setSlowMs(Long slowMs) {
        this.slowMs = slowMs;
    }

    /**
     * @return read-only view of the namespaces to keep
     */
    public Set<String> getNamespaces() {
        return Collections.unmodifiableSet(namespaces);
    }

    public void addNamespace(String namespace) {
        namespaces.add(namespace);
    }

    public String getFrom() {
        return from;
    }

    public void setFrom(String from) {
        this.from = from;
    }

    public String getTo() {
        return to;
    }

    public void setTo(String to) {
        this.to = to;
    }

    public boolean hasTimeRange() {
        return (from != null && !from.isBlank()) || (to != null && !to.isBlank());
    }
}
