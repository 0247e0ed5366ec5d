package com.mongodb.log.analytics.filter;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Properties;
import java.util.Set;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class FilterConfigTest {

    @TempDir
    Path tempDir;

    @Test
    public void testDefaults() {
        FilterConfig config = new FilterConfig();

        assertTrue(config.shouldIgnore("Mon Aug  5 20:27:10 [initandlisten] connection accepted from 127.0.0.1:50778"));
        assertFalse(config.shouldIgnore("Mon Aug  5 20:27:10 [conn1] query test.docs query: { a: 1 } 10ms"));
        assertNull(config.getSlowMs());
        assertTrue(config.getNamespaces().isEmpty());
        assertFalse(config.hasTimeRange());
    }

    @Test
    public void testAddAndRemovePatterns() {
        Properties props = new Properties();
        props.setProperty("filter.ignore.add", "getLastError, ,ping");
        props.setProperty("filter.ignore.remove", "end connection");

        FilterConfig config = new FilterConfig();
        config.loadFromProperties(props);

        assertTrue(config.shouldIgnore("command: { getLastError: 1 }"));
        assertTrue(config.shouldIgnore("command: { ping: 1 }"));
        assertFalse(config.shouldIgnore("end connection 127.0.0.1:50778"));
        assertFalse(config.getIgnorePatterns().contains(""));
    }

    @Test
    public void testReplacePatterns() {
        Properties props = new Properties();
        props.setProperty("filter.ignore.patterns", "foo,bar");

        FilterConfig config = new FilterConfig();
        config.loadFromProperties(props);

        assertEquals(Set.of("foo", "bar"), config.getIgnorePatterns());
        assertFalse(config.shouldIgnore("connection accepted from"));
    }

    @Test
    public void testLoadFromFile() throws IOException {
        Path file = tempDir.resolve("filter.properties");
        Files.write(file, List.of(
                "filter.slow.ms=100",
                "filter.namespaces=test.a, test.b",
                "filter.from=start +1h"), StandardCharsets.UTF_8);

        FilterConfig config = FilterConfig.load(file.toString());

        assertEquals(100L, config.getSlowMs());
        assertEquals(Set.of("test.a", "test.b"), config.getNamespaces());
        assertEquals("start +1h", config.getFrom());
        assertNull(config.getTo());
        assertTrue(config.hasTimeRange());
    }

    @Test
    public void testNamespacesAreReadOnlyView() {
        FilterConfig config = new FilterConfig();
        Set<String> namespaces = config.getNamespaces();
        config.addNamespace("test.a");

        assertEquals(Set.of("test.a"), namespaces);
        assertThrows(UnsupportedOperationException.class, () -> namespaces.add("test.b"));
    }

    @Test
    public void testInvalidSlowValue() {
        Properties props = new Properties();
        props.setProperty("filter.slow.ms", "fast");

        assertThrows(IllegalArgumentException.class, () -> new FilterConfig().loadFromProperties(props));
    }
}
