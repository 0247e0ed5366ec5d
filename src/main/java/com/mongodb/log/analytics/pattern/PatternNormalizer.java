package com.mongodb.log.analytics.pattern;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.core.util.MinimalPrettyPrinter;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Reduces a query fragment to its shape: every value becomes {@code 1}, range and
 * membership operators collapse, and keys are sorted. Two queries that differ only in
 * literal values or key order produce the same pattern string, e.g.
 * {@code { b: 'x', a: { $gt: 5 } }} becomes {@code {"a": 1, "b": 1}}.
 */
public class PatternNormalizer {

    private static final Logger logger = LoggerFactory.getLogger(PatternNormalizer.class);

    private static final Set<String> COLLAPSING_OPERATORS = Set.of("$in", "$gt", "$gte", "$lt", "$lte", "$exists");
    private static final Set<String> WRAPPER_KEYS = Set.of("query", "$query");
    private static final String NIN = "$nin";

    private static final Pattern BARE_KEY = Pattern.compile("([{,])\\s*([^,{\\s'\"]+)\\s*:");

    private static final Pattern[] SHELL_LITERALS = {
            Pattern.compile("BinData\\(.+?\\)"),
            Pattern.compile("ISODate\\(.*?\\)"),
            Pattern.compile("(new )?\\bDate\\(.*?\\)"),
            Pattern.compile("Timestamp\\(.+?\\)"),
            Pattern.compile("ObjectId\\(.*?\\)"),
            Pattern.compile("DBRef\\(.+?\\)"),
            Pattern.compile("Number(Long|Int|Decimal)\\(.+?\\)"),
            Pattern.compile("\\bundefined\\b"),
            Pattern.compile("\\bMinKey\\b"),
            Pattern.compile("\\bMaxKey\\b")
    };
    private static final Pattern REGEX_LITERAL = Pattern.compile("([:,\\[]\\s*)/.+?/\\w*");
    private static final Pattern BARE_VALUE = Pattern.compile("([:,\\[])\\s*([^{}\\[\\]\"]+?)\\s*([,}\\]])");

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final ObjectMapper mapper;

    public PatternNormalizer() {
        this.mapper = JsonMapper.builder()
                .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
                .enable(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS)
                .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
                .enable(JsonReadFeature.ALLOW_UNQUOTED_FIELD_NAMES)
                .enable(JsonReadFeature.ALLOW_LEADING_PLUS_SIGN_FOR_NUMBERS)
                .build();
    }

    /**
     * @return the canonical pattern, or null when the fragment cannot be parsed
     */
    public String normalize(String fragment) {
        if (fragment == null || fragment.isBlank()) {
            return null;
        }
        String json = toJson(fragment);
        try {
            JsonNode tree = mapper.readTree(json);
            if (tree == null || !tree.isContainerNode()) {
                logger.debug("Fragment is not a document: {}", fragment);
                return null;
            }
            return write(collapse(tree));
        } catch (IOException e) {
            logger.debug("Unable to parse query fragment '{}': {}", fragment, e.getMessage());
            return null;
        }
    }

    /**
     * Rewrites shell notation (unquoted keys, constructors, regex literals) into JSON
     * that Jackson accepts.
     */
    String toJson(String fragment) {
        String s = BARE_KEY.matcher(fragment).replaceAll(" $1 \"$2\" : ");
        for (Pattern literal : SHELL_LITERALS) {
            s = literal.matcher(s).replaceAll("1");
        }
        s = REGEX_LITERAL.matcher(s).replaceAll("$1 1");
        s = BARE_VALUE.matcher(s).replaceAll("$1 1 $3");
        return s;
    }

    private JsonNode collapse(JsonNode node) {
        if (node.isObject()) {
            return collapseObject(node);
        }
        if (node.isArray()) {
            return collapseArray(node);
        }
        return NODES.numberNode(1);
    }

    private JsonNode collapseObject(JsonNode node) {
        Map<String, JsonNode> sorted = new TreeMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String key = field.getKey();
            JsonNode value = field.getValue();
            if (COLLAPSING_OPERATORS.contains(key)) {
                return NODES.numberNode(1);
            }
            if (WRAPPER_KEYS.contains(key) && value.isObject()) {
                return collapse(value);
            }
            sorted.put(key, NIN.equals(key) ? NODES.numberNode(1) : collapse(value));
        }
        ObjectNode result = NODES.objectNode();
        sorted.forEach(result::set);
        return result;
    }

    private JsonNode collapseArray(JsonNode node) {
        List<JsonNode> items = new ArrayList<>();
        boolean containsObject = false;
        for (JsonNode item : node) {
            JsonNode collapsed = collapse(item);
            containsObject |= collapsed.isObject();
            items.add(collapsed);
        }
        if (!containsObject) {
            items.sort((a, b) -> a.toString().compareTo(b.toString()));
        }
        ArrayNode result = NODES.arrayNode();
        result.addAll(items);
        return result;
    }

    private String write(JsonNode node) throws JsonProcessingException {
        return mapper.writer(new PatternPrettyPrinter()).writeValueAsString(node);
    }

    /**
     * Single-line output with {@code ", "} and {@code ": "} separators.
     */
    static class PatternPrettyPrinter extends MinimalPrettyPrinter {

        private static final long serialVersionUID = 1L;

        @Override
        public void writeObjectFieldValueSeparator(JsonGenerator g) throws IOException {
            g.writeRaw(": ");
        }

        @Override
        public void writeObjectEntrySeparator(JsonGenerator g) throws IOException {
            g.writeRaw(", ");
        }

        @Override
        public void writeArrayValueSeparator(JsonGenerator g) throws IOException {
            g.writeRaw(", ");
        }
    }
}
