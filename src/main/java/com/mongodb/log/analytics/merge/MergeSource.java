package com.mongodb.log.analytics.merge;

import java.util.Iterator;

import com.mongodb.log.analytics.record.ParserConfig;

/**
 * One input of a merge: a name (used by the {@code filename} label style), its lines in
 * file order and the parser settings for that stream.
 */
public final class MergeSource {

    private final String name;
    private final Iterator<String> lines;
    private final ParserConfig parserConfig;

    public MergeSource(String name, Iterator<String> lines) {
        this(name, lines, ParserConfig.defaults());
    }

    public MergeSource(String name, Iterator<String> lines, ParserConfig parserConfig) {
        this.name = name;
        this.lines = lines;
        this.parserConfig = parserConfig;
    }

    public String getName() {
        return name;
    }

    public Iterator<String> getLines() {
        return lines;
    }

    public ParserConfig getParserConfig() {
        return parserConfig;
    }
}
