package com.mongodb.log.analytics.record;

import java.util.List;
import java.util.Optional;

/**
 * One timestamp grammar. Implementations are tried in order at each candidate offset,
 * so supporting a new server format means adding a matcher.
 */
public interface TimestampMatcher {

    Optional<TimestampMatch> tryMatch(List<String> tokens, int offset, ParserConfig config);
}
