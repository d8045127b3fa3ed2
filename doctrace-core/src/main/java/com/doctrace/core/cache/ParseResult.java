package com.doctrace.core.cache;

import com.doctrace.core.analyzer.DiagramAnalysis;

import java.util.Objects;

/**
 * An analysis together with whether it was served from the cache.
 *
 * @param analysis diagram analysis
 * @param fromCache true on a cache hit
 */
public record ParseResult(DiagramAnalysis analysis, boolean fromCache) {

    public ParseResult {
        Objects.requireNonNull(analysis, "analysis must not be null");
    }
}
