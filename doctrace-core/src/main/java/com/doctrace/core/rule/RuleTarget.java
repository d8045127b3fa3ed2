package com.doctrace.core.rule;

import com.doctrace.core.asset.Asset;
import com.doctrace.core.util.PathPatterns;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Selects the assets a rule applies to.
 *
 * <p>An asset matches when its declared id starts with {@code idPrefix} or its relative path
 * matches the glob {@code pathPattern}. A target with neither set matches every asset.
 *
 * @param idPrefix identifier prefix, e.g. {@code PER_}
 * @param pathPattern glob over relative paths, e.g. {@code personas/*}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RuleTarget(
    @JsonProperty("idPrefix") String idPrefix,
    @JsonProperty("pathPattern") String pathPattern
) {
    public static RuleTarget any() {
        return new RuleTarget(null, null);
    }

    @JsonIgnore
    public boolean hasIdPrefix() {
        return idPrefix != null && !idPrefix.isBlank();
    }

    @JsonIgnore
    public boolean hasPathPattern() {
        return pathPattern != null && !pathPattern.isBlank();
    }

    /**
     * Tests whether an asset is selected by this target.
     *
     * @param asset asset
     * @return true if the asset's id or path matches
     */
    public boolean matches(Asset asset) {
        if (!hasIdPrefix() && !hasPathPattern()) {
            return true;
        }
        String id = asset.id();
        if (hasIdPrefix() && id != null && id.startsWith(idPrefix)) {
            return true;
        }
        return hasPathPattern() && PathPatterns.matches(pathPattern, asset.relativePath());
    }
}
