package com.doctrace.core.graph;

import java.util.Objects;

/**
 * A folder claimed by a folder-level rule.
 *
 * @param ruleId claiming rule
 * @param path claimed folder relative to the docs root
 * @param idPrefix identifier prefix required inside the folder, may be null
 */
public record FolderClaim(String ruleId, String path, String idPrefix) {

    public FolderClaim {
        Objects.requireNonNull(ruleId, "ruleId must not be null");
        Objects.requireNonNull(path, "path must not be null");
    }

    public boolean hasIdPrefix() {
        return idPrefix != null && !idPrefix.isBlank();
    }
}
