package com.doctrace.core.graph;

import java.util.List;
import java.util.Set;

/**
 * Project-wide inputs to graph construction that come from the rule set and configuration.
 *
 * @param hubCategories categories declared by rules with a hub
 * @param folderClaims folders claimed by folder-level rules
 * @param exemptIds additional identifiers exempt from orphan detection
 */
public record GraphSettings(List<HubCategory> hubCategories, List<FolderClaim> folderClaims, Set<String> exemptIds) {

    public GraphSettings {
        hubCategories = hubCategories == null ? List.of() : List.copyOf(hubCategories);
        folderClaims = folderClaims == null ? List.of() : List.copyOf(folderClaims);
        exemptIds = exemptIds == null ? Set.of() : Set.copyOf(exemptIds);
    }

    public static GraphSettings empty() {
        return new GraphSettings(List.of(), List.of(), Set.of());
    }
}
