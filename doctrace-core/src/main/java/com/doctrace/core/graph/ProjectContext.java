package com.doctrace.core.graph;

import com.doctrace.core.analyzer.DiagramAnalysis;
import com.doctrace.core.analyzer.NotationType;
import com.doctrace.core.asset.Asset;
import com.doctrace.core.asset.AssetCollection;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The whole project as seen by rules: assets, their analyses and the traceability graph.
 *
 * <p>Built once per pass by {@link GraphBuilder}. Every collection is read-only; only
 * {@link NodeMetadata} may be written while rules run.
 */
public final class ProjectContext {

    /** Synthetic root of the navigation graph. */
    public static final String ROOT_ID = "ROOT";

    private final AssetCollection collection;
    private final Map<String, DiagramAnalysis> analyses;
    private final Set<String> referencedIds;
    private final Map<String, GraphNode> nodeMap;
    private final Map<String, String> idToFileMap;
    private final Map<String, List<String>> duplicateDeclarations;
    private final Set<String> exemptIds;
    private final GraphSettings settings;

    ProjectContext(
        AssetCollection collection,
        Map<String, DiagramAnalysis> analyses,
        Set<String> referencedIds,
        Map<String, GraphNode> nodeMap,
        Map<String, String> idToFileMap,
        Map<String, List<String>> duplicateDeclarations,
        Set<String> exemptIds,
        GraphSettings settings
    ) {
        this.collection = collection;
        this.analyses = Collections.unmodifiableMap(analyses);
        this.referencedIds = Collections.unmodifiableSet(referencedIds);
        this.nodeMap = Collections.unmodifiableMap(nodeMap);
        this.idToFileMap = Collections.unmodifiableMap(idToFileMap);
        this.duplicateDeclarations = Collections.unmodifiableMap(duplicateDeclarations);
        this.exemptIds = Collections.unmodifiableSet(exemptIds);
        this.settings = settings;
    }

    public List<Asset> assets() {
        return collection.assets();
    }

    /**
     * Every directory below the docs root, relative and sorted.
     *
     * @return directories
     */
    public List<String> directories() {
        return collection.directories();
    }

    /**
     * Files that are neither diagrams nor markdown.
     *
     * @return relative paths
     */
    public List<String> otherFiles() {
        return collection.otherFiles();
    }

    /**
     * Every identifier mentioned as an uplink, downlink, requirement or diagram endpoint.
     * Identifiers may be referenced without being declared.
     *
     * @return referenced identifiers
     */
    public Set<String> referencedIds() {
        return referencedIds;
    }

    public Map<String, GraphNode> nodeMap() {
        return nodeMap;
    }

    /**
     * Declared identifier to the first file that declared it.
     *
     * @return declarations
     */
    public Map<String, String> idToFileMap() {
        return idToFileMap;
    }

    /**
     * Identifiers declared by more than one file, mapped to every declaring file in the order seen.
     *
     * @return duplicate declarations
     */
    public Map<String, List<String>> duplicateDeclarations() {
        return duplicateDeclarations;
    }

    public Set<String> exemptIds() {
        return exemptIds;
    }

    public List<HubCategory> hubCategories() {
        return settings.hubCategories();
    }

    public List<FolderClaim> folderClaims() {
        return settings.folderClaims();
    }

    public Optional<GraphNode> node(String id) {
        return Optional.ofNullable(nodeMap.get(id));
    }

    public boolean isDeclared(String id) {
        return idToFileMap.containsKey(id);
    }

    public boolean isExempt(String id) {
        return exemptIds.contains(id);
    }

    /**
     * Returns the analysis of an asset, or an empty one for assets that were not analyzed.
     *
     * @param asset asset
     * @return analysis
     */
    public DiagramAnalysis analysisOf(Asset asset) {
        DiagramAnalysis analysis = analyses.get(asset.relativePath());
        return analysis != null ? analysis : DiagramAnalysis.empty(NotationType.UNKNOWN);
    }

    /**
     * Returns the most specific folder claim covering a folder.
     *
     * @param folder relative folder
     * @return claim with the longest matching path
     */
    public Optional<FolderClaim> claimFor(String folder) {
        FolderClaim best = null;
        for (FolderClaim claim : settings.folderClaims()) {
            if (claim.path().isEmpty()) {
                continue;
            }
            boolean covers = folder.equals(claim.path()) || folder.startsWith(claim.path() + "/");
            if (covers && (best == null || claim.path().length() > best.path().length())) {
                best = claim;
            }
        }
        return Optional.ofNullable(best);
    }
}
