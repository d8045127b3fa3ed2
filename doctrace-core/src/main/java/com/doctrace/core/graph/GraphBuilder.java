package com.doctrace.core.graph;

import com.doctrace.core.analyzer.DiagramAnalysis;
import com.doctrace.core.asset.Asset;
import com.doctrace.core.asset.AssetCollection;
import com.doctrace.core.asset.DocsLayout;
import com.doctrace.core.asset.DocumentKind;
import com.doctrace.core.asset.FrontMatter;
import com.doctrace.core.asset.FrontMatterEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Folds front matter and diagram analyses into one {@link ProjectContext}.
 *
 * <p>Edges come from four sources:
 * <ul>
 *   <li>explicit front matter ({@code uplink}, {@code downlinks}, {@code requirements}),
 *       recorded only on the declaring node so asymmetric links stay visible</li>
 *   <li>file ownership: an entity without explicit uplinks becomes a child of its file's id</li>
 *   <li>category ownership: a file id in a hub folder without explicit uplinks becomes a child
 *       of the category</li>
 *   <li>diagram ownership: a prefixed id ({@code COMP_Auth}) drawn in a file's diagram becomes a
 *       child of the file's id, except a persona drawn in a journey or requirement, which becomes
 *       its parent. An id the front matter already links is left to the explicit edge.</li>
 * </ul>
 * Ownership edges are recorded in both directions.
 *
 * <p>Every explicit target, owned child and diagram mention is a referenced id. The reverse half
 * of an ownership edge never marks the declaring file's own id as referenced. The builder validates
 * nothing; duplicate declarations are kept for the duplicate-id rule.
 */
public class GraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(GraphBuilder.class);

    static final String FUNCTIONAL = "Functional";

    private static final Pattern PREFIXED_ID = Pattern.compile("[A-Z]{2,}_.*");

    private final GraphSettings settings;

    public GraphBuilder(GraphSettings settings) {
        this.settings = settings == null ? GraphSettings.empty() : settings;
    }

    /**
     * Builds the project context.
     *
     * @param collection collected assets
     * @param analyses analyses keyed by asset relative path
     * @return context
     */
    public ProjectContext build(AssetCollection collection, Map<String, DiagramAnalysis> analyses) {
        Map<String, GraphNode> nodeMap = new LinkedHashMap<>();
        Map<String, String> idToFileMap = new LinkedHashMap<>();
        Map<String, List<String>> duplicates = new LinkedHashMap<>();
        Set<String> referenced = new LinkedHashSet<>();
        Set<String> exempt = new LinkedHashSet<>();

        referenced.add(ProjectContext.ROOT_ID);
        exempt.add(ProjectContext.ROOT_ID);
        for (HubCategory category : settings.hubCategories()) {
            referenced.add(category.id());
            exempt.add(category.id());
            nodeMap.computeIfAbsent(category.id(), GraphNode::new);
        }
        exempt.addAll(settings.exemptIds());

        for (Asset asset : collection.assets()) {
            for (String id : asset.frontMatter().declaredIds()) {
                declare(id, asset.relativePath(), idToFileMap, duplicates);
                nodeMap.computeIfAbsent(id, GraphNode::new);
            }
        }

        for (Asset asset : collection.assets()) {
            FrontMatter frontMatter = asset.frontMatter();
            String rootId = frontMatter.hasId() ? frontMatter.id() : null;

            if (rootId != null) {
                GraphNode root = nodeMap.get(rootId);
                explicitEdges(root, frontMatter.uplinks(), frontMatter.downlinks(), frontMatter.requirements(), referenced);
                HubCategory category = categoryFor(asset.relativePath());
                if (category != null) {
                    referenced.add(rootId);
                    if (frontMatter.uplinks().isEmpty() && frontMatter.requirements().isEmpty()) {
                        own(nodeMap.get(category.id()), root, referenced);
                    }
                }
            }

            for (FrontMatterEntity entity : frontMatter.entities()) {
                GraphNode node = nodeMap.get(entity.id());
                explicitEdges(node, entity.uplinks(), entity.downlinks(), entity.requirements(), referenced);
                boolean explicitParent = !entity.uplinks().isEmpty() || !entity.requirements().isEmpty();
                if (rootId != null && !entity.id().equals(rootId) && !explicitParent) {
                    own(nodeMap.get(rootId), node, referenced);
                }
            }

            DiagramAnalysis analysis = analyses.get(asset.relativePath());
            if (analysis != null) {
                diagramEdges(frontMatter, analysis, nodeMap, referenced);
            }
        }

        for (Asset asset : collection.assets()) {
            recordMetadata(asset.frontMatter(), nodeMap);
        }

        if (!duplicates.isEmpty()) {
            log.debug("Found {} identifiers declared by more than one file", duplicates.size());
        }
        log.info("Built graph with {} nodes, {} declared ids, {} referenced ids",
            nodeMap.size(), idToFileMap.size(), referenced.size());

        return new ProjectContext(collection, new LinkedHashMap<>(analyses), referenced, nodeMap, idToFileMap,
            duplicates, exempt, settings);
    }

    private static void declare(String id, String file, Map<String, String> idToFileMap,
                                Map<String, List<String>> duplicates) {
        String existing = idToFileMap.putIfAbsent(id, file);
        if (existing == null || existing.equals(file)) {
            return;
        }
        List<String> files = duplicates.computeIfAbsent(id, key -> new ArrayList<>(List.of(existing)));
        if (!files.contains(file)) {
            files.add(file);
        }
    }

    private static void explicitEdges(GraphNode node, List<String> uplinks, List<String> downlinks,
                                      List<String> requirements, Set<String> referenced) {
        for (String uplink : uplinks) {
            node.addUplink(uplink);
            referenced.add(uplink);
        }
        for (String requirement : requirements) {
            node.addUplink(requirement);
            referenced.add(requirement);
        }
        for (String downlink : downlinks) {
            node.addDownlink(downlink);
            referenced.add(downlink);
        }
    }

    private static void diagramEdges(FrontMatter frontMatter, DiagramAnalysis analysis,
                                     Map<String, GraphNode> nodeMap, Set<String> referenced) {
        String rootId = frontMatter.hasId() ? frontMatter.id() : null;
        boolean personaChild = frontMatter.kind() == DocumentKind.JOURNEY
            || frontMatter.kind() == DocumentKind.REQUIREMENT;
        for (String mentioned : analysis.mentionedIds()) {
            if (mentioned.equals(rootId)) {
                continue;
            }
            referenced.add(mentioned);
            if (rootId == null || !PREFIXED_ID.matcher(mentioned).matches()
                || frontMatter.uplinks().contains(mentioned)
                || frontMatter.requirements().contains(mentioned)
                || frontMatter.downlinks().contains(mentioned)) {
                continue;
            }
            GraphNode root = nodeMap.get(rootId);
            GraphNode other = nodeMap.computeIfAbsent(mentioned, GraphNode::new);
            if (personaChild && mentioned.startsWith(DocumentKind.PERSONA.idPrefix())) {
                link(other, root);
            } else {
                link(root, other);
            }
        }
    }

    private static void own(GraphNode parent, GraphNode child, Set<String> referenced) {
        link(parent, child);
        referenced.add(child.id());
    }

    private static void link(GraphNode parent, GraphNode child) {
        parent.addDownlink(child.id());
        child.addUplink(parent.id());
    }

    private static void recordMetadata(FrontMatter frontMatter, Map<String, GraphNode> nodeMap) {
        if (frontMatter.hasId()) {
            GraphNode root = nodeMap.get(frontMatter.id());
            NodeMetadata metadata = root.metadata();
            metadata.put(NodeMetadata.CLASSIFICATION, frontMatter.classification());
            metadata.put(NodeMetadata.IS_FILE_ROOT, Boolean.TRUE);
            boolean requirement = frontMatter.kind() == DocumentKind.REQUIREMENT;
            if (requirement && !root.hasUplinkWithPrefix(DocumentKind.REQUIREMENT.idPrefix())) {
                metadata.put(NodeMetadata.CLASSIFICATION, FUNCTIONAL);
            }
        }
        for (FrontMatterEntity entity : frontMatter.entities()) {
            nodeMap.get(entity.id()).metadata().put(NodeMetadata.CLASSIFICATION, entity.classification());
        }
    }

    private HubCategory categoryFor(String relativePath) {
        if (DocsLayout.isInFootnotes(relativePath)) {
            return null;
        }
        HubCategory best = null;
        for (HubCategory category : settings.hubCategories()) {
            if (category.path().isEmpty() || !relativePath.startsWith(category.path() + "/")) {
                continue;
            }
            if (best == null || category.path().length() > best.path().length()) {
                best = category;
            }
        }
        return best;
    }
}
