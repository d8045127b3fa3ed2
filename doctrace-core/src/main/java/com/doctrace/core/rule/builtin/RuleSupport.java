package com.doctrace.core.rule.builtin;

import com.doctrace.core.analyzer.NotationType;
import com.doctrace.core.asset.Asset;
import com.doctrace.core.asset.DocsLayout;
import com.doctrace.core.asset.FrontMatter;
import com.doctrace.core.graph.GraphNode;
import com.doctrace.core.graph.NodeMetadata;
import com.doctrace.core.graph.ProjectContext;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Helpers shared by built-in rules.
 */
final class RuleSupport {

    static final String PERSONA = "PER_";
    static final String REQUIREMENT = "REQ_";
    static final String JOURNEY = "JRN_";
    static final String FLOW = "FLOW_";
    static final String FUNCTIONAL = "functional";

    private RuleSupport() {
        // Utility class
    }

    /**
     * First line of a diagram after its front matter and comment lines, trimmed.
     *
     * @param asset asset
     * @return opening line or an empty string
     */
    static String openingLine(Asset asset) {
        String body = NotationType.stripPreamble(asset.rawContent());
        int newline = body.indexOf('\n');
        return (newline < 0 ? body : body.substring(0, newline)).trim();
    }

    /**
     * Whether the opening line starts with one of the keywords as a whole word. A keyword may
     * be followed by whitespace or punctuation ({@code graph TD}, {@code stateDiagram-v2}) but not
     * by further identifier characters ({@code graphs}).
     */
    static boolean opensWithAny(Asset asset, Collection<String> keywords) {
        String line = openingLine(asset);
        return keywords.stream().anyMatch(keyword -> opensWith(line, keyword));
    }

    private static boolean opensWith(String line, String keyword) {
        if (!line.startsWith(keyword)) {
            return false;
        }
        if (line.length() == keyword.length()) {
            return true;
        }
        char next = line.charAt(keyword.length());
        return !Character.isLetterOrDigit(next) && next != '_';
    }

    static String quotedList(Collection<String> values) {
        List<String> quoted = new ArrayList<>();
        values.forEach(value -> quoted.add("\"" + value + "\""));
        return String.join(" or ", quoted);
    }

    static List<String> missingFields(FrontMatter frontMatter, List<String> fields) {
        List<String> errors = new ArrayList<>();
        for (String field : fields) {
            if (frontMatter.value(field).isEmpty()) {
                errors.add("Missing required frontmatter: \"" + field + "\"");
            }
        }
        return errors;
    }

    static boolean startsWithAny(String value, Collection<String> prefixes) {
        return prefixes.stream().anyMatch(value::startsWith);
    }

    /**
     * A requirement counts as functional when classified so, or when it is a file root
     * without any classification.
     *
     * @param node requirement node, may be null
     * @return true if functional
     */
    static boolean isFunctional(GraphNode node) {
        if (node == null) {
            return false;
        }
        NodeMetadata metadata = node.metadata();
        return metadata.getString(NodeMetadata.CLASSIFICATION)
            .map(classification -> classification.toLowerCase(Locale.ROOT).equals(FUNCTIONAL))
            .orElseGet(() -> metadata.isTrue(NodeMetadata.IS_FILE_ROOT));
    }

    static String capitalize(String value) {
        return value.isEmpty() ? value : Character.toUpperCase(value.charAt(0)) + value.substring(1);
    }

    /**
     * Children of a node with the given prefix: its own downlinks plus every node that lists
     * it as an uplink.
     *
     * @param context project context
     * @param node parent node
     * @param prefix child id prefix
     * @return child ids in graph order
     */
    static Set<String> linkedChildren(ProjectContext context, GraphNode node, String prefix) {
        Set<String> children = new LinkedHashSet<>();
        node.downlinks().stream().filter(id -> id.startsWith(prefix)).forEach(children::add);
        context.nodeMap().values().stream()
            .filter(candidate -> candidate.id().startsWith(prefix))
            .filter(candidate -> candidate.uplinks().contains(node.id()))
            .forEach(candidate -> children.add(candidate.id()));
        return children;
    }

    /**
     * Returns true if the id is declared by a footnote. Footnote ids annotate another document and
     * take no part in persona, requirement and journey chains.
     *
     * @param context project context
     * @param id declared identifier
     * @return true if the first declaring file lives in a footnotes folder
     */
    static boolean isFootnoteId(ProjectContext context, String id) {
        String file = context.idToFileMap().get(id);
        return file != null && DocsLayout.isInFootnotes(file);
    }
}
