package com.doctrace.core.analyzer.impl;

import com.doctrace.core.analyzer.DiagramAnalysis;
import com.doctrace.core.analyzer.NotationType;
import com.doctrace.core.analyzer.base.AbstractRegexAnalyzer;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Analyzer for entity-relationship diagrams.
 *
 * <p>Entities come from block declarations ({@code CUSTOMER {}}), bare entity lines and
 * relationship endpoints. Attribute lines inside an entity block are ignored.
 */
public class EntityRelationshipAnalyzer extends AbstractRegexAnalyzer {

    private static final Pattern RELATIONSHIP = Pattern.compile(
        "^([\\w-]+)(?:\\[[^]]*])?\\s*([|}{o]{1,2}(?:--|\\.\\.)[|}{o]{1,2})\\s*([\\w-]+)(?:\\[[^]]*])?\\s*(?::(.*))?$");
    private static final Pattern ENTITY_BLOCK = Pattern.compile("^([\\w-]+)(?:\\[[^]]*])?\\s*\\{(.*)$");
    private static final Pattern ENTITY = Pattern.compile("^([\\w-]+)(?:\\[[^]]*])?$");

    private static final List<String> IGNORED = List.of("title", "direction", "classDef", "class", "style");

    @Override
    public String getId() {
        return "er-analyzer";
    }

    @Override
    public String getDisplayName() {
        return "Entity Relationship Analyzer";
    }

    @Override
    public NotationType getNotationType() {
        return NotationType.ENTITY_RELATIONSHIP;
    }

    @Override
    protected void extract(List<String> lines, DiagramAnalysis.Builder builder) {
        boolean inBlock = false;
        for (String line : lines) {
            if (inBlock) {
                if (line.contains("}")) {
                    inBlock = false;
                }
                continue;
            }
            if (startsWithKeyword(line, IGNORED)) {
                continue;
            }
            Matcher relationship = matchLine(RELATIONSHIP, line);
            if (relationship != null) {
                builder.link(relationship.group(1), relationship.group(3), cleanQuotes(extractGroup(relationship, 4)));
                continue;
            }
            Matcher block = matchLine(ENTITY_BLOCK, line);
            if (block != null) {
                builder.node(block.group(1));
                inBlock = !block.group(2).contains("}");
                continue;
            }
            Matcher entity = matchLine(ENTITY, line);
            if (entity != null) {
                builder.node(entity.group(1));
            }
        }
    }
}
