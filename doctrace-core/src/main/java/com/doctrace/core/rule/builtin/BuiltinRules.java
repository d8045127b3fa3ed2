package com.doctrace.core.rule.builtin;

import com.doctrace.core.rule.RuleCatalog;

/**
 * Registry of the rule implementations shipped with DocTrace.
 *
 * <p>Rule definitions select one of these by {@code implementation} (or by their own id when it
 * matches). A definition with a {@code checks} block always uses {@link DeclarativeRule}.
 */
public final class BuiltinRules {

    public static final String NOTATION = "notation";
    public static final String REQUIRED_FIELDS = "required-fields";
    public static final String FILENAME_ID = "filename-id";
    public static final String ID_PREFIX = "id-prefix";
    public static final String DUPLICATE_ID = "duplicate-id";
    public static final String RECIPROCITY = "reciprocity";
    public static final String ORPHAN = "orphan";
    public static final String DANGLING_REFERENCE = "dangling-reference";
    public static final String PERSONA_GATE = "persona-gate";
    public static final String PERSONA_DIVERSITY = "persona-diversity";
    public static final String PERSONA_REQUIREMENT_TRACE = "persona-requirement-trace";
    public static final String JOURNEY_SYNTAX = "journey-syntax";
    public static final String JOURNEY_INTEGRITY = "journey-integrity";
    public static final String FLOW_REQUIREMENT_TRACE = "flow-requirement-trace";
    public static final String FOOTNOTES_POLICY = "footnotes-policy";
    public static final String FOLDER_REGISTRY = "folder-registry";
    public static final String FILE_LAYOUT = "file-layout";
    public static final String FRONT_MATTER_SYNTAX = "front-matter-syntax";

    private BuiltinRules() {
        // Utility class
    }

    /**
     * Creates a catalog with every built-in implementation registered.
     *
     * @return catalog
     */
    public static RuleCatalog catalog() {
        return new RuleCatalog()
            .register(NOTATION, NotationRule::new)
            .register(REQUIRED_FIELDS, RequiredFieldsRule::new)
            .register(RuleCatalog.DECLARATIVE, DeclarativeRule::new)
            .register(FILENAME_ID, FilenameIdRule::new)
            .register(ID_PREFIX, IdPrefixRule::new)
            .register(DUPLICATE_ID, DuplicateIdRule::new)
            .register(RECIPROCITY, ReciprocityRule::new)
            .register(ORPHAN, OrphanRule::new)
            .register(DANGLING_REFERENCE, DanglingReferenceRule::new)
            .register(PERSONA_GATE, PersonaGateRule::new)
            .register(PERSONA_DIVERSITY, PersonaDiversityRule::new)
            .register(PERSONA_REQUIREMENT_TRACE, PersonaRequirementTraceRule::new)
            .register(JOURNEY_SYNTAX, JourneySyntaxRule::new)
            .register(JOURNEY_INTEGRITY, JourneyIntegrityRule::new)
            .register(FLOW_REQUIREMENT_TRACE, FlowRequirementTraceRule::new)
            .register(FOOTNOTES_POLICY, FootnotesPolicyRule::new)
            .register(FOLDER_REGISTRY, FolderRegistryRule::new)
            .register(FILE_LAYOUT, FileLayoutRule::new)
            .register(FRONT_MATTER_SYNTAX, FrontMatterSyntaxRule::new);
    }
}
