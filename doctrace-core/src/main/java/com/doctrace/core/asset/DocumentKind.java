package com.doctrace.core.asset;

/**
 * Known document kinds, selected by the identifier prefix a document declares.
 */
public enum DocumentKind {
    PERSONA("PER_"),
    REQUIREMENT("REQ_"),
    JOURNEY("JRN_"),
    COMPONENT("COMP_"),
    FLOW("FLOW_"),
    GENERIC("");

    private final String idPrefix;

    DocumentKind(String idPrefix) {
        this.idPrefix = idPrefix;
    }

    public String idPrefix() {
        return idPrefix;
    }

    /**
     * Resolves the kind of a document from its declared identifier.
     *
     * @param id declared identifier, may be null
     * @return matching kind, {@link #GENERIC} when no prefix matches
     */
    public static DocumentKind fromId(String id) {
        if (id == null) {
            return GENERIC;
        }
        for (DocumentKind kind : values()) {
            if (!kind.idPrefix.isEmpty() && id.startsWith(kind.idPrefix)) {
                return kind;
            }
        }
        return GENERIC;
    }
}
