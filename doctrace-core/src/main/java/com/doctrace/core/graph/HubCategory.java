package com.doctrace.core.graph;

import java.util.Objects;

/**
 * A navigation category backed by a docs folder. Files placed in the folder are owned by the
 * category node.
 *
 * @param id category node id, e.g. {@code GRP_Personas}
 * @param title display title
 * @param path folder relative to the docs root
 * @param idPrefix identifier prefix governing the folder, may be null
 */
public record HubCategory(String id, String title, String path, String idPrefix) {

    public HubCategory {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(path, "path must not be null");
    }
}
