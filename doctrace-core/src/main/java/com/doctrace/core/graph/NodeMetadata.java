package com.doctrace.core.graph;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Facts accumulated about a node during graph construction and rule evaluation.
 *
 * <p>Metadata is additive: a key, once set, keeps its first value. This is the only part of the
 * graph that rules may write to.
 *
 * <table>
 *   <caption>Known keys</caption>
 *   <tr><th>Key</th><th>Writer</th><th>Readers</th></tr>
 *   <tr><td>{@code classification}</td><td>graph builder</td><td>journey-integrity, flow-requirement-trace</td></tr>
 *   <tr><td>{@code isFileRoot}</td><td>graph builder</td><td>journey-integrity</td></tr>
 *   <tr><td>{@code personaType}</td><td>persona-gate</td><td>persona-diversity, journey-integrity</td></tr>
 * </table>
 */
public final class NodeMetadata {

    public static final String CLASSIFICATION = "classification";
    public static final String IS_FILE_ROOT = "isFileRoot";
    public static final String PERSONA_TYPE = "personaType";

    private final Map<String, Object> values = new ConcurrentHashMap<>();

    /**
     * Records a fact unless the key is already set.
     *
     * @param key metadata key
     * @param value value, ignored when null
     * @return true if the value was recorded
     */
    public boolean put(String key, Object value) {
        if (value == null) {
            return false;
        }
        return values.putIfAbsent(key, value) == null;
    }

    public Optional<Object> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    public Optional<String> getString(String key) {
        return get(key).map(Object::toString);
    }

    public boolean isTrue(String key) {
        return get(key).map(value -> Boolean.TRUE.equals(value) || "true".equals(value)).orElse(false);
    }

    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(values);
    }
}
