package com.plm.common.config;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-plugin configuration entry of a project.
 *
 * <p>
 * The {@code config} payload is owned by the plugin; the manager stores and
 * persists it without interpreting its shape. Fields this version does not
 * know about are kept in {@code unknownFields} and written back on save.
 * </p>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PluginConfig {

    private String name;

    private String version;

    @Builder.Default
    private boolean enabled = true;

    /** Opaque structured payload (maps, lists and scalars). */
    @Builder.Default
    private Map<String, Object> config = new LinkedHashMap<>();

    @Builder.Default
    @Setter(AccessLevel.NONE)
    private Map<String, Object> unknownFields = new LinkedHashMap<>();

    public static PluginConfig of(String name, String version) {
        return PluginConfig.builder().name(name).version(version).build();
    }

    // =========================================================================
    // Payload helpers
    // =========================================================================

    public Object getSetting(String key) {
        return config != null ? config.get(key) : null;
    }

    public void setSetting(String key, Object value) {
        if (config == null) {
            config = new LinkedHashMap<>();
        }
        config.put(key, value);
    }

    public Object removeSetting(String key) {
        return config != null ? config.remove(key) : null;
    }

    @JsonAnyGetter
    public Map<String, Object> getUnknownFields() {
        return unknownFields;
    }

    @JsonAnySetter
    public void putUnknownField(String key, Object value) {
        if (unknownFields == null) {
            unknownFields = new LinkedHashMap<>();
        }
        unknownFields.put(key, value);
    }
}
