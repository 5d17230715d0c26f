package com.github.alvarosanchez.spr.service;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.micronaut.core.annotation.Nullable;
import io.micronaut.serde.annotation.Serdeable;
import java.util.List;
import java.util.Map;

/**
 * Fully resolved config as returned to clients.
 *
 * @param resolvedConfig merged settings
 * @param inheritanceChain merged config names, root to leaf
 * @param instantiable whether the merged config may be instantiated
 * @param sourceMap dotted field path to contributing config, when requested
 * @param validationErrors structural problems, when validation was requested
 */
@Serdeable
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ResolvedView(
    @JsonProperty("resolved_config") Map<String, Object> resolvedConfig,
    @JsonProperty("inheritance_chain") List<String> inheritanceChain,
    boolean instantiable,
    @Nullable @JsonProperty("source_map") Map<String, String> sourceMap,
    @Nullable @JsonProperty("validation_errors") List<String> validationErrors
) {
}
