package com.github.alvarosanchez.spr.service;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.micronaut.core.annotation.Nullable;
import io.micronaut.serde.annotation.Serdeable;
import java.util.List;
import java.util.Map;

/**
 * Inheritance dependencies of a config.
 *
 * @param target requested config
 * @param dependencies configs the target inherits from, root first
 * @param resolutionOrder names in merge order, root to target
 * @param dependencyTree nested view starting at the target, when requested
 */
@Serdeable
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DependencyReport(
    ConfigNode target,
    List<ConfigNode> dependencies,
    @JsonProperty("resolution_order") List<String> resolutionOrder,
    @Nullable @JsonProperty("dependency_tree") TreeNode dependencyTree
) {

    public DependencyReport {
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        resolutionOrder = resolutionOrder == null ? List.of() : List.copyOf(resolutionOrder);
    }

    /**
     * One config of a chain.
     *
     * @param name config name
     * @param path repository-relative location
     * @param inherits declared parent name
     * @param from declared parent scope
     * @param checksum file checksum, with metadata only
     * @param metadata the document's metadata section, with metadata only
     */
    @Serdeable
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ConfigNode(
        String name,
        String path,
        @Nullable String inherits,
        @Nullable String from,
        @Nullable String checksum,
        @Nullable Map<String, Object> metadata
    ) {
    }

    /**
     * Node of the dependency tree. Children are the configs a node inherits from.
     *
     * @param name config name
     * @param path repository-relative location
     * @param children parents of this node
     */
    @Serdeable
    public record TreeNode(String name, String path, List<TreeNode> children) {

        public TreeNode {
            children = children == null ? List.of() : List.copyOf(children);
        }
    }
}
