package com.github.alvarosanchez.spr.resolve;

/**
 * Composite lookup key of a config: the name and scope it is referenced by, within a slicer and profile type.
 *
 * @param slicer slicer identifier, for example {@code orcaslicer}
 * @param type profile type directory, for example {@code filament}
 * @param scope source scope
 * @param name config name
 */
public record ConfigKey(String slicer, String type, Scope scope, String name) {

    @Override
    public String toString() {
        return scope.wireName() + ":" + slicer + "/" + type + "/" + name;
    }
}
