package com.github.alvarosanchez.spr.manifest;

/**
 * Caller-supplied identity of a profile seen for the first time.
 *
 * @param name display name
 * @param slicer slicer identifier
 * @param type profile type
 */
public record NewProfileMetadata(String name, String slicer, String type) {

    /**
     * Guesses metadata from a path of the form {@code <configs>/<slicer>/<type>/.../<name>.json}.
     *
     * @param path repository-relative path
     * @param configsDirectory config tree directory below the root
     * @return guessed metadata; segments that cannot be derived are empty
     */
    public static NewProfileMetadata guess(String path, String configsDirectory) {
        String prefix = configsDirectory.endsWith("/") ? configsDirectory : configsDirectory + "/";
        String withinConfigs = path.startsWith(prefix) ? path.substring(prefix.length()) : path;
        String[] segments = withinConfigs.split("/");
        String fileName = segments[segments.length - 1];
        int extension = fileName.lastIndexOf('.');
        String name = extension > 0 ? fileName.substring(0, extension) : fileName;
        String slicer = segments.length > 1 ? segments[0] : "";
        String type = segments.length > 2 ? segments[1] : "";
        return new NewProfileMetadata(name, slicer, type);
    }

    boolean isComplete() {
        return !isBlank(name) && !isBlank(slicer) && !isBlank(type);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
