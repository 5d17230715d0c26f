package com.github.alvarosanchez.spr;

import io.micronaut.context.annotation.ConfigurationProperties;

/**
 * Application settings bound from the {@code spr.*} properties.
 */
@ConfigurationProperties("spr")
public class SprConfiguration {

    private RepositoryConfiguration repository = new RepositoryConfiguration();
    private ResolverConfiguration resolver = new ResolverConfiguration();
    private ManifestConfiguration manifest = new ManifestConfiguration();

    public RepositoryConfiguration getRepository() {
        return repository;
    }

    public void setRepository(RepositoryConfiguration repository) {
        this.repository = repository;
    }

    public ResolverConfiguration getResolver() {
        return resolver;
    }

    public void setResolver(ResolverConfiguration resolver) {
        this.resolver = resolver;
    }

    public ManifestConfiguration getManifest() {
        return manifest;
    }

    public void setManifest(ManifestConfiguration manifest) {
        this.manifest = manifest;
    }

    /**
     * Repository served by the read API.
     */
    @ConfigurationProperties("repository")
    public static class RepositoryConfiguration {

        private String root = ".";
        private String configsDir = "configs";

        public String getRoot() {
            return root;
        }

        public void setRoot(String root) {
            this.root = root;
        }

        public String getConfigsDir() {
            return configsDir;
        }

        public void setConfigsDir(String configsDir) {
            this.configsDir = configsDir;
        }
    }

    @ConfigurationProperties("resolver")
    public static class ResolverConfiguration {

        private int maxDepth = 10;

        public int getMaxDepth() {
            return maxDepth;
        }

        public void setMaxDepth(int maxDepth) {
            this.maxDepth = maxDepth;
        }
    }

    @ConfigurationProperties("manifest")
    public static class ManifestConfiguration {

        private String specVersion = "1.0";

        public String getSpecVersion() {
            return specVersion;
        }

        public void setSpecVersion(String specVersion) {
            this.specVersion = specVersion;
        }
    }
}
