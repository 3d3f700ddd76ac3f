package org.clinidex.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the store and its search engine.
 * <p>
 * Binds to {@code clinidex.*} properties in application.yml.
 * </p>
 */
@ConfigurationProperties(prefix = "clinidex")
public class ClinidexProperties {

    private final Rules rules = new Rules();
    private final References references = new References();
    private final Search search = new Search();
    private final Bulk bulk = new Bulk();

    public Rules getRules() {
        return rules;
    }

    public References getReferences() {
        return references;
    }

    public Search getSearch() {
        return search;
    }

    public Bulk getBulk() {
        return bulk;
    }

    public static class Rules {

        private String location = "classpath:search-rules/";

        public String getLocation() {
            return location;
        }

        public void setLocation(String location) {
            this.location = location;
        }
    }

    public static class References {

        private boolean resolveUntyped = true;

        public boolean isResolveUntyped() {
            return resolveUntyped;
        }

        public void setResolveUntyped(boolean resolveUntyped) {
            this.resolveUntyped = resolveUntyped;
        }
    }

    public static class Search {

        private int defaultPageSize = 20;
        private int maxPageSize = 1000;
        private int maxSortCandidates = 10000;

        public int getDefaultPageSize() {
            return defaultPageSize;
        }

        public void setDefaultPageSize(int defaultPageSize) {
            this.defaultPageSize = defaultPageSize;
        }

        public int getMaxPageSize() {
            return maxPageSize;
        }

        public void setMaxPageSize(int maxPageSize) {
            this.maxPageSize = maxPageSize;
        }

        public int getMaxSortCandidates() {
            return maxSortCandidates;
        }

        public void setMaxSortCandidates(int maxSortCandidates) {
            this.maxSortCandidates = maxSortCandidates;
        }

        /**
         * Resolves a requested page size against the configured default and cap.
         */
        public int effectivePageSize(Integer requested) {
            if (requested == null) {
                return defaultPageSize;
            }
            return Math.min(Math.max(requested, 0), maxPageSize);
        }
    }

    public static class Bulk {

        private int parallelism = 4;
        private int queueCapacity = 64;

        public int getParallelism() {
            return parallelism;
        }

        public void setParallelism(int parallelism) {
            this.parallelism = parallelism;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }
    }
}
