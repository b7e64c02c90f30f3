package io.ecsexporter.core.model;

/**
 * The two resource kinds collected for every cluster.
 */
public enum ScrapedResource {
    SERVICES("services"),
    CLUSTER_INSTANCES("cluster_instances");

    private final String label;

    ScrapedResource(String label) {
        this.label = label;
    }

    /**
     * Value of the {@code scraped_resource} label.
     */
    public String label() {
        return label;
    }
}
