package org.clinidex.core.exception;

/**
 * Exception thrown when a write names an expected version that is no longer current,
 * or when a concurrent writer got to the key first.
 */
public class VersionConflictException extends ClinidexException {

    private final String resourceType;
    private final String resourceId;
    private final Integer expectedVersion;
    private final Integer actualVersion;

    public VersionConflictException(String resourceType, String resourceId,
                                    Integer expectedVersion, Integer actualVersion) {
        super(String.format("Version conflict on '%s/%s': expected %s, current %s",
                        resourceType, resourceId, expectedVersion, actualVersion),
                "conflict",
                String.format("Re-read %s/%s and retry the write against version %s",
                        resourceType, resourceId, actualVersion));
        this.resourceType = resourceType;
        this.resourceId = resourceId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public VersionConflictException(String resourceType, String resourceId, Throwable cause) {
        super(String.format("Concurrent write detected on '%s/%s'", resourceType, resourceId),
                "conflict",
                cause != null ? cause.getMessage() : null,
                cause);
        this.resourceType = resourceType;
        this.resourceId = resourceId;
        this.expectedVersion = null;
        this.actualVersion = null;
    }

    public String getResourceType() {
        return resourceType;
    }

    public String getResourceId() {
        return resourceId;
    }

    public Integer getExpectedVersion() {
        return expectedVersion;
    }

    public Integer getActualVersion() {
        return actualVersion;
    }
}
