package org.clinidex.core.exception;

/**
 * Exception thrown when no document exists at a key, or at a version of that key.
 */
public class ResourceNotFoundException extends ClinidexException {

    private final String resourceType;
    private final String resourceId;
    private final Integer versionId;

    public ResourceNotFoundException(String resourceType, String resourceId) {
        super(String.format("Resource '%s/%s' not found", resourceType, resourceId),
                "not-found",
                String.format("No resource of type %s found with id %s", resourceType, resourceId));
        this.resourceType = resourceType;
        this.resourceId = resourceId;
        this.versionId = null;
    }

    public ResourceNotFoundException(String resourceType, String resourceId, int versionId) {
        super(String.format("Resource '%s/%s' version %d not found", resourceType, resourceId, versionId),
                "not-found",
                String.format("No version %d recorded for %s/%s", versionId, resourceType, resourceId));
        this.resourceType = resourceType;
        this.resourceId = resourceId;
        this.versionId = versionId;
    }

    public String getResourceType() {
        return resourceType;
    }

    public String getResourceId() {
        return resourceId;
    }

    public Integer getVersionId() {
        return versionId;
    }
}
