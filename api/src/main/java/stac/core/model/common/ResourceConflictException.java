package stac.core.model.common;

/**
 * Signals that a resource cannot be created because one with the same id already exists.
 */
public class ResourceConflictException extends RuntimeException {

    public ResourceConflictException(String resourceType, String resourceId) {
        super("%s already exists: %s".formatted(resourceType, resourceId));
    }
}
