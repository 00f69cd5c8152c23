package stac.core.model.common;

/**
 * Signals that a requested item, collection or extension does not exist.
 *
 * <p>Mapped to a 404 problem at the HTTP boundary.
 */
public class ResourceNotFoundException extends RuntimeException {

    private final String resourceType;
    private final String resourceId;

    public ResourceNotFoundException(String resourceType, String resourceId) {
        super("%s not found: %s".formatted(resourceType, resourceId));
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }

    public static ResourceNotFoundException item(String collectionId, String itemId) {
        return new ResourceNotFoundException("Item", collectionId + "/" + itemId);
    }

    public static ResourceNotFoundException collection(String collectionId) {
        return new ResourceNotFoundException("Collection", collectionId);
    }

    public static ResourceNotFoundException extension(String extensionName) {
        return new ResourceNotFoundException("Extension", extensionName);
    }

    public String resourceType() {
        return resourceType;
    }

    public String resourceId() {
        return resourceId;
    }
}
