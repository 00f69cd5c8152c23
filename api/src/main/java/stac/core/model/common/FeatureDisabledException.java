package stac.core.model.common;

/**
 * Signals a call to a route whose extension is not enabled, or whose backend does not
 * supply the required client.
 */
public class FeatureDisabledException extends RuntimeException {

    private final String feature;

    public FeatureDisabledException(String feature) {
        super(feature + " is not enabled");
        this.feature = feature;
    }

    public String feature() {
        return feature;
    }
}
