package assetguard.data;

/**
 * Field-level patch for a bulk edit. A null status or a blank category means "leave as is".
 */
public record AssetPatch(AssetStatus status, String category) {

    public static AssetPatch status(AssetStatus status) {
        return new AssetPatch(status, null);
    }

    public static AssetPatch category(String category) {
        return new AssetPatch(null, category);
    }

    public boolean hasStatus() {
        return status != null;
    }

    public boolean hasCategory() {
        return category != null && !category.isBlank();
    }

    public boolean isEmpty() {
        return !hasStatus() && !hasCategory();
    }
}
