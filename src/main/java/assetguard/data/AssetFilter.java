package assetguard.data;

import java.time.LocalDate;

/**
 * Criteria for the asset list view. Every field is optional; null means "no restriction".
 * The search term matches name, id or serial number, ignoring case. The date range applies to
 * the purchase date and includes both ends.
 */
public record AssetFilter(String searchTerm, AssetStatus status, String category, LocalDate purchasedFrom, LocalDate purchasedTo) {

    public static AssetFilter all() {
        return new AssetFilter(null, null, null, null, null);
    }

    public AssetFilter withSearchTerm(String term) {
        return new AssetFilter(term, status, category, purchasedFrom, purchasedTo);
    }

    public AssetFilter withStatus(AssetStatus newStatus) {
        return new AssetFilter(searchTerm, newStatus, category, purchasedFrom, purchasedTo);
    }

    public AssetFilter withCategory(String newCategory) {
        return new AssetFilter(searchTerm, status, newCategory, purchasedFrom, purchasedTo);
    }

    public AssetFilter withPurchaseRange(LocalDate from, LocalDate to) {
        return new AssetFilter(searchTerm, status, category, from, to);
    }
}
