package assetguard.data;

public enum AssetStatus {
    AVAILABLE("Available"),
    BORROWED("Borrowed"),
    MAINTENANCE("Maintenance"),
    LOST("Lost");

    private final String label;

    AssetStatus(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Resolves a stored or user-entered label, case-insensitively.
     *
     * @throws IllegalArgumentException if the label matches no status
     */
    public static AssetStatus fromLabel(String label) {
        for (AssetStatus status : values()) {
            if (status.label.equalsIgnoreCase(label.trim())) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown asset status: " + label);
    }

    @Override
    public String toString() {
        return label;
    }
}
