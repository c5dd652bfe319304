package assetguard.data;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

public class Asset {
    private String id;
    private String name;
    private String category;
    private String model;
    private String serialNumber;
    private String purchaseDate;
    private AssetStatus status = AssetStatus.AVAILABLE;
    private String currentHolder;
    private String imageUrl;
    private String qrCode;
    private String description;
    private Map<String, String> customFeatures = new LinkedHashMap<>();

    public Asset() {
    }

    public Asset(String id, String name, String category, AssetStatus status) {
        this.id = id;
        this.name = name;
        this.category = category;
        this.status = status;
        this.qrCode = qrCodeFor(id);
    }

    /**
     * Copy constructor. Callers edit copies and hand them back to the store; they never keep
     * a reference past one operation.
     */
    public Asset(Asset other) {
        this.id = other.id;
        this.name = other.name;
        this.category = other.category;
        this.model = other.model;
        this.serialNumber = other.serialNumber;
        this.purchaseDate = other.purchaseDate;
        this.status = other.status;
        this.currentHolder = other.currentHolder;
        this.imageUrl = other.imageUrl;
        this.qrCode = other.qrCode;
        this.description = other.description;
        this.customFeatures = new LinkedHashMap<>(other.customFeatures);
    }

    public static String qrCodeFor(String assetId) {
        return "qr-" + assetId;
    }

    // Getters and Setters
    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getCategory() {
        return category;
    }

    public void setCategory(String category) {
        this.category = category;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public String getSerialNumber() {
        return serialNumber;
    }

    public void setSerialNumber(String serialNumber) {
        this.serialNumber = serialNumber;
    }

    public String getPurchaseDate() {
        return purchaseDate;
    }

    public void setPurchaseDate(String purchaseDate) {
        this.purchaseDate = purchaseDate;
    }

    public AssetStatus getStatus() {
        return status;
    }

    public void setStatus(AssetStatus status) {
        this.status = status;
    }

    public String getCurrentHolder() {
        return currentHolder;
    }

    public void setCurrentHolder(String currentHolder) {
        this.currentHolder = currentHolder;
    }

    public String getImageUrl() {
        return imageUrl;
    }

    public void setImageUrl(String imageUrl) {
        this.imageUrl = imageUrl;
    }

    public String getQrCode() {
        return qrCode;
    }

    public void setQrCode(String qrCode) {
        this.qrCode = qrCode;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public Map<String, String> getCustomFeatures() {
        return Collections.unmodifiableMap(customFeatures);
    }

    public void setCustomFeatures(Map<String, String> customFeatures) {
        this.customFeatures = customFeatures == null ? new LinkedHashMap<>() : new LinkedHashMap<>(customFeatures);
    }

    /**
     * Custom features ordered by key, for display and export.
     */
    public SortedMap<String, String> getSortedCustomFeatures() {
        return new TreeMap<>(customFeatures);
    }

    public boolean hasHolder() {
        return currentHolder != null && !currentHolder.isBlank();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Asset other = (Asset) o;
        return Objects.equals(id, other.id) && Objects.equals(name, other.name) && Objects.equals(category, other.category)
                && Objects.equals(model, other.model) && Objects.equals(serialNumber, other.serialNumber)
                && Objects.equals(purchaseDate, other.purchaseDate) && status == other.status
                && Objects.equals(currentHolder, other.currentHolder) && Objects.equals(imageUrl, other.imageUrl)
                && Objects.equals(qrCode, other.qrCode) && Objects.equals(description, other.description)
                && Objects.equals(customFeatures, other.customFeatures);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, category, model, serialNumber, purchaseDate, status, currentHolder, imageUrl, qrCode, description, customFeatures);
    }

    @Override
    public String toString() {
        return "Asset{id='" + id + "', name='" + name + "', status=" + status + ", holder='" + currentHolder + "'}";
    }
}
