package assetguard.data;

/**
 * An advisory booking of an asset for a date range. Nothing checks it against other
 * reservations or against the asset's lifecycle status.
 */
public class Reservation {
    private String id;
    private String assetId;
    private String userId;
    private String startDate;
    private String endDate;
    private ReservationStatus status = ReservationStatus.CONFIRMED;

    public Reservation() {
    }

    public Reservation(String id, String assetId, String userId, String startDate, String endDate, ReservationStatus status) {
        this.id = id;
        this.assetId = assetId;
        this.userId = userId;
        this.startDate = startDate;
        this.endDate = endDate;
        this.status = status;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getAssetId() {
        return assetId;
    }

    public void setAssetId(String assetId) {
        this.assetId = assetId;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public String getStartDate() {
        return startDate;
    }

    public void setStartDate(String startDate) {
        this.startDate = startDate;
    }

    public String getEndDate() {
        return endDate;
    }

    public void setEndDate(String endDate) {
        this.endDate = endDate;
    }

    public ReservationStatus getStatus() {
        return status;
    }

    public void setStatus(ReservationStatus status) {
        this.status = status;
    }
}
