package assetguard.dao;

import assetguard.data.Asset;
import assetguard.data.AssetFilter;
import assetguard.data.AssetStatus;
import assetguard.db.DatabaseConnection;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.*;

public class AssetDAO {

    private static final String SELECT_COLUMNS = "SELECT id, name, category, model, serial_number, purchase_date, status, current_holder, image_url, qr_code, description, custom_features FROM assets";
    private static final TypeReference<LinkedHashMap<String, String>> FEATURE_MAP = new TypeReference<>() {
    };

    private final DatabaseConnection database;
    private final ObjectMapper objectMapper;

    public AssetDAO(DatabaseConnection database, ObjectMapper objectMapper) {
        this.database = database;
        this.objectMapper = objectMapper;
    }

    public Optional<Asset> findById(String id) throws SQLException {
        try (Connection conn = database.getInventoryConnection()) {
            return findById(conn, id);
        }
    }

    public Optional<Asset> findById(Connection conn, String id) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(SELECT_COLUMNS + " WHERE id = ?")) {
            stmt.setString(1, id);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRowToAsset(rs));
                }
            }
        }
        return Optional.empty();
    }

    public Optional<AssetStatus> findStatus(Connection conn, String id) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement("SELECT status FROM assets WHERE id = ?")) {
            stmt.setString(1, id);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(AssetStatus.fromLabel(rs.getString("status")));
                }
            }
        }
        return Optional.empty();
    }

    public List<Asset> findAll() throws SQLException {
        return findByFilter(AssetFilter.all());
    }

    public List<Asset> findByFilter(AssetFilter filter) throws SQLException {
        QueryAndParams query = buildFilteredQuery(filter);
        List<Asset> assets = new ArrayList<>();
        try (Connection conn = database.getInventoryConnection(); PreparedStatement stmt = conn.prepareStatement(query.sql())) {
            for (int i = 0; i < query.params().size(); i++) {
                stmt.setString(i + 1, query.params().get(i));
            }
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    assets.add(mapRowToAsset(rs));
                }
            }
        }
        return assets;
    }

    public boolean exists(Connection conn, String id) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement("SELECT 1 FROM assets WHERE id = ?")) {
            stmt.setString(1, id);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next();
            }
        }
    }

    public void insert(Connection conn, Asset asset) throws SQLException {
        String sql = "INSERT INTO assets (id, name, category, model, serial_number, purchase_date, status, current_holder, image_url, qr_code, description, custom_features) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, asset.getId());
            stmt.setString(2, asset.getName());
            stmt.setString(3, asset.getCategory());
            stmt.setString(4, asset.getModel());
            stmt.setString(5, asset.getSerialNumber());
            stmt.setString(6, asset.getPurchaseDate());
            stmt.setString(7, asset.getStatus().getLabel());
            stmt.setString(8, asset.getCurrentHolder());
            stmt.setString(9, asset.getImageUrl());
            stmt.setString(10, asset.getQrCode());
            stmt.setString(11, asset.getDescription());
            stmt.setString(12, writeFeatures(asset));
            stmt.executeUpdate();
        }
    }

    /**
     * Replaces every column of an existing row.
     *
     * @return the number of rows changed, 0 when the id is unknown
     */
    public int update(Connection conn, Asset asset) throws SQLException {
        String sql = "UPDATE assets SET name = ?, category = ?, model = ?, serial_number = ?, purchase_date = ?, status = ?, current_holder = ?, image_url = ?, qr_code = ?, description = ?, custom_features = ? WHERE id = ?";
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, asset.getName());
            stmt.setString(2, asset.getCategory());
            stmt.setString(3, asset.getModel());
            stmt.setString(4, asset.getSerialNumber());
            stmt.setString(5, asset.getPurchaseDate());
            stmt.setString(6, asset.getStatus().getLabel());
            stmt.setString(7, asset.getCurrentHolder());
            stmt.setString(8, asset.getImageUrl());
            stmt.setString(9, asset.getQrCode());
            stmt.setString(10, asset.getDescription());
            stmt.setString(11, writeFeatures(asset));
            stmt.setString(12, asset.getId());
            return stmt.executeUpdate();
        }
    }

    /**
     * Compare-and-set on status: the row only changes if it still has {@code expectedStatus}.
     *
     * @return 1 on success, 0 when the id is unknown or the status has moved on
     */
    public int updateLifecycle(Connection conn, String id, AssetStatus expectedStatus, AssetStatus newStatus, String holder) throws SQLException {
        String sql = "UPDATE assets SET status = ?, current_holder = ? WHERE id = ? AND status = ?";
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, newStatus.getLabel());
            stmt.setString(2, holder);
            stmt.setString(3, id);
            stmt.setString(4, expectedStatus.getLabel());
            return stmt.executeUpdate();
        }
    }

    public Map<AssetStatus, Integer> countByStatus() throws SQLException {
        Map<AssetStatus, Integer> counts = new EnumMap<>(AssetStatus.class);
        for (AssetStatus status : AssetStatus.values()) {
            counts.put(status, 0);
        }
        String sql = "SELECT status, COUNT(*) AS status_count FROM assets GROUP BY status";
        try (Connection conn = database.getInventoryConnection(); PreparedStatement stmt = conn.prepareStatement(sql); ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                counts.put(AssetStatus.fromLabel(rs.getString("status")), rs.getInt("status_count"));
            }
        }
        return counts;
    }

    public Map<String, Integer> countByCategory() throws SQLException {
        Map<String, Integer> counts = new LinkedHashMap<>();
        String sql = "SELECT category, COUNT(*) AS category_count FROM assets GROUP BY category ORDER BY category";
        try (Connection conn = database.getInventoryConnection(); PreparedStatement stmt = conn.prepareStatement(sql); ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                counts.put(rs.getString("category"), rs.getInt("category_count"));
            }
        }
        return counts;
    }

    public List<String> findDistinctCategories() throws SQLException {
        List<String> categories = new ArrayList<>();
        String sql = "SELECT DISTINCT category FROM assets WHERE category IS NOT NULL AND category != '' ORDER BY category";
        try (Connection conn = database.getInventoryConnection(); PreparedStatement stmt = conn.prepareStatement(sql); ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                categories.add(rs.getString(1));
            }
        }
        return categories;
    }

    private QueryAndParams buildFilteredQuery(AssetFilter filter) {
        List<String> params = new ArrayList<>();
        StringBuilder whereClause = new StringBuilder(" WHERE 1=1");

        String term = filter.searchTerm() == null ? "" : filter.searchTerm().trim();
        if (!term.isEmpty()) {
            whereClause.append(" AND (LOWER(name) LIKE ? ESCAPE '\\' OR LOWER(id) LIKE ? ESCAPE '\\' OR LOWER(serial_number) LIKE ? ESCAPE '\\')");
            String pattern = "%" + escapeLike(term.toLowerCase(Locale.ROOT)) + "%";
            params.add(pattern);
            params.add(pattern);
            params.add(pattern);
        }
        if (filter.status() != null) {
            whereClause.append(" AND status = ?");
            params.add(filter.status().getLabel());
        }
        if (filter.category() != null) {
            whereClause.append(" AND category = ?");
            params.add(filter.category());
        }
        // purchase dates are ISO strings; the first ten characters compare as calendar dates
        if (filter.purchasedFrom() != null) {
            whereClause.append(" AND LEFT(purchase_date, 10) >= ?");
            params.add(filter.purchasedFrom().toString());
        }
        if (filter.purchasedTo() != null) {
            whereClause.append(" AND LEFT(purchase_date, 10) <= ?");
            params.add(filter.purchasedTo().toString());
        }
        return new QueryAndParams(SELECT_COLUMNS + whereClause + " ORDER BY seq", params);
    }

    private static String escapeLike(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }

    private Asset mapRowToAsset(ResultSet rs) throws SQLException {
        Asset asset = new Asset();
        asset.setId(rs.getString("id"));
        asset.setName(rs.getString("name"));
        asset.setCategory(rs.getString("category"));
        asset.setModel(rs.getString("model"));
        asset.setSerialNumber(rs.getString("serial_number"));
        asset.setPurchaseDate(rs.getString("purchase_date"));
        asset.setStatus(AssetStatus.fromLabel(rs.getString("status")));
        asset.setCurrentHolder(rs.getString("current_holder"));
        asset.setImageUrl(rs.getString("image_url"));
        asset.setQrCode(rs.getString("qr_code"));
        asset.setDescription(rs.getString("description"));
        asset.setCustomFeatures(readFeatures(asset.getId(), rs.getString("custom_features")));
        return asset;
    }

    private String writeFeatures(Asset asset) throws SQLException {
        if (asset.getCustomFeatures().isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(asset.getCustomFeatures());
        } catch (JsonProcessingException e) {
            throw new SQLException("Could not serialize custom features of asset " + asset.getId(), e);
        }
    }

    private Map<String, String> readFeatures(String assetId, String json) throws SQLException {
        if (json == null || json.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            return objectMapper.readValue(json, FEATURE_MAP);
        } catch (JsonProcessingException e) {
            throw new SQLException("Stored custom features of asset " + assetId + " are not valid JSON", e);
        }
    }

    private record QueryAndParams(String sql, List<String> params) {
    }
}
