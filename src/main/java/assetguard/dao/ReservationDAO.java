package assetguard.dao;

import assetguard.data.Reservation;
import assetguard.data.ReservationStatus;
import assetguard.db.DatabaseConnection;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class ReservationDAO {

    private static final String SELECT_COLUMNS = "SELECT id, asset_id, user_id, start_date, end_date, status FROM reservations";

    private final DatabaseConnection database;

    public ReservationDAO(DatabaseConnection database) {
        this.database = database;
    }

    public Optional<Reservation> findById(String id) throws SQLException {
        List<Reservation> found = query(SELECT_COLUMNS + " WHERE id = ?", id);
        return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
    }

    public List<Reservation> findAll() throws SQLException {
        return query(SELECT_COLUMNS + " ORDER BY seq");
    }

    public List<Reservation> findByAssetId(String assetId) throws SQLException {
        return query(SELECT_COLUMNS + " WHERE asset_id = ? ORDER BY start_date, seq", assetId);
    }

    public boolean exists(Connection conn, String id) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement("SELECT 1 FROM reservations WHERE id = ?")) {
            stmt.setString(1, id);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next();
            }
        }
    }

    public void insert(Connection conn, Reservation reservation) throws SQLException {
        String sql = "INSERT INTO reservations (id, asset_id, user_id, start_date, end_date, status) VALUES (?, ?, ?, ?, ?, ?)";
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, reservation.getId());
            stmt.setString(2, reservation.getAssetId());
            stmt.setString(3, reservation.getUserId());
            stmt.setString(4, reservation.getStartDate());
            stmt.setString(5, reservation.getEndDate());
            stmt.setString(6, reservation.getStatus().getLabel());
            stmt.executeUpdate();
        }
    }

    public int update(Connection conn, Reservation reservation) throws SQLException {
        String sql = "UPDATE reservations SET asset_id = ?, user_id = ?, start_date = ?, end_date = ?, status = ? WHERE id = ?";
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, reservation.getAssetId());
            stmt.setString(2, reservation.getUserId());
            stmt.setString(3, reservation.getStartDate());
            stmt.setString(4, reservation.getEndDate());
            stmt.setString(5, reservation.getStatus().getLabel());
            stmt.setString(6, reservation.getId());
            return stmt.executeUpdate();
        }
    }

    private List<Reservation> query(String sql, String... params) throws SQLException {
        List<Reservation> reservations = new ArrayList<>();
        try (Connection conn = database.getInventoryConnection(); PreparedStatement stmt = conn.prepareStatement(sql)) {
            for (int i = 0; i < params.length; i++) {
                stmt.setString(i + 1, params[i]);
            }
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    reservations.add(new Reservation(
                            rs.getString("id"),
                            rs.getString("asset_id"),
                            rs.getString("user_id"),
                            rs.getString("start_date"),
                            rs.getString("end_date"),
                            ReservationStatus.fromLabel(rs.getString("status"))));
                }
            }
        }
        return reservations;
    }
}
