package assetguard.dao;

import assetguard.data.User;
import assetguard.data.UserRole;
import assetguard.db.DatabaseConnection;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

public class UserDAO {

    private static final String SELECT_COLUMNS = "SELECT id, name, role, email, department, password FROM app_users";

    private final DatabaseConnection database;

    public UserDAO(DatabaseConnection database) {
        this.database = database;
    }

    public Optional<User> findById(String id) throws SQLException {
        List<User> users = query(SELECT_COLUMNS + " WHERE id = ?", id);
        return users.isEmpty() ? Optional.empty() : Optional.of(users.get(0));
    }

    /**
     * First registered user with exactly this name, if any.
     */
    public Optional<User> findByName(String name) throws SQLException {
        List<User> users = query(SELECT_COLUMNS + " WHERE name = ? ORDER BY seq LIMIT 1", name);
        return users.isEmpty() ? Optional.empty() : Optional.of(users.get(0));
    }

    public List<User> findAll() throws SQLException {
        return query(SELECT_COLUMNS + " ORDER BY seq");
    }

    public List<User> search(String term) throws SQLException {
        String trimmed = term == null ? "" : term.trim();
        if (trimmed.isEmpty()) {
            return findAll();
        }
        String pattern = "%" + trimmed.toLowerCase(Locale.ROOT) + "%";
        return query(SELECT_COLUMNS + " WHERE LOWER(name) LIKE ? OR LOWER(email) LIKE ? ORDER BY seq", pattern, pattern);
    }

    public boolean exists(Connection conn, String id) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement("SELECT 1 FROM app_users WHERE id = ?")) {
            stmt.setString(1, id);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next();
            }
        }
    }

    public void insert(Connection conn, User user) throws SQLException {
        String sql = "INSERT INTO app_users (id, name, role, email, department, password) VALUES (?, ?, ?, ?, ?, ?)";
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, user.getId());
            stmt.setString(2, user.getName());
            stmt.setString(3, user.getRole().getLabel());
            stmt.setString(4, user.getEmail());
            stmt.setString(5, user.getDepartment());
            stmt.setString(6, user.getPassword());
            stmt.executeUpdate();
        }
    }

    public int update(Connection conn, User user) throws SQLException {
        String sql = "UPDATE app_users SET name = ?, role = ?, email = ?, department = ?, password = ? WHERE id = ?";
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, user.getName());
            stmt.setString(2, user.getRole().getLabel());
            stmt.setString(3, user.getEmail());
            stmt.setString(4, user.getDepartment());
            stmt.setString(5, user.getPassword());
            stmt.setString(6, user.getId());
            return stmt.executeUpdate();
        }
    }

    private List<User> query(String sql, String... params) throws SQLException {
        List<User> users = new ArrayList<>();
        try (Connection conn = database.getInventoryConnection(); PreparedStatement stmt = conn.prepareStatement(sql)) {
            for (int i = 0; i < params.length; i++) {
                stmt.setString(i + 1, params[i]);
            }
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    User user = new User(rs.getString("id"), rs.getString("name"), UserRole.fromLabel(rs.getString("role")), rs.getString("email"), rs.getString("department"));
                    user.setPassword(rs.getString("password"));
                    users.add(user);
                }
            }
        }
        return users;
    }
}
