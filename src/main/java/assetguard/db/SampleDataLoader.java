package assetguard.db;

import assetguard.data.*;
import assetguard.exception.DuplicateIdException;
import assetguard.store.EntityStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Seeds an empty store with the demo users, assets, ledger entries and reservation.
 */
public final class SampleDataLoader {

    private static final Logger logger = LoggerFactory.getLogger(SampleDataLoader.class);

    private SampleDataLoader() {
    }

    public static void load(EntityStore store, Clock clock) throws SQLException, DuplicateIdException {
        for (User user : users()) {
            store.insertUser(user);
        }
        for (Asset asset : assets()) {
            store.insertAsset(asset);
        }
        long now = clock.millis();
        store.appendTransaction(new Transaction("TX-1002", "AST-003", "DJI Mavic 3 Pro", "U002", "Bob Smith",
                TransactionType.MAINTENANCE_LOG, now - Duration.ofDays(5).toMillis(), "", "Propeller check"));
        store.appendTransaction(new Transaction("TX-1001", "AST-002", "Sony Alpha a7 IV", "U001", "Alice Chen",
                TransactionType.BORROW, now - Duration.ofDays(2).toMillis(), "", "Project photoshoot"));
        store.insertReservation(new Reservation("RES-001", "AST-004", "U001", "2024-06-01", "2024-06-03", ReservationStatus.CONFIRMED));
        logger.info("Sample data loaded");
    }

    static List<User> users() {
        return List.of(
                user("U001", "Alice Chen", UserRole.STAFF, "alice.c@company.com", "Design", "123"),
                user("U002", "Bob Smith", UserRole.OPERATOR, "bob.s@company.com", "Engineering", "123"),
                user("U003", "Carol Admin", UserRole.ADMIN, "carol.d@company.com", "IT Support", "123456"),
                user("U004", "David View", UserRole.VIEWER, "david.v@company.com", "Audit", "123"));
    }

    static List<Asset> assets() {
        return List.of(
                asset("AST-001", "MacBook Pro 16\"", "Laptop", "M3 Max", "FVFX1234K9", "2024-01-15", AssetStatus.AVAILABLE, null,
                        "High performance laptop.", Map.of("Color", "Space Gray", "RAM", "64GB")),
                asset("AST-002", "Sony Alpha a7 IV", "Camera", "ILCE-7M4", "SNY887221", "2023-11-20", AssetStatus.BORROWED, "Alice Chen",
                        "Full frame mirrorless.", Map.of("Lens", "24-70mm GM", "Warranty", "Extended")),
                asset("AST-003", "DJI Mavic 3 Pro", "Drone", "Mavic 3", "DJI998877", "2024-02-10", AssetStatus.MAINTENANCE, null,
                        "Triple camera drone.", Map.of()),
                asset("AST-004", "Projector 4K", "Office", "Epson Pro", "EPS445566", "2023-05-05", AssetStatus.AVAILABLE, null,
                        "Main meeting room projector.", Map.of("Resolution", "4K", "Mount", "Ceiling")),
                asset("AST-005", "iPad Pro 12.9\"", "Tablet", "6th Gen", "APP998811", "2024-03-01", AssetStatus.AVAILABLE, null,
                        "Design tablet.", Map.of("Storage", "1TB", "Connectivity", "5G + Wi-Fi")));
    }

    private static User user(String id, String name, UserRole role, String email, String department, String password) {
        User user = new User(id, name, role, email, department);
        user.setPassword(password);
        return user;
    }

    private static Asset asset(String id, String name, String category, String model, String serial, String purchaseDate,
                               AssetStatus status, String holder, String description, Map<String, String> features) {
        Asset asset = new Asset(id, name, category, status);
        asset.setModel(model);
        asset.setSerialNumber(serial);
        asset.setPurchaseDate(purchaseDate);
        asset.setCurrentHolder(holder);
        asset.setImageUrl("https://picsum.photos/400/300?random=" + id.substring(id.length() - 1));
        asset.setDescription(description);
        asset.setCustomFeatures(features);
        return asset;
    }
}
