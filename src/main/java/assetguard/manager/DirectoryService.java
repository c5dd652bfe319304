package assetguard.manager;

import assetguard.data.Reservation;
import assetguard.data.ReservationStatus;
import assetguard.data.User;
import assetguard.data.UserRole;
import assetguard.exception.DuplicateIdException;
import assetguard.exception.NotFoundException;
import assetguard.store.EntityStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.util.List;

/**
 * Users and reservations. Reservations are advisory: they are not checked against each other or
 * against the asset's lifecycle.
 */
public class DirectoryService {

    private static final Logger logger = LoggerFactory.getLogger(DirectoryService.class);

    static final String ADMIN_DEFAULT_PASSWORD = "123456";
    static final String USER_DEFAULT_PASSWORD = "123";

    private final EntityStore store;

    public DirectoryService(EntityStore store) {
        this.store = store;
    }

    public User addUser(User draft) throws DuplicateIdException, SQLException {
        if (isBlank(draft.getName()) || isBlank(draft.getEmail())) {
            throw new IllegalArgumentException("User name and email are required.");
        }
        User user = new User(
                isBlank(draft.getId()) ? IdGenerator.userId() : draft.getId().trim(),
                draft.getName().trim(),
                draft.getRole() == null ? UserRole.STAFF : draft.getRole(),
                draft.getEmail().trim(),
                draft.getDepartment());
        if (isBlank(draft.getPassword())) {
            user.setPassword(user.getRole() == UserRole.ADMIN ? ADMIN_DEFAULT_PASSWORD : USER_DEFAULT_PASSWORD);
        } else {
            user.setPassword(draft.getPassword());
        }

        store.insertUser(user);
        logger.info("User {} added as {}", user.getId(), user.getRole());
        return user;
    }

    /**
     * Replaces the user with the same id. A blank password keeps the stored one.
     */
    public User updateUser(User user) throws NotFoundException, SQLException {
        User existing = store.findUser(user.getId()).orElseThrow(() -> new NotFoundException("User", user.getId()));
        if (isBlank(user.getName()) || isBlank(user.getEmail())) {
            throw new IllegalArgumentException("User name and email are required.");
        }
        User updated = new User(user.getId(), user.getName().trim(), user.getRole() == null ? existing.getRole() : user.getRole(),
                user.getEmail().trim(), user.getDepartment());
        updated.setPassword(isBlank(user.getPassword()) ? existing.getPassword() : user.getPassword());
        store.updateUser(updated);
        return updated;
    }

    public List<User> listUsers() throws SQLException {
        return store.listUsers();
    }

    public List<User> searchUsers(String term) throws SQLException {
        return store.searchUsers(term);
    }

    public Reservation addReservation(Reservation draft) throws NotFoundException, DuplicateIdException, SQLException {
        if (isBlank(draft.getAssetId()) || isBlank(draft.getUserId()) || isBlank(draft.getStartDate()) || isBlank(draft.getEndDate())) {
            throw new IllegalArgumentException("Asset, user, start date and end date are required.");
        }
        if (store.findAsset(draft.getAssetId()).isEmpty()) {
            throw new NotFoundException("Asset", draft.getAssetId());
        }
        if (store.findUser(draft.getUserId()).isEmpty()) {
            throw new NotFoundException("User", draft.getUserId());
        }
        Reservation reservation = new Reservation(
                isBlank(draft.getId()) ? IdGenerator.reservationId() : draft.getId().trim(),
                draft.getAssetId(),
                draft.getUserId(),
                draft.getStartDate(),
                draft.getEndDate(),
                draft.getStatus() == null ? ReservationStatus.CONFIRMED : draft.getStatus());

        store.insertReservation(reservation);
        logger.info("Reservation {} added for asset {} ({} to {})", reservation.getId(), reservation.getAssetId(), reservation.getStartDate(), reservation.getEndDate());
        return reservation;
    }

    public void updateReservation(Reservation reservation) throws NotFoundException, SQLException {
        store.updateReservation(reservation);
    }

    public List<Reservation> listReservations() throws SQLException {
        return store.listReservations();
    }

    public List<Reservation> reservationsFor(String assetId) throws SQLException {
        return store.reservationsForAsset(assetId);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
