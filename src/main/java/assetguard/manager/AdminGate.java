package assetguard.manager;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The password prompt in front of the admin view. A low-security convenience gate: one shared
 * password kept in memory for the session.
 */
public class AdminGate {

    private static final Logger logger = LoggerFactory.getLogger(AdminGate.class);
    static final int MIN_PASSWORD_LENGTH = 4;

    private String password;
    private boolean loggedIn;

    public AdminGate(String initialPassword) {
        if (initialPassword == null || initialPassword.isEmpty()) {
            throw new IllegalArgumentException("Initial admin password must not be empty.");
        }
        this.password = initialPassword;
    }

    public synchronized boolean login(String attempt) {
        loggedIn = password.equals(attempt);
        if (!loggedIn) {
            logger.warn("Rejected admin login attempt");
        }
        return loggedIn;
    }

    public synchronized void logout() {
        loggedIn = false;
    }

    public synchronized boolean isLoggedIn() {
        return loggedIn;
    }

    public synchronized void changePassword(String newPassword) {
        if (newPassword == null || newPassword.length() < MIN_PASSWORD_LENGTH) {
            throw new IllegalArgumentException("Password must be at least " + MIN_PASSWORD_LENGTH + " characters.");
        }
        password = newPassword;
        logger.info("Admin password changed");
    }
}
