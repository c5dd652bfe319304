package assetguard.manager;

import java.util.Locale;
import java.util.UUID;

/**
 * Random, collision-resistant ids for every entity kind. Collisions are not retried; the store
 * reports them as duplicates.
 */
public final class IdGenerator {

    private IdGenerator() {
    }

    public static String transactionId() {
        return "TX-" + UUID.randomUUID();
    }

    public static String assetId() {
        return "AST-" + shortHex().toUpperCase(Locale.ROOT);
    }

    public static String userId() {
        return "U" + shortHex();
    }

    public static String reservationId() {
        return "RES-" + shortHex();
    }

    private static String shortHex() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 8);
    }
}
