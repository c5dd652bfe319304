package assetguard.manager;

import assetguard.data.*;
import assetguard.support.TestSessions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class NotificationDeriverTest {

    private static final Instant NOW = TestSessions.NOW;

    private final NotificationDeriver deriver = new NotificationDeriver(Duration.ofDays(7));

    @Test
    @DisplayName("a lost asset gives one critical alert with a stable key, however often it is derived")
    void lostAssetAlert() {
        Asset lost = TestSessions.asset("AST-003", "DJI Mavic 3 Pro", "Drone", AssetStatus.LOST);
        List<Asset> assets = List.of(lost);

        List<Notification> first = deriver.derive(assets, List.of(), NOW);
        List<Notification> second = deriver.derive(assets, List.of(), NOW.plusSeconds(60));

        assertThat(first).singleElement().satisfies(n -> {
            assertThat(n.key()).isEqualTo("lost-AST-003");
            assertThat(n.severity()).isEqualTo(NotificationSeverity.CRITICAL);
            assertThat(n.title()).isEqualTo("Asset Lost Alert");
            assertThat(n.message()).isEqualTo("DJI Mavic 3 Pro (AST-003) is marked as Lost.");
        });
        assertThat(second).extracting(Notification::key).containsExactly("lost-AST-003");
    }

    @Test
    @DisplayName("a borrow older than the threshold gives one warning")
    void overdueBorrow() {
        Asset camera = TestSessions.borrowedAsset("AST-002", "Sony Alpha a7 IV", "Alice Chen");
        Transaction borrow = borrow("AST-002", "Alice Chen", NOW.minus(Duration.ofDays(8)));

        List<Notification> notifications = deriver.derive(List.of(camera), List.of(borrow), NOW);

        assertThat(notifications).singleElement().satisfies(n -> {
            assertThat(n.key()).isEqualTo("overdue-AST-002");
            assertThat(n.severity()).isEqualTo(NotificationSeverity.WARNING);
            assertThat(n.title()).isEqualTo("Overdue Alert");
            assertThat(n.message()).isEqualTo("Sony Alpha a7 IV held by Alice Chen for >7 days.");
        });
    }

    @Test
    @DisplayName("a six-day-old borrow is not overdue")
    void recentBorrow() {
        Asset camera = TestSessions.borrowedAsset("AST-002", "Sony Alpha a7 IV", "Alice Chen");
        Transaction borrow = borrow("AST-002", "Alice Chen", NOW.minus(Duration.ofDays(6)));

        assertThat(deriver.derive(List.of(camera), List.of(borrow), NOW)).isEmpty();
    }

    @Test
    @DisplayName("exactly at the threshold is not yet overdue")
    void boundaryIsExclusive() {
        Asset camera = TestSessions.borrowedAsset("AST-002", "Sony Alpha a7 IV", "Alice Chen");
        Transaction borrow = borrow("AST-002", "Alice Chen", NOW.minus(Duration.ofDays(7)));

        assertThat(deriver.derive(List.of(camera), List.of(borrow), NOW)).isEmpty();
    }

    @Test
    @DisplayName("only the most recent borrow of an asset counts")
    void latestBorrowWins() {
        Asset camera = TestSessions.borrowedAsset("AST-002", "Sony Alpha a7 IV", "Bob Smith");
        List<Transaction> ledger = List.of(
                borrow("AST-002", "Bob Smith", NOW.minus(Duration.ofDays(1))),
                borrow("AST-002", "Alice Chen", NOW.minus(Duration.ofDays(30))));

        assertThat(deriver.derive(List.of(camera), ledger, NOW)).isEmpty();
    }

    @Test
    @DisplayName("a borrowed asset with no borrow entry produces no alert")
    void borrowedWithoutLedgerEntry() {
        Asset camera = TestSessions.borrowedAsset("AST-002", "Sony Alpha a7 IV", "Alice Chen");

        assertThat(deriver.derive(List.of(camera), List.of(), NOW)).isEmpty();
    }

    @Test
    @DisplayName("lost alerts come before overdue alerts, each in asset order")
    void ordering() {
        List<Asset> assets = List.of(
                TestSessions.borrowedAsset("AST-001", "Laptop", "Alice Chen"),
                TestSessions.asset("AST-002", "Drone", "Drone", AssetStatus.LOST),
                TestSessions.borrowedAsset("AST-003", "Camera", "Bob Smith"),
                TestSessions.asset("AST-004", "Tablet", "Tablet", AssetStatus.LOST));
        List<Transaction> ledger = List.of(
                borrow("AST-003", "Bob Smith", NOW.minus(Duration.ofDays(9))),
                borrow("AST-001", "Alice Chen", NOW.minus(Duration.ofDays(10))));

        assertThat(deriver.derive(assets, ledger, NOW)).extracting(Notification::key)
                .containsExactly("lost-AST-002", "lost-AST-004", "overdue-AST-001", "overdue-AST-003");
    }

    @Test
    @DisplayName("the day count in the message follows the configured threshold")
    void customThreshold() {
        NotificationDeriver strict = new NotificationDeriver(Duration.ofDays(3));
        Asset camera = TestSessions.borrowedAsset("AST-002", "Sony Alpha a7 IV", "Alice Chen");
        Transaction borrow = borrow("AST-002", "Alice Chen", NOW.minus(Duration.ofDays(4)));

        assertThat(strict.derive(List.of(camera), List.of(borrow), NOW))
                .extracting(Notification::message)
                .containsExactly("Sony Alpha a7 IV held by Alice Chen for >3 days.");
    }

    private static Transaction borrow(String assetId, String userName, Instant at) {
        return new Transaction(IdGenerator.transactionId(), assetId, "name", "U001", userName, TransactionType.BORROW, at.toEpochMilli(), "", null);
    }
}
