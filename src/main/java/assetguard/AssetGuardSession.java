package assetguard;

import assetguard.config.AppConfig;
import assetguard.db.DatabaseConnection;
import assetguard.label.QrArchiveExporter;
import assetguard.label.QrCodeGenerator;
import assetguard.manager.*;
import assetguard.service.AssetInsightService;
import assetguard.service.GeminiInsightClient;
import assetguard.service.InsightClient;
import assetguard.store.EntityStore;
import assetguard.ui.SignaturePad;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.sql.SQLException;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Everything one running instance needs: the connection pool, the store and the services built on
 * it. Nothing here is global, so several sessions can coexist (tests open one per test).
 */
public class AssetGuardSession implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(AssetGuardSession.class);

    private final AppConfig config;
    private final DatabaseConnection database;
    private final ExecutorService workers;
    private final EntityStore store;
    private final LifecycleService lifecycleService;
    private final NotificationCenter notificationCenter;
    private final BulkEditService bulkEditService;
    private final AssetCatalogService catalogService;
    private final AssetCsvService csvService;
    private final QrArchiveExporter qrArchiveExporter;
    private final DirectoryService directoryService;
    private final LedgerService ledgerService;
    private final DashboardDataService dashboardDataService;
    private final ReportingService reportingService;
    private final AssetInsightService insightService;
    private final AdminGate adminGate;

    private AssetGuardSession(AppConfig config, Clock clock, DatabaseConnection database, InsightClient insightClient) {
        this.config = config;
        this.database = database;
        this.workers = Executors.newFixedThreadPool(config.getQrThreads());
        ObjectMapper objectMapper = new ObjectMapper();

        this.store = new EntityStore(database, objectMapper);
        this.lifecycleService = new LifecycleService(store, clock);
        this.notificationCenter = new NotificationCenter(store, new NotificationDeriver(config.getOverdueThreshold()), clock);
        this.bulkEditService = new BulkEditService(store);
        this.catalogService = new AssetCatalogService(store, clock);
        this.csvService = new AssetCsvService(catalogService, clock);
        this.qrArchiveExporter = new QrArchiveExporter(new QrCodeGenerator(config.getQrSize(), config.getQrMargin()), workers, config.getQrFolder(), clock);
        this.directoryService = new DirectoryService(store);
        this.ledgerService = new LedgerService(store);
        this.dashboardDataService = new DashboardDataService(store);
        this.reportingService = new ReportingService(clock);
        this.insightService = new AssetInsightService(store, insightClient, config.getInsightApiKey().orElse(null), objectMapper, workers, clock);
        this.adminGate = new AdminGate(config.getAdminDefaultPassword());

        store.addListener(notificationCenter);
    }

    public static AssetGuardSession open(AppConfig config) throws SQLException, IOException {
        return open(config, Clock.systemDefaultZone());
    }

    public static AssetGuardSession open(AppConfig config, Clock clock) throws SQLException, IOException {
        return open(config, clock, new GeminiInsightClient(config.getInsightEndpoint(), new ObjectMapper()));
    }

    public static AssetGuardSession open(AppConfig config, Clock clock, InsightClient insightClient) throws SQLException, IOException {
        DatabaseConnection database = new DatabaseConnection(config);
        AssetGuardSession session = null;
        try {
            database.initializeSchema();
            session = new AssetGuardSession(config, clock, database, insightClient);
            session.notificationCenter.refresh();
            logger.info("Session opened on {}", config.getDatabaseUrl());
            return session;
        } catch (SQLException | IOException | RuntimeException e) {
            if (session != null) {
                session.close();
            } else {
                database.close();
            }
            throw e;
        }
    }

    /**
     * A signature pad sized for a container of the given width (zero or less if unknown).
     */
    public SignaturePad newSignaturePad(int containerWidth) {
        return new SignaturePad(containerWidth > 0 ? containerWidth : config.getSignatureDefaultWidth(), config.getSignatureHeight());
    }

    public AppConfig getConfig() {
        return config;
    }

    public EntityStore getStore() {
        return store;
    }

    public LifecycleService getLifecycleService() {
        return lifecycleService;
    }

    public NotificationCenter getNotificationCenter() {
        return notificationCenter;
    }

    public BulkEditService getBulkEditService() {
        return bulkEditService;
    }

    public AssetCatalogService getCatalogService() {
        return catalogService;
    }

    public AssetCsvService getCsvService() {
        return csvService;
    }

    public QrArchiveExporter getQrArchiveExporter() {
        return qrArchiveExporter;
    }

    public DirectoryService getDirectoryService() {
        return directoryService;
    }

    public LedgerService getLedgerService() {
        return ledgerService;
    }

    public DashboardDataService getDashboardDataService() {
        return dashboardDataService;
    }

    public ReportingService getReportingService() {
        return reportingService;
    }

    public AssetInsightService getInsightService() {
        return insightService;
    }

    public AdminGate getAdminGate() {
        return adminGate;
    }

    @Override
    public void close() {
        store.removeListener(notificationCenter);
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                logger.warn("Worker pool did not stop in time; forcing shutdown");
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        database.close();
        logger.info("Session closed");
    }
}
