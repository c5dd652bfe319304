package assetguard.label;

import assetguard.data.Asset;
import assetguard.exception.EncodingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Batch QR export: one PNG per asset id, generated in parallel and packed into a single zip under
 * one folder. An asset whose code cannot be generated is left out and reported, and the rest of
 * the batch still goes through.
 */
public class QrArchiveExporter {

    private static final Logger logger = LoggerFactory.getLogger(QrArchiveExporter.class);

    private final QrCodeGenerator generator;
    private final Executor executor;
    private final String folder;
    private final Clock clock;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public QrArchiveExporter(QrCodeGenerator generator, Executor executor, String folder, Clock clock) {
        this.generator = generator;
        this.executor = executor;
        this.folder = folder;
        this.clock = clock;
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Generates a QR code for every asset and returns the zip. Entries follow the input order and are
     * named {@code <folder>/<id>_qr.png}. Duplicate ids are exported once.
     *
     * @throws IllegalArgumentException if {@code assets} is empty
     */
    public QrExportResult export(List<Asset> assets, ExportProgressListener listener) throws IOException {
        if (assets.isEmpty()) {
            throw new IllegalArgumentException("There are no assets to export.");
        }
        Set<String> ids = new LinkedHashSet<>();
        for (Asset asset : assets) {
            ids.add(asset.getId());
        }

        running.set(true);
        listener.onRunningChanged(true);
        try {
            logger.info("Starting QR export for {} assets", ids.size());
            int total = ids.size();
            AtomicInteger completed = new AtomicInteger();
            List<CompletableFuture<EncodedQr>> futures = new ArrayList<>();
            for (String id : ids) {
                futures.add(CompletableFuture.supplyAsync(() -> {
                    EncodedQr encoded = encode(id);
                    listener.onProgress(completed.incrementAndGet(), total, "Generated QR code for " + id);
                    return encoded;
                }, executor));
            }
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

            List<String> skippedIds = new ArrayList<>();
            int encodedCount = 0;
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            try (ZipOutputStream zip = new ZipOutputStream(out)) {
                zip.putNextEntry(new ZipEntry(folder + "/"));
                zip.closeEntry();
                for (CompletableFuture<EncodedQr> future : futures) {
                    EncodedQr encoded = future.join();
                    if (encoded.png() == null) {
                        skippedIds.add(encoded.assetId());
                        continue;
                    }
                    zip.putNextEntry(new ZipEntry(entryName(encoded.assetId())));
                    zip.write(encoded.png());
                    zip.closeEntry();
                    encodedCount++;
                }
            }

            listener.onProgress(total, total, "Archive ready");
            logger.info("QR export finished: {} encoded, {} skipped", encodedCount, skippedIds.size());
            return new QrExportResult(out.toByteArray(), encodedCount, skippedIds);
        } finally {
            running.set(false);
            listener.onRunningChanged(false);
        }
    }

    /**
     * Writes the archive into {@code directory} under {@link #archiveFileName()}.
     */
    public Path exportToDirectory(List<Asset> assets, Path directory, ExportProgressListener listener) throws IOException {
        QrExportResult result = export(assets, listener);
        Path target = directory.resolve(archiveFileName());
        Files.write(target, result.archive());
        logger.info("QR archive written to {}", target);
        return target;
    }

    public String archiveFileName() {
        return folder + "_" + LocalDate.now(clock) + ".zip";
    }

    String entryName(String assetId) {
        return folder + "/" + assetId.replace('/', '_').replace('\\', '_') + "_qr.png";
    }

    private EncodedQr encode(String assetId) {
        try {
            return new EncodedQr(assetId, generator.generatePng(assetId));
        } catch (EncodingException e) {
            logger.warn("Skipping QR code for asset {}: {}", assetId, e.getMessage(), e);
            return new EncodedQr(assetId, null);
        } catch (RuntimeException e) {
            logger.error("QR generation failed for asset {}", assetId, e);
            return new EncodedQr(assetId, null);
        }
    }

    private record EncodedQr(String assetId, byte[] png) {
    }
}
