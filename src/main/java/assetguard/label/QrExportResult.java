package assetguard.label;

import java.util.List;

/**
 * @param archive      the zip bytes
 * @param encodedCount number of QR images in the archive
 * @param skippedIds   asset ids whose QR code could not be generated
 */
public record QrExportResult(byte[] archive, int encodedCount, List<String> skippedIds) {

    public QrExportResult {
        skippedIds = List.copyOf(skippedIds);
    }
}
