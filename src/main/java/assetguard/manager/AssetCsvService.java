package assetguard.manager;

import assetguard.data.Asset;
import assetguard.exception.DuplicateIdException;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.CSVWriter;
import com.opencsv.exceptions.CsvMalformedLineException;
import com.opencsv.exceptions.CsvValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.StringReader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.SQLException;
import java.time.Clock;
import java.time.LocalDate;
import java.util.*;

/**
 * Moves assets in and out of CSV. Export writes the visible asset list with one extra column per
 * custom feature; import turns each data row into a brand-new asset.
 */
public class AssetCsvService {

    private static final Logger logger = LoggerFactory.getLogger(AssetCsvService.class);

    static final String[] BASE_HEADERS = {"ID", "Name", "Category", "Model", "SN", "Status", "Holder", "Date", "Desc"};
    static final String IMPORT_DESCRIPTION = "CSV Import";
    private static final char BOM = '\uFEFF';

    private final AssetCatalogService catalogService;
    private final Clock clock;

    public AssetCsvService(AssetCatalogService catalogService, Clock clock) {
        this.catalogService = catalogService;
        this.clock = clock;
    }

    // --- Export ---

    /**
     * Renders {@code assets} as UTF-8 CSV bytes, starting with a byte-order mark so spreadsheet
     * tools detect the encoding. Fields are quoted only when they need it.
     */
    public byte[] exportCsv(List<Asset> assets) throws IOException {
        List<String> featureKeys = AssetCatalogService.customFeatureKeys(assets);
        List<String> header = new ArrayList<>(Arrays.asList(BASE_HEADERS));
        header.addAll(featureKeys);

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (Writer streamWriter = new OutputStreamWriter(out, StandardCharsets.UTF_8); CSVWriter writer = new CSVWriter(streamWriter)) {
            streamWriter.write(BOM);
            writer.writeNext(header.toArray(new String[0]), false);
            for (Asset asset : assets) {
                writer.writeNext(toRow(asset, featureKeys), false);
            }
        }
        logger.info("Exported {} assets with {} custom feature columns", assets.size(), featureKeys.size());
        return out.toByteArray();
    }

    /**
     * Writes the export into {@code directory} under {@link #exportFileName()}.
     *
     * @return the written file
     */
    public Path exportTo(List<Asset> assets, Path directory) throws IOException {
        Path target = directory.resolve(exportFileName());
        Files.write(target, exportCsv(assets));
        logger.info("CSV export written to {}", target);
        return target;
    }

    public String exportFileName() {
        return "assets_export_" + LocalDate.now(clock) + ".csv";
    }

    private String[] toRow(Asset asset, List<String> featureKeys) {
        List<String> row = new ArrayList<>();
        row.add(asset.getId());
        row.add(asset.getName());
        row.add(asset.getCategory());
        row.add(asset.getModel());
        row.add(asset.getSerialNumber());
        row.add(asset.getStatus().getLabel());
        row.add(asset.getCurrentHolder());
        row.add(asset.getPurchaseDate());
        row.add(asset.getDescription());
        for (String key : featureKeys) {
            row.add(asset.getCustomFeatures().get(key));
        }
        return row.stream().map(value -> value == null ? "" : value).toArray(String[]::new);
    }

    // --- Import ---

    public ImportResult importFile(Path file) throws IOException {
        String content = Files.readString(file, StandardCharsets.UTF_8);
        return importCsv(file.getFileName().toString(), content);
    }

    /**
     * Creates one asset per usable data row of {@code content}. The first record is the header. If it
     * has a Name column, columns are matched by header name; otherwise the first four fields are read
     * as name, category, model and serial. Quoted fields may span lines. Rows without a name, rows
     * that do not parse and rows the store refuses are skipped and counted. An unterminated quote
     * runs to the end of the input, so it ends the import after the rows read before it.
     */
    public ImportResult importCsv(String source, String content) {
        logger.info("--- Starting CSV import from {} ---", source);
        List<Asset> imported = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        int skipped = 0;

        try (CSVReader reader = new CSVReaderBuilder(new StringReader(stripBom(content))).build()) {
            String[] headerFields = reader.readNext();
            if (headerFields == null) {
                logger.warn("CSV source {} is empty.", source);
                return new ImportResult(source, List.of(), 0, List.of());
            }
            Map<String, Integer> headers = readHeader(headerFields);
            if (headers == null) {
                logger.info("No Name column in header of {}; reading columns by position.", source);
            }

            while (true) {
                long lineNumber = reader.getLinesRead() + 1;
                String[] fields;
                try {
                    fields = reader.readNext();
                } catch (CsvMalformedLineException e) {
                    logger.warn("Skipping unparseable record at line {} of {}: {}", lineNumber, source, e.getMessage());
                    errors.add("Line " + lineNumber + ": " + e.getMessage());
                    skipped++;
                    break;
                } catch (CsvValidationException e) {
                    logger.warn("Skipping invalid record at line {} of {}: {}", lineNumber, source, e.getMessage());
                    errors.add("Line " + lineNumber + ": " + e.getMessage());
                    skipped++;
                    continue;
                }
                if (fields == null) {
                    break;
                }
                if (isBlankRecord(fields)) {
                    continue;
                }

                Asset draft = toDraft(fields, headers);
                if (draft.getName() == null) {
                    logger.debug("Skipping line {} of {}: no name", lineNumber, source);
                    skipped++;
                    continue;
                }
                try {
                    imported.add(catalogService.addAsset(draft));
                } catch (DuplicateIdException e) {
                    logger.warn("Skipping line {} of {}: {}", lineNumber, source, e.getMessage());
                    errors.add("Line " + lineNumber + ": " + e.getMessage());
                    skipped++;
                } catch (SQLException e) {
                    logger.warn("Skipping line {} of {}: the store rejected the row", lineNumber, source, e);
                    errors.add("Line " + lineNumber + ": " + e.getMessage());
                    skipped++;
                }
            }
        } catch (IOException | CsvValidationException e) {
            // Rows added before the failure stay.
            logger.error("CSV import from {} stopped early", source, e);
            errors.add("Import stopped: " + e.getMessage());
        }

        logger.info("--- Finished CSV import from {}: {} imported, {} skipped ---", source, imported.size(), skipped);
        return new ImportResult(source, imported, skipped, errors);
    }

    private Asset toDraft(String[] fields, Map<String, Integer> headers) {
        Asset draft = new Asset();
        if (headers != null) {
            draft.setName(getValue(fields, headers, "name"));
            draft.setCategory(getValue(fields, headers, "category"));
            draft.setModel(getValue(fields, headers, "model"));
            draft.setSerialNumber(getValue(fields, headers, "sn", "serial", "serial number"));
        } else {
            draft.setName(getValue(fields, 0));
            draft.setCategory(getValue(fields, 1));
            draft.setModel(getValue(fields, 2));
            draft.setSerialNumber(getValue(fields, 3));
        }
        draft.setDescription(IMPORT_DESCRIPTION);
        return draft;
    }

    /**
     * @return lower-cased header names mapped to their column, or null when there is no Name column
     */
    private Map<String, Integer> readHeader(String[] names) {
        Map<String, Integer> map = new HashMap<>();
        for (int i = 0; i < names.length; i++) {
            map.putIfAbsent(names[i].trim().toLowerCase(Locale.ROOT), i);
        }
        return map.containsKey("name") ? map : null;
    }

    private static boolean isBlankRecord(String[] fields) {
        return fields.length == 1 && (fields[0] == null || fields[0].isBlank());
    }

    private String getValue(String[] fields, Map<String, Integer> headers, String... possibleNames) {
        for (String name : possibleNames) {
            Integer index = headers.get(name);
            if (index != null) {
                String value = getValue(fields, index);
                if (value != null) {
                    return value;
                }
            }
        }
        return null;
    }

    private String getValue(String[] fields, int index) {
        if (index >= fields.length || fields[index] == null) {
            return null;
        }
        String value = fields[index].trim();
        return value.isEmpty() ? null : value;
    }

    private static String stripBom(String content) {
        return !content.isEmpty() && content.charAt(0) == BOM ? content.substring(1) : content;
    }
}
