package assetguard.manager;

import assetguard.data.Asset;
import assetguard.data.AssetStatus;
import org.apache.poi.ss.usermodel.*;
import org.apache.poi.ss.util.AreaReference;
import org.apache.poi.ss.util.CellReference;
import org.apache.poi.xssf.usermodel.XSSFSheet;
import org.apache.poi.xssf.usermodel.XSSFTable;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.openxmlformats.schemas.spreadsheetml.x2006.main.CTTable;
import org.openxmlformats.schemas.spreadsheetml.x2006.main.CTTableStyleInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.util.*;

/**
 * Excel report of an asset list: the same columns as the CSV export on an "Assets" sheet with an
 * auto-filter table, and a "Summary" sheet with counts per status.
 */
public class ReportingService {
    private static final Logger logger = LoggerFactory.getLogger(ReportingService.class);

    static final String ASSETS_SHEET = "Assets";
    static final String SUMMARY_SHEET = "Summary";
    private static final int COLUMN_WIDTH_CHARS = 18;

    private final Clock clock;

    public ReportingService(Clock clock) {
        this.clock = clock;
    }

    public byte[] exportToXlsx(List<Asset> assets) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        writeWorkbook(assets, out);
        return out.toByteArray();
    }

    public Path exportToXlsx(List<Asset> assets, Path directory) throws IOException {
        Path target = directory.resolve("assets_report_" + LocalDate.now(clock) + ".xlsx");
        try (OutputStream fileOut = Files.newOutputStream(target)) {
            writeWorkbook(assets, fileOut);
        }
        logger.info("XLSX report written to {}", target);
        return target;
    }

    private void writeWorkbook(List<Asset> assets, OutputStream out) throws IOException {
        List<String> featureKeys = AssetCatalogService.customFeatureKeys(assets);
        List<String> headers = new ArrayList<>(Arrays.asList(AssetCsvService.BASE_HEADERS));
        headers.addAll(featureKeys);

        try (XSSFWorkbook workbook = new XSSFWorkbook()) {
            XSSFSheet dataSheet = workbook.createSheet(ASSETS_SHEET);
            XSSFSheet summarySheet = workbook.createSheet(SUMMARY_SHEET);

            CellStyle headerStyle = workbook.createCellStyle();
            Font headerFont = workbook.createFont();
            headerFont.setBold(true);
            headerStyle.setFont(headerFont);

            Row headerRow = dataSheet.createRow(0);
            for (int i = 0; i < headers.size(); i++) {
                Cell cell = headerRow.createCell(i);
                cell.setCellValue(headers.get(i));
                cell.setCellStyle(headerStyle);
            }

            Map<AssetStatus, Integer> statusCounts = new EnumMap<>(AssetStatus.class);
            for (AssetStatus status : AssetStatus.values()) {
                statusCounts.put(status, 0);
            }

            int rowNum = 1;
            for (Asset asset : assets) {
                Row row = dataSheet.createRow(rowNum++);
                row.createCell(0).setCellValue(asset.getId());
                row.createCell(1).setCellValue(asset.getName());
                row.createCell(2).setCellValue(asset.getCategory());
                row.createCell(3).setCellValue(asset.getModel());
                row.createCell(4).setCellValue(asset.getSerialNumber());
                row.createCell(5).setCellValue(asset.getStatus().getLabel());
                row.createCell(6).setCellValue(nullToEmpty(asset.getCurrentHolder()));
                row.createCell(7).setCellValue(nullToEmpty(asset.getPurchaseDate()));
                row.createCell(8).setCellValue(nullToEmpty(asset.getDescription()));
                for (int k = 0; k < featureKeys.size(); k++) {
                    row.createCell(AssetCsvService.BASE_HEADERS.length + k).setCellValue(nullToEmpty(asset.getCustomFeatures().get(featureKeys.get(k))));
                }
                statusCounts.merge(asset.getStatus(), 1, Integer::sum);
            }

            if (rowNum > 1) {
                AreaReference tableArea = workbook.getCreationHelper().createAreaReference(new CellReference(0, 0), new CellReference(rowNum - 1, headers.size() - 1));
                XSSFTable table = dataSheet.createTable(tableArea);
                table.setDisplayName("AssetData");
                table.setName("AssetData");
                CTTable cttable = table.getCTTable();
                cttable.addNewAutoFilter().setRef(tableArea.formatAsString());
                CTTableStyleInfo styleInfo = cttable.addNewTableStyleInfo();
                styleInfo.setName("TableStyleMedium2");
                styleInfo.setShowRowStripes(true);
                cttable.setTableStyleInfo(styleInfo);
            }

            // autoSizeColumn needs font metrics, which headless containers may lack
            for (int i = 0; i < headers.size(); i++) {
                dataSheet.setColumnWidth(i, COLUMN_WIDTH_CHARS * 256);
            }

            buildSummarySheet(summarySheet, assets.size(), headerStyle, statusCounts);
            workbook.setActiveSheet(0);
            workbook.write(out);
        }
        logger.info("XLSX report built for {} assets", assets.size());
    }

    private void buildSummarySheet(XSSFSheet sheet, int totalAssets, CellStyle headerStyle, Map<AssetStatus, Integer> statusCounts) {
        sheet.createRow(0).createCell(0).setCellValue("Asset Summary");
        sheet.getRow(0).getCell(0).setCellStyle(headerStyle);
        sheet.createRow(2).createCell(0).setCellValue("Total Assets in Report:");
        sheet.getRow(2).createCell(1).setCellValue(totalAssets);
        sheet.createRow(4).createCell(0).setCellValue("Assets by Status:");
        sheet.getRow(4).getCell(0).setCellStyle(headerStyle);

        int summaryRowNum = 5;
        for (Map.Entry<AssetStatus, Integer> entry : statusCounts.entrySet()) {
            Row row = sheet.createRow(summaryRowNum++);
            row.createCell(0).setCellValue(entry.getKey().getLabel());
            row.createCell(1).setCellValue(entry.getValue());
        }
        sheet.setColumnWidth(0, 28 * 256);
        sheet.setColumnWidth(1, 12 * 256);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
