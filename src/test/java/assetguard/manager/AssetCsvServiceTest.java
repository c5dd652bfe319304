package assetguard.manager;

import assetguard.AssetGuardSession;
import assetguard.data.Asset;
import assetguard.data.AssetStatus;
import assetguard.support.TestSessions;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class AssetCsvServiceTest {

    private AssetGuardSession session;
    private AssetCsvService csvService;

    @BeforeEach
    void setUp() throws Exception {
        session = TestSessions.open(TestSessions.clock());
        csvService = session.getCsvService();
    }

    @AfterEach
    void tearDown() {
        session.close();
    }

    @Test
    @DisplayName("rows without a name are skipped and the rest become new Available assets")
    void importSkipsNamelessRows() throws Exception {
        String content = "Name,Category,Model,SN\n"
                + "Drone X,Drone,V2,SN1\n"
                + ",BadRow,,\n"
                + "Tablet Y,Tablet,T1,SN2\n";

        ImportResult result = csvService.importCsv("upload.csv", content);

        assertThat(result.successfulCount()).isEqualTo(2);
        assertThat(result.skippedRows()).isEqualTo(1);
        assertThat(result.imported()).extracting(Asset::getName).containsExactly("Drone X", "Tablet Y");
        Asset drone = result.imported().get(0);
        assertThat(drone.getCategory()).isEqualTo("Drone");
        assertThat(drone.getModel()).isEqualTo("V2");
        assertThat(drone.getSerialNumber()).isEqualTo("SN1");
        assertThat(drone.getStatus()).isEqualTo(AssetStatus.AVAILABLE);
        assertThat(drone.getCurrentHolder()).isNull();
        assertThat(drone.getDescription()).isEqualTo(AssetCsvService.IMPORT_DESCRIPTION);
        assertThat(drone.getPurchaseDate()).isEqualTo("2026-03-10");
        assertThat(drone.getQrCode()).isEqualTo("qr-" + drone.getId());
        assertThat(session.getStore().listAssets()).hasSize(2);
    }

    @Test
    @DisplayName("missing optional columns fall back to defaults and ids are always generated")
    void importDefaults() throws Exception {
        ImportResult result = csvService.importCsv("upload.csv", "Name\nLaser Pointer\nLaser Pointer\n");

        assertThat(result.imported()).hasSize(2).allSatisfy(asset -> {
            assertThat(asset.getCategory()).isEqualTo(AssetCatalogService.DEFAULT_CATEGORY);
            assertThat(asset.getModel()).isEqualTo(AssetCatalogService.DEFAULT_MODEL);
            assertThat(asset.getSerialNumber()).isEqualTo(AssetCatalogService.DEFAULT_SERIAL);
            assertThat(asset.getId()).startsWith("AST-");
        });
        assertThat(result.imported().get(0).getId()).isNotEqualTo(result.imported().get(1).getId());
    }

    @Test
    @DisplayName("a header without a Name column means the first four fields are read by position")
    void positionalImport() throws Exception {
        ImportResult result = csvService.importCsv("legacy.csv", "\uFEFFa,b,c,d\nProjector,AV,P1,SN9\n");

        assertThat(result.imported()).singleElement().satisfies(asset -> {
            assertThat(asset.getName()).isEqualTo("Projector");
            assertThat(asset.getCategory()).isEqualTo("AV");
            assertThat(asset.getSerialNumber()).isEqualTo("SN9");
        });
    }

    @Test
    @DisplayName("an unterminated quote is reported with its line and the rows before it are kept")
    void malformedRowSkipped() throws Exception {
        String content = "Name,Category\nGood One,Drone\n\"Broken,Drone\nSwallowed,Drone\n";

        ImportResult result = csvService.importCsv("upload.csv", content);

        assertThat(result.imported()).extracting(Asset::getName).containsExactly("Good One");
        assertThat(result.skippedRows()).isEqualTo(1);
        assertThat(result.errors()).hasSize(1);
        assertThat(result.errors().get(0)).startsWith("Line 3");
    }

    @Test
    @DisplayName("a row the store rejects is skipped and the rows after it still import")
    void rejectedRowDoesNotAbortImport() throws Exception {
        String content = "Name,Category,Model,SN\n"
                + "Drone X,Drone,V2,SN1\n"
                + "Bad," + "C".repeat(300) + ",M,S\n"
                + "Tablet Y,Tablet,T1,SN2\n";

        ImportResult result = csvService.importCsv("upload.csv", content);

        assertThat(result.imported()).extracting(Asset::getName).containsExactly("Drone X", "Tablet Y");
        assertThat(result.skippedRows()).isEqualTo(1);
        assertThat(result.errors()).hasSize(1);
        assertThat(result.errors().get(0)).startsWith("Line 3");
        assertThat(session.getStore().listAssets()).hasSize(2);
    }

    @Test
    @DisplayName("a quoted field spanning lines stays one record and counts lines from where it starts")
    void multiLineRecord() throws Exception {
        String content = "Name,Category\n\"Tripod\nheavy\",Camera\n,Nameless\n";

        ImportResult result = csvService.importCsv("upload.csv", content);

        assertThat(result.imported()).singleElement().satisfies(asset -> {
            assertThat(asset.getName()).isEqualTo("Tripod\nheavy");
            assertThat(asset.getCategory()).isEqualTo("Camera");
        });
        assertThat(result.skippedRows()).isEqualTo(1);
        assertThat(result.errors()).isEmpty();
    }

    @Test
    @DisplayName("an empty file imports nothing")
    void emptyImport() throws Exception {
        ImportResult result = csvService.importCsv("empty.csv", "");

        assertThat(result.imported()).isEmpty();
        assertThat(result.skippedRows()).isZero();
    }

    @Test
    @DisplayName("export starts with a BOM, lists base columns then sorted feature columns")
    void exportLayout() throws Exception {
        Asset laptop = TestSessions.asset("AST-001", "MacBook Pro", "Laptop", AssetStatus.AVAILABLE);
        laptop.setCustomFeatures(Map.of("RAM", "64GB"));
        Asset camera = TestSessions.borrowedAsset("AST-002", "Sony Alpha a7 IV", "Alice Chen");
        camera.setCustomFeatures(Map.of("Color", "Black"));

        byte[] bytes = csvService.exportCsv(List.of(laptop, camera));

        assertThat(bytes).startsWith((byte) 0xEF, (byte) 0xBB, (byte) 0xBF);
        List<String> lines = new String(bytes, StandardCharsets.UTF_8).substring(1).lines().collect(Collectors.toList());
        assertThat(lines.get(0)).isEqualTo("ID,Name,Category,Model,SN,Status,Holder,Date,Desc,Color,RAM");
        assertThat(lines.get(1)).isEqualTo("AST-001,MacBook Pro,Laptop,Model-AST-001,SN-AST-001,Available,,2024-01-15,,,64GB");
        assertThat(lines.get(2)).isEqualTo("AST-002,Sony Alpha a7 IV,Camera,Model-AST-002,SN-AST-002,Borrowed,Alice Chen,2024-01-15,,Black,");
    }

    @Test
    @DisplayName("fields with commas or quotes are quoted")
    void exportQuoting() throws Exception {
        Asset asset = TestSessions.asset("AST-001", "Cable, HDMI", "AV", AssetStatus.AVAILABLE);
        asset.setDescription("the \"long\" one");

        String csv = new String(csvService.exportCsv(List.of(asset)), StandardCharsets.UTF_8);

        assertThat(csv).contains("\"Cable, HDMI\"").contains("\"the \"\"long\"\" one\"");
    }

    @Test
    @DisplayName("an exported file imports back with the same names, categories, models and serials")
    void roundTrip(@TempDir Path dir) throws Exception {
        Asset first = TestSessions.asset("AST-001", "Cable, HDMI", "AV", AssetStatus.LOST);
        Asset second = TestSessions.borrowedAsset("AST-002", "Sony Alpha a7 IV", "Alice Chen");

        Path file = csvService.exportTo(List.of(first, second), dir);
        assertThat(file.getFileName().toString()).isEqualTo("assets_export_2026-03-10.csv");
        assertThat(Files.exists(file)).isTrue();

        ImportResult result = csvService.importFile(file);

        assertThat(result.source()).isEqualTo("assets_export_2026-03-10.csv");
        assertThat(result.imported()).extracting(Asset::getName, Asset::getCategory, Asset::getModel, Asset::getSerialNumber)
                .containsExactly(
                        tuple("Cable, HDMI", "AV", "Model-AST-001", "SN-AST-001"),
                        tuple("Sony Alpha a7 IV", "Camera", "Model-AST-002", "SN-AST-002"));
        assertThat(result.imported()).allSatisfy(asset -> {
            assertThat(asset.getStatus()).isEqualTo(AssetStatus.AVAILABLE);
            assertThat(asset.getId()).isNotIn("AST-001", "AST-002");
        });
    }

    @Test
    @DisplayName("an exported description with line breaks and commas does not split the asset on re-import")
    void roundTripMultiLineDescription() throws Exception {
        Asset asset = TestSessions.asset("AST-001", "Field Recorder", "Audio", AssetStatus.AVAILABLE);
        asset.setDescription("line one\nSecond,Line,Phantom,X");

        String csv = new String(csvService.exportCsv(List.of(asset)), StandardCharsets.UTF_8);
        ImportResult result = csvService.importCsv("export.csv", csv);

        assertThat(result.errors()).isEmpty();
        assertThat(result.skippedRows()).isZero();
        assertThat(result.imported()).extracting(Asset::getName, Asset::getCategory, Asset::getModel, Asset::getSerialNumber)
                .containsExactly(tuple("Field Recorder", "Audio", "Model-AST-001", "SN-AST-001"));
    }
}
