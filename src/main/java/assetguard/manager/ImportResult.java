package assetguard.manager;

import assetguard.data.Asset;

import java.util.List;

public record ImportResult(String source, List<Asset> imported, int skippedRows, List<String> errors) {

    public ImportResult {
        imported = List.copyOf(imported);
        errors = List.copyOf(errors);
    }

    public int successfulCount() {
        return imported.size();
    }
}
