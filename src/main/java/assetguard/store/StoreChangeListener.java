package assetguard.store;

@FunctionalInterface
public interface StoreChangeListener {
    void onStoreChanged(StoreChangeEvent event);
}
