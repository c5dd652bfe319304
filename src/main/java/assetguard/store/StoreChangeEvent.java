package assetguard.store;

import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Raised after a committed write. {@code ids} holds the ids of every record the write touched,
 * across all kinds.
 */
public record StoreChangeEvent(Set<EntityKind> kinds, Set<String> ids) {

    public StoreChangeEvent {
        kinds = Set.copyOf(kinds);
        ids = Set.copyOf(ids);
    }

    public static StoreChangeEvent of(EntityKind kind, String id) {
        return new StoreChangeEvent(EnumSet.of(kind), Set.of(id));
    }

    public static StoreChangeEvent of(EntityKind kind, Collection<String> ids) {
        return new StoreChangeEvent(EnumSet.of(kind), new LinkedHashSet<>(ids));
    }

    public static StoreChangeEvent of(Set<EntityKind> kinds, Collection<String> ids) {
        return new StoreChangeEvent(kinds, new LinkedHashSet<>(ids));
    }

    public boolean affects(EntityKind kind) {
        return kinds.contains(kind);
    }
}
