package io.debugtoolbar.core.toolbar;

import io.debugtoolbar.core.context.RequestContext;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.UUID;

/**
 * Bounded in-memory history of recent requests.
 *
 * <p>
 * Keeps at most {@code maxSize} entries; storing beyond that evicts the oldest. Storing an id
 * that is already present replaces it and makes it the newest. Thread-safe.
 */
public final class ToolbarStorage {

    private final int maxSize;
    private final LinkedHashMap<UUID, StoredRequest> entries = new LinkedHashMap<>();

    public ToolbarStorage(int maxSize) {
        if (maxSize < 1) {
            throw new IllegalArgumentException("maxSize must be at least 1, got " + maxSize);
        }
        this.maxSize = maxSize;
    }

    /** Stores an entry, evicting the oldest ones above the size bound. */
    public synchronized void store(StoredRequest request) {
        entries.remove(request.requestId());
        entries.put(request.requestId(), request);
        Iterator<UUID> oldest = entries.keySet().iterator();
        while (entries.size() > maxSize && oldest.hasNext()) {
            oldest.next();
            oldest.remove();
        }
    }

    /** Snapshots a context and stores it. */
    public void storeFromContext(RequestContext context) {
        store(StoredRequest.from(context));
    }

    /** The entry for an id, or {@code null}. */
    public synchronized StoredRequest get(UUID requestId) {
        return entries.get(requestId);
    }

    /** Every entry, newest first. */
    public synchronized List<StoredRequest> all() {
        List<StoredRequest> list = new ArrayList<>(entries.values());
        Collections.reverse(list);
        return Collections.unmodifiableList(list);
    }

    public synchronized void clear() {
        entries.clear();
    }

    public synchronized int size() {
        return entries.size();
    }

    public int maxSize() {
        return maxSize;
    }

    /** Ids in storage order, oldest first. */
    synchronized List<UUID> ids() {
        return List.copyOf(entries.keySet());
    }

    @Override
    public synchronized String toString() {
        return "ToolbarStorage[" + entries.size() + "/" + maxSize + "]";
    }
}
