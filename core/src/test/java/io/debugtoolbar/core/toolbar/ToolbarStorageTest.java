package io.debugtoolbar.core.toolbar;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.debugtoolbar.core.context.RequestContext;
import java.time.Instant;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class ToolbarStorageTest {

    private static StoredRequest entry(UUID id) {
        return new StoredRequest(id, null, null, null, Instant.now());
    }

    @Test
    void evictsOldestBeyondBound() {
        ToolbarStorage storage = new ToolbarStorage(2);
        UUID a = UUID.randomUUID();
        UUID b = UUID.randomUUID();
        UUID c = UUID.randomUUID();

        storage.store(entry(a));
        storage.store(entry(b));
        storage.store(entry(c));

        assertThat(storage.size()).isEqualTo(2);
        assertThat(storage.get(a)).isNull();
        assertThat(storage.ids()).containsExactly(b, c);
    }

    @Test
    void allIsNewestFirst() {
        ToolbarStorage storage = new ToolbarStorage(5);
        UUID a = UUID.randomUUID();
        UUID b = UUID.randomUUID();
        storage.store(entry(a));
        storage.store(entry(b));

        assertThat(storage.all()).extracting(StoredRequest::requestId).containsExactly(b, a);
    }

    @Test
    void restoringMovesEntryToNewest() {
        ToolbarStorage storage = new ToolbarStorage(2);
        UUID a = UUID.randomUUID();
        UUID b = UUID.randomUUID();
        UUID c = UUID.randomUUID();
        storage.store(entry(a));
        storage.store(entry(b));

        storage.store(entry(a));
        storage.store(entry(c));

        assertThat(storage.ids()).containsExactly(a, c);
    }

    @Test
    void snapshotsContext() {
        ToolbarStorage storage = new ToolbarStorage(3);
        RequestContext context = new RequestContext();
        context.putMetadata("path", "/x");
        context.recordTiming(DebugToolbar.TOTAL_TIME, 0.25);

        storage.storeFromContext(context);
        context.putMetadata("path", "/changed");

        StoredRequest stored = storage.get(context.requestId());
        assertThat(stored.metadata()).containsEntry("path", "/x");
        assertThat(stored.totalTime()).isEqualTo(0.25);
        assertThat(stored.panelData()).isEmpty();
    }

    @Test
    void clearEmptiesHistory() {
        ToolbarStorage storage = new ToolbarStorage(3);
        storage.store(entry(UUID.randomUUID()));

        storage.clear();

        assertThat(storage.size()).isZero();
        assertThat(storage.all()).isEmpty();
    }

    @Test
    void rejectsZeroBound() {
        assertThatThrownBy(() -> new ToolbarStorage(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
