package io.walletstate.core.state;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

/** One page of a listing plus the token for the next one, absent once the scan is exhausted. */
public final class Page<T> {
    private final List<T> items;
    private final String nextCursor;

    public Page(List<T> items, String nextCursor) {
        this.items = Collections.unmodifiableList(items);
        this.nextCursor = nextCursor;
    }

    public List<T> items() { return items; }

    public Optional<String> nextCursor() { return Optional.ofNullable(nextCursor); }

    public boolean hasMore() { return nextCursor != null; }

    @Override
    public String toString() {
        return "Page{" + items.size() + " items" + (nextCursor != null ? ", more" : "") + "}";
    }
}
