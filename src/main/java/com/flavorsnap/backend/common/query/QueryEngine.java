package com.flavorsnap.backend.common.query;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flavorsnap.backend.common.store.RecordStore;
import com.flavorsnap.backend.common.store.StoredRecord;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;

/**
 * Filter + sort + paginate over a sequence of records, usually the result of a filtered store scan.
 * <p>
 * Offset mode slices {@code [start, start + limit)}. Cursor mode anchors on the id stored in the
 * cursor; a cursor that cannot be decoded, or whose id is gone, falls back to offset mode.
 */
@Component
public class QueryEngine {

    public static final int MIN_LIMIT = 1;
    public static final int MAX_LIMIT = 100;

    private final CursorCodec cursors;

    public QueryEngine(ObjectMapper om) {
        this.cursors = new CursorCodec(om);
    }

    /** The store evaluates the column filters; sorting and paging run on what comes back. */
    public <T extends StoredRecord<T>> PageResult<T> list(RecordStore<T> store, RecordSchema<T> schema,
                                                         ListQuery query, int defaultLimit) {
        ListQuery q = (query == null) ? ListQuery.empty() : query;
        return list(store.scan(schema.storeFilter(q)), schema, q, defaultLimit);
    }

    public <T> PageResult<T> list(Collection<T> records, RecordSchema<T> schema, ListQuery query, int defaultLimit) {
        ListQuery q = (query == null) ? ListQuery.empty() : query;

        RecordSchema.ResolvedSort sort = schema.resolveSort(q.sortBy(), q.sortDir());
        List<T> sorted = records.stream()
                .filter(schema.filter(q))
                .sorted(schema.comparator(sort))
                .toList();

        int total = sorted.size();
        int limit = clampLimit(q.limit(), defaultLimit);
        Window w = window(sorted, schema, q, limit);

        int from = Math.min(w.start(), total);
        int to = Math.max(from, Math.min(w.end(), total));
        List<T> items = List.copyOf(sorted.subList(from, to));

        String next = null;
        if (items.size() == limit && to < total) {
            T last = items.get(items.size() - 1);
            next = cursors.encode(Cursor.after(schema.cursorKey(sort, last), schema.idOf(last)));
        }

        String prev = null;
        if (w.start() > 0) {
            if (items.isEmpty()) {
                prev = cursors.encode(Cursor.beforeEnd());
            } else {
                T first = items.get(0);
                prev = cursors.encode(Cursor.before(schema.cursorKey(sort, first), schema.idOf(first)));
            }
        }

        int totalPages = total == 0 ? 0 : (int) (((long) total + limit - 1) / limit);
        Pagination p = new Pagination(
                w.start() / limit + 1,
                limit,
                w.start(),
                total,
                totalPages,
                items.size(),
                to < total,
                w.start() > 0,
                next,
                prev
        );
        return new PageResult<>(items, p);
    }

    public static int clampLimit(Integer requested, int defaultLimit) {
        int v = (requested == null) ? defaultLimit : requested;
        return Math.max(MIN_LIMIT, Math.min(MAX_LIMIT, v));
    }

    private <T> Window window(List<T> sorted, RecordSchema<T> schema, ListQuery q, int limit) {
        Cursor c = cursors.decodeOrNull(q.cursor());
        if (c != null) {
            int anchor = (c.isBefore() && c.id() == null) ? sorted.size() : indexOf(sorted, schema, c.id());
            if (anchor >= 0) {
                if (c.isAfter()) {
                    return new Window(anchor + 1, anchor + 1 + limit);
                }
                return new Window(Math.max(0, anchor - limit), anchor);
            }
            // stale cursor：id 已不在結果裡 -> 當作沒帶 cursor
        }

        long start;
        if (q.offset() != null) {
            start = Math.max(0, q.offset());
        } else {
            int page = (q.page() == null || q.page() < 1) ? 1 : q.page();
            start = (long) (page - 1) * limit;
        }
        int s = (int) Math.min(start, Integer.MAX_VALUE - (long) limit);
        return new Window(s, s + limit);
    }

    private static <T> int indexOf(List<T> sorted, RecordSchema<T> schema, String id) {
        if (id == null) return -1;
        for (int i = 0; i < sorted.size(); i++) {
            if (id.equals(schema.idOf(sorted.get(i)))) return i;
        }
        return -1;
    }

    private record Window(int start, int end) {}
}
