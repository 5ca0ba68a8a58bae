package space.ketterling.hydro.db;

import space.ketterling.hydro.error.StorageException;
import space.ketterling.hydro.model.CanonicalPoint;
import space.ketterling.hydro.model.DatasetCategory;
import space.ketterling.hydro.model.SeriesKey;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

/**
 * Map-backed store for tests. Can be told to fail the next N upserts.
 */
public class InMemoryMeasurementStore implements MeasurementStore {

    private final Map<DatasetCategory, Map<SeriesKey, NavigableMap<Instant, CanonicalPoint>>> data =
            new ConcurrentHashMap<>();
    private final AtomicInteger upserts = new AtomicInteger();
    private final AtomicInteger failuresLeft = new AtomicInteger();
    private volatile Predicate<CanonicalPoint> alwaysFail = p -> false;

    public void failNext(int n) {
        failuresLeft.set(n);
    }

    public void failWhen(Predicate<CanonicalPoint> p) {
        alwaysFail = p;
    }

    public int upsertCalls() {
        return upserts.get();
    }

    public int size(DatasetCategory category) {
        int n = 0;
        for (NavigableMap<Instant, CanonicalPoint> m : series(category).values()) {
            n += m.size();
        }
        return n;
    }

    @Override
    public void upsert(DatasetCategory category, CanonicalPoint point) {
        upserts.incrementAndGet();
        if (alwaysFail.test(point) || failuresLeft.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
            throw new StorageException("simulated failure", null);
        }
        series(category).computeIfAbsent(point.key(), k -> new ConcurrentSkipListMap<>())
                .put(point.timestamp(), point);
    }

    @Override
    public List<CanonicalPoint> query(DatasetCategory category, String location, String dataset, Instant start,
            Instant end) {
        NavigableMap<Instant, CanonicalPoint> m = series(category).get(new SeriesKey(location, dataset));
        return m == null ? List.of() : new ArrayList<>(m.subMap(start, true, end, true).values());
    }

    @Override
    public List<CanonicalPoint> queryAll(DatasetCategory category, String location, String dataset) {
        NavigableMap<Instant, CanonicalPoint> m = series(category).get(new SeriesKey(location, dataset));
        return m == null ? List.of() : new ArrayList<>(m.values());
    }

    @Override
    public Optional<Instant> latestTimestamp(DatasetCategory category, String location, String dataset) {
        NavigableMap<Instant, CanonicalPoint> m = series(category).get(new SeriesKey(location, dataset));
        return m == null || m.isEmpty() ? Optional.empty() : Optional.of(m.lastKey());
    }

    @Override
    public Optional<Instant> latestNonNullTimestamp(DatasetCategory category, String location, String dataset) {
        NavigableMap<Instant, CanonicalPoint> m = series(category).get(new SeriesKey(location, dataset));
        if (m == null) {
            return Optional.empty();
        }
        for (CanonicalPoint p : m.descendingMap().values()) {
            if (p.hasValue()) {
                return Optional.of(p.timestamp());
            }
        }
        return Optional.empty();
    }

    @Override
    public List<SeriesKey> seriesKeys(DatasetCategory category) {
        List<SeriesKey> keys = new ArrayList<>(series(category).keySet());
        keys.sort((a, b) -> (a.location() + "\u0000" + a.dataset()).compareTo(b.location() + "\u0000" + b.dataset()));
        return keys;
    }

    private Map<SeriesKey, NavigableMap<Instant, CanonicalPoint>> series(DatasetCategory category) {
        return data.computeIfAbsent(category, c -> new ConcurrentHashMap<>());
    }
}
