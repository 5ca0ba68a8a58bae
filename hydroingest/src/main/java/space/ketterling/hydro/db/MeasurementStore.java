package space.ketterling.hydro.db;

import space.ketterling.hydro.model.CanonicalPoint;
import space.ketterling.hydro.model.DatasetCategory;
import space.ketterling.hydro.model.SeriesKey;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Keyed upsert store for canonical points. The category selects the table;
 * (location, dataset, timestamp) is the key inside it.
 *
 * <p>
 * Writes to the same key are last-write-wins. Read methods return points in
 * ascending timestamp order, explicit null values included.
 * </p>
 */
public interface MeasurementStore {

    /**
     * Inserts or overwrites one point.
     *
     * @throws space.ketterling.hydro.error.StorageException when the write fails
     */
    void upsert(DatasetCategory category, CanonicalPoint point);

    /** Points with {@code start <= timestamp <= end}. */
    List<CanonicalPoint> query(DatasetCategory category, String location, String dataset, Instant start,
            Instant end);

    List<CanonicalPoint> queryAll(DatasetCategory category, String location, String dataset);

    Optional<Instant> latestTimestamp(DatasetCategory category, String location, String dataset);

    Optional<Instant> latestNonNullTimestamp(DatasetCategory category, String location, String dataset);

    /** Every (location, dataset) pair with at least one stored row. */
    List<SeriesKey> seriesKeys(DatasetCategory category);
}
