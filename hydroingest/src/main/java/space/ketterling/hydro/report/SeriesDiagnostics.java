package space.ketterling.hydro.report;

import space.ketterling.hydro.db.MeasurementStore;
import space.ketterling.hydro.model.CanonicalPoint;
import space.ketterling.hydro.model.DatasetCategory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Explains an empty report: how many rows each location has stored and over
 * which span.
 */
public record SeriesDiagnostics(int totalRows, List<LocationSpan> locations) {

    public SeriesDiagnostics {
        locations = List.copyOf(locations);
    }

    /** {@code first}/{@code last} are null when the location has no rows. */
    public record LocationSpan(String location, int rows, int nonNullRows, Instant first, Instant last) {
    }

    public static SeriesDiagnostics inspect(MeasurementStore store, DatasetCategory category,
            List<String> locations, String dataset) {
        int total = 0;
        List<LocationSpan> spans = new ArrayList<>();
        for (String loc : locations) {
            List<CanonicalPoint> rows = store.queryAll(category, loc, dataset);
            int nonNull = 0;
            for (CanonicalPoint p : rows) {
                if (p.hasValue()) {
                    nonNull++;
                }
            }
            Instant first = rows.isEmpty() ? null : rows.get(0).timestamp();
            Instant last = rows.isEmpty() ? null : rows.get(rows.size() - 1).timestamp();
            spans.add(new LocationSpan(loc, rows.size(), nonNull, first, last));
            total += rows.size();
        }
        return new SeriesDiagnostics(total, spans);
    }
}
