package space.ketterling.hydro.report;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.hydro.db.MeasurementStore;
import space.ketterling.hydro.error.StorageException;
import space.ketterling.hydro.model.DatasetCategory;
import space.ketterling.hydro.model.FetchWindow;
import space.ketterling.hydro.model.Series;
import space.ketterling.hydro.model.SeriesKey;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Read side: selects a window, collapses or splits the rows and computes
 * stats. Also drives the bulk graph export.
 */
public class ReportService {
    private static final Logger log = LoggerFactory.getLogger(ReportService.class);
    private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("yyyyMMdd").withZone(ZoneOffset.UTC);

    private final MeasurementStore store;
    private final WindowSelector selector;

    public ReportService(MeasurementStore store, WindowSelector selector) {
        this.store = store;
        this.selector = selector;
    }

    public SeriesReport report(DatasetCategory category, String location, String dataset, FetchWindow requested,
            boolean split) {
        return report(category, location, List.of(location), dataset, requested, split);
    }

    /**
     * Reports {@code locations} together under {@code label}.
     *
     * @param requested null for the default trailing window
     * @param split     true to split duplicate timestamps into sub-series,
     *                  false to keep the last row per timestamp
     */
    public SeriesReport report(DatasetCategory category, String label, List<String> locations, String dataset,
            FetchWindow requested, boolean split) {
        SeriesKey key = new SeriesKey(label, dataset);
        WindowSelection sel = selector.select(category, locations, dataset, requested);
        if (sel.isEmpty()) {
            SeriesDiagnostics diag = SeriesDiagnostics.inspect(store, category, locations, dataset);
            log.info("no data for {} {} ({} stored rows)", label, dataset, diag.totalRows());
            return new SeriesReport(key, sel.tier(), sel.window(), List.of(), SeriesStats.of(Series.empty(key)),
                    diag);
        }
        List<Series> series = split
                ? SeriesSplitter.split(key, sel.rows())
                : List.of(SeriesSplitter.collapse(key, sel.rows()));
        return new SeriesReport(key, sel.tier(), sel.window(), series, SeriesStats.of(series.get(0)), null);
    }

    /**
     * Exports every stored series of every category, split into sub-series. A
     * series that cannot be read or written is logged and skipped.
     */
    public ExportSummary exportAll(SeriesExporter exporter) {
        int files = 0;
        List<String> failed = new ArrayList<>();
        for (DatasetCategory category : DatasetCategory.values()) {
            List<SeriesKey> keys;
            try {
                keys = store.seriesKeys(category);
            } catch (StorageException e) {
                log.warn("export skipped {}: {}", category.table(), e.getMessage());
                failed.add(category.table());
                continue;
            }
            for (SeriesKey key : keys) {
                try {
                    files += exportSeries(exporter, category, key);
                } catch (RuntimeException e) {
                    log.warn("export failed for {} {}/{}: {}", category.table(), key.location(), key.dataset(),
                            e.getMessage());
                    failed.add(category.table() + ":" + key.location() + "/" + key.dataset());
                }
            }
        }
        log.info("exported {} series file(s), {} failure(s)", files, failed.size());
        return new ExportSummary(files, failed);
    }

    private int exportSeries(SeriesExporter exporter, DatasetCategory category, SeriesKey key) {
        SeriesReport r = report(category, key.location(), key.dataset(), null, true);
        int files = 0;
        for (int i = 0; i < r.series().size(); i++) {
            Series s = r.series().get(i);
            if (!s.isEmpty()) {
                exporter.export(s, exportLabel(key, r.window(), i));
                files++;
            }
        }
        return files;
    }

    /**
     * {@code <location>__<dataset>__<yyyyMMdd>_<yyyyMMdd>} with {@code __<n>}
     * appended for sub-series after the first.
     */
    static String exportLabel(SeriesKey key, FetchWindow window, int index) {
        String base = safe(key.location()) + "__" + safe(key.dataset()) + "__"
                + DAY.format(window.start()) + "_" + DAY.format(window.end());
        return index == 0 ? base : base + "__" + index;
    }

    private static String safe(String s) {
        return s.replaceAll("[^A-Za-z0-9._-]+", "_");
    }
}
