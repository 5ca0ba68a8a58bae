package space.ketterling.hydro.report;

import space.ketterling.hydro.model.FetchWindow;
import space.ketterling.hydro.model.Series;
import space.ketterling.hydro.model.SeriesKey;

import java.util.List;

/**
 * A report for one key: the chosen window, the chartable series (one when
 * collapsed, several when split) and stats for the first of them.
 * {@code diagnostics} is only set when nothing was found.
 */
public record SeriesReport(SeriesKey key, WindowSelection.Tier tier, FetchWindow window, List<Series> series,
        SeriesStats stats, SeriesDiagnostics diagnostics) {

    public SeriesReport {
        series = List.copyOf(series);
    }

    public boolean isEmpty() {
        return tier == WindowSelection.Tier.NONE;
    }
}
