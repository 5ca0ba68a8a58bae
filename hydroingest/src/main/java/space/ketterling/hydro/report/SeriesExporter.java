package space.ketterling.hydro.report;

import space.ketterling.hydro.model.Series;

/**
 * Hands a finished series to whatever draws or stores it.
 */
public interface SeriesExporter {

    /**
     * @param label file-safe name unique within one export run
     */
    void export(Series series, String label);
}
