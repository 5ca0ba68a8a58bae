package space.ketterling.hydro.report;

import space.ketterling.hydro.model.CanonicalPoint;
import space.ketterling.hydro.model.Series;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Summary figures shown next to a chart. Values are rounded to three
 * decimals; all fields except {@code count} are null for an empty series.
 */
public record SeriesStats(int count, Double mean, Double stdDev, Double median, Double min, Double max,
        Double range) {

    public static SeriesStats of(Series series) {
        List<Double> values = new ArrayList<>(series.size());
        for (CanonicalPoint p : series.points()) {
            if (p.hasValue()) {
                values.add(p.value());
            }
        }
        if (values.isEmpty()) {
            return new SeriesStats(0, null, null, null, null, null, null);
        }

        int n = values.size();
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        double mean = sum / n;
        double sq = 0;
        for (double v : values) {
            sq += (v - mean) * (v - mean);
        }
        // population standard deviation
        double std = Math.sqrt(sq / n);

        Collections.sort(values);
        double median = n % 2 == 1
                ? values.get(n / 2)
                : (values.get(n / 2 - 1) + values.get(n / 2)) / 2.0;
        double min = values.get(0);
        double max = values.get(n - 1);

        return new SeriesStats(n, round3(mean), round3(std), round3(median), round3(min), round3(max),
                round3(max - min));
    }

    static double round3(double v) {
        return Math.round(v * 1000.0) / 1000.0;
    }
}
