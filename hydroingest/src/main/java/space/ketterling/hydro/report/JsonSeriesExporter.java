package space.ketterling.hydro.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.hydro.model.CanonicalPoint;
import space.ketterling.hydro.model.Series;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes each series to {@code <dir>/<label>.json}.
 */
public class JsonSeriesExporter implements SeriesExporter {
    private static final Logger log = LoggerFactory.getLogger(JsonSeriesExporter.class);

    private final ObjectMapper om;
    private final Path dir;

    public JsonSeriesExporter(ObjectMapper om, Path dir) {
        this.om = om;
        this.dir = dir;
    }

    @Override
    public void export(Series series, String label) {
        Path file = dir.resolve(label + ".json");
        try {
            Files.createDirectories(dir);
            om.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), seriesNode(om, series));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + file, e);
        }
        log.debug("exported {} points to {}", series.size(), file);
    }

    /**
     * {@code {location, dataset, points: [{t, v}]}} with ISO-8601 UTC times.
     */
    public static ObjectNode seriesNode(ObjectMapper om, Series series) {
        ObjectNode root = om.createObjectNode();
        root.put("location", series.location());
        root.put("dataset", series.dataset());
        ArrayNode points = root.putArray("points");
        for (CanonicalPoint p : series.points()) {
            ObjectNode row = points.addObject();
            row.put("t", p.timestamp().toString());
            if (p.value() == null) {
                row.putNull("v");
            } else {
                row.put("v", p.value());
            }
        }
        return root;
    }
}
