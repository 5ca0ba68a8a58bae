package space.ketterling.hydro.ingest;

import space.ketterling.hydro.model.DatasetCategory;
import space.ketterling.hydro.model.FetchWindow;
import space.ketterling.hydro.model.PullCutoff;
import space.ketterling.hydro.model.PullTarget;
import space.ketterling.hydro.model.RawPayload;
import space.ketterling.hydro.model.SeriesKey;

import java.time.Duration;
import java.util.List;

/**
 * One upstream source. Pull orchestration ({@code pull}, {@code pullAll},
 * storing) lives in {@link IngestPipeline}; a connector only knows how to
 * fetch and how to process.
 */
public interface SourceConnector {

    /** Short source name used in logs, metrics and the run log. */
    String name();

    DatasetCategory category();

    /**
     * False when a required credential is missing. A disabled connector is
     * skipped; the others still run.
     */
    default boolean enabled() {
        return true;
    }

    /** Every unit {@code pullAll} iterates. */
    List<PullTarget> targets();

    /**
     * Series a target is expected to produce, used to look up stored cutoffs.
     * Empty when the source cannot know in advance.
     */
    List<SeriesKey> seriesFor(PullTarget target);

    /**
     * How far before a stored cutoff an incremental fetch restarts. Sources
     * whose requests are dated in the station's local day need a full day so
     * the rest of the cutoff's local day is requested again; the cutoff filter
     * drops what is already stored.
     */
    default Duration refetchOverlap() {
        return Duration.ZERO;
    }

    /**
     * Retrieves raw records for one target. Must not throw for a failed
     * sub-request (page, chunk, station); such failures go into the payload's
     * diagnostics.
     */
    RawPayload fetch(PullTarget target, FetchWindow window);

    /**
     * Turns a payload into normalized series. No I/O. Records not strictly
     * after the cutoff are excluded.
     */
    ProcessResult process(RawPayload payload, PullCutoff cutoff);
}
