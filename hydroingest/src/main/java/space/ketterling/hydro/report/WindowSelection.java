package space.ketterling.hydro.report;

import space.ketterling.hydro.model.CanonicalPoint;
import space.ketterling.hydro.model.FetchWindow;

import java.util.List;

/**
 * The window a report ended up using, which fallback tier produced it and the
 * non-null rows found there.
 */
public record WindowSelection(Tier tier, FetchWindow window, List<CanonicalPoint> rows) {

    public enum Tier {
        /** Rows found in the requested (or default) window. */
        REQUESTED,
        /** Window of the requested length ending at the latest non-null row. */
        LATEST_ANCHORED,
        /** All stored rows; the window spans their first and last timestamp. */
        FULL_HISTORY,
        /** Nothing stored at all. */
        NONE
    }

    public WindowSelection {
        rows = List.copyOf(rows);
    }

    public boolean isEmpty() {
        return tier == Tier.NONE;
    }
}
