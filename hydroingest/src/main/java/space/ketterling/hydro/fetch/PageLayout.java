package space.ketterling.hydro.fetch;

/**
 * Where a paginated JSON body keeps its rows and, optionally, its
 * count/limit/offset metadata. Both values are JSON pointers.
 */
public record PageLayout(String resultsPointer, String metadataPointer) {

    /** NOAA CDO v2: {@code results[]} with {@code metadata.resultset}. */
    public static final PageLayout NOAA_CDO = new PageLayout("/results", "/metadata/resultset");

    /** ArcGIS feature query: {@code features[]}, no metadata. */
    public static final PageLayout ARCGIS = new PageLayout("/features", null);

    public boolean hasMetadata() {
        return metadataPointer != null && !metadataPointer.isBlank();
    }
}
