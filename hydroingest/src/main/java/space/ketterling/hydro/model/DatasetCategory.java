package space.ketterling.hydro.model;

/**
 * Storage routing: each category lives in its own table.
 */
public enum DatasetCategory {
    GAUGE("gauge"),
    DAM("dam"),
    WEATHER("noaa_weather"),
    RESERVOIR("shadehill"),
    PRECIPITATION("cocorahs"),
    WATER_QUALITY("water_quality");

    private final String table;

    DatasetCategory(String table) {
        this.table = table;
    }

    public String table() {
        return table;
    }
}
