package space.ketterling.hydro.ndgis;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.csv.DuplicateHeaderMode;
import space.ketterling.hydro.error.PayloadParseException;
import space.ketterling.hydro.model.RawRecord;

import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Parses a DEQ chemistry export.
 *
 * <p>
 * Exports start with an Excel {@code sep=;} hint line when the delimiter is
 * not a comma. Without the hint the delimiter is guessed from the header.
 * Only rows whose {@code Parameter} is in the wanted set are returned.
 * </p>
 */
public final class NdgisCsvParser {
    static final String PARAMETER = "Parameter";
    static final String DATE = "DATE_COLL";
    static final String RESULT = "Result";
    private static final char BOM = '\uFEFF';

    private NdgisCsvParser() {
    }

    public static List<RawRecord> parse(String text, String stationId, Collection<String> parameters) {
        List<RawRecord> out = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return out;
        }

        String body = text.charAt(0) == BOM ? text.substring(1) : text;
        char delimiter;
        int nl = body.indexOf('\n');
        String firstLine = (nl < 0 ? body : body.substring(0, nl)).trim();
        if (firstLine.startsWith("sep=") && firstLine.length() > 4) {
            delimiter = firstLine.charAt(4);
            body = nl < 0 ? "" : body.substring(nl + 1);
        } else {
            delimiter = guessDelimiter(firstLine);
        }

        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setDelimiter(delimiter)
                .setHeader()
                .setSkipHeaderRecord(true)
                .setTrim(true)
                .setAllowMissingColumnNames(true)
                .setDuplicateHeaderMode(DuplicateHeaderMode.ALLOW_ALL)
                .build();

        try (CSVParser parser = format.parse(new StringReader(body))) {
            List<String> headers = parser.getHeaderNames();
            if (headers.isEmpty()) {
                return out;
            }
            if (!headers.contains(PARAMETER) || !headers.contains(DATE) || !headers.contains(RESULT)) {
                throw new PayloadParseException("NDGIS export for " + stationId + " lacks "
                        + PARAMETER + "/" + DATE + "/" + RESULT + " columns: " + headers);
            }
            for (CSVRecord row : parser) {
                if (!row.isSet(PARAMETER) || !row.isSet(DATE)) {
                    continue;
                }
                String parameter = row.get(PARAMETER);
                if (!parameters.contains(parameter)) {
                    continue;
                }
                String result = row.isSet(RESULT) ? row.get(RESULT) : null;
                out.add(new RawRecord(stationId, parameter, row.get(DATE), result));
            }
        } catch (IOException | UncheckedIOException | IllegalStateException e) {
            throw new PayloadParseException("NDGIS export for " + stationId + " is not valid CSV", e);
        }
        return out;
    }

    static char guessDelimiter(String headerLine) {
        int semis = 0;
        int commas = 0;
        for (int i = 0; i < headerLine.length(); i++) {
            char c = headerLine.charAt(i);
            if (c == ';') {
                semis++;
            } else if (c == ',') {
                commas++;
            }
        }
        return semis > commas ? ';' : ',';
    }
}
