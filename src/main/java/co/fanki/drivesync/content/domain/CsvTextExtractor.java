package co.fanki.drivesync.content.domain;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Converts CSV content to a markdown pipe table.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class CsvTextExtractor {

    private final CsvMapper mapper;

    /** Creates a new CsvTextExtractor. */
    public CsvTextExtractor() {
        this.mapper = new CsvMapper();
        this.mapper.enable(CsvParser.Feature.WRAP_AS_ARRAY);
        this.mapper.enable(CsvParser.Feature.SKIP_EMPTY_LINES);
    }

    /**
     * Converts UTF-8 CSV bytes, first row as header.
     *
     * @param content the CSV bytes
     * @return the markdown table, empty for an empty file
     */
    public String extract(final byte[] content) {
        final List<List<String>> rows = new ArrayList<>();
        try (MappingIterator<String[]> it = mapper
                .readerFor(String[].class)
                .readValues(content)) {
            while (it.hasNextValue()) {
                rows.add(Arrays.asList(it.nextValue()));
            }
        } catch (final IOException | RuntimeException e) {
            throw new TextExtractionException(
                    "Cannot parse CSV: " + e.getMessage(), e);
        }
        return MarkdownTable.format(rows);
    }

}
