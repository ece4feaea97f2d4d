package com.appmonitor.collector.service;

import com.appmonitor.collector.exception.ReportParseException;
import com.appmonitor.collector.model.BulkStatsMetrics.DailyBulkStats;
import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.StringReader;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.List;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Decodes and parses the monthly installs overview CSV of the bulk export.
 *
 * Exports arrive as UTF-16 with a BOM or as UTF-8, depending on their age. Each candidate
 * encoding is tried strictly and accepted only if the decoded text carries a {@code Date}
 * header; the last resort is lenient UTF-8.
 */
@Component
@Slf4j
public class OverviewCsvParser {

    static final String COL_DATE = "Date";
    static final String COL_INSTALLS = "Daily User Installs";
    static final String COL_UNINSTALLS = "Daily User Uninstalls";

    private static final List<Charset> CANDIDATES = List.of(
            StandardCharsets.UTF_16,
            StandardCharsets.UTF_16LE,
            StandardCharsets.UTF_8,
            StandardCharsets.ISO_8859_1);

    public String decode(byte[] content) {
        for (Charset charset : CANDIDATES) {
            try {
                String text = stripBom(charset.newDecoder()
                        .onMalformedInput(CodingErrorAction.REPORT)
                        .onUnmappableCharacter(CodingErrorAction.REPORT)
                        .decode(ByteBuffer.wrap(content))
                        .toString());
                if (text.contains(COL_DATE)) {
                    log.debug("Decoded overview as {}", charset);
                    return text;
                }
            } catch (CharacterCodingException e) {
                log.trace("Overview is not {}", charset);
            }
        }
        log.warn("Overview matched no known encoding, decoding leniently as UTF-8");
        return stripBom(new String(content, StandardCharsets.UTF_8));
    }

    /**
     * Builds the date map from every row. Thousands separators are removed and empty counts
     * read as 0. Rows with unparseable dates are skipped.
     */
    public NavigableMap<LocalDate, DailyBulkStats> parse(String text) {
        try (CSVReader reader = new CSVReader(new StringReader(text))) {
            String[] header = reader.readNext();
            if (header == null) {
                throw new ReportParseException("Installs overview is empty");
            }
            int dateCol = column(header, COL_DATE);
            int installsCol = column(header, COL_INSTALLS);
            int uninstallsCol = column(header, COL_UNINSTALLS);
            if (dateCol < 0 || installsCol < 0 || uninstallsCol < 0) {
                throw new ReportParseException("Installs overview is missing required columns, found "
                        + Arrays.toString(header));
            }

            NavigableMap<LocalDate, DailyBulkStats> daily = new TreeMap<>();
            String[] row;
            while ((row = reader.readNext()) != null) {
                if (row.length <= dateCol) continue;
                LocalDate date;
                try {
                    date = LocalDate.parse(row[dateCol].trim());
                } catch (DateTimeParseException e) {
                    log.debug("Skipping overview row with date '{}'", row[dateCol]);
                    continue;
                }
                daily.put(date, new DailyBulkStats(
                        NumericSanitizer.parseCountOrZero(cell(row, installsCol)),
                        NumericSanitizer.parseCountOrZero(cell(row, uninstallsCol))));
            }
            return daily;

        } catch (IOException | CsvValidationException e) {
            throw new ReportParseException("Could not parse installs overview: " + e.getMessage(), e);
        }
    }

    private static int column(String[] header, String name) {
        for (int i = 0; i < header.length; i++) {
            if (stripBom(header[i]).trim().equalsIgnoreCase(name)) {
                return i;
            }
        }
        return -1;
    }

    private static String cell(String[] row, int index) {
        return index < row.length ? row[index] : "";
    }

    private static String stripBom(String text) {
        return text.startsWith("\uFEFF") ? text.substring(1) : text;
    }
}
