package com.appmonitor.collector.service;

import com.appmonitor.collector.exception.ReportParseException;
import com.opencsv.CSVParserBuilder;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses the tab-separated segment files of the async-report API. The first line is the
 * header; short rows are padded with empty values.
 */
@Component
@Slf4j
public class ReportCsvParser {

    public List<ReportRow> parse(Reader source) {
        try (CSVReader reader = new CSVReaderBuilder(source)
                .withCSVParser(new CSVParserBuilder()
                        .withSeparator('\t')
                        .withIgnoreQuotations(true)
                        .build())
                .build()) {

            String[] header = reader.readNext();
            if (header == null) {
                return List.of();
            }
            for (int i = 0; i < header.length; i++) {
                header[i] = header[i].replace("\uFEFF", "").trim();
            }

            List<ReportRow> rows = new ArrayList<>();
            String[] line;
            while ((line = reader.readNext()) != null) {
                if (line.length == 1 && line[0].isBlank()) continue;
                Map<String, String> values = new LinkedHashMap<>();
                for (int i = 0; i < header.length; i++) {
                    values.put(header[i], i < line.length ? line[i] : "");
                }
                rows.add(new ReportRow(values));
            }
            log.debug("Parsed {} segment rows with columns {}", rows.size(), List.of(header));
            return rows;

        } catch (IOException | CsvValidationException e) {
            throw new ReportParseException("Could not read report segment: " + e.getMessage(), e);
        }
    }
}
