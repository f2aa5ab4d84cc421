package com.loadcomb.export;

import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.loadcomb.exception.ReportException;

import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;

/**
 * CSV report, one row per load case: {@code combination,load_case,factor}.
 */
public class CsvReportWriter implements ReportWriter {

    private static final CsvMapper csvMapper = new CsvMapper();

    private static final CsvSchema schema = csvMapper.schemaFor(CombinationRow.class).withHeader();

    @Override
    public void write(List<LoadCombination> combinations, Writer out) {
        List<CombinationRow> rows = new ArrayList<>();
        for (LoadCombination combination : combinations) {
            rows.addAll(combination.toRows());
        }
        try {
            csvMapper.writer(schema).writeValue(out, rows);
        } catch (IOException e) {
            throw new ReportException("Failed to write CSV report", e);
        }
    }
}
