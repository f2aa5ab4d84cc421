package com.loadcomb.export;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.loadcomb.exception.ReportException;

import java.io.IOException;
import java.io.Writer;
import java.util.List;

/**
 * JSON report: a list of {@code {"name": ..., "load_cases": {...}}} objects.
 */
public class JsonReportWriter implements ReportWriter {

    private static final ObjectMapper objectMapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    @Override
    public void write(List<LoadCombination> combinations, Writer out) {
        try {
            objectMapper.writeValue(out, combinations);
        } catch (IOException e) {
            throw new ReportException("Failed to write JSON report", e);
        }
    }
}
