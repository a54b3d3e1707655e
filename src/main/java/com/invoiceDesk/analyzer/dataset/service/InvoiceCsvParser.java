package com.invoiceDesk.analyzer.dataset.service;

import com.invoiceDesk.analyzer.dataset.exception.InvalidDatasetException;
import com.invoiceDesk.analyzer.dataset.model.DatasetOrigin;
import com.invoiceDesk.analyzer.dataset.model.InvoiceRecord;
import com.invoiceDesk.analyzer.dataset.model.RecordSet;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses invoice CSV text into a {@link RecordSet}.
 * 
 * Expected header: {@code invoice_id,customer,amount,paid_at,status}. Columns are matched by
 * header name, blank lines are skipped. A field may be wrapped in double quotes to hold commas;
 * a doubled quote inside a quoted field stands for one quote character. Quoted line breaks are not supported.
 * 
 * Inline datasets are parsed strictly: any malformed line rejects the whole request.
 * The persisted dataset is parsed leniently: malformed rows are skipped and logged.
 */
@Slf4j
@Component
public class InvoiceCsvParser {
    
    static final String COLUMN_ID = "invoice_id";
    static final String COLUMN_CUSTOMER = "customer";
    static final String COLUMN_AMOUNT = "amount";
    static final String COLUMN_PAID_AT = "paid_at";
    static final String COLUMN_STATUS = "status";
    
    private static final List<String> REQUIRED_COLUMNS =
            List.of(COLUMN_ID, COLUMN_CUSTOMER, COLUMN_AMOUNT, COLUMN_PAID_AT, COLUMN_STATUS);
    
    /**
     * Parses a dataset supplied inline by the caller.
     * The text must contain a header line and at least one row.
     * 
     * @param csvText Raw CSV text from the request
     * @return Parsed records with origin {@link DatasetOrigin#INLINE}
     * @throws InvalidDatasetException if the text is not a header plus at least one row, or a line is malformed
     */
    public RecordSet parseInline(String csvText) {
        List<String> lines = splitLines(csvText == null ? "" : csvText.strip());
        if (lines.size() < 2) {
            throw new InvalidDatasetException("Invalid CSV data format: expected a header line and at least one row");
        }
        Map<String, Integer> columnIndex = indexHeader(lines.get(0));
        int columnCount = splitFields(lines.get(0)).size();
        
        List<InvoiceRecord> records = new ArrayList<>();
        for (int lineNo = 1; lineNo < lines.size(); lineNo++) {
            String line = lines.get(lineNo);
            if (line.isBlank()) {
                continue;
            }
            records.add(toRecord(line, lineNo + 1, columnIndex, columnCount));
        }
        
        log.debug("Parsed inline dataset - lines: {}, records: {}", lines.size(), records.size());
        return new RecordSet(records, DatasetOrigin.INLINE);
    }
    
    /**
     * Parses the content of the persisted dataset file. Never fails: empty content or an unusable
     * header yields an empty set, and malformed rows are skipped with a warning.
     * 
     * @param csvText File content
     * @return Parsed records with origin {@link DatasetOrigin#PERSISTED}
     */
    public RecordSet parsePersisted(String csvText) {
        List<String> lines = splitLines(csvText == null ? "" : csvText);
        if (lines.stream().allMatch(String::isBlank)) {
            return RecordSet.empty(DatasetOrigin.PERSISTED);
        }
        
        Map<String, Integer> columnIndex;
        int columnCount;
        try {
            columnIndex = indexHeader(lines.get(0));
            columnCount = splitFields(lines.get(0)).size();
        } catch (InvalidDatasetException e) {
            log.warn("Persisted dataset ignored - {}", e.getMessage());
            return RecordSet.empty(DatasetOrigin.PERSISTED);
        }
        
        List<InvoiceRecord> records = new ArrayList<>();
        int skipped = 0;
        for (int lineNo = 1; lineNo < lines.size(); lineNo++) {
            String line = lines.get(lineNo);
            if (line.isBlank()) {
                continue;
            }
            try {
                records.add(toRecord(line, lineNo + 1, columnIndex, columnCount));
            } catch (InvalidDatasetException e) {
                skipped++;
                log.warn("Skipping persisted dataset row - {}", e.getMessage());
            }
        }
        
        log.debug("Parsed persisted dataset - lines: {}, records: {}, skipped: {}", lines.size(), records.size(), skipped);
        return new RecordSet(records, DatasetOrigin.PERSISTED);
    }
    
    private InvoiceRecord toRecord(String line, int lineNo, Map<String, Integer> columnIndex, int columnCount) {
        List<String> fields = splitFields(line);
        if (fields == null) {
            throw new InvalidDatasetException(String.format(
                    "Invalid CSV data format: line %d has an unterminated quoted field", lineNo));
        }
        if (fields.size() != columnCount) {
            throw new InvalidDatasetException(String.format(
                    "Invalid CSV data format: line %d has %d fields, header has %d",
                    lineNo, fields.size(), columnCount));
        }
        return InvoiceRecord.builder()
                .id(fields.get(columnIndex.get(COLUMN_ID)))
                .customer(fields.get(columnIndex.get(COLUMN_CUSTOMER)))
                .amount(fields.get(columnIndex.get(COLUMN_AMOUNT)))
                .paidAt(fields.get(columnIndex.get(COLUMN_PAID_AT)))
                .status(fields.get(columnIndex.get(COLUMN_STATUS)))
                .build();
    }
    
    private Map<String, Integer> indexHeader(String headerLine) {
        List<String> columns = splitFields(headerLine);
        if (columns == null) {
            throw new InvalidDatasetException("Invalid CSV data format: header has an unterminated quoted field");
        }
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < columns.size(); i++) {
            index.putIfAbsent(columns.get(i).strip(), i);
        }
        for (String required : REQUIRED_COLUMNS) {
            if (!index.containsKey(required)) {
                throw new InvalidDatasetException("Invalid CSV data format: missing column '" + required + "'");
            }
        }
        return index;
    }
    
    /**
     * Splits one line into fields, honouring double-quoted fields.
     * 
     * @return Fields in order, or null if a quoted field is not closed
     */
    static List<String> splitFields(String line) {
        List<String> fields = new ArrayList<>();
        StringBuilder field = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quoted) {
                if (c != '"') {
                    field.append(c);
                } else if (i + 1 < line.length() && line.charAt(i + 1) == '"') {
                    field.append('"');
                    i++;
                } else {
                    quoted = false;
                }
            } else if (c == '"') {
                quoted = true;
            } else if (c == ',') {
                fields.add(field.toString());
                field.setLength(0);
            } else {
                field.append(c);
            }
        }
        if (quoted) {
            return null;
        }
        fields.add(field.toString());
        return fields;
    }
    
    private List<String> splitLines(String text) {
        List<String> lines = new ArrayList<>();
        for (String line : text.split("\n", -1)) {
            lines.add(line.endsWith("\r") ? line.substring(0, line.length() - 1) : line);
        }
        return lines;
    }
}
