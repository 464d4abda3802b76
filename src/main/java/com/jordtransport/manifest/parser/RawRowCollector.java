package com.jordtransport.manifest.parser;

import com.jordtransport.manifest.exception.FormatException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns positional cells into named {@link RawRow}s. Both readers feed it, which is what keeps their output
 * shapes identical.
 */
@Slf4j
class RawRowCollector {

    // Column position -> header name; null where the header cell was blank
    private final List<String> columnNames;
    private final List<String> header;
    private final List<RawRow> rows = new ArrayList<>();
    private int blankRowsSkipped;

    RawRowCollector(List<?> headerCells) {
        this.columnNames = new ArrayList<>(headerCells.size());
        List<String> names = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        Set<String> duplicates = new LinkedHashSet<>();

        for (Object cell : headerCells) {
            String name = CellValues.asText(cell);
            if (name.isEmpty()) {
                columnNames.add(null);
                continue;
            }
            if (!seen.add(name)) {
                duplicates.add(name);
            }
            columnNames.add(name);
            names.add(name);
        }

        if (names.isEmpty()) {
            throw new FormatException("Filen mangler en overskriftsrække");
        }
        if (!duplicates.isEmpty()) {
            throw new FormatException("Duplikerede kolonner fundet: " + String.join(", ", duplicates));
        }
        this.header = Collections.unmodifiableList(names);
    }

    void add(int rowIndex, List<?> cells) {
        Map<String, Object> values = new LinkedHashMap<>();
        boolean hasData = false;

        for (int i = 0; i < columnNames.size(); i++) {
            String name = columnNames.get(i);
            if (name == null) continue;
            Object value = i < cells.size() ? cells.get(i) : null;
            values.put(name, value);
            if (!CellValues.isBlank(value)) hasData = true;
        }
        if (cells.size() > columnNames.size()) {
            log.debug("Row {} has {} cells but the header has {}; extra cells ignored", rowIndex, cells.size(), columnNames.size());
        }

        if (!hasData) {
            blankRowsSkipped++;
            return;
        }
        rows.add(new RawRow(rowIndex, Collections.unmodifiableMap(values)));
    }

    ParsedManifest build() {
        if (rows.isEmpty()) {
            throw new FormatException("Filen indeholder ingen data");
        }
        return new ParsedManifest(header, Collections.unmodifiableList(rows), blankRowsSkipped);
    }
}
