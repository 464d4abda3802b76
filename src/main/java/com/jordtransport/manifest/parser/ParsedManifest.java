package com.jordtransport.manifest.parser;

import lombok.Value;

import java.util.List;

/**
 * Format-independent result of reading an upload: the header in file order and the non-blank data rows.
 */
@Value
public class ParsedManifest {
    List<String> header;
    List<RawRow> rows;
    int blankRowsSkipped;
}
