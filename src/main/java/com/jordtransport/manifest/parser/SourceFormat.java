package com.jordtransport.manifest.parser;

import java.util.Locale;

public enum SourceFormat {
    SPREADSHEET,
    DELIMITED_TEXT;

    /**
     * Picks the reader for an upload. The file extension wins; without a recognised extension the content is
     * sniffed: a ZIP signature ("PK") means an .xlsx package, anything else is treated as delimited text.
     */
    public static SourceFormat detect(String filename, byte[] content) {
        if (filename != null) {
            String lower = filename.trim().toLowerCase(Locale.ROOT);
            if (lower.endsWith(".xlsx") || lower.endsWith(".xlsm")) return SPREADSHEET;
            if (lower.endsWith(".csv") || lower.endsWith(".txt")) return DELIMITED_TEXT;
        }
        if (content != null && content.length >= 2 && content[0] == 'P' && content[1] == 'K') {
            return SPREADSHEET;
        }
        return DELIMITED_TEXT;
    }
}
