package com.jordtransport.manifest.parser;

import com.jordtransport.manifest.exception.FormatException;
import lombok.extern.slf4j.Slf4j;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads UTF-8 delimited text manifests.
 * <p>
 * Quoting follows RFC 4180: a field in double quotes may contain the delimiter, line breaks and doubled
 * quotes. Comma is the documented delimiter; semicolon and tab are accepted when the header line clearly uses
 * one of them instead, which is what a Danish-locale spreadsheet export produces.
 */
@Slf4j
public class DelimitedTextManifestParser implements ManifestParser {

    private static final char[] CANDIDATE_DELIMITERS = {',', ';', '\t'};

    @Override
    public SourceFormat getFormat() {
        return SourceFormat.DELIMITED_TEXT;
    }

    @Override
    public ParsedManifest parse(byte[] content) {
        String text = decode(content);
        if (text.startsWith("\uFEFF")) {
            text = text.substring(1);
            log.debug("UTF-8 BOM detected and stripped");
        }

        char delimiter = detectDelimiter(text);
        List<List<String>> records = parseRecords(text, delimiter);
        if (records.isEmpty()) {
            throw new FormatException("Filen er tom");
        }

        RawRowCollector collector = new RawRowCollector(records.get(0));
        for (int i = 1; i < records.size(); i++) {
            collector.add(i, records.get(i));
        }
        return collector.build();
    }

    private String decode(byte[] content) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(content))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new FormatException("Filen er ikke gyldig UTF-8 tekst", e);
        }
    }

    /**
     * Picks the candidate that occurs most often, outside quotes, on the first line. Ties and lines without
     * any candidate fall back to comma.
     */
    char detectDelimiter(String text) {
        int[] counts = new int[CANDIDATE_DELIMITERS.length];
        boolean inQuotes = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '"') {
                inQuotes = !inQuotes;
            } else if (!inQuotes && (c == '\n' || c == '\r')) {
                break;
            } else if (!inQuotes) {
                for (int k = 0; k < CANDIDATE_DELIMITERS.length; k++) {
                    if (c == CANDIDATE_DELIMITERS[k]) counts[k]++;
                }
            }
        }

        int best = 0;
        for (int k = 1; k < counts.length; k++) {
            if (counts[k] > counts[best]) best = k;
        }
        if (best != 0) {
            log.debug("Using delimiter '{}' detected from header line", CANDIDATE_DELIMITERS[best]);
        }
        return CANDIDATE_DELIMITERS[best];
    }

    List<List<String>> parseRecords(String text, char delimiter) {
        List<List<String>> records = new ArrayList<>();
        List<String> fields = new ArrayList<>();
        StringBuilder field = new StringBuilder();
        boolean inQuotes = false;
        boolean recordStarted = false;
        int length = text.length();

        for (int i = 0; i < length; i++) {
            char c = text.charAt(i);

            if (inQuotes) {
                if (c == '"') {
                    if (i + 1 < length && text.charAt(i + 1) == '"') {
                        field.append('"');
                        i++;
                    } else {
                        inQuotes = false;
                    }
                } else {
                    field.append(c);
                }
                continue;
            }

            if (c == '"') {
                inQuotes = true;
                recordStarted = true;
            } else if (c == delimiter) {
                fields.add(field.toString());
                field.setLength(0);
                recordStarted = true;
            } else if (c == '\r' || c == '\n') {
                if (c == '\r' && i + 1 < length && text.charAt(i + 1) == '\n') {
                    i++;
                }
                fields.add(field.toString());
                field.setLength(0);
                records.add(fields);
                fields = new ArrayList<>();
                recordStarted = false;
            } else {
                field.append(c);
                recordStarted = true;
            }
        }

        if (inQuotes) {
            throw new FormatException("Uafsluttet anførselstegn i række " + records.size());
        }
        if (recordStarted) {
            fields.add(field.toString());
            records.add(fields);
        }
        return records;
    }
}
