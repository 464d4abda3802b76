package com.jordtransport.manifest.parser;

import com.jordtransport.manifest.exception.FormatException;

public interface ManifestParser {

    SourceFormat getFormat();

    /**
     * Reads the header and data rows of an upload.
     *
     * @param content the complete file
     * @return header and rows, rows indexed from 1 below the header
     * @throws FormatException if the bytes are not a readable file of this format, or hold no data rows
     */
    ParsedManifest parse(byte[] content);
}
