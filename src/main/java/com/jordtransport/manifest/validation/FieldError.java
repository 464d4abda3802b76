package com.jordtransport.manifest.validation;

import lombok.Value;

/**
 * One failed constraint on one cell.
 */
@Value
public class FieldError {
    String field;
    int rowIndex;
    ErrorCode code;

    /**
     * Message shown to the uploader, in Danish like the rest of the template.
     */
    String message;

    /**
     * The offending cell as text, "" when it was empty.
     */
    String value;

    @Override
    public String toString() {
        return "Række " + rowIndex + ", felt '" + field + "': " + message;
    }
}
