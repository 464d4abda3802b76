package com.jordtransport.manifest.dto;

import com.jordtransport.manifest.validation.FieldError;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Value
public class RowRejection {
    /**
     * The row number in the uploaded file, counted from 1 below the header.
     */
    int rowIndex;

    /**
     * Never empty: a rejection always carries at least one reason.
     */
    List<FieldError> errors;

    /**
     * Column name -> cell as read, so the row can be written back out in an error dump.
     */
    Map<String, Object> rawValues;

    /**
     * All reasons joined for a single cell of an error dump, e.g. "[Postnummer: ...] [LastVægt: ...]".
     */
    public String getErrorMessage() {
        return errors.stream()
                .map(e -> "[" + e.getField() + ": " + e.getMessage() + "]")
                .collect(Collectors.joining(" "));
    }
}
