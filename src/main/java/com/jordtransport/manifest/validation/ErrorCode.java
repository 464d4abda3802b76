package com.jordtransport.manifest.validation;

public enum ErrorCode {
    REQUIRED_FIELD_MISSING,
    INVALID_TYPE,
    POSTAL_CODE_OUT_OF_RANGE,
    UNKNOWN_FACILITY_ID,
    INVALID_ENUM_VALUE,
    INVALID_DATE_FORMAT
}
