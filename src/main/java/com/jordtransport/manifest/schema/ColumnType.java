package com.jordtransport.manifest.schema;

public enum ColumnType {
    TEXT,
    INTEGER,
    DECIMAL,
    DATE,
    ENUM
}
