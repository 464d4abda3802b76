package com.jordtransport.manifest.schema;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Immutable column contract for manifest uploads.
 * <p>
 * The spreadsheet template locks its header row and offers dropdowns, but none of that travels with a CSV
 * file or survives a user unprotecting the sheet. This class is the authoritative version of the contract and
 * is checked on every import regardless of what the uploaded file allowed the user to edit.
 */
@Getter
public final class SchemaDefinition {

    public static final String ADRESSE = "Adresse";
    public static final String POSTNUMMER = "Postnummer";
    public static final String POST_DISTRIKT = "PostDistrikt";
    public static final String MODTAGERANLAEG_ID = "ModtageranlægID";

    public static final String NAVN = "Navn";
    public static final String DATO = "Dato";
    public static final String KOERETOEJS_TYPE = "KøretøjsType";
    public static final String LAST_VAEGT = "LastVægt";
    public static final String BRAENDSTOF_TYPE = "Brændstoftype";

    public static final int POSTAL_CODE_MIN = 1000;
    public static final int POSTAL_CODE_MAX = 9999;

    private static final SchemaDefinition STANDARD = new SchemaDefinition("2024.1", List.of(
            ColumnDefinition.mandatory(ADRESSE, ColumnType.TEXT),
            ColumnDefinition.mandatory(POSTNUMMER, ColumnType.INTEGER),
            ColumnDefinition.mandatory(POST_DISTRIKT, ColumnType.TEXT),
            ColumnDefinition.mandatory(MODTAGERANLAEG_ID, ColumnType.INTEGER),
            ColumnDefinition.optional(NAVN, ColumnType.TEXT),
            ColumnDefinition.optional(DATO, ColumnType.DATE),
            ColumnDefinition.optionalEnum(KOERETOEJS_TYPE, VehicleType.labels()),
            ColumnDefinition.optional(LAST_VAEGT, ColumnType.DECIMAL),
            ColumnDefinition.optionalEnum(BRAENDSTOF_TYPE, FuelType.labels())
    ));

    private final String version;
    private final List<ColumnDefinition> columns;

    @Getter(lombok.AccessLevel.NONE)
    private final Map<String, ColumnDefinition> byName;

    public SchemaDefinition(String version, List<ColumnDefinition> columns) {
        this.version = version;
        this.columns = List.copyOf(columns);
        Map<String, ColumnDefinition> index = new LinkedHashMap<>();
        for (ColumnDefinition column : columns) {
            if (index.put(column.getName(), column) != null) {
                throw new IllegalArgumentException("Duplicate column in schema: " + column.getName());
            }
        }
        this.byName = Collections.unmodifiableMap(index);
    }

    /**
     * The contract shipped with this version of the application.
     */
    public static SchemaDefinition standard() {
        return STANDARD;
    }

    public List<ColumnDefinition> getMandatoryColumns() {
        return columns.stream().filter(ColumnDefinition::isMandatory).collect(Collectors.toUnmodifiableList());
    }

    public List<ColumnDefinition> getOptionalColumns() {
        return columns.stream().filter(c -> !c.isMandatory()).collect(Collectors.toUnmodifiableList());
    }

    public List<String> getColumnNames() {
        return columns.stream().map(ColumnDefinition::getName).collect(Collectors.toUnmodifiableList());
    }

    public Optional<ColumnDefinition> column(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    public boolean isKnownColumn(String name) {
        return byName.containsKey(name);
    }

    /**
     * Mandatory column names absent from the given header, in contract order.
     */
    public List<String> missingMandatoryColumns(Collection<String> header) {
        List<String> missing = new ArrayList<>();
        for (ColumnDefinition column : getMandatoryColumns()) {
            if (!header.contains(column.getName())) {
                missing.add(column.getName());
            }
        }
        return missing;
    }

    /**
     * Header names the contract does not know about, in file order.
     */
    public List<String> unknownColumns(Collection<String> header) {
        return header.stream().filter(h -> !isKnownColumn(h)).collect(Collectors.toList());
    }
}
