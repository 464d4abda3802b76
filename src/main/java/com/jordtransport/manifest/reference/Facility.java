package com.jordtransport.manifest.reference;

import lombok.Value;

/**
 * A registered receiving site (modtageranlæg) for transported soil.
 */
@Value
public class Facility {
    int id;
    String name;
    String address;

    public String getDisplayName() {
        return id + " - " + name;
    }
}
