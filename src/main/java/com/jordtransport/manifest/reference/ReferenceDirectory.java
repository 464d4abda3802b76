package com.jordtransport.manifest.reference;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only registry of verified receiving facilities, keyed by facility ID.
 * <p>
 * Built once and shared by reference. Tests and alternative deployments pass their own instance instead of
 * relying on {@link #standard()}.
 */
public final class ReferenceDirectory {

    private static final ReferenceDirectory STANDARD = new ReferenceDirectory("2024.1", List.of(
            new Facility(1061, "Gert Svith, Birkesig Grusgrav", "Rugvænget 18, 8444 Grenå"),
            new Facility(1013, "JJ Grus A/S (Kalbygård Grusgrav)", "Hovedvejen 24A, 8670 Låsby"),
            new Facility(1327, "Johs. Sørensen & Sønner A/S, Ren depotjord", "Holmstrupgårdvej 9, 8220 Brabrand"),
            new Facility(2191, "JJ Grus A/S (Ans)", "Søndermarksgade 43, 8643 Ans"),
            new Facility(1901, "EHJ Energi & Miljø A/S - Let forurenet jord", "Hadstenvej 16, 8940 Randers SV")
    ));

    private final String version;
    private final Map<Integer, Facility> facilities;

    public ReferenceDirectory(String version, Collection<Facility> facilities) {
        this.version = version;
        Map<Integer, Facility> index = new LinkedHashMap<>();
        for (Facility facility : facilities) {
            if (index.put(facility.getId(), facility) != null) {
                throw new IllegalArgumentException("Duplicate facility id: " + facility.getId());
            }
        }
        this.facilities = Collections.unmodifiableMap(index);
    }

    public static ReferenceDirectory standard() {
        return STANDARD;
    }

    public String getVersion() {
        return version;
    }

    public Optional<Facility> find(int facilityId) {
        return Optional.ofNullable(facilities.get(facilityId));
    }

    public boolean contains(int facilityId) {
        return facilities.containsKey(facilityId);
    }

    public Set<Integer> getFacilityIds() {
        return facilities.keySet();
    }

    public Collection<Facility> getFacilities() {
        return facilities.values();
    }

    public int size() {
        return facilities.size();
    }
}
