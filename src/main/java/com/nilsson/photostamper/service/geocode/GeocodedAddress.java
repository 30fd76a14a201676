package com.nilsson.photostamper.service.geocode;

import java.util.Map;

/**
 Address components returned by a reverse geocoder. Missing components are empty strings, never null.
 */
public final class GeocodedAddress {

    private static final GeocodedAddress EMPTY = new GeocodedAddress("", "", "", "", "");

    private final String province;
    private final String city;
    private final String town;
    private final String village;
    private final String suburb;

    public GeocodedAddress(String province, String city, String town, String village, String suburb) {
        this.province = clean(province);
        this.city = clean(city);
        this.town = clean(town);
        this.village = clean(village);
        this.suburb = clean(suburb);
    }

    public static GeocodedAddress empty() {
        return EMPTY;
    }

    /**
     Builds an address from a component map keyed by {@code province}, {@code city},
     {@code town}, {@code village} and {@code suburb}. Other keys are ignored.
     */
    public static GeocodedAddress fromComponents(Map<String, String> components) {
        if (components == null || components.isEmpty()) return EMPTY;
        return new GeocodedAddress(
                components.get("province"),
                components.get("city"),
                components.get("town"),
                components.get("village"),
                components.get("suburb"));
    }

    private static String clean(String value) {
        return value == null ? "" : value.trim();
    }

    public String getProvince() {
        return province;
    }

    public String getCity() {
        return city;
    }

    public String getTown() {
        return town;
    }

    public String getVillage() {
        return village;
    }

    public String getSuburb() {
        return suburb;
    }

    public boolean isEmpty() {
        return province.isEmpty() && city.isEmpty() && town.isEmpty() && village.isEmpty() && suburb.isEmpty();
    }

    @Override
    public String toString() {
        return "GeocodedAddress{province='" + province + "', city='" + city + "', town='" + town
                + "', village='" + village + "', suburb='" + suburb + "'}";
    }
}
