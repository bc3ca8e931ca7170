package com.example.bloodlink.store.model;

/**
 * Latitude/longitude pair for blood bank and campaign locations.
 */
public record GeoPoint(double lat, double lng) {
}
