package com.dynop.routing.hybrid.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Mode of travel for a route query.
 *
 * <ul>
 *   <li>{@link #DRIVING} - routed with the provider's {@code driving-car} profile</li>
 *   <li>{@link #WALKING} - routed with the provider's {@code foot-walking} profile</li>
 *   <li>{@link #CYCLING} - routed with the provider's {@code cycling-regular} profile</li>
 * </ul>
 */
public enum TravelProfile {

    @JsonProperty("driving")
    DRIVING("driving", "driving-car"),

    @JsonProperty("walking")
    WALKING("walking", "foot-walking"),

    @JsonProperty("cycling")
    CYCLING("cycling", "cycling-regular");

    private final String id;
    private final String providerProfile;

    TravelProfile(String id, String providerProfile) {
        this.id = id;
        this.providerProfile = providerProfile;
    }

    /**
     * @return lower-case identifier used in cache keys and JSON payloads
     */
    public String getId() {
        return id;
    }

    /**
     * @return path segment appended to the provider base URL
     */
    public String getProviderProfile() {
        return providerProfile;
    }

    /**
     * Parses a profile identifier, accepting either the short id or the provider profile name.
     *
     * @param value profile name, may be null or blank for the default
     * @return the matching profile, {@link #DRIVING} when value is null or blank
     * @throws IllegalArgumentException if the value names no known profile
     */
    public static TravelProfile parse(String value) {
        if (value == null || value.isBlank()) {
            return DRIVING;
        }
        for (TravelProfile profile : values()) {
            if (profile.id.equalsIgnoreCase(value) || profile.providerProfile.equalsIgnoreCase(value)) {
                return profile;
            }
        }
        throw new IllegalArgumentException("Invalid profile: " + value + ". Valid values: driving, walking, cycling");
    }
}
