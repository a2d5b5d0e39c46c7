package com.example.bookingcom.client;

import com.example.bookingcom.exception.UnknownEndpointException;

import java.util.HashMap;
import java.util.Map;

/**
 * The fixed catalog of booking.com static data endpoints.
 */
public enum Endpoint {

    CITIES("getCities"),
    COUNTRIES("getCountries"),
    DISTRICTS("getDistricts"),
    DISTRICT_HOTELS("getDistrictHotels"),
    FACILITY_TYPES("getFacilityTypes"),
    HOTEL_DESCRIPTION_PHOTOS("getHotelDescriptionPhotos"),
    HOTEL_DESCRIPTION_TRANSLATIONS("getHotelDescriptionTranslations"),
    HOTEL_DESCRIPTION_TYPES("getHotelDescriptionTypes"),
    HOTEL_FACILITIES("getHotelFacilities"),
    HOTEL_FACILITY_TYPES("getHotelFacilityTypes"),
    HOTEL_LOGO_PHOTOS("getHotelLogoPhotos"),
    HOTEL_PHOTOS("getHotelPhotos"),
    HOTEL_TRANSLATIONS("getHotelTranslations"),
    HOTEL_TYPES("getHotelTypes"),
    HOTELS("getHotels"),
    REGIONS("getRegions"),
    REGION_HOTELS("getRegionHotels"),
    ROOMS("getRooms"),
    ROOM_TYPES("getRoomTypes"),
    ROOM_FACILITY_TYPES("getRoomFacilityTypes"),
    ROOM_FACILITIES("getRoomFacilities"),
    ROOM_TRANSLATIONS("getRoomTranslations"),
    ROOM_PHOTOS("getRoomPhotos");

    private static final Map<String, Endpoint> BY_API_NAME = new HashMap<>();

    static {
        for (Endpoint endpoint : values()) {
            BY_API_NAME.put(endpoint.apiName, endpoint);
        }
    }

    private final String apiName;

    Endpoint(String apiName) {
        this.apiName = apiName;
    }

    /**
     * Returns the name used in request URLs, page files and XML root elements,
     * e.g. {@code getCountries}.
     */
    public String apiName() {
        return apiName;
    }

    /**
     * Looks up an endpoint by its API name.
     *
     * @param apiName e.g. {@code getHotels}
     * @return the endpoint
     * @throws UnknownEndpointException if the name is not in the catalog
     */
    public static Endpoint fromApiName(String apiName) {
        Endpoint endpoint = BY_API_NAME.get(apiName);
        if (endpoint == null) {
            throw new UnknownEndpointException(apiName);
        }
        return endpoint;
    }
}
