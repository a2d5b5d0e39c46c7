package com.example.bookingcom.client;

import com.example.bookingcom.config.BookingcomClientConfig;
import com.example.bookingcom.fetcher.PageFetcher;
import com.example.bookingcom.iterable.EndpointSequence;
import com.example.bookingcom.model.ApiRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.function.IntFunction;

/**
 * Main entry point: one lazy record sequence per booking.com endpoint.
 *
 * <p>Every endpoint of the {@link Endpoint} catalog has an accessor named
 * after it, with and without a page size. Each call returns a new
 * {@link EndpointSequence}; nothing is fetched until it is iterated.
 *
 * <p>Example usage:
 * <pre>{@code
 * // Pre-fetched files under /data/bookingcom/<endpoint>/offset_<n>.xml
 * BookingcomClient client = new BookingcomClient(
 *     BookingcomClientConfig.builder().dataDirectory(Path.of("/data/bookingcom")).build()
 * );
 *
 * for (ApiRecord country : client.getCountries()) {
 *     System.out.println(country.getString("name"));
 * }
 *
 * // Live API, 500 rows per request
 * BookingcomClient remote = new BookingcomClient(
 *     BookingcomClientConfig.builder()
 *         .fetcherStrategy(FetcherStrategy.REMOTE)
 *         .username("user")
 *         .password("secret")
 *         .build()
 * );
 * long hotels = remote.getHotels(500).stream().count();
 * }</pre>
 *
 * <p><b>Thread Safety:</b> This class is immutable and thread-safe. The
 * iterators of the returned sequences are not.
 */
public class BookingcomClient {

    private static final Logger log = LoggerFactory.getLogger(BookingcomClient.class);

    private final BookingcomClientConfig config;
    private final Map<Endpoint, IntFunction<EndpointSequence<ApiRecord>>> endpoints;

    /**
     * Creates a client reading from pre-fetched files in the default data directory.
     */
    public BookingcomClient() {
        this(BookingcomClientConfig.defaults());
    }

    /**
     * Creates a client whose pages come from the configured fetcher strategy.
     *
     * @param config shared connection settings
     */
    public BookingcomClient(BookingcomClientConfig config) {
        this(config, config.fetcherStrategy().createFetcher(config));
    }

    /**
     * Creates a client with a custom page fetcher.
     * Useful for testing or when using a different data source.
     *
     * @param config shared settings; only the default page size is used
     * @param pageFetcher source of pages for every endpoint
     */
    public BookingcomClient(BookingcomClientConfig config, PageFetcher<ApiRecord> pageFetcher) {
        this.config = config;
        Map<Endpoint, IntFunction<EndpointSequence<ApiRecord>>> factories = new EnumMap<>(Endpoint.class);
        for (Endpoint endpoint : Endpoint.values()) {
            factories.put(endpoint, rows -> new EndpointSequence<>(endpoint.apiName(), rows, pageFetcher));
        }
        this.endpoints = Collections.unmodifiableMap(factories);
        log.debug("Created client {}", config);
    }

    /**
     * Returns the records of an endpoint using the configured default page size.
     */
    public EndpointSequence<ApiRecord> endpoint(Endpoint endpoint) {
        return endpoints.get(endpoint).apply(config.defaultPageSize());
    }

    /**
     * Returns the records of an endpoint.
     *
     * @param endpoint the endpoint
     * @param rows number of records requested per page
     * @return a lazy sequence of records
     * @throws IllegalArgumentException if {@code rows} is not positive
     */
    public EndpointSequence<ApiRecord> endpoint(Endpoint endpoint, int rows) {
        if (rows <= 0) {
            throw new IllegalArgumentException("rows must be positive: " + rows);
        }
        return endpoints.get(endpoint).apply(rows);
    }

    /**
     * Returns the records of an endpoint looked up by API name.
     *
     * @throws com.example.bookingcom.exception.UnknownEndpointException if the name is not in the catalog
     */
    public EndpointSequence<ApiRecord> endpoint(String apiName) {
        return endpoint(Endpoint.fromApiName(apiName));
    }

    /**
     * Returns the records of an endpoint looked up by API name.
     *
     * @throws com.example.bookingcom.exception.UnknownEndpointException if the name is not in the catalog
     */
    public EndpointSequence<ApiRecord> endpoint(String apiName, int rows) {
        return endpoint(Endpoint.fromApiName(apiName), rows);
    }

    public BookingcomClientConfig getConfig() {
        return config;
    }

    // one accessor pair per catalog endpoint

    public EndpointSequence<ApiRecord> getCities() {
        return endpoint(Endpoint.CITIES);
    }

    public EndpointSequence<ApiRecord> getCities(int rows) {
        return endpoint(Endpoint.CITIES, rows);
    }

    public EndpointSequence<ApiRecord> getCountries() {
        return endpoint(Endpoint.COUNTRIES);
    }

    public EndpointSequence<ApiRecord> getCountries(int rows) {
        return endpoint(Endpoint.COUNTRIES, rows);
    }

    public EndpointSequence<ApiRecord> getDistricts() {
        return endpoint(Endpoint.DISTRICTS);
    }

    public EndpointSequence<ApiRecord> getDistricts(int rows) {
        return endpoint(Endpoint.DISTRICTS, rows);
    }

    public EndpointSequence<ApiRecord> getDistrictHotels() {
        return endpoint(Endpoint.DISTRICT_HOTELS);
    }

    public EndpointSequence<ApiRecord> getDistrictHotels(int rows) {
        return endpoint(Endpoint.DISTRICT_HOTELS, rows);
    }

    public EndpointSequence<ApiRecord> getFacilityTypes() {
        return endpoint(Endpoint.FACILITY_TYPES);
    }

    public EndpointSequence<ApiRecord> getFacilityTypes(int rows) {
        return endpoint(Endpoint.FACILITY_TYPES, rows);
    }

    public EndpointSequence<ApiRecord> getHotelDescriptionPhotos() {
        return endpoint(Endpoint.HOTEL_DESCRIPTION_PHOTOS);
    }

    public EndpointSequence<ApiRecord> getHotelDescriptionPhotos(int rows) {
        return endpoint(Endpoint.HOTEL_DESCRIPTION_PHOTOS, rows);
    }

    public EndpointSequence<ApiRecord> getHotelDescriptionTranslations() {
        return endpoint(Endpoint.HOTEL_DESCRIPTION_TRANSLATIONS);
    }

    public EndpointSequence<ApiRecord> getHotelDescriptionTranslations(int rows) {
        return endpoint(Endpoint.HOTEL_DESCRIPTION_TRANSLATIONS, rows);
    }

    public EndpointSequence<ApiRecord> getHotelDescriptionTypes() {
        return endpoint(Endpoint.HOTEL_DESCRIPTION_TYPES);
    }

    public EndpointSequence<ApiRecord> getHotelDescriptionTypes(int rows) {
        return endpoint(Endpoint.HOTEL_DESCRIPTION_TYPES, rows);
    }

    public EndpointSequence<ApiRecord> getHotelFacilities() {
        return endpoint(Endpoint.HOTEL_FACILITIES);
    }

    public EndpointSequence<ApiRecord> getHotelFacilities(int rows) {
        return endpoint(Endpoint.HOTEL_FACILITIES, rows);
    }

    public EndpointSequence<ApiRecord> getHotelFacilityTypes() {
        return endpoint(Endpoint.HOTEL_FACILITY_TYPES);
    }

    public EndpointSequence<ApiRecord> getHotelFacilityTypes(int rows) {
        return endpoint(Endpoint.HOTEL_FACILITY_TYPES, rows);
    }

    public EndpointSequence<ApiRecord> getHotelLogoPhotos() {
        return endpoint(Endpoint.HOTEL_LOGO_PHOTOS);
    }

    public EndpointSequence<ApiRecord> getHotelLogoPhotos(int rows) {
        return endpoint(Endpoint.HOTEL_LOGO_PHOTOS, rows);
    }

    public EndpointSequence<ApiRecord> getHotelPhotos() {
        return endpoint(Endpoint.HOTEL_PHOTOS);
    }

    public EndpointSequence<ApiRecord> getHotelPhotos(int rows) {
        return endpoint(Endpoint.HOTEL_PHOTOS, rows);
    }

    public EndpointSequence<ApiRecord> getHotelTranslations() {
        return endpoint(Endpoint.HOTEL_TRANSLATIONS);
    }

    public EndpointSequence<ApiRecord> getHotelTranslations(int rows) {
        return endpoint(Endpoint.HOTEL_TRANSLATIONS, rows);
    }

    public EndpointSequence<ApiRecord> getHotelTypes() {
        return endpoint(Endpoint.HOTEL_TYPES);
    }

    public EndpointSequence<ApiRecord> getHotelTypes(int rows) {
        return endpoint(Endpoint.HOTEL_TYPES, rows);
    }

    public EndpointSequence<ApiRecord> getHotels() {
        return endpoint(Endpoint.HOTELS);
    }

    public EndpointSequence<ApiRecord> getHotels(int rows) {
        return endpoint(Endpoint.HOTELS, rows);
    }

    public EndpointSequence<ApiRecord> getRegions() {
        return endpoint(Endpoint.REGIONS);
    }

    public EndpointSequence<ApiRecord> getRegions(int rows) {
        return endpoint(Endpoint.REGIONS, rows);
    }

    public EndpointSequence<ApiRecord> getRegionHotels() {
        return endpoint(Endpoint.REGION_HOTELS);
    }

    public EndpointSequence<ApiRecord> getRegionHotels(int rows) {
        return endpoint(Endpoint.REGION_HOTELS, rows);
    }

    public EndpointSequence<ApiRecord> getRooms() {
        return endpoint(Endpoint.ROOMS);
    }

    public EndpointSequence<ApiRecord> getRooms(int rows) {
        return endpoint(Endpoint.ROOMS, rows);
    }

    public EndpointSequence<ApiRecord> getRoomTypes() {
        return endpoint(Endpoint.ROOM_TYPES);
    }

    public EndpointSequence<ApiRecord> getRoomTypes(int rows) {
        return endpoint(Endpoint.ROOM_TYPES, rows);
    }

    public EndpointSequence<ApiRecord> getRoomFacilityTypes() {
        return endpoint(Endpoint.ROOM_FACILITY_TYPES);
    }

    public EndpointSequence<ApiRecord> getRoomFacilityTypes(int rows) {
        return endpoint(Endpoint.ROOM_FACILITY_TYPES, rows);
    }

    public EndpointSequence<ApiRecord> getRoomFacilities() {
        return endpoint(Endpoint.ROOM_FACILITIES);
    }

    public EndpointSequence<ApiRecord> getRoomFacilities(int rows) {
        return endpoint(Endpoint.ROOM_FACILITIES, rows);
    }

    public EndpointSequence<ApiRecord> getRoomTranslations() {
        return endpoint(Endpoint.ROOM_TRANSLATIONS);
    }

    public EndpointSequence<ApiRecord> getRoomTranslations(int rows) {
        return endpoint(Endpoint.ROOM_TRANSLATIONS, rows);
    }

    public EndpointSequence<ApiRecord> getRoomPhotos() {
        return endpoint(Endpoint.ROOM_PHOTOS);
    }

    public EndpointSequence<ApiRecord> getRoomPhotos(int rows) {
        return endpoint(Endpoint.ROOM_PHOTOS, rows);
    }
}
