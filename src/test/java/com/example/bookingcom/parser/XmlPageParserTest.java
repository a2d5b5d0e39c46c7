package com.example.bookingcom.parser;

import com.example.bookingcom.exception.PageParseException;
import com.example.bookingcom.model.ApiRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class XmlPageParserTest {

    private final XmlPageParser parser = new XmlPageParser();

    @Test
    @DisplayName("Should parse every result element in document order")
    void shouldParseResults() {
        String xml = """
                <?xml version="1.0" standalone="yes"?>
                <getCountries>
                  <result>
                    <area>Europe</area>
                    <countrycode>ad</countrycode>
                    <languagecode>en</languagecode>
                    <name>Andorra</name>
                  </result>
                  <result>
                    <area>Caribbean</area>
                    <countrycode>ag</countrycode>
                    <languagecode>en</languagecode>
                    <name>Antigua &amp; Barbuda</name>
                  </result>
                </getCountries>
                """;

        List<ApiRecord> records = parse("getCountries", xml);

        assertThat(records).hasSize(2);
        assertThat(records.get(0).getString("countrycode")).isEqualTo("ad");
        assertThat(records.get(0).fields().keySet()).containsExactly("area", "countrycode", "languagecode", "name");
        assertThat(records.get(1).getString("name")).isEqualTo("Antigua & Barbuda");
    }

    @Test
    @DisplayName("Should return a single result as a one-element list")
    void shouldParseSingleResult() {
        String xml = "<getHotelTypes><result><hotel_type_id>1</hotel_type_id><name>Apartment</name></result></getHotelTypes>";

        List<ApiRecord> records = parse("getHotelTypes", xml);

        assertThat(records).hasSize(1);
        assertThat(records.get(0).getString("name")).isEqualTo("Apartment");
    }

    @Test
    @DisplayName("Should return no records when there is no result element")
    void shouldHandleMissingResults() {
        assertThat(parse("getCountries", "<getCountries><count>0</count></getCountries>")).isEmpty();
        assertThat(parse("getCountries", "<getCountries></getCountries>")).isEmpty();
    }

    @Test
    @DisplayName("Should return no records when the root element is another endpoint")
    void shouldIgnoreOtherRootElement() {
        String xml = "<getCities><result><name>Amsterdam</name></result></getCities>";

        assertThat(parse("getCountries", xml)).isEmpty();
    }

    @Test
    @DisplayName("Should keep nested and repeated elements")
    void shouldKeepNestedValues() {
        String xml = """
                <getHotels>
                  <result>
                    <hotel_id>42</hotel_id>
                    <location>
                      <latitude>52.37</latitude>
                      <longitude>4.89</longitude>
                    </location>
                    <photo>a.jpg</photo>
                    <photo>b.jpg</photo>
                  </result>
                </getHotels>
                """;

        ApiRecord hotel = parse("getHotels", xml).get(0);

        assertThat(hotel.getString("hotel_id")).isEqualTo("42");
        assertThat(hotel.getRecord("location").getString("latitude")).isEqualTo("52.37");
        assertThat(hotel.get("photo")).isEqualTo(List.of("a.jpg", "b.jpg"));
    }

    @Test
    @DisplayName("Should count an empty result element as a record")
    void shouldKeepEmptyResult() {
        String xml = "<getRooms><result><room_id>1</room_id></result><result/></getRooms>";

        List<ApiRecord> records = parse("getRooms", xml);

        assertThat(records).hasSize(2);
        assertThat(records.get(1).isEmpty()).isTrue();
    }

    @Test
    @DisplayName("Should read undecoded bytes in the declared encoding, UTF-8 otherwise")
    void shouldDetectEncodingOfBytes() {
        String latin1 = "<?xml version=\"1.0\" encoding=\"ISO-8859-1\"?><getCities><result><name>Malé</name></result></getCities>";
        String undeclared = "<getCities><result><name>Zürich</name></result></getCities>";

        List<ApiRecord> fromLatin1 = parser.parse("getCities", latin1.getBytes(StandardCharsets.ISO_8859_1));
        List<ApiRecord> fromUtf8 = parser.parse("getCities", undeclared.getBytes(StandardCharsets.UTF_8));

        assertThat(fromLatin1.get(0).getString("name")).isEqualTo("Malé");
        assertThat(fromUtf8.get(0).getString("name")).isEqualTo("Zürich");
    }

    @Test
    @DisplayName("Should fail on malformed XML")
    void shouldFailOnMalformedXml() {
        assertThatThrownBy(() -> parse("getCountries", "<getCountries><result><name>x</result>"))
                .isInstanceOf(PageParseException.class)
                .hasMessageContaining("getCountries");
    }

    private List<ApiRecord> parse(String endpoint, String xml) {
        return parser.parse(endpoint, xml.getBytes(StandardCharsets.UTF_8));
    }
}
