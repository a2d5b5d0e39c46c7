package com.example.bookingcom.parser;

import com.example.bookingcom.exception.PageParseException;
import com.example.bookingcom.model.ApiRecord;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;

import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Parses one page of the provider's XML dialect into records.
 *
 * <p>A page looks like:
 * <pre>{@code
 * <?xml version="1.0" standalone="yes"?>
 * <getCountries>
 *   <result>
 *     <countrycode>ad</countrycode>
 *     <name>Andorra</name>
 *   </result>
 *   <result>...</result>
 * </getCountries>
 * }</pre>
 *
 * <p>The root element is named after the endpoint and each {@code result}
 * child is one record. Repeated child elements inside a record become lists.
 *
 * <p><b>Thread Safety:</b> instances are immutable and may be shared.
 */
public class XmlPageParser {

    static final String RESULT_ELEMENT = "result";

    private final XmlMapper xmlMapper;

    public XmlPageParser() {
        this(new XmlMapper());
    }

    public XmlPageParser(XmlMapper xmlMapper) {
        this.xmlMapper = xmlMapper;
    }

    /**
     * Extracts the records of one page. The page is passed undecoded; its
     * character encoding is taken from the XML declaration, UTF-8 when there is none.
     *
     * @param endpoint the endpoint the page belongs to; must match the root element
     * @param xml raw page bytes as stored or received
     * @return records in document order; empty if the root element is not the
     *         endpoint or there is no {@code result} element
     * @throws PageParseException if the content is not well-formed XML
     */
    public List<ApiRecord> parse(String endpoint, byte[] xml) {
        try {
            return read(endpoint, inputFactory().createXMLStreamReader(new ByteArrayInputStream(xml)));
        } catch (XMLStreamException | IOException e) {
            throw new PageParseException("Failed to parse " + endpoint + " page", e);
        }
    }

    private XMLInputFactory inputFactory() {
        return xmlMapper.getFactory().getXMLInputFactory();
    }

    private List<ApiRecord> read(String endpoint, XMLStreamReader reader) throws XMLStreamException, IOException {
        if (!moveToRootElement(reader) || !endpoint.equals(reader.getLocalName())) {
            return List.of();
        }
        Object root = xmlMapper.readValue(reader, Object.class);
        return extractResults(root);
    }

    private boolean moveToRootElement(XMLStreamReader reader) throws XMLStreamException {
        while (reader.getEventType() != XMLStreamConstants.START_ELEMENT) {
            if (!reader.hasNext()) {
                return false;
            }
            reader.next();
        }
        return true;
    }

    /**
     * Normalizes the three shapes of the result key (absent, one mapping,
     * a list of mappings) into a list.
     */
    private List<ApiRecord> extractResults(Object root) {
        if (!(root instanceof Map<?, ?> page)) {
            // <getCountries/> binds to an empty string
            return List.of();
        }
        Object results = page.get(RESULT_ELEMENT);
        if (results == null) {
            return List.of();
        }
        if (!(results instanceof List<?> resultList)) {
            return List.of(toRecord(results));
        }
        List<ApiRecord> records = new ArrayList<>();
        for (Object result : resultList) {
            records.add(toRecord(result));
        }
        return Collections.unmodifiableList(records);
    }

    @SuppressWarnings("unchecked")
    private ApiRecord toRecord(Object result) {
        if (result instanceof Map) {
            return new ApiRecord((Map<String, ?>) result);
        }
        // text-only or empty <result/>; still counts towards the page length
        return ApiRecord.empty();
    }
}
