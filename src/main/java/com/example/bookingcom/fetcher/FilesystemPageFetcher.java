package com.example.bookingcom.fetcher;

import com.example.bookingcom.model.ApiRecord;
import com.example.bookingcom.model.Page;
import com.example.bookingcom.parser.XmlPageParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads pages from a directory of pre-fetched API responses.
 *
 * <p>Layout: {@code <rootDirectory>/<endpoint>/offset_<offset>.xml}, one file
 * per page. A missing file is the normal end of data. Files are handed to
 * the parser undecoded so that the encoding in the XML declaration applies.
 *
 * <p>A file that exists but cannot be read is treated as an empty page, so
 * iteration ends instead of failing. The failure is logged at WARN. Content
 * that is read but is not valid XML still fails with a
 * {@link com.example.bookingcom.exception.PageParseException}.
 */
public class FilesystemPageFetcher implements PageFetcher<ApiRecord> {

    private static final Logger log = LoggerFactory.getLogger(FilesystemPageFetcher.class);

    private final Path rootDirectory;
    private final XmlPageParser parser;

    public FilesystemPageFetcher(Path rootDirectory) {
        this(rootDirectory, new XmlPageParser());
    }

    public FilesystemPageFetcher(Path rootDirectory, XmlPageParser parser) {
        this.rootDirectory = rootDirectory;
        this.parser = parser;
    }

    @Override
    public Page<ApiRecord> fetch(String endpoint, long offset, int pageSize) {
        Path path = pagePath(endpoint, offset);
        if (!Files.exists(path)) {
            log.debug("No page file {}, end of {}", path, endpoint);
            return Page.empty();
        }

        byte[] xml;
        try {
            xml = Files.readAllBytes(path);
        } catch (IOException e) {
            log.warn("Could not read page file {}, treating it as empty", path, e);
            return Page.empty();
        }

        log.debug("Read {} at offset {} from {}", endpoint, offset, path);
        return Page.of(parser.parse(endpoint, xml));
    }

    /**
     * Returns the file holding the page of {@code endpoint} at {@code offset}.
     */
    public Path pagePath(String endpoint, long offset) {
        return rootDirectory.resolve(endpoint).resolve("offset_" + offset + ".xml");
    }

    public Path getRootDirectory() {
        return rootDirectory;
    }
}
