package com.largomodo.nesinfo.nes;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reader for iNES / NES 2.0 image files.
 * <p>
 * Combines {@link NesHeaderParser} and {@link CartridgeLoader} over the bytes of one file:
 * the file is read once, the header is decoded, then the same buffer is sliced.
 * No state survives between calls.
 */
public class NesRomReader {

    private static final Logger log = LoggerFactory.getLogger(NesRomReader.class);

    private final NesHeaderParser parser;
    private final CartridgeLoader loader;

    public NesRomReader() {
        this(new NesHeaderParser(), new CartridgeLoader());
    }

    public NesRomReader(NesHeaderParser parser, CartridgeLoader loader) {
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
        this.loader = Objects.requireNonNull(loader, "loader must not be null");
    }

    /**
     * Load and parse a .nes file.
     *
     * @param path path to the ROM file
     * @return loaded cartridge
     * @throws InvalidRomException if the content is not a valid image
     * @throws IOException         if the file cannot be read
     */
    public NesCartridge load(Path path) throws IOException {
        Objects.requireNonNull(path, "path must not be null");
        byte[] data = Files.readAllBytes(path);
        log.debug("Read {} bytes from {}", data.length, path);
        return load(data);
    }

    /**
     * Parse and slice an in-memory image.
     *
     * @param data complete image bytes
     * @return loaded cartridge
     * @throws InvalidRomException if the buffer is not a valid image
     */
    public NesCartridge load(byte[] data) throws InvalidRomException {
        NesHeader header = parser.parse(data);
        return loader.load(data, header);
    }
}
