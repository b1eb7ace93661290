package com.largomodo.nesinfo.core;

import com.largomodo.nesinfo.nes.NesCartridge;
import com.largomodo.nesinfo.nes.NesRomReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Inspection pipeline for a single ROM file.
 * <p>
 * Reads the file, decodes the header, slices the data and logs the cartridge summary.
 * Lifecycle events go to an {@link InspectionObserver}; failures are reported to the
 * observer and then rethrown so single-file callers can fail fast while batch callers
 * decide for themselves whether to continue.
 */
public class CartridgeInspector {

    private static final Logger log = LoggerFactory.getLogger(CartridgeInspector.class);

    private final NesRomReader reader;
    private final boolean showRawHeader;

    public CartridgeInspector(NesRomReader reader, boolean showRawHeader) {
        this.reader = Objects.requireNonNull(reader, "reader must not be null");
        this.showRawHeader = showRawHeader;
    }

    /**
     * Inspect one ROM file.
     *
     * @param rom      path to the .nes file
     * @param observer lifecycle callbacks (use {@code new InspectionObserver() {}} for none)
     * @return the loaded cartridge
     * @throws IOException if the file cannot be read or is not a valid image
     */
    public NesCartridge inspect(Path rom, InspectionObserver observer) throws IOException {
        Objects.requireNonNull(rom, "rom must not be null");
        Objects.requireNonNull(observer, "observer must not be null");

        observer.onStart(rom);
        NesCartridge cartridge;
        try {
            cartridge = reader.load(rom);
        } catch (IOException | RuntimeException e) {
            observer.onFailure(rom, e);
            throw e;
        }

        log.info("Loaded: {}", rom.getFileName());
        for (String line : CartridgeSummary.lines(cartridge)) {
            log.info("  {}", line);
        }
        if (showRawHeader) {
            log.info("  Raw header: {}", CartridgeSummary.rawHeaderHex(cartridge));
        }
        observer.onSuccess(rom, cartridge);
        return cartridge;
    }
}
