package com.largomodo.nesinfo.nes;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Objects;

/**
 * Slices an image buffer into trainer, PRG-ROM and CHR-ROM according to a parsed header.
 * <p>
 * Regions are laid out back to back from offset 16. Every region is bounds-checked
 * before anything is copied, so either a complete {@link NesCartridge} is returned or an
 * {@link InvalidRomException} names the first region the buffer cannot back.
 * Offsets are computed in {@code long} so oversized NES 2.0 declarations fail cleanly
 * instead of overflowing.
 */
public class CartridgeLoader {

    private static final Logger log = LoggerFactory.getLogger(CartridgeLoader.class);

    /**
     * Build a cartridge from {@code data} and its already parsed header.
     *
     * @param data   full image bytes, header included
     * @param header header parsed from the same buffer
     * @return cartridge owning copies of every region
     * @throws InvalidRomException {@code TOO_SHORT}, {@code TRUNCATED_TRAINER} or {@code TRUNCATED_ROM}
     */
    public NesCartridge load(byte[] data, NesHeader header) throws InvalidRomException {
        Objects.requireNonNull(data, "data must not be null");
        Objects.requireNonNull(header, "header must not be null");

        if (data.length < NesConstants.HEADER_SIZE) {
            throw InvalidRomException.tooShort(data.length);
        }

        long trainerOffset = NesConstants.HEADER_SIZE;
        long prgOffset = trainerOffset + (header.hasTrainer() ? NesConstants.TRAINER_SIZE : 0);
        long chrOffset = prgOffset + header.prgRomSize();
        long end = chrOffset + header.chrRomSize();

        // Validate all regions first; nothing is copied until the whole layout fits
        if (header.hasTrainer()) {
            requireRegion(data, RomRegion.TRAINER, trainerOffset, NesConstants.TRAINER_SIZE);
        }
        requireRegion(data, RomRegion.PRG_ROM, prgOffset, header.prgRomSize());
        requireRegion(data, RomRegion.CHR_ROM, chrOffset, header.chrRomSize());

        byte[] rawHeader = Arrays.copyOfRange(data, 0, NesConstants.HEADER_SIZE);
        byte[] trainer = header.hasTrainer()
                ? Arrays.copyOfRange(data, (int) trainerOffset, (int) prgOffset)
                : null;
        byte[] prgRom = Arrays.copyOfRange(data, (int) prgOffset, (int) chrOffset);
        byte[] chrRom = Arrays.copyOfRange(data, (int) chrOffset, (int) end);

        if (data.length > end) {
            log.debug("Ignoring {} trailing bytes after CHR-ROM", data.length - end);
        }
        return new NesCartridge(header, rawHeader, trainer, prgRom, chrRom);
    }

    private void requireRegion(byte[] data, RomRegion region, long offset, long size) throws InvalidRomException {
        long available = Math.max(0, data.length - offset);
        if (available < size) {
            throw InvalidRomException.truncated(region, size, available);
        }
    }
}
