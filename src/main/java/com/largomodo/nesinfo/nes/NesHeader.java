package com.largomodo.nesinfo.nes;

import java.util.Objects;

/**
 * Immutable, fully decoded iNES / NES 2.0 header.
 * <p>
 * All sizes are in bytes. Instances come from {@link NesHeaderParser#parse(byte[])};
 * the compact constructor rejects field combinations the header format cannot express,
 * so a constructed header always satisfies the format's bit widths and unit multiples.
 */
public record NesHeader(
        HeaderFormat format,
        int mapper,
        int submapper,
        int prgRomSize,
        int chrRomSize,
        int prgRamSize,
        int prgNvramSize,
        int chrRamSize,
        int chrNvramSize,
        Mirroring mirroring,
        boolean batteryBacked,
        boolean hasTrainer,
        ConsoleType consoleType,
        TvSystem tvSystem
) {
    public NesHeader {
        Objects.requireNonNull(format, "format must not be null");
        Objects.requireNonNull(mirroring, "mirroring must not be null");
        Objects.requireNonNull(consoleType, "consoleType must not be null");
        Objects.requireNonNull(tvSystem, "tvSystem must not be null");

        int maxMapper = format == HeaderFormat.NES2 ? 0xFFF : 0xFF;
        if (mapper < 0 || mapper > maxMapper) {
            throw new IllegalArgumentException("Mapper " + mapper + " out of range for " + format.getDisplayName());
        }
        if (submapper < 0 || submapper > 0x0F) {
            throw new IllegalArgumentException("Submapper out of range: " + submapper);
        }
        if (format == HeaderFormat.INES1 && submapper != 0) {
            throw new IllegalArgumentException("Submapper is only defined for NES 2.0 headers");
        }
        if (prgRomSize < 0 || prgRomSize % NesConstants.PRG_ROM_UNIT != 0) {
            throw new IllegalArgumentException("PRG-ROM size must be a non-negative multiple of 16 KiB: " + prgRomSize);
        }
        if (chrRomSize < 0 || chrRomSize % NesConstants.CHR_ROM_UNIT != 0) {
            throw new IllegalArgumentException("CHR-ROM size must be a non-negative multiple of 8 KiB: " + chrRomSize);
        }
        if (prgRamSize < 0 || prgNvramSize < 0 || chrRamSize < 0 || chrNvramSize < 0) {
            throw new IllegalArgumentException("RAM sizes must not be negative");
        }
    }

    public boolean isNes2() {
        return format == HeaderFormat.NES2;
    }

    /**
     * @return true when the board uses writable CHR memory instead of CHR-ROM
     */
    public boolean usesChrRam() {
        return chrRomSize == 0;
    }

    public String mapperName() {
        return MapperRegistry.nameOf(mapper);
    }

    /**
     * Number of bytes the image must contain after the header: trainer, PRG-ROM and CHR-ROM.
     */
    public long dataSize() {
        long trainer = hasTrainer ? NesConstants.TRAINER_SIZE : 0;
        return trainer + prgRomSize + chrRomSize;
    }
}
