package com.largomodo.nesinfo.nes;

/**
 * Shared constants for iNES / NES 2.0 image layout.
 * Centralizes magic numbers used by the parser, the loader and the tests.
 */
public class NesConstants {

    /**
     * Fixed header prefix of every .nes image.
     */
    public static final int HEADER_SIZE = 16;

    /**
     * Optional trainer block between header and PRG-ROM.
     */
    public static final int TRAINER_SIZE = 512;

    /**
     * PRG-ROM is counted in 16 KiB units.
     */
    public static final int PRG_ROM_UNIT = 16384;

    /**
     * CHR-ROM is counted in 8 KiB units.
     */
    public static final int CHR_ROM_UNIT = 8192;

    /**
     * iNES 1.0 PRG-RAM units (byte 8) are 8 KiB each.
     */
    public static final int PRG_RAM_UNIT = 8192;

    public static final int KB = 1024;

    private NesConstants() {
    }
}
