package com.largomodo.nesinfo.nes;

/**
 * CPU/PPU timing region of the cartridge.
 */
public enum TvSystem {
    NTSC("NTSC"),
    PAL("PAL"),
    MULTI("Multi-region"),
    UNKNOWN("Unknown");

    private final String displayName;

    TvSystem(String displayName) {
        this.displayName = displayName;
    }

    /**
     * NES 2.0: 2-bit field in byte 12.
     */
    public static TvSystem fromNes2Byte12(int byte12) {
        return switch (byte12 & 0x03) {
            case 0 -> NTSC;
            case 1 -> PAL;
            case 2 -> MULTI;
            default -> UNKNOWN;
        };
    }

    /**
     * iNES 1.0: bit 0 of byte 9.
     */
    public static TvSystem fromInes1Byte9(int byte9) {
        return (byte9 & 0x01) != 0 ? PAL : NTSC;
    }

    public String getDisplayName() {
        return displayName;
    }
}
