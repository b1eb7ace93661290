package com.largomodo.nesinfo.nes;

/**
 * Header dialect, selected by bits 2-3 of flags 7.
 */
public enum HeaderFormat {
    INES1("iNES 1.0"),
    NES2("NES 2.0");

    private final String displayName;

    HeaderFormat(String displayName) {
        this.displayName = displayName;
    }

    /**
     * Resolves the dialect from the flags 7 byte alone.
     * <p>
     * Only the value {@code 0b10} in bits 2-3 marks NES 2.0; the three other values
     * (including the "archaic" {@code 0b01} and the dirty-header {@code 0b11}) are read as iNES 1.0.
     *
     * @param flags7 header byte 7 (only the low 8 bits are used)
     * @return detected header format
     */
    public static HeaderFormat fromFlags7(int flags7) {
        return (flags7 & 0x0C) == 0x08 ? NES2 : INES1;
    }

    public String getDisplayName() {
        return displayName;
    }
}
