package com.largomodo.nesinfo.nes;

/**
 * Nametable mirroring declared in flags 6.
 */
public enum Mirroring {
    HORIZONTAL("Horizontal"),
    VERTICAL("Vertical"),
    FOUR_SCREEN("Four-screen VRAM");

    private final String displayName;

    Mirroring(String displayName) {
        this.displayName = displayName;
    }

    /**
     * Bit 3 (four-screen) wins over bit 0 (vertical) when both are set.
     *
     * @param flags6 header byte 6
     * @return declared mirroring mode
     */
    public static Mirroring fromFlags6(int flags6) {
        if ((flags6 & 0x08) != 0) {
            return FOUR_SCREEN;
        }
        return (flags6 & 0x01) != 0 ? VERTICAL : HORIZONTAL;
    }

    public String getDisplayName() {
        return displayName;
    }
}
