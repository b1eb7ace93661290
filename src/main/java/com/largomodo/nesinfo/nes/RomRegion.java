package com.largomodo.nesinfo.nes;

/**
 * Data regions that follow the 16-byte header, in file order.
 */
public enum RomRegion {
    TRAINER("trainer"),
    PRG_ROM("PRG-ROM"),
    CHR_ROM("CHR-ROM");

    private final String label;

    RomRegion(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
