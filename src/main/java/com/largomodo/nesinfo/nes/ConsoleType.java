package com.largomodo.nesinfo.nes;

/**
 * Console type stored in the two low bits of flags 7.
 * <p>
 * The bits form a single 2-bit field. They are never read as independent
 * VS System / PlayChoice-10 flags.
 */
public enum ConsoleType {
    STANDARD("NES/Famicom"),
    VS_SYSTEM("VS System"),
    PLAYCHOICE_10("PlayChoice-10"),
    // Actual hardware is named by NES 2.0 byte 13, which is not decoded here
    EXTENDED("Extended");

    private final String displayName;

    ConsoleType(String displayName) {
        this.displayName = displayName;
    }

    public static ConsoleType fromFlags7(int flags7) {
        return switch (flags7 & 0x03) {
            case 1 -> VS_SYSTEM;
            case 2 -> PLAYCHOICE_10;
            case 3 -> EXTENDED;
            default -> STANDARD;
        };
    }

    public String getDisplayName() {
        return displayName;
    }
}
