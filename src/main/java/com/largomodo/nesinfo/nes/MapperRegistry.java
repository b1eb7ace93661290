package com.largomodo.nesinfo.nes;

import java.util.Map;

/**
 * Registry of well-known iNES mapper numbers.
 * Static utility pattern: the table is immutable and shared without synchronization.
 * Names follow the board designations in common use on nesdev.
 */
public class MapperRegistry {

    public static final String UNKNOWN_NAME = "Unknown/Custom";

    private static final Map<Integer, String> NAMES = Map.ofEntries(
            Map.entry(0, "NROM"),
            Map.entry(1, "MMC1 (SxROM)"),
            Map.entry(2, "UNROM (UxROM)"),
            Map.entry(3, "CNROM (CxROM)"),
            Map.entry(4, "MMC3 (TxROM)"),
            Map.entry(5, "MMC5 (ExROM)"),
            Map.entry(7, "AOROM (AxROM)"),
            Map.entry(9, "MMC2 (PxROM)"),
            Map.entry(10, "MMC4 (FxROM)"),
            Map.entry(11, "Color Dreams"),
            Map.entry(13, "CPROM"),
            Map.entry(15, "100-in-1"),
            Map.entry(66, "GxROM/MxROM"),
            Map.entry(69, "FME-7 / Sunsoft 5"),
            Map.entry(71, "Camerica (BF909x)"),
            Map.entry(73, "VRC3"),
            Map.entry(75, "VRC1"),
            Map.entry(76, "VRC4"),
            Map.entry(78, "Irem 74HC161/32"),
            Map.entry(79, "NINA-003/006"),
            Map.entry(85, "VRC7"),
            Map.entry(87, "VRC2"),
            Map.entry(94, "HVC-UN1ROM"),
            Map.entry(118, "TxSROM"),
            Map.entry(119, "TQROM"),
            Map.entry(210, "Namco 129/163")
    );

    private MapperRegistry() {
    }

    /**
     * Human-readable board name for a mapper number. Total: never throws, never returns null.
     *
     * @param mapper mapper number (any int)
     * @return known board name or {@link #UNKNOWN_NAME}
     */
    public static String nameOf(int mapper) {
        return NAMES.getOrDefault(mapper, UNKNOWN_NAME);
    }

    public static boolean isKnown(int mapper) {
        return NAMES.containsKey(mapper);
    }

    /**
     * Policy for iNES 1.0 images that leave byte 8 at zero: MMC1 and MMC3 boards
     * are assumed to carry 8 KiB of PRG-RAM. This is a compatibility convention of
     * iNES 1.0 dumps, not a property of the hardware.
     */
    public static boolean requiresPrgRam(int mapper) {
        return mapper == 1 || mapper == 4;
    }
}
