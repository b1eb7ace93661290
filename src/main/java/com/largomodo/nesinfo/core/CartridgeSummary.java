package com.largomodo.nesinfo.core;

import com.largomodo.nesinfo.nes.ConsoleType;
import com.largomodo.nesinfo.nes.NesCartridge;
import com.largomodo.nesinfo.nes.NesHeader;
import com.largomodo.nesinfo.util.SizeFormatter;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Renders a loaded cartridge as ordered, human-readable info lines.
 * <p>
 * Optional lines are omitted rather than printed empty: CHR RAM only appears when declared,
 * console type only when it is not a standard NES/Famicom.
 */
public class CartridgeSummary {

    private CartridgeSummary() {
    }

    public static List<String> lines(NesCartridge cartridge) {
        NesHeader h = cartridge.header();
        List<String> lines = new ArrayList<>();

        lines.add("Format: " + h.format().getDisplayName());

        String mapperLine = "Mapper: " + h.mapper() + " (" + h.mapperName() + ")";
        if (h.submapper() != 0) {
            mapperLine += ", submapper " + h.submapper();
        }
        lines.add(mapperLine);

        lines.add("PRG ROM: " + SizeFormatter.format(h.prgRomSize()));
        lines.add("CHR ROM: " + SizeFormatter.format(h.chrRomSize()));

        if (h.prgRamSize() > 0 || h.prgNvramSize() > 0) {
            lines.add("PRG RAM: " + withNv(h.prgRamSize(), h.prgNvramSize()));
        } else {
            lines.add("PRG RAM: none declared");
        }
        if (h.chrRamSize() > 0 || h.chrNvramSize() > 0) {
            lines.add("CHR RAM: " + withNv(h.chrRamSize(), h.chrNvramSize()));
        }

        lines.add("Mirroring: " + h.mirroring().getDisplayName());
        lines.add("Battery-backed RAM: " + yesNo(h.batteryBacked()));
        lines.add("Trainer present: " + yesNo(h.hasTrainer()));
        if (h.consoleType() != ConsoleType.STANDARD) {
            lines.add("Console type: " + h.consoleType().getDisplayName());
        }
        lines.add("TV system: " + h.tvSystem().getDisplayName());
        return lines;
    }

    /**
     * Hex dump of the raw 16 header bytes, e.g. {@code "4E 45 53 1A 02 01 ..."}.
     */
    public static String rawHeaderHex(NesCartridge cartridge) {
        byte[] raw = cartridge.rawHeader();
        StringBuilder sb = new StringBuilder(raw.length * 3);
        for (int i = 0; i < raw.length; i++) {
            if (i > 0) {
                sb.append(' ');
            }
            sb.append(String.format(Locale.ROOT, "%02X", raw[i] & 0xFF));
        }
        return sb.toString();
    }

    private static String withNv(int volatileSize, int nvSize) {
        String s = SizeFormatter.format(volatileSize);
        if (nvSize > 0) {
            s += " (NV: " + SizeFormatter.format(nvSize) + ")";
        }
        return s;
    }

    private static String yesNo(boolean b) {
        return b ? "yes" : "no";
    }
}
