package com.largomodo.nesinfo.nes;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class NesCartridgeTest {

    private static final byte[] RAW = {'N', 'E', 'S', 0x1A, 1, 1, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0};

    private static NesHeader header(boolean trainer, int prgSize, int chrSize) {
        return new NesHeader(HeaderFormat.INES1, 0, 0, prgSize, chrSize, 0, 0, 0, 0,
                Mirroring.HORIZONTAL, false, trainer, ConsoleType.STANDARD, TvSystem.NTSC);
    }

    @Test
    void testConstructorCreatesValidCartridge() {
        NesCartridge cartridge = new NesCartridge(header(false, 16384, 8192), RAW, null,
                new byte[16384], new byte[8192]);

        assertEquals(16384, cartridge.prgRom().length);
        assertEquals(8192, cartridge.chrRom().length);
        assertEquals(16 + 16384 + 8192, cartridge.imageSize());
    }

    @Test
    void testNullHeaderThrowsNPE() {
        assertThrows(NullPointerException.class, () ->
                new NesCartridge(null, RAW, null, new byte[16384], new byte[8192]));
    }

    @Test
    void testNullPrgRomThrowsNPE() {
        assertThrows(NullPointerException.class, () ->
                new NesCartridge(header(false, 16384, 8192), RAW, null, null, new byte[8192]));
    }

    @Test
    void testSliceShorterThanDeclaredIsRejected() {
        assertThrows(IllegalArgumentException.class, () ->
                new NesCartridge(header(false, 16384, 8192), RAW, null, new byte[16383], new byte[8192]));
        assertThrows(IllegalArgumentException.class, () ->
                new NesCartridge(header(false, 16384, 8192), RAW, null, new byte[16384], new byte[0]));
    }

    @Test
    void testTrainerMustMatchHeaderFlag() {
        assertThrows(IllegalArgumentException.class, () ->
                new NesCartridge(header(true, 16384, 0), RAW, null, new byte[16384], new byte[0]));
        assertThrows(IllegalArgumentException.class, () ->
                new NesCartridge(header(false, 16384, 0), RAW, new byte[512], new byte[16384], new byte[0]));
        assertThrows(IllegalArgumentException.class, () ->
                new NesCartridge(header(true, 16384, 0), RAW, new byte[100], new byte[16384], new byte[0]));
    }

    @Test
    void testRawHeaderMustBeSixteenBytes() {
        assertThrows(IllegalArgumentException.class, () ->
                new NesCartridge(header(false, 16384, 0), new byte[15], null, new byte[16384], new byte[0]));
    }

    @Test
    void testAccessorsReturnCopies() {
        byte[] prg = new byte[16384];
        NesCartridge cartridge = new NesCartridge(header(false, 16384, 0), RAW, null, prg, new byte[0]);

        prg[0] = 42;
        cartridge.prgRom()[1] = 42;
        cartridge.rawHeader()[0] = 0;

        assertEquals(0, cartridge.prgRom()[0]);
        assertEquals(0, cartridge.prgRom()[1]);
        assertEquals('N', cartridge.rawHeader()[0]);
    }

    @Test
    void testEqualsAndHashCodeCompareContents() {
        NesCartridge a = new NesCartridge(header(true, 16384, 0), RAW, new byte[512], new byte[16384], new byte[0]);
        NesCartridge b = new NesCartridge(header(true, 16384, 0), RAW.clone(), new byte[512], new byte[16384], new byte[0]);

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
    }

    @Test
    void testDifferentPrgContentIsNotEqual() {
        byte[] prg = new byte[16384];
        prg[100] = 1;
        NesCartridge a = new NesCartridge(header(false, 16384, 0), RAW, null, new byte[16384], new byte[0]);
        NesCartridge b = new NesCartridge(header(false, 16384, 0), RAW, null, prg, new byte[0]);

        assertNotEquals(a, b);
    }

    @Test
    void testToStringSummarizesSizes() {
        NesCartridge cartridge = new NesCartridge(header(false, 16384, 8192), RAW, null,
                new byte[16384], new byte[8192]);

        String s = cartridge.toString();
        assertTrue(s.contains("prgRom=16384"));
        assertTrue(s.contains("chrRom=8192"));
    }
}
