package com.largomodo.nesinfo.nes;

import com.largomodo.nesinfo.nes.generators.SyntheticNesImage;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.IntRange;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class CartridgeLoaderTest {

    private final NesHeaderParser parser = new NesHeaderParser();
    private final CartridgeLoader loader = new CartridgeLoader();

    @Test
    void slicesRegionsInFileOrder() throws Exception {
        byte[] data = SyntheticNesImage.ines().prgUnits(2).chrUnits(1).trainer(true).build();

        NesCartridge cartridge = loader.load(data, parser.parse(data));

        assertTrue(cartridge.trainerBlock().isPresent());
        assertEquals(512, cartridge.trainer().length);
        assertAllBytes(SyntheticNesImage.TRAINER_FILL, cartridge.trainer());
        assertEquals(32768, cartridge.prgRom().length);
        assertAllBytes(SyntheticNesImage.PRG_FILL, cartridge.prgRom());
        assertEquals(8192, cartridge.chrRom().length);
        assertAllBytes(SyntheticNesImage.CHR_FILL, cartridge.chrRom());
        assertArrayEquals(Arrays.copyOf(data, 16), cartridge.rawHeader());
    }

    @Test
    void withoutTrainerPrgStartsAtOffset16() throws Exception {
        byte[] data = SyntheticNesImage.ines().prgUnits(1).chrUnits(1).build();
        data[16] = 0x11;
        data[16 + 16384] = 0x22;

        NesCartridge cartridge = loader.load(data, parser.parse(data));

        assertNull(cartridge.trainer());
        assertTrue(cartridge.trainerBlock().isEmpty());
        assertEquals(0x11, cartridge.prgRom()[0]);
        assertEquals(0x22, cartridge.chrRom()[0]);
    }

    @Test
    void declaredTrainerWithHeaderOnlyBufferIsTruncatedTrainer() throws Exception {
        byte[] data = {'N', 'E', 'S', 0x1A, 2, 1, 0x05, 0x00, 0, 0, 0, 0, 0, 0, 0, 0};
        NesHeader header = parser.parse(data);

        InvalidRomException ex = assertThrows(InvalidRomException.class, () -> loader.load(data, header));

        assertEquals(InvalidRomException.Reason.TRUNCATED_TRAINER, ex.getReason());
        assertEquals(RomRegion.TRAINER, ex.getRegion().orElseThrow());
        assertEquals(512, ex.getExpectedBytes());
        assertEquals(0, ex.getAvailableBytes());
    }

    @Test
    void shortPrgIsTruncatedRomTaggedPrg() throws Exception {
        byte[] full = SyntheticNesImage.ines().prgUnits(2).chrUnits(1).build();
        byte[] data = Arrays.copyOf(full, 16 + 20000);

        InvalidRomException ex = assertThrows(InvalidRomException.class,
                () -> loader.load(data, parser.parse(data)));

        assertEquals(InvalidRomException.Reason.TRUNCATED_ROM, ex.getReason());
        assertEquals(RomRegion.PRG_ROM, ex.getRegion().orElseThrow());
        assertEquals(32768, ex.getExpectedBytes());
        assertEquals(20000, ex.getAvailableBytes());
        assertTrue(ex.getMessage().contains("PRG-ROM"));
    }

    @Test
    void shortChrIsTruncatedRomTaggedChr() throws Exception {
        byte[] full = SyntheticNesImage.ines().prgUnits(1).chrUnits(1).trainer(true).build();
        byte[] data = Arrays.copyOf(full, full.length - 1);

        InvalidRomException ex = assertThrows(InvalidRomException.class,
                () -> loader.load(data, parser.parse(data)));

        assertEquals(InvalidRomException.Reason.TRUNCATED_ROM, ex.getReason());
        assertEquals(RomRegion.CHR_ROM, ex.getRegion().orElseThrow());
        assertEquals(8191, ex.getAvailableBytes());
    }

    @Test
    void zeroChrUnitsYieldEmptyChrSlice() throws Exception {
        byte[] data = SyntheticNesImage.ines().prgUnits(1).chrUnits(0).build();

        NesCartridge cartridge = loader.load(data, parser.parse(data));

        assertEquals(0, cartridge.chrRom().length);
        assertTrue(cartridge.header().usesChrRam());
    }

    @Test
    void trailingBytesAreIgnored() throws Exception {
        byte[] exact = SyntheticNesImage.ines().prgUnits(1).chrUnits(1).build();
        byte[] padded = Arrays.copyOf(exact, exact.length + 128);

        NesCartridge fromExact = loader.load(exact, parser.parse(exact));
        NesCartridge fromPadded = loader.load(padded, parser.parse(padded));

        assertEquals(fromExact, fromPadded);
        assertEquals(exact.length, fromPadded.imageSize());
    }

    @Test
    void hugeNes2DeclarationFailsWithoutOverflow() throws Exception {
        byte[] data = SyntheticNesImage.nes2().prgUnits(0xFF).chrUnits(0xFF).set(9, 0xFF).header();

        InvalidRomException ex = assertThrows(InvalidRomException.class,
                () -> loader.load(data, parser.parse(data)));

        assertEquals(RomRegion.PRG_ROM, ex.getRegion().orElseThrow());
        assertEquals(0xFFFL * 16384, ex.getExpectedBytes());
    }

    @Test
    void loaderRejectsBufferShorterThanHeader() throws Exception {
        NesHeader header = parser.parse(SyntheticNesImage.ines().header());
        InvalidRomException ex = assertThrows(InvalidRomException.class,
                () -> loader.load(new byte[8], header));
        assertEquals(InvalidRomException.Reason.TOO_SHORT, ex.getReason());
    }

    @Test
    void cartridgeDoesNotShareSourceBuffer() throws Exception {
        byte[] data = SyntheticNesImage.ines().prgUnits(1).chrUnits(1).build();
        NesCartridge cartridge = loader.load(data, parser.parse(data));

        Arrays.fill(data, (byte) 0);

        assertAllBytes(SyntheticNesImage.PRG_FILL, cartridge.prgRom());
        assertEquals('N', cartridge.rawHeader()[0]);
    }

    @Property(tries = 50)
    void anyMissingByteIsDetected(@ForAll @IntRange(min = 1, max = 512 + 16384 + 8192) int missing,
                                  @ForAll boolean trainer) throws Exception {
        byte[] full = SyntheticNesImage.ines().prgUnits(1).chrUnits(1).trainer(trainer).build();
        int cut = Math.min(missing, full.length - 16);
        byte[] data = Arrays.copyOf(full, full.length - cut);
        NesHeader header = parser.parse(data);

        assertThrows(InvalidRomException.class, () -> loader.load(data, header));
    }

    private static void assertAllBytes(byte expected, byte[] actual) {
        for (int i = 0; i < actual.length; i++) {
            if (actual[i] != expected) {
                fail(String.format("Byte %d: expected 0x%02X but was 0x%02X", i, expected & 0xFF, actual[i] & 0xFF));
            }
        }
    }
}
