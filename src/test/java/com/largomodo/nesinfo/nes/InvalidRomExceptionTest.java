package com.largomodo.nesinfo.nes;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

class InvalidRomExceptionTest {

    @Test
    void testTrainerTruncationUsesTrainerReason() {
        InvalidRomException ex = InvalidRomException.truncated(RomRegion.TRAINER, 512, 10);

        assertEquals(InvalidRomException.Reason.TRUNCATED_TRAINER, ex.getReason());
        assertEquals(RomRegion.TRAINER, ex.getRegion().orElseThrow());
        assertTrue(ex.getMessage().contains("trainer"));
    }

    @Test
    void testRomTruncationNamesRegion() {
        InvalidRomException prg = InvalidRomException.truncated(RomRegion.PRG_ROM, 32768, 100);
        InvalidRomException chr = InvalidRomException.truncated(RomRegion.CHR_ROM, 8192, 0);

        assertEquals(InvalidRomException.Reason.TRUNCATED_ROM, prg.getReason());
        assertEquals(InvalidRomException.Reason.TRUNCATED_ROM, chr.getReason());
        assertTrue(prg.getMessage().contains("PRG-ROM"));
        assertTrue(chr.getMessage().contains("CHR-ROM"));
        assertTrue(prg.getMessage().contains("32768"));
    }

    @Test
    void testHeaderFailuresHaveNoRegion() {
        assertTrue(InvalidRomException.badMagic().getRegion().isEmpty());
        assertTrue(InvalidRomException.tooShort(3).getRegion().isEmpty());
    }

    @Test
    void testIsAnIOException() {
        assertInstanceOf(IOException.class, InvalidRomException.badMagic());
    }
}
