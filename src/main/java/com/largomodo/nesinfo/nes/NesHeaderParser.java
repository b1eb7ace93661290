package com.largomodo.nesinfo.nes;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Decoder for the 16-byte iNES / NES 2.0 header.
 * <p>
 * This class handles:
 * <ul>
 *   <li>Length and magic ({@code NES<0x1A>}) validation</li>
 *   <li>Format detection (iNES 1.0 vs NES 2.0) from flags 7</li>
 *   <li>Mapper/submapper assembly from the flags 6/7/8 nibbles</li>
 *   <li>ROM size decoding, including the NES 2.0 high-nibble extension in byte 9</li>
 *   <li>RAM/NVRAM sizing: NES 2.0 shift counts, iNES 1.0 unit counts and defaults</li>
 * </ul>
 * <p>
 * Only the first 16 bytes are inspected. Stateless and safe for concurrent use.
 * <p>
 * NES 2.0 byte 9 nibbles are treated as plain bits 8-11 of the unit counts. The
 * exponent-multiplier form (nibble value 0xF) is not decoded.
 */
public class NesHeaderParser {

    private static final Logger log = LoggerFactory.getLogger(NesHeaderParser.class);

    private static final byte[] MAGIC = {'N', 'E', 'S', 0x1A};

    /**
     * Parse the header at the start of {@code data}.
     *
     * @param data image bytes; at least 16 bytes, trailing bytes are ignored
     * @return decoded header
     * @throws InvalidRomException {@code TOO_SHORT} or {@code BAD_MAGIC}
     */
    public NesHeader parse(byte[] data) throws InvalidRomException {
        Objects.requireNonNull(data, "data must not be null");

        // Length is checked before the magic so a 3-byte file reports TOO_SHORT
        if (data.length < NesConstants.HEADER_SIZE) {
            throw InvalidRomException.tooShort(data.length);
        }
        for (int i = 0; i < MAGIC.length; i++) {
            if (data[i] != MAGIC[i]) {
                throw InvalidRomException.badMagic();
            }
        }

        int prgUnits = data[4] & 0xFF;
        int chrUnits = data[5] & 0xFF;
        int flags6 = data[6] & 0xFF;
        int flags7 = data[7] & 0xFF;
        int byte8 = data[8] & 0xFF;
        int byte9 = data[9] & 0xFF;
        int byte10 = data[10] & 0xFF;
        int byte11 = data[11] & 0xFF;
        int byte12 = data[12] & 0xFF;

        HeaderFormat format = HeaderFormat.fromFlags7(flags7);
        boolean nes2 = format == HeaderFormat.NES2;

        int mapper = (flags6 >> 4) | (flags7 & 0xF0);
        int submapper = 0;
        if (nes2) {
            mapper |= (byte8 & 0x0F) << 8;
            submapper = byte8 >> 4;
            prgUnits |= (byte9 & 0x0F) << 8;
            chrUnits |= (byte9 >> 4) << 8;
        }

        int prgRomSize = prgUnits * NesConstants.PRG_ROM_UNIT;
        int chrRomSize = chrUnits * NesConstants.CHR_ROM_UNIT;

        int prgRamSize;
        int prgNvramSize;
        int chrRamSize;
        int chrNvramSize;
        TvSystem tvSystem;
        if (nes2) {
            prgRamSize = decodeShiftSize(byte10 & 0x0F);
            prgNvramSize = decodeShiftSize(byte10 >> 4);
            chrRamSize = decodeShiftSize(byte11 & 0x0F);
            chrNvramSize = decodeShiftSize(byte11 >> 4);
            tvSystem = TvSystem.fromNes2Byte12(byte12);
        } else {
            if (byte8 != 0) {
                prgRamSize = byte8 * NesConstants.PRG_RAM_UNIT;
            } else {
                prgRamSize = MapperRegistry.requiresPrgRam(mapper) ? NesConstants.PRG_RAM_UNIT : 0;
            }
            // iNES 1.0 has no NVRAM fields
            prgNvramSize = 0;
            chrRamSize = chrRomSize == 0 ? NesConstants.CHR_ROM_UNIT : 0;
            chrNvramSize = 0;
            tvSystem = TvSystem.fromInes1Byte9(byte9);
        }

        NesHeader header = new NesHeader(
                format,
                mapper,
                submapper,
                prgRomSize,
                chrRomSize,
                prgRamSize,
                prgNvramSize,
                chrRamSize,
                chrNvramSize,
                Mirroring.fromFlags6(flags6),
                (flags6 & 0x02) != 0,
                (flags6 & 0x04) != 0,
                ConsoleType.fromFlags7(flags7),
                tvSystem
        );
        log.debug("Parsed {} header: mapper={} submapper={} prg={} chr={}",
                format.getDisplayName(), mapper, submapper, prgRomSize, chrRomSize);
        return header;
    }

    /**
     * NES 2.0 RAM size encoding: a zero shift count means no memory, otherwise
     * {@code 64 << shift} bytes.
     *
     * @param shift 4-bit shift count (0-15)
     * @return size in bytes
     */
    public static int decodeShiftSize(int shift) {
        if (shift < 0 || shift > 0x0F) {
            throw new IllegalArgumentException("Shift count must fit in 4 bits: " + shift);
        }
        return shift == 0 ? 0 : 64 << shift;
    }
}
