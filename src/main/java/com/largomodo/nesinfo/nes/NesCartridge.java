package com.largomodo.nesinfo.nes;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable representation of a loaded cartridge image.
 * <p>
 * This record owns private copies of the raw 16-byte header, the optional 512-byte
 * trainer and the PRG/CHR-ROM slices. Array accessors return copies, so a cartridge
 * cannot be modified after construction. An empty CHR-ROM means the board uses CHR-RAM.
 * <p>
 * The constructor re-checks every slice against the header, so a cartridge whose data
 * does not match its declared sizes cannot exist.
 */
public record NesCartridge(
        NesHeader header,
        byte[] rawHeader,
        byte[] trainer,
        byte[] prgRom,
        byte[] chrRom
) {
    public NesCartridge {
        Objects.requireNonNull(header, "header must not be null");
        Objects.requireNonNull(rawHeader, "rawHeader must not be null");
        Objects.requireNonNull(prgRom, "prgRom must not be null");
        Objects.requireNonNull(chrRom, "chrRom must not be null");

        if (rawHeader.length != NesConstants.HEADER_SIZE) {
            throw new IllegalArgumentException("rawHeader must be " + NesConstants.HEADER_SIZE
                    + " bytes, got " + rawHeader.length);
        }
        if (header.hasTrainer() != (trainer != null)) {
            throw new IllegalArgumentException("Trainer presence does not match header flag");
        }
        if (trainer != null && trainer.length != NesConstants.TRAINER_SIZE) {
            throw new IllegalArgumentException("Trainer must be " + NesConstants.TRAINER_SIZE
                    + " bytes, got " + trainer.length);
        }
        if (prgRom.length != header.prgRomSize()) {
            throw new IllegalArgumentException("PRG-ROM length " + prgRom.length
                    + " does not match declared " + header.prgRomSize());
        }
        if (chrRom.length != header.chrRomSize()) {
            throw new IllegalArgumentException("CHR-ROM length " + chrRom.length
                    + " does not match declared " + header.chrRomSize());
        }

        rawHeader = rawHeader.clone();
        trainer = trainer == null ? null : trainer.clone();
        prgRom = prgRom.clone();
        chrRom = chrRom.clone();
    }

    @Override
    public byte[] rawHeader() {
        return rawHeader.clone();
    }

    /**
     * @return copy of the trainer block, or null when the image has none
     * @see #trainerBlock()
     */
    @Override
    public byte[] trainer() {
        return trainer == null ? null : trainer.clone();
    }

    public Optional<byte[]> trainerBlock() {
        return Optional.ofNullable(trainer());
    }

    @Override
    public byte[] prgRom() {
        return prgRom.clone();
    }

    @Override
    public byte[] chrRom() {
        return chrRom.clone();
    }

    /**
     * @return total image length this cartridge was sliced from, excluding trailing bytes
     */
    public long imageSize() {
        return NesConstants.HEADER_SIZE + header.dataSize();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NesCartridge that = (NesCartridge) o;
        return header.equals(that.header) &&
                Arrays.equals(rawHeader, that.rawHeader) &&
                Arrays.equals(trainer, that.trainer) &&
                Arrays.equals(prgRom, that.prgRom) &&
                Arrays.equals(chrRom, that.chrRom);
    }

    @Override
    public int hashCode() {
        int result = header.hashCode();
        result = 31 * result + Arrays.hashCode(rawHeader);
        result = 31 * result + Arrays.hashCode(trainer);
        result = 31 * result + Arrays.hashCode(prgRom);
        result = 31 * result + Arrays.hashCode(chrRom);
        return result;
    }

    @Override
    public String toString() {
        return "NesCartridge{" +
                "format=" + header.format() +
                ", mapper=" + header.mapper() +
                ", trainer=" + (trainer != null) +
                ", prgRom=" + prgRom.length +
                ", chrRom=" + chrRom.length +
                '}';
    }
}
