package com.largomodo.nesinfo.nes;

import java.io.IOException;
import java.util.Objects;
import java.util.Optional;

/**
 * Thrown when a byte buffer is not a usable iNES / NES 2.0 image.
 * <p>
 * Extends IOException so callers reading ROM files handle malformed content and
 * unreadable files through one catch clause. The {@link Reason} tells them which check failed;
 * truncation failures also name the short {@link RomRegion} and the byte counts involved.
 */
public class InvalidRomException extends IOException {

    /**
     * Failure taxonomy of the parse and load steps.
     */
    public enum Reason {
        TOO_SHORT,
        BAD_MAGIC,
        TRUNCATED_TRAINER,
        TRUNCATED_ROM
    }

    private final Reason reason;
    private final RomRegion region;
    private final long expectedBytes;
    private final long availableBytes;

    private InvalidRomException(Reason reason, RomRegion region, long expectedBytes,
                                long availableBytes, String message) {
        super(message);
        this.reason = Objects.requireNonNull(reason, "reason must not be null");
        this.region = region;
        this.expectedBytes = expectedBytes;
        this.availableBytes = availableBytes;
    }

    /**
     * Buffer cannot even hold the 16-byte header.
     *
     * @param length actual buffer length
     */
    public static InvalidRomException tooShort(int length) {
        return new InvalidRomException(Reason.TOO_SHORT, null, NesConstants.HEADER_SIZE, length,
                "File too small to contain an iNES header: " + length + " bytes (need "
                        + NesConstants.HEADER_SIZE + ")");
    }

    public static InvalidRomException badMagic() {
        return new InvalidRomException(Reason.BAD_MAGIC, null, 0, 0,
                "Missing NES<0x1A> magic; not an iNES/NES 2.0 image");
    }

    /**
     * A declared region extends past the end of the buffer.
     *
     * @param region    region that could not be read in full
     * @param expected  bytes the header declares for the region
     * @param available bytes left in the buffer at the region's offset
     */
    public static InvalidRomException truncated(RomRegion region, long expected, long available) {
        Objects.requireNonNull(region, "region must not be null");
        Reason reason = region == RomRegion.TRAINER ? Reason.TRUNCATED_TRAINER : Reason.TRUNCATED_ROM;
        return new InvalidRomException(reason, region, expected, available,
                "File truncated: " + region.getLabel() + " declares " + expected
                        + " bytes but only " + available + " remain");
    }

    public Reason getReason() {
        return reason;
    }

    /**
     * @return the short region for truncation failures, empty for header failures
     */
    public Optional<RomRegion> getRegion() {
        return Optional.ofNullable(region);
    }

    public long getExpectedBytes() {
        return expectedBytes;
    }

    public long getAvailableBytes() {
        return availableBytes;
    }
}
