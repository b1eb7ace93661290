package com.largomodo.nesinfo.core;

import com.largomodo.nesinfo.nes.NesCartridge;

import java.nio.file.Path;

/**
 * Observer interface for ROM inspection lifecycle events.
 * <p>
 * All methods have default no-op implementations, allowing consumers to override
 * only the events they care about.
 *
 * @see CartridgeInspector
 */
public interface InspectionObserver {

    /**
     * Called before the ROM file is read.
     *
     * @param rom the ROM file being inspected
     */
    default void onStart(Path rom) {}

    /**
     * Called when the ROM was parsed and sliced successfully.
     *
     * @param rom       the ROM file that was inspected
     * @param cartridge the loaded cartridge
     */
    default void onSuccess(Path rom, NesCartridge cartridge) {}

    /**
     * Called when reading, parsing or loading fails.
     *
     * @param rom the ROM file that failed
     * @param e   the exception that caused the failure
     */
    default void onFailure(Path rom, Exception e) {}
}
