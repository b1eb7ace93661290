package com.largomodo.nesinfo;

import com.largomodo.nesinfo.core.CartridgeInspector;
import com.largomodo.nesinfo.core.InspectionObserver;
import com.largomodo.nesinfo.nes.NesCartridge;
import com.largomodo.nesinfo.nes.NesRomReader;
import com.largomodo.nesinfo.util.NesRomMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import picocli.CommandLine;
import picocli.CommandLine.*;
import picocli.CommandLine.Model.CommandSpec;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

/**
 * CLI entry point for iNES / NES 2.0 cartridge inspection.
 * <p>
 * Accepts a single positional input path (file or directory) and determines the
 * processing mode via runtime inspection:
 * - File input: inspect one image, fail fast (exit code 1) on any error
 * - Directory input: recursive batch over .nes files, fail-soft per file
 */
@Command(
        name = "nesinfo",
        mixinStandardHelpOptions = true,
        resourceBundle = "nesinfo.nesinfo",
        version = "${bundle:application.version}",
        header = "Inspects iNES / NES 2.0 cartridge images.",
        description = {
                "Decodes the 16-byte header of .nes files (mapper, submapper, PRG/CHR sizes, RAM/NVRAM," +
                        " mirroring, console type, TV system) and verifies that the file actually contains" +
                        " the data the header declares.",
                "",
                "Directories are scanned recursively for .nes files."
        },
        exitCodeListHeading = "%nExit Codes:%n",
        exitCodeList = {
                "0:Successful completion",
                "1:General execution error (I/O, invalid or truncated ROM)",
                "2:Invalid command line arguments"
        },
        footerHeading = "%nSee Also:%n",
        footer = {
                "https://www.nesdev.org/wiki/INES",
                "https://www.nesdev.org/wiki/NES_2.0"
        }
)
public class NesInfo implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(NesInfo.class);

    @Parameters(index = "0", paramLabel = "INPUT",
            description = {
                    "The .nes file to inspect, or a directory to scan.",
                    "If a directory is provided, every .nes file below it is inspected and failures " +
                            "are reported without stopping the batch."
            })
    File inputPath;

    @Option(names = "--raw", description = "Also print the raw 16 header bytes as hex")
    boolean showRawHeader;

    @Spec
    CommandSpec spec;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output")
    private boolean verbose;

    public static void main(String[] args) {
        CommandLine cmd = new CommandLine(new NesInfo());
        int exitCode = cmd.execute(args);
        System.exit(exitCode);
    }

    /**
     * Inspect every .nes file below {@code inputRoot} on a fixed pool sized to CPU cores.
     * <p>
     * Bounded queue (2 * coreCount) with CallerRunsPolicy provides backpressure on large
     * ROM libraries. Each task tags its log lines with the ROM name through MDC.
     *
     * @return number of failed files
     */
    static int runBatch(Path inputRoot, CartridgeInspector inspector) throws IOException {
        int coreCount = Runtime.getRuntime().availableProcessors();
        ExecutorService executor = new ThreadPoolExecutor(
                coreCount,
                coreCount,
                0L,
                TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(2 * coreCount),
                new ThreadPoolExecutor.CallerRunsPolicy()
        );

        final AtomicInteger successCount = new AtomicInteger(0);
        final AtomicInteger failCount = new AtomicInteger(0);

        InspectionObserver observer = new InspectionObserver() {
            @Override
            public void onSuccess(Path rom, NesCartridge cartridge) {
                successCount.incrementAndGet();
            }

            @Override
            public void onFailure(Path rom, Exception e) {
                failCount.incrementAndGet();
                log.error("FAILED: {} - {}", inputRoot.relativize(rom), e.getMessage());
            }
        };

        try (Stream<Path> stream = Files.walk(inputRoot)) {
            stream.filter(path -> {
                        try {
                            return NesRomMatcher.isRom(path);
                        } catch (UncheckedIOException e) {
                            // Broken symlink or permission denied on the file itself
                            log.warn("Cannot access {} - skipping", inputRoot.relativize(path));
                            return false;
                        }
                    })
                    .sorted()
                    .forEach(romPath -> executor.submit(() -> {
                        try {
                            MDC.put("rom", romPath.getFileName().toString());
                            inspector.inspect(romPath, observer);
                        } catch (IOException | RuntimeException e) {
                            // Already counted and logged by the observer; the batch continues
                            log.debug("Inspection of {} aborted", romPath, e);
                        } finally {
                            MDC.remove("rom");
                        }
                        return null;
                    }));
        } catch (UncheckedIOException e) {
            // A subdirectory became unreadable mid-traversal: keep what was already inspected
            log.error("Directory traversal interrupted - {}", e.getCause().getMessage());
            failCount.incrementAndGet();
        } finally {
            // Two-phase shutdown: graceful then forceful
            executor.shutdown();
            try {
                if (!executor.awaitTermination(5, TimeUnit.MINUTES)) {
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }

        log.info("Batch complete: {} successful, {} failed", successCount.get(), failCount.get());
        return failCount.get();
    }

    @Override
    public Integer call() throws Exception {
        if (verbose) {
            ch.qos.logback.classic.Logger root =
                    (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
            root.setLevel(ch.qos.logback.classic.Level.DEBUG);
        }

        if (!inputPath.exists()) {
            throw new ParameterException(spec.commandLine(),
                    "Input path does not exist: " + inputPath.getAbsolutePath());
        }
        if (!inputPath.canRead()) {
            throw new ParameterException(spec.commandLine(),
                    "Input path is not readable (check permissions): " + inputPath.getAbsolutePath());
        }

        CartridgeInspector inspector = new CartridgeInspector(new NesRomReader(), showRawHeader);

        if (inputPath.isFile()) {
            MDC.put("rom", inputPath.getName());
            try {
                inspector.inspect(inputPath.toPath(), new InspectionObserver() {});
                return 0;
            } catch (IOException e) {
                log.error("FAILED: {} - {}", inputPath.getName(), e.getMessage());
                return 1;
            } finally {
                MDC.remove("rom");
            }
        }

        int failures = runBatch(inputPath.toPath(), inspector);
        return failures == 0 ? 0 : 1;
    }
}
