package com.largomodo.boxpicker;

import com.largomodo.boxpicker.core.BoxCatalog;
import com.largomodo.boxpicker.core.FitMode;
import com.largomodo.boxpicker.core.PackingObserver;
import com.largomodo.boxpicker.core.RequestProcessor;
import com.largomodo.boxpicker.core.RequestReport;
import com.largomodo.boxpicker.core.domain.BoxPacker;
import com.largomodo.boxpicker.core.domain.GreedyBoxPacker;
import com.largomodo.boxpicker.core.request.ErrorCode;
import com.largomodo.boxpicker.core.request.PackRequestValidator;
import com.largomodo.boxpicker.service.JsonRequestCodec;
import com.largomodo.boxpicker.util.RequestFileMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import picocli.CommandLine;
import picocli.CommandLine.*;
import picocli.CommandLine.Model.CommandSpec;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

/**
 * CLI entry point for packing items into standard catalog boxes.
 * <p>
 * Uses Picocli framework for argument parsing with automatic help generation
 * and type-safe validation. Accepts a single positional input path (request file or
 * directory) and determines processing mode via runtime inspection.
 * <p>
 * Smart defaults:
 * - File input without -o: response JSON printed to standard output
 * - Directory input without -o: responses written to <input>/output
 * - Explicit -o flag: overrides all defaults
 */
@Command(
        name = "boxpicker",
        mixinStandardHelpOptions = true,
        resourceBundle = "boxpicker.boxpicker",
        version = "${bundle:application.version}",
        header = "Picks the smallest set of standard boxes for a list of items.",
        description = {
                "Reads pack requests ({\"items\": [{\"sku\": ..., \"dimensions\": {\"length\": ..., " +
                        "\"width\": ..., \"height\": ...}}]}) and assigns every item to a catalog box.",
                "",
                "Boxes: BX-S 8x6x4, BX-M 12x10x6, BX-L 16x12x8, BX-XL 20x16x12, BX-XXL 24x20x20.",
                "Items may be rotated. A single box is used whenever one fits all items; otherwise",
                "items are spread over several boxes, fewest boxes first."
        },
        exitCodeListHeading = "%nExit Codes:%n",
        exitCodeList = {
                "0:Request packed, or batch completed",
                "1:General execution error (I/O, unreadable input, etc.)",
                "2:Invalid command line arguments",
                "3:Request rejected (invalid_json, validation_error, item_too_large, packing_error)"
        }
)
public class BoxPicker implements Callable<Integer> {

    static final int EXIT_REJECTED = 3;

    private static final Logger log = LoggerFactory.getLogger(BoxPicker.class);

    @Parameters(index = "0", paramLabel = "INPUT",
            description = {
                    "A pack request (.json) to process, or a directory of requests.",
                    "If a directory is provided, the tool scans it recursively for .json files and " +
                            "processes them in batch mode, preserving the directory structure."
            })
    File inputPath;

    @Option(names = {"-o", "--output-dir"},
            description = {
                    "The destination directory for responses (<name>.packed.json).",
                    "If omitted, defaults apply:",
                    "  - Single file input: The response is printed to standard output.",
                    "  - Directory input: Defaults to a folder named 'output' inside the input directory.",
                    "Necessary subdirectories will be created automatically."
            })
    File outputDir;

    @Option(names = "--fit-mode", defaultValue = "PER_ITEM",
            description = {
                    "Rule deciding whether items may share a box.",
                    "PER_ITEM checks each item alone; SHELF also simulates a row/layer layout.",
                    "Valid values: ${COMPLETION-CANDIDATES}",
                    "Default: ${DEFAULT-VALUE}"
            })
    FitMode fitMode;

    @Option(names = "--pretty", description = "Indent JSON responses")
    boolean pretty;

    @Spec
    CommandSpec spec;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output")
    private boolean verbose;


    public static void main(String[] args) {
        int exitCode = commandLine(new BoxPicker()).execute(args);
        System.exit(exitCode);
    }

    /**
     * Command line with the converters and parser settings every entry point shares.
     * Accepts {@code shelf}, {@code SHELF}, {@code per-item} and {@code PER_ITEM} alike.
     */
    static CommandLine commandLine(BoxPicker app) {
        CommandLine cmd = new CommandLine(app);
        cmd.setCaseInsensitiveEnumValuesAllowed(true);
        cmd.registerConverter(FitMode.class, FitMode::fromCliArgument);
        return cmd;
    }

    /**
     * Factory method wiring the request pipeline for the selected placement rule.
     * All collaborators are stateless, so one processor serves every batch worker.
     */
    private static RequestProcessor createProcessor(Config config) {
        BoxPacker packer = new GreedyBoxPacker(BoxCatalog.standard(), config.fitMode.createStrategy());
        return new RequestProcessor(new JsonRequestCodec(config.pretty), new PackRequestValidator(), packer);
    }

    /**
     * Execute batch request processing with concurrent execution and fail-soft error handling.
     * <p>
     * Strategy: Fixed thread pool sized to CPU cores prevents oversubscription.
     * Bounded queue provides backpressure. CallerRunsPolicy throttles submission.
     * Requests share nothing but the immutable catalog, so no coordination is needed between workers.
     */
    private static void runBatch(Config config) throws IOException {
        Path inputRoot = Paths.get(config.inputDir);
        Path outputRoot = Paths.get(config.outputDir);

        RequestProcessor processor = createProcessor(config);

        int coreCount = Runtime.getRuntime().availableProcessors();
        ExecutorService executor = new ThreadPoolExecutor(
                coreCount,
                coreCount,
                0L,
                TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(2 * coreCount),
                new ThreadPoolExecutor.CallerRunsPolicy()
        );

        final AtomicInteger packedCount = new AtomicInteger(0);
        final AtomicInteger rejectedCount = new AtomicInteger(0);
        final AtomicInteger failCount = new AtomicInteger(0);

        PackingObserver observer = new PackingObserver() {
            @Override
            public void onPacked(Path request, int boxCount) {
                packedCount.incrementAndGet();
            }

            @Override
            public void onRejected(Path request, ErrorCode code) {
                rejectedCount.incrementAndGet();
                log.warn("REJECTED: {} - {}", inputRoot.relativize(request), code.getCode());
            }

            @Override
            public void onFailure(Path request, Exception e) {
                failCount.incrementAndGet();
                log.error("FAILED: {} - {}", inputRoot.relativize(request), e.getMessage());
            }
        };

        // Shutdown hook for graceful SIGINT handling
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            if (!executor.isShutdown()) {
                log.info("Interrupt received, shutting down gracefully...");
                executor.shutdown();
                try {
                    if (!executor.awaitTermination(1, TimeUnit.MINUTES)) {
                        executor.shutdownNow();
                    }
                } catch (InterruptedException e) {
                    executor.shutdownNow();
                }
            }
        }));

        try (Stream<Path> stream = Files.walk(inputRoot)) {
            stream.filter(path -> !path.startsWith(outputRoot))
                    .filter(path -> {
                        try {
                            return RequestFileMatcher.isRequest(path);
                        } catch (UncheckedIOException e) {
                            // File attributes unreadable (broken symlink, permission denied on file)
                            log.warn("Cannot access {} - skipping", inputRoot.relativize(path));
                            return false;
                        }
                    })
                    .forEach(requestPath -> {
                        executor.submit(() -> {
                            try {
                                MDC.put("request", requestPath.getFileName().toString());
                                Path relativePath = inputRoot.relativize(requestPath.getParent());
                                Path responsePath = outputRoot.resolve(relativePath)
                                        .resolve(RequestFileMatcher.responseNameFor(requestPath));

                                observer.onStart(requestPath);
                                RequestReport report = processor.processFile(requestPath, responsePath);
                                if (report.isPacked()) {
                                    observer.onPacked(requestPath, report.boxCount());
                                } else {
                                    observer.onRejected(requestPath, report.errorCode());
                                }
                            } catch (Exception e) {
                                // Catch all exceptions to prevent worker thread death (batch continues)
                                observer.onFailure(requestPath, e);
                            } finally {
                                MDC.clear();
                            }
                            return null;
                        });
                    });
        } catch (UncheckedIOException e) {
            // Subdirectory became unreadable mid-walk: keep what was already processed
            log.error("Directory traversal interrupted - {}", e.getCause().getMessage());
            log.error("Batch incomplete: {} packed, {} rejected, {} failed, some directories skipped",
                    packedCount.get(), rejectedCount.get(), failCount.get());
            return;
        } catch (IOException e) {
            log.error("Cannot traverse input directory: {}", e.getMessage());
            return;
        } finally {
            // Standard two-phase shutdown: graceful then forceful
            executor.shutdown();
            try {
                if (!executor.awaitTermination(1, TimeUnit.MINUTES)) {
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }

        log.info("Batch complete: {} packed, {} rejected, {} failed",
                packedCount.get(), rejectedCount.get(), failCount.get());
    }

    /**
     * Execute single-request processing with fail-fast error handling.
     * <p>
     * Without an output directory the response goes to {@code stdout}, the picocli output
     * writer, which tests replace to capture the document.
     *
     * @return exit code: 0 when packed, {@link #EXIT_REJECTED} when an error document was written
     * @throws IOException if the request cannot be read or the response cannot be written
     */
    private static int runSingleFile(Config config, PrintWriter stdout) throws IOException {
        Path inputPath = Paths.get(config.inputFile);

        // Validation order: existence before type check (prevents confusing "not a file" for missing paths)
        if (!Files.exists(inputPath)) {
            throw new IOException("Input file does not exist: " + inputPath);
        }
        if (!Files.isRegularFile(inputPath)) {
            throw new IOException("Input path is not a file: " + inputPath);
        }

        RequestProcessor processor = createProcessor(config);

        RequestReport report;
        if (config.outputDir == null) {
            try (InputStream in = Files.newInputStream(inputPath)) {
                report = processor.process(in, stdout);
            }
        } else {
            Path responsePath = Paths.get(config.outputDir).resolve(RequestFileMatcher.responseNameFor(inputPath));
            report = processor.processFile(inputPath, responsePath);
            log.info("Response written: {}", responsePath);
        }

        return report.isPacked() ? 0 : EXIT_REJECTED;
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

        if (outputDir == null && inputPath.isDirectory()) {
            outputDir = new File(inputPath, "output");
        }

        if (outputDir != null) {
            if (outputDir.exists() && !outputDir.isDirectory()) {
                throw new ParameterException(spec.commandLine(),
                        "Output path must be a directory, not a file: " + outputDir.getAbsolutePath());
            }
            if (outputDir.exists() && !outputDir.canWrite()) {
                throw new ParameterException(spec.commandLine(),
                        "Output directory is not writable (check permissions): " + outputDir.getAbsolutePath());
            }
            Files.createDirectories(outputDir.toPath());
        }

        String output = outputDir == null ? null : outputDir.getAbsolutePath();
        if (inputPath.isFile()) {
            return runSingleFile(
                    new Config(null, output, fitMode, pretty, inputPath.getAbsolutePath()),
                    spec.commandLine().getOut()
            );
        }

        runBatch(new Config(inputPath.getAbsolutePath(), output, fitMode, pretty, null));
        return 0;
    }

    /**
     * Bridges Picocli field-based arguments to runBatch/runSingleFile method signatures.
     */
    private record Config(String inputDir, String outputDir,
                          FitMode fitMode, boolean pretty, String inputFile) {
    }
}
