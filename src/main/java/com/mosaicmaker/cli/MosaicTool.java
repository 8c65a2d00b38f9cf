package com.mosaicmaker.cli;

import com.mosaicmaker.config.ConfigService;
import com.mosaicmaker.config.MosaicConfig;
import com.mosaicmaker.core.model.Catalog;
import com.mosaicmaker.logging.AppLogger;
import com.mosaicmaker.session.MosaicException;
import com.mosaicmaker.session.MosaicSession;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Command-line workflow: select an image and a library, build the catalog, match, and export.
 * <p>
 * Settings start from the persisted preferences and arguments apply left to right. A
 * {@code --config} JSON file replaces everything set before it, except paths the file leaves out.
 */
public final class MosaicTool {
    private static final Logger LOGGER = AppLogger.get();

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    private static final String USAGE = String.join(System.lineSeparator(),
        "Usage: mosaic --image <file> --library <dir> --output <file.png|file.pdf> [options]",
        "  --width <n>        grid columns (intermediate width)",
        "  --height <n>       grid rows (intermediate height)",
        "  --subpixel <n>     tile size in pixels",
        "  --threshold <n>    maximum (exclusive) color distance for a match",
        "  --unique           drain used tiles before reusing them",
        "  --no-unique        allow the best tile on every cell",
        "  --config <file>    JSON settings file",
        "  --save-config      persist the resulting settings as defaults");

    private MosaicTool() {}

    public static void main(String[] args) {
        int code = run(args, ConfigService.getInstance(), System.err);
        if (code != EXIT_OK) {
            System.exit(code);
        }
    }

    static int run(String[] args, ConfigService configService, PrintStream err) {
        Options options;
        try {
            options = Options.parse(args, configService.load());
        } catch (IllegalArgumentException | IOException e) {
            err.println(e.getMessage());
            err.println(USAGE);
            return EXIT_USAGE;
        }
        if (options.output == null
            || options.config.getInputPath().isEmpty()
            || options.config.getLibraryPath().isEmpty()) {
            err.println("Missing --image, --library or --output");
            err.println(USAGE);
            return EXIT_USAGE;
        }

        MosaicSession session = MosaicSession.withDefaults(options.config);
        try {
            session.selectImage(options.config.getInputPath().get());
            session.selectLibrary(options.config.getLibraryPath().get());
            Catalog catalog = session.reloadLibrary();
            if (catalog.isEmpty()) {
                LOGGER.warning("Library contains no usable images; the mosaic will be fully transparent");
            }
            session.refresh();
            session.export(options.output);
        } catch (MosaicException e) {
            LOGGER.log(Level.SEVERE, e.getMessage(), e.getCause());
            return EXIT_FAILED;
        }

        if (options.saveConfig) {
            configService.save(session.getConfig());
        }
        LOGGER.info("Mosaic written to " + options.output.toAbsolutePath());
        return EXIT_OK;
    }

    static final class Options {
        final MosaicConfig config;
        final Path output;
        final boolean saveConfig;

        private Options(MosaicConfig config, Path output, boolean saveConfig) {
            this.config = config;
            this.output = output;
            this.saveConfig = saveConfig;
        }

        static Options parse(String[] args, MosaicConfig base) throws IOException {
            MosaicConfig.Builder b = base.toBuilder();
            Path output = null;
            boolean saveConfig = false;

            for (int i = 0; i < args.length; i++) {
                String arg = args[i] == null ? "" : args[i].trim();
                switch (arg.toLowerCase(Locale.ROOT)) {
                    case "--image" -> b.inputPath(Path.of(value(args, ++i, arg)));
                    case "--library" -> b.libraryPath(Path.of(value(args, ++i, arg)));
                    case "--output" -> output = Path.of(value(args, ++i, arg));
                    case "--width" -> b.intermediateWidth(intValue(args, ++i, arg));
                    case "--height" -> b.intermediateHeight(intValue(args, ++i, arg));
                    case "--subpixel" -> b.subpixelSize(intValue(args, ++i, arg));
                    case "--threshold" -> b.uniqueThreshold(intValue(args, ++i, arg));
                    case "--unique" -> b.prioritizeUnique(true);
                    case "--no-unique" -> b.prioritizeUnique(false);
                    case "--save-config" -> saveConfig = true;
                    case "--config" -> {
                        Path file = Path.of(value(args, ++i, arg));
                        MosaicConfig current = b.build();
                        MosaicConfig fromFile = MosaicConfig.fromJson(Files.readString(file));
                        b = fromFile.toBuilder();
                        if (fromFile.getInputPath().isEmpty()) {
                            b.inputPath(current.getInputPath().orElse(null));
                        }
                        if (fromFile.getLibraryPath().isEmpty()) {
                            b.libraryPath(current.getLibraryPath().orElse(null));
                        }
                    }
                    default -> throw new IllegalArgumentException("Unknown argument: " + arg);
                }
            }
            return new Options(b.build(), output, saveConfig);
        }

        private static String value(String[] args, int index, String flag) {
            if (index >= args.length || args[index] == null || args[index].isBlank()) {
                throw new IllegalArgumentException(flag + " needs a value");
            }
            return args[index].trim();
        }

        private static int intValue(String[] args, int index, String flag) {
            String raw = value(args, index, flag);
            try {
                return Integer.parseInt(raw);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(flag + " expects a whole number, got '" + raw + "'");
            }
        }
    }
}
