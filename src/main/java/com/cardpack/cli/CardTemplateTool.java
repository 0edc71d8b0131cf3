package com.cardpack.cli;

import com.cardpack.config.ConfigService;
import com.cardpack.core.ValidationException;
import com.cardpack.core.image.Orientation;
import com.cardpack.logging.AppLogger;
import com.cardpack.logging.PackagingErrorLogger;
import com.cardpack.workflow.ConversionRequest;
import com.cardpack.workflow.ConversionResult;
import com.cardpack.workflow.ConversionWorkflow;
import com.cardpack.workflow.ProgressListener;
import com.cardpack.workflow.SourceMode;

import java.nio.file.Path;
import java.util.Locale;
import java.util.logging.Logger;

/**
 * Command-line front end: converts a card PDF or a folder of card PNGs into Epson Photo+ .etdx
 * templates.
 *
 * <pre>
 *   --pdf &lt;file&gt;        PDF with one card face per page (front1, back1, front2, back2, ...)
 *   --images &lt;folder&gt;   folder of PNG card faces, always packaged
 *   --out &lt;folder&gt;      output folder, defaults to the input's folder
 *   --portrait          cards are 54x86 and get rotated
 *   --etdx              in PDF mode also package the rendered pages
 *   --template &lt;dir&gt;   extracted base template, remembered for later runs
 * </pre>
 */
public final class CardTemplateTool {
    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private static final Logger LOGGER = AppLogger.get();

    private final ConfigService config;
    private final PackagingErrorLogger errorLogger;

    CardTemplateTool(ConfigService config, PackagingErrorLogger errorLogger) {
        this.config = config;
        this.errorLogger = errorLogger;
    }

    public static void main(String[] args) {
        int exit = new CardTemplateTool(ConfigService.createDefault(), new PackagingErrorLogger()).run(args);
        if (exit != EXIT_OK) {
            System.exit(exit);
        }
    }

    int run(String[] args) {
        ConversionRequest request;
        try {
            request = parse(args);
        } catch (ValidationException ex) {
            LOGGER.severe(ex.getMessage());
            LOGGER.info(usage());
            return EXIT_USAGE;
        }

        ConversionWorkflow workflow = ConversionWorkflow.fromConfig(config);
        try {
            ConversionResult result = workflow.run(request, new LoggingProgress());
            if (request.packagesTemplates()) {
                LOGGER.info("Generated " + result.archives().size() + " ETDX template(s) from "
                    + result.images().size() + " image(s)");
                result.archives().forEach(archive -> LOGGER.info("  " + archive));
            } else {
                LOGGER.info("Converted " + result.images().size() + " page(s)");
            }
            return EXIT_OK;
        } catch (ValidationException ex) {
            LOGGER.severe(ex.getMessage());
            errorLogger.logFailure("validation", ex);
            return EXIT_FAILURE;
        } catch (Exception ex) {
            LOGGER.severe("ETDX generation failed: " + ex.getMessage());
            errorLogger.logFailure("conversion", ex);
            return EXIT_FAILURE;
        }
    }

    ConversionRequest parse(String[] args) {
        SourceMode mode = null;
        Path input = null;
        Path output = null;
        Orientation orientation = Orientation.LANDSCAPE;
        boolean etdx = false;
        Path template = null;

        for (int i = 0; args != null && i < args.length; i++) {
            String arg = args[i] == null ? "" : args[i].trim();
            switch (arg.toLowerCase(Locale.ROOT)) {
                case "--pdf":
                    mode = requireSingleMode(mode, SourceMode.PDF);
                    input = Path.of(value(args, ++i, arg));
                    break;
                case "--images":
                    mode = requireSingleMode(mode, SourceMode.IMAGES);
                    input = Path.of(value(args, ++i, arg));
                    break;
                case "--out":
                    output = Path.of(value(args, ++i, arg));
                    break;
                case "--portrait":
                    orientation = Orientation.PORTRAIT;
                    break;
                case "--landscape":
                    orientation = Orientation.LANDSCAPE;
                    break;
                case "--etdx":
                    etdx = true;
                    break;
                case "--template":
                    template = Path.of(value(args, ++i, arg));
                    break;
                default:
                    throw new ValidationException("Unknown argument: " + arg);
            }
        }

        if (mode == null) {
            throw new ValidationException("Either --pdf or --images is required");
        }
        if (output == null) {
            Path absolute = input.toAbsolutePath();
            output = mode == SourceMode.PDF ? absolute.getParent() : absolute;
        }
        ConversionRequest request = new ConversionRequest(mode, input, output, orientation, etdx);
        // Remembered only once the whole command line is valid.
        if (template != null) {
            config.setTemplateDirectory(template);
        }
        return request;
    }

    private static SourceMode requireSingleMode(SourceMode current, SourceMode requested) {
        if (current != null && current != requested) {
            throw new ValidationException("Use either --pdf or --images, not both");
        }
        return requested;
    }

    private static String value(String[] args, int index, String option) {
        if (index >= args.length || args[index] == null || args[index].isBlank()) {
            throw new ValidationException("Missing value for " + option);
        }
        return args[index].trim();
    }

    static String usage() {
        return "Usage: CardTemplateTool (--pdf <file> | --images <folder>) [--out <folder>] "
            + "[--portrait] [--etdx] [--template <dir>]";
    }

    private static final class LoggingProgress implements ProgressListener {
        private int lastPercent = -1;

        @Override
        public void status(String message) {
            LOGGER.info(message);
        }

        @Override
        public void progress(double fraction) {
            int percent = (int) Math.round(fraction * 100);
            if (percent != lastPercent && percent % 10 == 0) {
                lastPercent = percent;
                LOGGER.fine("Progress " + percent + "%");
            }
        }
    }
}
