package com.questrail.cbd.cli;

import com.questrail.cbd.config.Base64Alphabet;
import com.questrail.cbd.config.Base64Mode;
import com.questrail.cbd.config.ByteStringPolicy;
import com.questrail.cbd.config.CodecConfig;
import com.questrail.cbd.config.JsonStyle;
import com.questrail.cbd.config.TranscodeConfig;
import com.questrail.cbd.config.TranscodeDirection;
import com.questrail.cbd.exceptions.TranscodeException;
import com.questrail.cbd.exceptions.TranscodeIoException;
import com.questrail.cbd.observability.NullObservabilitySink;
import com.questrail.cbd.observability.Slf4jTranscodeObservabilitySink;
import com.questrail.cbd.observability.TranscodeObservabilitySink;
import com.questrail.cbd.runtime.TranscodePipeline;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import java.io.InputStream;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;

/**
 * CbdCommand
 * =============================================================================
 * Command line entry point: reads standard input, writes the transcoded
 * result to standard output.
 *
 * <pre>
 *   cbd [options] &lt; input &gt; output
 * </pre>
 *
 * <h2>Exit codes</h2>
 * <ul>
 *   <li>0 - success</li>
 *   <li>1 - the input could not be transcoded</li>
 *   <li>2 - invalid command line</li>
 *   <li>3 - reading or writing failed</li>
 * </ul>
 *
 * <p>Diagnostics go to standard error only. {@code --verbose} works by
 * setting the {@value #LOG_LEVEL_PROPERTY} system property read by
 * {@code logback.xml}, so it takes effect only if logging has not been
 * initialised yet; nothing in this class logs before option parsing.
 * Transcode events are only logged in verbose mode.</p>
 */
public final class CbdCommand {
    public static final int EXIT_OK = 0;
    public static final int EXIT_TRANSCODE_ERROR = 1;
    public static final int EXIT_USAGE = 2;
    public static final int EXIT_IO_ERROR = 3;

    public static final String LOG_LEVEL_PROPERTY = "cbd.log.level";

    private static final String ENCODE = "encode";
    private static final String BASE64 = "base64";
    private static final String AUTO_BASE64 = "auto-base64";
    private static final String URL_SAFE = "url-safe";
    private static final String COMPACT = "compact";
    private static final String REJECT_BYTES = "reject-bytes";
    private static final String MAX_DEPTH = "max-depth";
    private static final String VERBOSE = "verbose";
    private static final String HELP = "help";

    private static final Options OPTIONS = new Options()
            .addOption(Option.builder("e").longOpt(ENCODE)
                    .desc("Encode JSON into CBOR (default: decode CBOR into JSON)").build())
            .addOption(Option.builder("b").longOpt(BASE64)
                    .desc("The CBOR side is base64 text").build())
            .addOption(Option.builder("a").longOpt(AUTO_BASE64)
                    .desc("When decoding, detect base64 input automatically").build())
            .addOption(Option.builder("u").longOpt(URL_SAFE)
                    .desc("Write base64 with the URL-safe alphabet").build())
            .addOption(Option.builder("c").longOpt(COMPACT)
                    .desc("Print JSON without a space after ':'").build())
            .addOption(Option.builder("r").longOpt(REJECT_BYTES)
                    .desc("Fail on CBOR byte strings instead of printing them as base64").build())
            .addOption(Option.builder("d").longOpt(MAX_DEPTH).hasArg().argName("n")
                    .desc("Maximum nesting depth (default " + CodecConfig.DEFAULT_MAX_DEPTH + ")").build())
            .addOption(Option.builder("v").longOpt(VERBOSE)
                    .desc("Debug logging on standard error").build())
            .addOption(Option.builder("h").longOpt(HELP)
                    .desc("Show this help").build());

    public static void main(String[] args) {
        System.exit(new CbdCommand().run(args, System.in, System.out, System.err));
    }

    /**
     * Runs one invocation against the given streams.
     *
     * @return the process exit code
     */
    public int run(String[] args, InputStream in, PrintStream out, PrintStream err) {
        final CommandLine commandLine;
        try {
            commandLine = new DefaultParser().parse(OPTIONS, args);
        } catch (ParseException e) {
            return usageError(err, e.getMessage());
        }

        if (commandLine.hasOption(HELP)) {
            printUsage(out);
            return EXIT_OK;
        }
        if (!commandLine.getArgList().isEmpty()) {
            return usageError(err, "Unexpected argument(s): " + String.join(" ", commandLine.getArgList()));
        }
        if (commandLine.hasOption(BASE64) && commandLine.hasOption(AUTO_BASE64)) {
            return usageError(err, "--base64 and --auto-base64 cannot be combined");
        }
        if (commandLine.hasOption(ENCODE) && commandLine.hasOption(AUTO_BASE64)) {
            return usageError(err, "--auto-base64 only applies when decoding");
        }

        final TranscodeConfig config;
        try {
            config = toConfig(commandLine);
        } catch (IllegalArgumentException e) {
            return usageError(err, e.getMessage());
        }

        // Without --verbose the "cbd:" line on stderr is the only report of a failure.
        TranscodeObservabilitySink sink = NullObservabilitySink.INSTANCE;
        if (commandLine.hasOption(VERBOSE)) {
            System.setProperty(LOG_LEVEL_PROPERTY, "DEBUG");
            sink = new Slf4jTranscodeObservabilitySink();
        }

        final TranscodePipeline pipeline = TranscodePipeline.builder()
                .withConfig(config)
                .withObservabilitySink(sink)
                .build();

        try {
            pipeline.run(in, out);
        } catch (TranscodeIoException e) {
            err.println("cbd: " + e.describe());
            return EXIT_IO_ERROR;
        } catch (TranscodeException e) {
            err.println("cbd: " + e.describe());
            return EXIT_TRANSCODE_ERROR;
        }

        // PrintStream records write failures instead of throwing them.
        if (out.checkError()) {
            err.println("cbd: IoError: Failed to write output");
            return EXIT_IO_ERROR;
        }
        return EXIT_OK;
    }

    static TranscodeConfig toConfig(CommandLine commandLine) {
        final CodecConfig.Builder codec = CodecConfig.builder()
                .withJsonStyle(commandLine.hasOption(COMPACT) ? JsonStyle.COMPACT : JsonStyle.SPACED)
                .withByteStringPolicy(commandLine.hasOption(REJECT_BYTES) ? ByteStringPolicy.REJECT : ByteStringPolicy.BASE64)
                .withBase64Alphabet(commandLine.hasOption(URL_SAFE) ? Base64Alphabet.URL_SAFE : Base64Alphabet.STANDARD);

        if (commandLine.hasOption(MAX_DEPTH)) {
            final String depth = commandLine.getOptionValue(MAX_DEPTH);
            try {
                codec.withMaxDepth(Integer.parseInt(depth));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("--max-depth expects an integer, got '" + depth + "'", e);
            }
        }

        final Base64Mode base64Mode;
        if (commandLine.hasOption(BASE64)) {
            base64Mode = Base64Mode.ON;
        } else if (commandLine.hasOption(AUTO_BASE64)) {
            base64Mode = Base64Mode.AUTO;
        } else {
            base64Mode = Base64Mode.OFF;
        }

        return TranscodeConfig.builder()
                .withDirection(commandLine.hasOption(ENCODE) ? TranscodeDirection.ENCODE : TranscodeDirection.DECODE)
                .withBase64Mode(base64Mode)
                .withCodec(codec.build())
                .build();
    }

    private static int usageError(PrintStream err, String message) {
        err.println("cbd: " + message);
        printUsage(err);
        return EXIT_USAGE;
    }

    private static void printUsage(PrintStream stream) {
        final PrintWriter writer = new PrintWriter(new OutputStreamWriter(stream, StandardCharsets.UTF_8));
        new HelpFormatter().printHelp(writer, HelpFormatter.DEFAULT_WIDTH, "cbd [options] < input > output",
                "Transcode CBOR on standard input to JSON on standard output, or the reverse with --encode.",
                OPTIONS, HelpFormatter.DEFAULT_LEFT_PAD, HelpFormatter.DEFAULT_DESC_PAD, null);
        writer.flush();
    }
}
