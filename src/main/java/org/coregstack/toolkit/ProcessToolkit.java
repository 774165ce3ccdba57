package org.coregstack.toolkit;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs each toolkit operation as an external program.
 * <p>
 * The program is looked up as {@code {install}/{package}/bin/{name}} or
 * {@code {install}/{package}/scripts/{name}} for the configured packages, falling back to the
 * bare program name resolved through the {@code PATH}. Optional arguments the stack does not
 * supply are passed as {@code -}. Standard output and error are captured by reader threads so a
 * chatty program cannot block on a full pipe.
 */
public class ProcessToolkit implements GeophysicalToolkit {

    private static final Logger log = LoggerFactory.getLogger(ProcessToolkit.class);

    /** Placeholder for an argument left at the program's default. */
    static final String NOT_PROVIDED = "-";

    /** How long output readers may keep draining after a timed out program was killed. */
    private static final long OUTPUT_DRAIN_MILLIS = 2000;

    private final ToolkitSettings settings;
    private final Path workingDirectory;

    public ProcessToolkit(ToolkitSettings settings) {
        this(settings, null);
    }

    private ProcessToolkit(ToolkitSettings settings, Path workingDirectory) {
        this.settings = settings;
        this.workingDirectory = workingDirectory;
    }

    /**
     * Returns a toolkit running its programs inside {@code directory}, where programs that write
     * scratch files into their current directory leave them.
     */
    public ProcessToolkit inDirectory(Path directory) {
        return new ProcessToolkit(settings, directory);
    }

    @Override
    public ToolResult createOffset(Path par1, Path par2, Path offPar, int algorithm, int rangeLooks,
                                   int azimuthLooks, int interactive) {
        return run("create_offset", par1, par2, offPar, algorithm, rangeLooks, azimuthLooks, interactive);
    }

    @Override
    public ToolResult slcInterpLtScanSar(Path slc2Tab, Path slc2Par, Path slc1Tab, Path slc1Par, Path lookupTable,
                                         Path mli1Par, Path mli2Par, Path offPar, Path rslc2Tab, Path rslc2,
                                         Path rslc2Par) {
        return run("SLC_interp_lt_ScanSAR", slc2Tab, slc2Par, slc1Tab, slc1Par, lookupTable, mli1Par, mli2Par,
                offPar, rslc2Tab, rslc2, rslc2Par);
    }

    @Override
    public ToolResult offsetPwrTracking(Path slc1, Path slc2, Path slc1Par, Path slc2Par, Path offPar, Path offs,
                                        Path snr, int rangeWindow, int azimuthWindow, int oversampling,
                                        double snrThreshold, int rangeStep, int azimuthStep, int rangeStart,
                                        int rangeEnd, int azimuthStart, int azimuthEnd) {
        return run("offset_pwr_tracking", slc1, slc2, slc1Par, slc2Par, offPar, offs, snr, rangeWindow,
                azimuthWindow, null, oversampling, snrThreshold, rangeStep, azimuthStep, rangeStart, rangeEnd,
                azimuthStart, azimuthEnd);
    }

    @Override
    public ToolResult offsetFit(Path offs, Path snr, Path offPar, double snrThreshold, int polynomialTerms) {
        return run("offset_fit", offs, snr, offPar, null, null, snrThreshold, polynomialTerms, 0);
    }

    @Override
    public ToolResult createDiffPar(Path par1, Path par2, Path diffPar, int parType, int interactive) {
        return run("create_diff_par", par1, par2, diffPar, parType, interactive);
    }

    @Override
    public ToolResult slcCopy(Path slcIn, Path parIn, Path slcOut, Path parOut, double scale, int rangeOffset,
                              int rangeSamples, int lineOffset, int lines) {
        return run("SLC_copy", slcIn, parIn, slcOut, parOut, null, scale, rangeOffset, rangeSamples, lineOffset,
                lines);
    }

    @Override
    public ToolResult slcIntf(Path slc1, Path slc2, Path par1, Path par2, Path offPar, Path interferogram,
                              int rangeLooks, int azimuthLooks) {
        return run("SLC_intf", slc1, slc2, par1, par2, offPar, interferogram, rangeLooks, azimuthLooks, 0, null,
                0, 0);
    }

    @Override
    public ToolResult cpxToReal(Path input, Path output, int width, int type) {
        return run("cpx_to_real", input, output, width, type);
    }

    @Override
    public ToolResult subPhase(Path interferogram, Path phase, Path diffPar, Path output, int dataType,
                               int subtractMode) {
        return run("sub_phase", interferogram, phase, diffPar, output, dataType, subtractMode);
    }

    @Override
    public ToolResult multiCpx(Path input, Path offIn, Path output, Path offOut, int rangeLooks, int azimuthLooks) {
        return run("multi_cpx", input, offIn, output, offOut, rangeLooks, azimuthLooks);
    }

    @Override
    public ToolResult ccWave(Path interferogram, Path coherence, int width, int rangeWindow, int azimuthWindow,
                             int weighting) {
        return run("cc_wave", interferogram, null, null, coherence, width, rangeWindow, azimuthWindow, weighting);
    }

    @Override
    public ToolResult rasccMask(Path coherence, int width, double coherenceThreshold, Path mask) {
        // start 1 1, no flip, 1x1 averaging, coherence threshold, no intensity threshold, 0..1 scaled, gamma 0.35
        return run("rascc_mask", coherence, null, width, 1, 1, 0, 1, 1, coherenceThreshold, null, 0.0, 1.0, 1.0,
                0.35, 1, mask);
    }

    @Override
    public ToolResult adf(Path interferogram, Path filtered, Path coherence, int width, double alpha, int fftWindow,
                          int coherenceWindow, int step) {
        return run("adf", interferogram, filtered, coherence, width, alpha, fftWindow, coherenceWindow, step);
    }

    @Override
    public ToolResult mcf(Path interferogram, Path coherence, Path mask, Path unwrapped, int width, int patchSize,
                          int rangeReference, int azimuthReference) {
        return run("mcf", interferogram, coherence, mask, unwrapped, width, 1, 0, 0, null, null, 1, 1, patchSize,
                rangeReference, azimuthReference);
    }

    @Override
    public ToolResult imageStat(Path image, int width, Path statistics) {
        return run("image_stat", image, width, null, null, null, null, statistics);
    }

    @Override
    public ToolResult rdcTrans(Path mli1Par, Path dem, Path mli2Par, Path lookupTable) {
        return run("rdc_trans", mli1Par, dem, mli2Par, lookupTable);
    }

    @Override
    public ToolResult multiLook(Path slc, Path slcPar, Path mli, Path mliPar, int rangeLooks, int azimuthLooks) {
        return run("multi_look", slc, slcPar, mli, mliPar, rangeLooks, azimuthLooks);
    }

    /**
     * Runs {@code program} with the given arguments; {@code null} arguments are passed as {@code -}.
     */
    ToolResult run(String program, Object... arguments) {
        List<String> command = new ArrayList<>(arguments.length + 1);
        command.add(resolve(program).toString());
        for (Object argument : arguments) {
            command.add(argument == null ? NOT_PROVIDED : argument.toString());
        }
        log.debug("Running {}", String.join(" ", command));

        Process process;
        try {
            ProcessBuilder builder = new ProcessBuilder(command);
            if (workingDirectory != null) {
                builder.directory(workingDirectory.toFile());
            }
            process = builder.start();
        } catch (IOException e) {
            throw new ToolInvocationException("Failed to start toolkit program " + program,
                    new ToolResult(command, ToolInvocationException.NO_EXIT_STATUS, "", e.getMessage()), e);
        }

        StreamCollector stdout = new StreamCollector(process.getInputStream(), program + "-stdout-reader");
        StreamCollector stderr = new StreamCollector(process.getErrorStream(), program + "-stderr-reader");
        try {
            if (!process.waitFor(settings.timeout().toMillis(), TimeUnit.MILLISECONDS)) {
                destroy(process);
                ToolResult result = new ToolResult(command, ToolInvocationException.NO_EXIT_STATUS,
                        stdout.await(OUTPUT_DRAIN_MILLIS), stderr.await(OUTPUT_DRAIN_MILLIS));
                log.error("Toolkit program {} exceeded its timeout of {}", program, settings.timeout());
                throw new ToolInvocationException("Toolkit program " + program + " timed out after "
                        + settings.timeout(), result, null);
            }
            ToolResult result = new ToolResult(command, process.exitValue(), stdout.await(), stderr.await());
            if (!result.succeeded()) {
                log.error("Toolkit program {} failed with status {}: {}", program, result.status(),
                        result.stderr().isBlank() ? result.stdout().strip() : result.stderr().strip());
                throw new ToolInvocationException(result);
            }
            return result;
        } catch (InterruptedException e) {
            destroy(process);
            Thread.currentThread().interrupt();
            throw new ToolInvocationException("Interrupted while running toolkit program " + program,
                    new ToolResult(command, ToolInvocationException.NO_EXIT_STATUS, "", ""), e);
        }
    }

    /**
     * Kills the program and everything it started. Scripts leave grandchildren holding the output
     * pipes open, and they are reparented once the script dies, so they go first.
     */
    private static void destroy(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }

    private Path resolve(String program) {
        if (settings.installDirectory().isEmpty()) {
            return Path.of(program);
        }
        Path install = settings.installDirectory().get();
        for (String pkg : settings.packages()) {
            for (String dir : List.of("bin", "scripts")) {
                Path candidate = install.resolve(pkg).resolve(dir).resolve(program);
                if (Files.isRegularFile(candidate)) {
                    return candidate;
                }
            }
        }
        log.debug("{} not found below {}, using PATH", program, install);
        return Path.of(program);
    }

    private static final class StreamCollector {

        private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        private final Thread reader;

        StreamCollector(InputStream stream, String name) {
            this.reader = new Thread(() -> {
                try (InputStream in = stream) {
                    in.transferTo(buffer);
                } catch (IOException e) {
                    log.debug("Output reader {} stopped: {}", name, e.getMessage());
                }
            }, name);
            reader.setDaemon(true);
            reader.start();
        }

        String await() throws InterruptedException {
            reader.join();
            return text();
        }

        /** Output collected within {@code millis}; a reader still blocked on the pipe is abandoned. */
        String await(long millis) throws InterruptedException {
            reader.join(millis);
            if (reader.isAlive()) {
                log.debug("Output reader {} still attached after {} ms, returning partial output",
                        reader.getName(), millis);
            }
            return text();
        }

        private String text() {
            synchronized (buffer) {
                return buffer.toString(StandardCharsets.UTF_8);
            }
        }
    }
}
