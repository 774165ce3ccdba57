package org.coregstack.coreg;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * The {@code .ovr_results} report of a pair: every burst overlap sample of every fine iteration,
 * with subswath and scene averages and the resulting azimuth correction.
 */
public final class OverlapReport implements Closeable {

    private final BufferedWriter writer;

    private OverlapReport(BufferedWriter writer) {
        this.writer = writer;
    }

    /**
     * Creates (truncates) the report and writes its header.
     */
    public static OverlapReport create(Path file, SampleThresholds thresholds) throws IOException {
        Path parent = file.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        OverlapReport report = new OverlapReport(Files.newBufferedWriter(file, StandardCharsets.UTF_8));
        report.line("    Burst Overlap Results");
        report.line("        thresholds applied: cc_thresh: " + thresholds.coherence()
                + ",  ph_fraction_thresh: " + thresholds.fraction()
                + ", ph_stdev_thresh (rad): " + thresholds.stdev());
        report.line("");
        report.line("        IW  overlap  ph_mean ph_stdev ph_fraction   (cc_mean cc_stdev cc_fraction)    weight");
        report.line("");
        return report;
    }

    public void sample(BurstOverlapSample sample, double weight) {
        if (sample.phaseFraction() > 0) {
            line("IW" + sample.subswath() + " " + sample.burst() + " " + sample.phaseMean() + " "
                    + sample.phaseStdev() + " " + sample.phaseFraction() + " (" + coherence(sample) + ") " + weight);
        } else {
            line("IW" + sample.subswath() + " " + sample.burst() + " 0.00000 0.00000 0.00000 ("
                    + coherence(sample) + ") " + weight);
        }
    }

    public void unwrapFailure(int subswath, int burst) {
        line("IW" + subswath + " " + burst + " MCF FAILURE");
    }

    public void subswathAverage(int subswath, double average) {
        line("IW" + subswath + " average: " + average);
    }

    public void sceneSummary(OverlapAverage average) {
        line("scene mean: " + average.sceneAverage() + ", subswath mean: " + average.subswathMean()
                + ", subswath stddev: " + average.subswathDeviation());
    }

    public void correction(double azimuthPixelOffset) {
        line("azimuth_pixel_offset " + azimuthPixelOffset + " [azimuth SLC pixel]");
    }

    private static String coherence(BurstOverlapSample sample) {
        return sample.coherenceMean() + " " + sample.coherenceStdev() + " " + sample.coherenceFraction();
    }

    private void line(String text) {
        try {
            writer.write(text);
            writer.newLine();
            writer.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write overlap report", e);
        }
    }

    @Override
    public void close() throws IOException {
        writer.close();
    }
}
