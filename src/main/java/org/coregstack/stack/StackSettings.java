package org.coregstack.stack;

import java.nio.file.Path;
import java.util.Optional;

import com.typesafe.config.Config;

/**
 * Stack-level settings read from the {@code coregstack.stack} configuration block.
 *
 * @param stackId              identifier used in marker and summary file names
 * @param outputDirectory      root of the stack products (scene directories, list files)
 * @param workDirectory        directory holding completion markers and run summaries
 * @param scenesList           list file with one acquisition date per line
 * @param referenceDate        explicit stack reference, or empty to derive it from the dates
 * @param polarisation         polarisation of the coregistered products
 * @param rangeLooks           range multi-look factor
 * @param azimuthLooks         azimuth multi-look factor
 * @param ifgConnections       number of later dates each date is paired with
 * @param ifgMaxBaselineDays   maximum temporal baseline of an interferogram pair
 */
public record StackSettings(
        String stackId,
        Path outputDirectory,
        Path workDirectory,
        Path scenesList,
        Optional<AcquisitionDate> referenceDate,
        String polarisation,
        int rangeLooks,
        int azimuthLooks,
        int ifgConnections,
        int ifgMaxBaselineDays
) {

    public StackSettings {
        if (rangeLooks < 1 || azimuthLooks < 1) {
            throw new IllegalArgumentException(
                    "Multi-look factors must be positive, got " + rangeLooks + "x" + azimuthLooks);
        }
        if (ifgConnections < 1) {
            throw new IllegalArgumentException("ifg-connections must be >= 1, got " + ifgConnections);
        }
        polarisation = polarisation.toUpperCase();
    }

    /**
     * Reads the settings from a {@code coregstack.stack} block.
     *
     * @param stack the stack configuration block
     * @return the parsed settings
     */
    public static StackSettings fromConfig(Config stack) {
        Optional<AcquisitionDate> reference = stack.hasPath("reference-date")
                && !stack.getString("reference-date").isBlank()
                ? Optional.of(AcquisitionDate.parse(stack.getString("reference-date")))
                : Optional.empty();

        return new StackSettings(
                stack.getString("id"),
                Path.of(stack.getString("output-dir")),
                Path.of(stack.getString("work-dir")),
                Path.of(stack.getString("scenes-list")),
                reference,
                stack.getString("polarisation"),
                stack.getInt("range-looks"),
                stack.getInt("azimuth-looks"),
                stack.getInt("ifg-connections"),
                stack.getInt("ifg-max-baseline-days"));
    }
}
