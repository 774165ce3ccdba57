package org.coregstack.coreg;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;

import org.coregstack.toolkit.ParameterFile;

/**
 * Range and azimuth offset polynomials between two images.
 * <p>
 * Six coefficients per direction in the toolkit's ordering, the constant term first.
 * Instances are immutable: folding a residual returns a new model.
 */
public final class OffsetModel {

    public static final String RANGE_KEY = "range_offset_polynomial";
    public static final String AZIMUTH_KEY = "azimuth_offset_polynomial";
    public static final int TERMS = 6;

    private final double[] range;
    private final double[] azimuth;

    public OffsetModel(double[] range, double[] azimuth) {
        if (range.length != TERMS || azimuth.length != TERMS) {
            throw new IllegalArgumentException("Offset polynomials need " + TERMS + " coefficients, got "
                    + range.length + " and " + azimuth.length);
        }
        this.range = range.clone();
        this.azimuth = azimuth.clone();
    }

    public static OffsetModel zero() {
        return new OffsetModel(new double[TERMS], new double[TERMS]);
    }

    /** Reads the polynomials of an offset parameter file. */
    public static OffsetModel from(ParameterFile offPar) {
        return new OffsetModel(offPar.getDoubles(RANGE_KEY, TERMS), offPar.getDoubles(AZIMUTH_KEY, TERMS));
    }

    public static OffsetModel read(Path offPar) throws IOException {
        return from(ParameterFile.read(offPar));
    }

    public double[] range() {
        return range.clone();
    }

    public double[] azimuth() {
        return azimuth.clone();
    }

    public double rangeConstant() {
        return range[0];
    }

    public double azimuthConstant() {
        return azimuth[0];
    }

    /**
     * Model with the residual constant offsets added.
     */
    public OffsetModel plusConstants(double rangeResidual, double azimuthResidual) {
        double[] newRange = range.clone();
        double[] newAzimuth = azimuth.clone();
        newRange[0] += rangeResidual;
        newAzimuth[0] += azimuthResidual;
        return new OffsetModel(newRange, newAzimuth);
    }

    public OffsetModel plusAzimuthConstant(double azimuthCorrection) {
        return plusConstants(0.0, azimuthCorrection);
    }

    /**
     * Writes both polynomials into the existing parameter file {@code offPar}, keeping its other lines.
     */
    public void persist(Path offPar) throws IOException {
        ParameterFile file = ParameterFile.read(offPar);
        file.setDoubles(RANGE_KEY, range);
        file.setDoubles(AZIMUTH_KEY, azimuth);
        file.write(offPar);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OffsetModel)) return false;
        OffsetModel that = (OffsetModel) o;
        return Arrays.equals(range, that.range) && Arrays.equals(azimuth, that.azimuth);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(range) + Arrays.hashCode(azimuth);
    }

    @Override
    public String toString() {
        return "OffsetModel{range=" + Arrays.toString(range) + ", azimuth=" + Arrays.toString(azimuth) + "}";
    }
}
