package org.coregstack.toolkit;

import java.nio.file.Path;

/**
 * The elementary operations of the external geophysical processing toolkit used by the stack.
 * <p>
 * Every method runs one toolkit program and returns its captured output. A non-zero exit status
 * raises {@link ToolInvocationException}; implementations never return a failed result.
 * Parameter names follow the toolkit's own documentation.
 */
public interface GeophysicalToolkit {

    /** {@code create_offset}: creates an offset parameter file for two SLC/MLI parameter files. */
    ToolResult createOffset(Path par1, Path par2, Path offPar, int algorithm, int rangeLooks, int azimuthLooks,
                            int interactive);

    /** {@code SLC_interp_lt_ScanSAR}: resamples a burst mode SLC with a lookup table and offset model. */
    ToolResult slcInterpLtScanSar(Path slc2Tab, Path slc2Par, Path slc1Tab, Path slc1Par, Path lookupTable,
                                  Path mli1Par, Path mli2Par, Path offPar, Path rslc2Tab, Path rslc2,
                                  Path rslc2Par);

    /** {@code offset_pwr_tracking}: intensity cross-correlation offset tracking. */
    ToolResult offsetPwrTracking(Path slc1, Path slc2, Path slc1Par, Path slc2Par, Path offPar, Path offs,
                                 Path snr, int rangeWindow, int azimuthWindow, int oversampling,
                                 double snrThreshold, int rangeStep, int azimuthStep, int rangeStart,
                                 int rangeEnd, int azimuthStart, int azimuthEnd);

    /** {@code offset_fit}: fits range and azimuth offset polynomials to tracked offsets. */
    ToolResult offsetFit(Path offs, Path snr, Path offPar, double snrThreshold, int polynomialTerms);

    /** {@code create_diff_par}: creates a differential parameter file. */
    ToolResult createDiffPar(Path par1, Path par2, Path diffPar, int parType, int interactive);

    /** {@code SLC_copy}: copies a line range of an SLC. */
    ToolResult slcCopy(Path slcIn, Path parIn, Path slcOut, Path parOut, double scale, int rangeOffset,
                       int rangeSamples, int lineOffset, int lines);

    /** {@code SLC_intf}: computes a single look interferogram. */
    ToolResult slcIntf(Path slc1, Path slc2, Path par1, Path par2, Path offPar, Path interferogram,
                       int rangeLooks, int azimuthLooks);

    /** {@code cpx_to_real}: extracts a real component of complex data. */
    ToolResult cpxToReal(Path input, Path output, int width, int type);

    /** {@code sub_phase}: subtracts a phase from an interferogram. */
    ToolResult subPhase(Path interferogram, Path phase, Path diffPar, Path output, int dataType, int subtractMode);

    /** {@code multi_cpx}: multi-looks complex data. */
    ToolResult multiCpx(Path input, Path offIn, Path output, Path offOut, int rangeLooks, int azimuthLooks);

    /** {@code cc_wave}: estimates interferometric coherence. */
    ToolResult ccWave(Path interferogram, Path coherence, int width, int rangeWindow, int azimuthWindow,
                      int weighting);

    /** {@code rascc_mask}: creates a validity mask raster from coherence. */
    ToolResult rasccMask(Path coherence, int width, double coherenceThreshold, Path mask);

    /** {@code adf}: adaptive interferogram filter. */
    ToolResult adf(Path interferogram, Path filtered, Path coherence, int width, double alpha, int fftWindow,
                   int coherenceWindow, int step);

    /** {@code mcf}: minimum cost flow phase unwrapping. */
    ToolResult mcf(Path interferogram, Path coherence, Path mask, Path unwrapped, int width, int patchSize,
                   int rangeReference, int azimuthReference);

    /** {@code image_stat}: writes mean, standard deviation and valid fraction of an image. */
    ToolResult imageStat(Path image, int width, Path statistics);

    /** {@code rdc_trans}: initial lookup table between two radar geometries from a DEM. */
    ToolResult rdcTrans(Path mli1Par, Path dem, Path mli2Par, Path lookupTable);

    /** {@code multi_look}: multi-looks an SLC into an MLI. */
    ToolResult multiLook(Path slc, Path slcPar, Path mli, Path mliPar, int rangeLooks, int azimuthLooks);
}
