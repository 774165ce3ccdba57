package org.coregstack.stack;

import java.nio.file.Path;

/**
 * File layout of a stack.
 * <p>
 * Layout under the output directory:
 * <pre>
 *   lists/secondaries{n}.list, lists/ifgs.list
 *   SLC/{date}/{date}_{pol}.slc(.par), {date}_{pol}_IW{n}.slc(.par|.TOPS_par), {date}_{pol}_tab
 *   SLC/{date}/{date}_{pol}_{rlks}rlks.mli(.par)
 *   SLC/{date}/r{date}_{pol}.slc(.par), r{date}_{pol}_tab, r{date}_{pol}_{rlks}rlks.mli(.par)
 *   DEM/{ref}_{pol}_{rlks}rlks_rdc.dem, r{ref}_{pol}.slc.par, r{ref}_{pol}_{rlks}rlks.mli.par
 *   INT/{primary}_{secondary}/{primary}-{secondary}_{pol}_{rlks}rlks.int
 * </pre>
 * Completion markers and run summaries live under the work directory.
 */
public final class StackPaths {

    private static final String LIST_DIR = "lists";
    private static final String SLC_DIR = "SLC";
    private static final String DEM_DIR = "DEM";
    private static final String INT_DIR = "INT";

    private final Path outputDirectory;
    private final Path workDirectory;
    private final String polarisation;
    private final int rangeLooks;

    public StackPaths(Path outputDirectory, Path workDirectory, String polarisation, int rangeLooks) {
        this.outputDirectory = outputDirectory;
        this.workDirectory = workDirectory;
        this.polarisation = polarisation.toUpperCase();
        this.rangeLooks = rangeLooks;
    }

    public static StackPaths of(StackSettings settings) {
        return new StackPaths(settings.outputDirectory(), settings.workDirectory(),
                settings.polarisation(), settings.rangeLooks());
    }

    public Path outputDirectory() {
        return outputDirectory;
    }

    public Path workDirectory() {
        return workDirectory;
    }

    public String polarisation() {
        return polarisation;
    }

    public int rangeLooks() {
        return rangeLooks;
    }

    public Path listDirectory() {
        return outputDirectory.resolve(LIST_DIR);
    }

    /** Tier list file, {@code tier} is 1-based. */
    public Path tierList(int tier) {
        return listDirectory().resolve("secondaries" + tier + ".list");
    }

    public Path interferogramList() {
        return listDirectory().resolve("ifgs.list");
    }

    public Path sceneDirectory(AcquisitionDate date) {
        return outputDirectory.resolve(SLC_DIR).resolve(date.toString());
    }

    private String prefix(AcquisitionDate date) {
        return date + "_" + polarisation;
    }

    public Path slc(AcquisitionDate date) {
        return sceneDirectory(date).resolve(prefix(date) + ".slc");
    }

    public Path slcPar(AcquisitionDate date) {
        return sceneDirectory(date).resolve(prefix(date) + ".slc.par");
    }

    public Path slcTab(AcquisitionDate date) {
        return sceneDirectory(date).resolve(prefix(date) + "_tab");
    }

    public Path mli(AcquisitionDate date) {
        return sceneDirectory(date).resolve(prefix(date) + "_" + rangeLooks + "rlks.mli");
    }

    public Path mliPar(AcquisitionDate date) {
        return sceneDirectory(date).resolve(prefix(date) + "_" + rangeLooks + "rlks.mli.par");
    }

    /** Stem of subswath files; the tab file entries append {@code _IW{n}.slc} etc. */
    public String subswathStem(AcquisitionDate date) {
        return prefix(date);
    }

    public Path resampledSlc(AcquisitionDate date) {
        return sceneDirectory(date).resolve("r" + prefix(date) + ".slc");
    }

    public Path resampledSlcPar(AcquisitionDate date) {
        return sceneDirectory(date).resolve("r" + prefix(date) + ".slc.par");
    }

    public Path resampledSlcTab(AcquisitionDate date) {
        return sceneDirectory(date).resolve("r" + prefix(date) + "_tab");
    }

    public String resampledSubswathStem(AcquisitionDate date) {
        return "r" + prefix(date);
    }

    public Path resampledMli(AcquisitionDate date) {
        return sceneDirectory(date).resolve("r" + prefix(date) + "_" + rangeLooks + "rlks.mli");
    }

    public Path resampledMliPar(AcquisitionDate date) {
        return sceneDirectory(date).resolve("r" + prefix(date) + "_" + rangeLooks + "rlks.mli.par");
    }

    public Path demDirectory() {
        return outputDirectory.resolve(DEM_DIR);
    }

    /** DEM in radar coordinates of the stack reference. */
    public Path rdcDem(AcquisitionDate reference) {
        return demDirectory().resolve(prefix(reference) + "_" + rangeLooks + "rlks_rdc.dem");
    }

    /** SLC parameters of the reference geometry the DEM was coregistered to. */
    public Path demReferenceSlcPar(AcquisitionDate reference) {
        return demDirectory().resolve("r" + prefix(reference) + ".slc.par");
    }

    public Path demReferenceMliPar(AcquisitionDate reference) {
        return demDirectory().resolve("r" + prefix(reference) + "_" + rangeLooks + "rlks.mli.par");
    }

    public Path interferogramDirectory(DatePair pair) {
        return outputDirectory.resolve(INT_DIR).resolve(pair.primary() + "_" + pair.secondary());
    }

    public String pairName(AcquisitionDate primary, AcquisitionDate secondary) {
        return primary + "-" + secondary + "_" + polarisation + "_" + rangeLooks + "rlks";
    }

    public Path interferogram(DatePair pair) {
        return interferogramDirectory(pair).resolve(pairName(pair.primary(), pair.secondary()) + ".int");
    }

    public Path interferogramOffset(DatePair pair) {
        return interferogramDirectory(pair).resolve(pairName(pair.primary(), pair.secondary()) + ".off");
    }
}
