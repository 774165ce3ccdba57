package org.coregstack.coreg;

import java.nio.file.Path;
import java.util.Optional;

import org.coregstack.stack.AcquisitionDate;
import org.coregstack.stack.StackPaths;
import org.coregstack.toolkit.TabFile;

/**
 * Files read and written when coregistering {@code target} to the stack {@code reference}.
 * <p>
 * Products of the pair are written next to the target scene. When the target's local reference
 * is another (already coregistered) date, the burst overlap interferograms are formed against
 * that date's resampled SLC instead of the stack reference SLC.
 */
public final class CoregisteredSlcPaths {

    private final StackPaths stack;
    private final AcquisitionDate reference;
    private final AcquisitionDate target;
    private final Optional<AcquisitionDate> localReference;
    private final String pairName;

    private CoregisteredSlcPaths(StackPaths stack, AcquisitionDate reference, AcquisitionDate target,
                                 Optional<AcquisitionDate> localReference) {
        this.stack = stack;
        this.reference = reference;
        this.target = target;
        this.localReference = localReference;
        this.pairName = stack.pairName(reference, target);
    }

    /**
     * @param localReference the date the target is aligned through; the stack reference itself means none
     */
    public static CoregisteredSlcPaths of(StackPaths stack, AcquisitionDate reference, AcquisitionDate target,
                                          AcquisitionDate localReference) {
        if (reference.equals(target)) {
            throw new IllegalArgumentException("Cannot coregister the reference " + reference + " to itself");
        }
        Optional<AcquisitionDate> tertiary = localReference == null || localReference.equals(reference)
                ? Optional.empty() : Optional.of(localReference);
        return new CoregisteredSlcPaths(stack, reference, target, tertiary);
    }

    public AcquisitionDate reference() {
        return reference;
    }

    public AcquisitionDate target() {
        return target;
    }

    public Optional<AcquisitionDate> localReference() {
        return localReference;
    }

    public String pairName() {
        return pairName;
    }

    public Path targetDirectory() {
        return stack.sceneDirectory(target);
    }

    public Path referenceSlc() {
        return stack.slc(reference);
    }

    public Path referenceSlcTab() {
        return stack.slcTab(reference);
    }

    public TabFile referenceTab() {
        return TabFile.forScene(stack.sceneDirectory(reference), stack.subswathStem(reference));
    }

    public Path demReferenceSlcPar() {
        return stack.demReferenceSlcPar(reference);
    }

    public Path demReferenceMliPar() {
        return stack.demReferenceMliPar(reference);
    }

    public Path rdcDem() {
        return stack.rdcDem(reference);
    }

    public Path targetSlc() {
        return stack.slc(target);
    }

    public Path targetSlcPar() {
        return stack.slcPar(target);
    }

    public Path targetMliPar() {
        return stack.mliPar(target);
    }

    public Path targetSlcTab() {
        return stack.slcTab(target);
    }

    public TabFile targetTab() {
        return TabFile.forScene(targetDirectory(), stack.subswathStem(target));
    }

    public Path resampledSlc() {
        return stack.resampledSlc(target);
    }

    public Path resampledSlcPar() {
        return stack.resampledSlcPar(target);
    }

    public Path resampledSlcTab() {
        return stack.resampledSlcTab(target);
    }

    public TabFile resampledTab() {
        return TabFile.forScene(targetDirectory(), stack.resampledSubswathStem(target));
    }

    public Path resampledMli() {
        return stack.resampledMli(target);
    }

    public Path resampledMliPar() {
        return stack.resampledMliPar(target);
    }

    /**
     * Bursts forming the reference side of the overlap interferograms: the resampled local
     * reference when there is one, the stack reference otherwise.
     */
    public TabFile overlapSourceTab() {
        return localReference
                .map(local -> TabFile.forScene(stack.sceneDirectory(local), stack.resampledSubswathStem(local)))
                .orElseGet(this::referenceTab);
    }

    public Path lookupTable() {
        return targetDirectory().resolve(pairName + ".lt");
    }

    /** Offset model of the pair. */
    public Path offPar() {
        return targetDirectory().resolve(pairName + ".off");
    }

    /** Residual offsets of the last coarse iteration. */
    public Path doffPar() {
        return targetDirectory().resolve(pairName + ".doff");
    }

    public Path fineIterationCopy(int iteration) {
        return targetDirectory().resolve(pairName + ".off.az_ovr." + iteration);
    }

    public Path overlapReport() {
        return targetDirectory().resolve(pairName + ".ovr_results");
    }

    public Path accuracyWarning() {
        return targetDirectory().resolve(AccuracyWarnings.FILE_NAME);
    }

    public Path scratchDirectory() {
        return targetDirectory().resolve(pairName + "_scratch");
    }
}
