package org.coregstack.coreg;

import java.util.List;

/**
 * Result of the coarse stage.
 *
 * @param model             the offset model after the last iteration
 * @param azimuthResiduals  azimuth residual (pixels) measured by each iteration
 * @param converged         whether the last residual was within the coarse threshold
 */
public record CoarseResult(OffsetModel model, List<Double> azimuthResiduals, boolean converged) {

    public CoarseResult {
        azimuthResiduals = List.copyOf(azimuthResiduals);
    }

    public int iterations() {
        return azimuthResiduals.size();
    }
}
