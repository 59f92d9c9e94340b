package com.example.rebus.domain.model;

/**
 * Domain record pairing one puzzle's ground-truth idiom with the raw model response.
 * Either text field may be {@code null} when the source record was malformed.
 */
public record Sample(
        String id,
        String groundTruth,
        String rawPrediction
) {

	/**
	 * Indicates whether the sample carries both texts required for scoring.
	 *
	 * @return {@code true} when ground truth and prediction are present (possibly empty)
	 */
    public boolean isComplete() {
        return groundTruth != null && rawPrediction != null;
    }
}
