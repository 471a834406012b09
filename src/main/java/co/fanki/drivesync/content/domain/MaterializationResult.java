package co.fanki.drivesync.content.domain;

import co.fanki.drivesync.change.domain.Change;
import co.fanki.drivesync.shared.Preconditions;

/**
 * Outcome of applying one change to the working copy.
 *
 * @param change the change that was applied
 * @param succeeded whether the working copy now reflects the change
 * @param derivedTextPath the folder-relative derived text path present
 *                        after the change, null when there is none
 * @param failureReason why the change could not be applied, null on
 *                      success
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record MaterializationResult(
        Change change,
        boolean succeeded,
        String derivedTextPath,
        String failureReason
) {

    /** Validates the change. */
    public MaterializationResult {
        Preconditions.requireNonNull(change, "Change is required");
    }

    /**
     * Creates a successful result.
     *
     * @param change the applied change
     * @param derivedTextPath the derived text path, may be null
     * @return the result
     */
    public static MaterializationResult success(final Change change,
            final String derivedTextPath) {
        return new MaterializationResult(change, true, derivedTextPath, null);
    }

    /**
     * Creates a failed result.
     *
     * @param change the change that could not be applied
     * @param reason the failure description
     * @return the result
     */
    public static MaterializationResult failed(final Change change,
            final String reason) {
        return new MaterializationResult(change, false, null, reason);
    }

}
