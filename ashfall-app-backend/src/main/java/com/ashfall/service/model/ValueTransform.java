package com.ashfall.service.model;

/**
 * Interface defining the domain in which thickness values are fitted.
 */
public interface ValueTransform {

    /**
     * Maps a thickness in cm into the fitting domain.
     */
    double forward(double thicknessCm);

    /**
     * Maps a fitted value back to a thickness in cm. The result may be
     * negative or non-finite; callers apply their own numeric policy.
     */
    double inverse(double value);
}
