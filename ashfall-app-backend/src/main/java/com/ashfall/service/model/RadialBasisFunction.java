package com.ashfall.service.model;

/**
 * Interface defining the kernel of a radial-basis-function surface.
 */
public interface RadialBasisFunction {

    /**
     * Evaluates the kernel at a distance.
     *
     * @param r       distance between two points, in coordinate units
     * @param epsilon shape parameter; kernels without one ignore it
     * @return the kernel value
     */
    double evaluate(double r, double epsilon);
}
