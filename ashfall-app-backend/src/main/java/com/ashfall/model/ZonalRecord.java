package com.ashfall.model;

/**
 * Land-use breakdown for one class touched by the region. Shares are percentages.
 */
public final class ZonalRecord {

    private final int classCode;
    private final String className;
    private final long pixelCountInRegion;
    private final long pixelCountTotal;
    private final double shareOfRegion;
    private final double shareOfClass;
    private final double areaKm2;

    public ZonalRecord(int classCode, String className, long pixelCountInRegion, long pixelCountTotal,
                       double shareOfRegion, double shareOfClass, double areaKm2) {
        this.classCode = classCode;
        this.className = className;
        this.pixelCountInRegion = pixelCountInRegion;
        this.pixelCountTotal = pixelCountTotal;
        this.shareOfRegion = shareOfRegion;
        this.shareOfClass = shareOfClass;
        this.areaKm2 = areaKm2;
    }

    public int getClassCode() {
        return classCode;
    }

    public String getClassName() {
        return className;
    }

    public long getPixelCountInRegion() {
        return pixelCountInRegion;
    }

    public long getPixelCountTotal() {
        return pixelCountTotal;
    }

    /** Share of the region's classified pixels, in percent. */
    public double getShareOfRegion() {
        return shareOfRegion;
    }

    /** Share of all pixels of this class that fall inside the region, in percent. */
    public double getShareOfClass() {
        return shareOfClass;
    }

    public double getAreaKm2() {
        return areaKm2;
    }

    @Override
    public String toString() {
        return "ZonalRecord{" +
                "classCode=" + classCode +
                ", className='" + className + '\'' +
                ", pixelCountInRegion=" + pixelCountInRegion +
                ", pixelCountTotal=" + pixelCountTotal +
                ", shareOfRegion=" + shareOfRegion +
                ", shareOfClass=" + shareOfClass +
                ", areaKm2=" + areaKm2 +
                '}';
    }
}
