package com.sdsketch.model;

import java.util.Objects;

/**
 * Fields 4 to 7 of a {@code 1,} record: shape, hidden flag, polarity code and thickness. A shape of
 * {@code 100} or {@code 4} marks a flow pipe rather than an influence arrow.
 */
public final class ArrowParams {
    public static final ArrowParams STANDARD = new ArrowParams("0", "0", "0", "22");

    private final String shape;
    private final String hidden;
    private final String polarityCode;
    private final String thickness;

    public ArrowParams(String shape, String hidden, String polarityCode, String thickness) {
        this.shape = Objects.requireNonNull(shape, "shape");
        this.hidden = Objects.requireNonNull(hidden, "hidden");
        this.polarityCode = Objects.requireNonNull(polarityCode, "polarityCode");
        this.thickness = Objects.requireNonNull(thickness, "thickness");
    }

    public String getShape() {
        return shape;
    }

    public String getHidden() {
        return hidden;
    }

    public String getPolarityCode() {
        return polarityCode;
    }

    public String getThickness() {
        return thickness;
    }

    public boolean isFlowPipe() {
        return "100".equals(shape) || "4".equals(shape);
    }

    /** Shape 100 is drawn from the valve back to the flow's source. */
    public boolean isSourcePipe() {
        return "100".equals(shape);
    }

    public Polarity getPolarity() {
        return Polarity.fromArrowCode(polarityCode);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof ArrowParams)) {
            return false;
        }
        ArrowParams other = (ArrowParams) obj;
        return shape.equals(other.shape)
                && hidden.equals(other.hidden)
                && polarityCode.equals(other.polarityCode)
                && thickness.equals(other.thickness);
    }

    @Override
    public int hashCode() {
        return Objects.hash(shape, hidden, polarityCode, thickness);
    }

    @Override
    public String toString() {
        return shape + "," + hidden + "," + polarityCode + "," + thickness;
    }
}
