package com.sdsketch.model;

/**
 * Closed set of variable kinds that appear in a sketch. The shape code is the value stored in
 * field 7 of a {@code 10,} record.
 */
public enum VariableKind {
    STOCK("Stock", 3),
    FLOW("Flow", 40),
    AUXILIARY("Auxiliary", 8),
    CLOUD("Cloud", 48);

    private final String displayName;
    private final int shapeCode;

    VariableKind(String displayName, int shapeCode) {
        this.displayName = displayName;
        this.shapeCode = shapeCode;
    }

    public String getDisplayName() {
        return displayName;
    }

    public int getShapeCode() {
        return shapeCode;
    }

    /** Classifies a {@code 10,} record shape code. Anything that is not a stock or a flow is an auxiliary. */
    public static VariableKind fromShapeCode(int shapeCode) {
        switch (shapeCode) {
            case 3:
                return STOCK;
            case 40:
                return FLOW;
            default:
                return AUXILIARY;
        }
    }

    /** Parses the interchange spelling ("Stock", "Flow", ...), case-insensitively. Unknown values map to AUXILIARY. */
    public static VariableKind fromDisplayName(String name) {
        if (name != null) {
            for (VariableKind kind : values()) {
                if (kind.displayName.equalsIgnoreCase(name.trim())) {
                    return kind;
                }
            }
        }
        return AUXILIARY;
    }
}
