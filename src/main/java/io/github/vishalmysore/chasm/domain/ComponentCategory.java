package io.github.vishalmysore.chasm.domain;

/**
 * Physical sub-system classification of a {@link Component}.
 */
public enum ComponentCategory {
    MECHANICAL("Mechanical"),
    ELECTRICAL("Electrical"),
    FIRMWARE("Firmware"),
    PACKAGING("Packaging"),
    UNKNOWN("Unknown");

    private final String label;

    ComponentCategory(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public static ComponentCategory fromLabel(String label) {
        for (ComponentCategory category : values()) {
            if (category.label.equals(label) || category.name().equals(label)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown component category: " + label);
    }
}
