package io.github.vishalmysore.chasm.domain;

/**
 * Channel a piece of feedback came from.
 */
public enum SourceType {
    WEBSITE("Website"),
    REDDIT("Reddit"),
    REVIEW("Review"),
    EMPLOYEE_INTERVIEW("Employee_Interview");

    private final String label;

    SourceType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public static SourceType fromLabel(String label) {
        for (SourceType type : values()) {
            if (type.label.equals(label) || type.name().equals(label)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown source type: " + label);
    }
}
