package com.raditha.cildiff.diff;

/**
 * Which input a change or a failure belongs to.
 */
public enum DiffSide {
    /**
     * Present only in the left policy.
     */
    LEFT("Addition", "+++"),
    /**
     * Present only in the right policy.
     */
    RIGHT("Deletion", "---");

    private final String changeName;
    private final String marker;

    DiffSide(String changeName, String marker) {
        this.changeName = changeName;
        this.marker = marker;
    }

    /**
     * Name of the change as seen from the right policy towards the left one.
     */
    public String getChangeName() {
        return changeName;
    }

    public String getMarker() {
        return marker;
    }

    public String getLabel() {
        return name().toLowerCase();
    }
}
