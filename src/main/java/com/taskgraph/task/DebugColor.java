package com.taskgraph.task;

import java.util.Arrays;

/**
 * Three-component (red, green, blue) color used to label a task in profiling output.
 * Components are in the range [0, 1]. Immutable.
 */
public final class DebugColor {

    /** Default color of every task: opaque white. */
    public static final DebugColor WHITE = new DebugColor(1.0f, 1.0f, 1.0f);

    private final float red;
    private final float green;
    private final float blue;

    public DebugColor(float red, float green, float blue) {
        this.red = checkComponent(red, "red");
        this.green = checkComponent(green, "green");
        this.blue = checkComponent(blue, "blue");
    }

    /**
     * Creates a color from an array of at least three components.
     *
     * @param rgb components, only the first three are read
     * @return the color
     * @throws IllegalArgumentException if fewer than three components are given
     */
    public static DebugColor of(float... rgb) {
        if (rgb == null || rgb.length < 3) {
            throw new IllegalArgumentException("A debug color needs 3 components, got " + Arrays.toString(rgb));
        }
        return new DebugColor(rgb[0], rgb[1], rgb[2]);
    }

    private static float checkComponent(float value, String component) {
        if (!(value >= 0.0f && value <= 1.0f)) {
            throw new IllegalArgumentException(component + " component must be in [0, 1], got " + value);
        }
        return value;
    }

    public float getRed() {
        return red;
    }

    public float getGreen() {
        return green;
    }

    public float getBlue() {
        return blue;
    }

    /**
     * @return a fresh array {red, green, blue}
     */
    public float[] toArray() {
        return new float[] { red, green, blue };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DebugColor)) return false;
        DebugColor other = (DebugColor) o;
        return Float.compare(red, other.red) == 0
                && Float.compare(green, other.green) == 0
                && Float.compare(blue, other.blue) == 0;
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(toArray());
    }

    @Override
    public String toString() {
        return String.format("DebugColor[%.2f, %.2f, %.2f]", red, green, blue);
    }
}
