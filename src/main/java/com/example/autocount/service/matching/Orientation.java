package com.example.autocount.service.matching;

import com.example.autocount.exception.InvalidInputException;

/**
 * Right-angle orientations a symbol may be placed at on a drawing. Angles are counter-clockwise,
 * following the OpenCV rotation convention.
 */
public enum Orientation {
    DEG_0(0),
    DEG_90(90),
    DEG_180(180),
    DEG_270(270);

    private final int degrees;

    Orientation(int degrees) {
        this.degrees = degrees;
    }

    public int degrees() {
        return degrees;
    }

    public static Orientation fromDegrees(int degrees) {
        int normalized = Math.floorMod(degrees, 360);
        for (Orientation orientation : values()) {
            if (orientation.degrees == normalized) {
                return orientation;
            }
        }
        throw new InvalidInputException("Unsupported orientation " + degrees + ", expected a multiple of 90 degrees");
    }
}
