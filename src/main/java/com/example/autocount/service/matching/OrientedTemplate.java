package com.example.autocount.service.matching;

import org.bytedeco.opencv.opencv_core.Mat;

/**
 * A template image already rotated into one of the search orientations. Owns the native buffer.
 */
public record OrientedTemplate(Orientation orientation, Mat image) implements AutoCloseable {

    public int width() {
        return image.cols();
    }

    public int height() {
        return image.rows();
    }

    @Override
    public void close() {
        image.close();
    }
}
