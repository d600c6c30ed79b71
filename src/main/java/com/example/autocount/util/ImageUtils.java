package com.example.autocount.util;

import com.example.autocount.exception.InvalidInputException;
import org.bytedeco.javacpp.BytePointer;
import org.bytedeco.opencv.global.opencv_imgcodecs;
import org.bytedeco.opencv.global.opencv_imgproc;
import org.bytedeco.opencv.opencv_core.Mat;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/**
 * Loading and encoding helpers for page and template rasters. Every loader returns a single
 * channel 8-bit image, the only format the scanner accepts.
 */
public final class ImageUtils {

    private ImageUtils() {
    }

    public static Mat readGrayscale(String path) {
        if (path == null || path.isBlank()) {
            throw new InvalidInputException("Image path is required");
        }
        Path resolved;
        try {
            resolved = Path.of(path);
        } catch (InvalidPathException ex) {
            throw new InvalidInputException("Image file not found: " + path, ex);
        }
        return readGrayscale(resolved);
    }

    public static Mat readGrayscale(Path path) {
        if (path == null) {
            throw new InvalidInputException("Image path is required");
        }
        if (!Files.isRegularFile(path)) {
            throw new InvalidInputException("Image file not found: " + path);
        }
        if (!Files.isReadable(path)) {
            throw new InvalidInputException("Image file is not readable: " + path);
        }
        Mat color = opencv_imgcodecs.imread(path.toString(), opencv_imgcodecs.IMREAD_COLOR);
        if (color == null || color.empty()) {
            if (color != null) {
                color.close();
            }
            throw new InvalidInputException("Failed to load image: " + path);
        }
        return toGray(color);
    }

    public static Mat decodeGrayscale(byte[] data, String name) {
        return toGray(decodeColor(data, name));
    }

    public static Mat decodeColor(byte[] data, String name) {
        if (data == null || data.length == 0) {
            throw new InvalidInputException("Image payload is empty: " + name);
        }
        Mat color;
        try (Mat buffer = new Mat(data)) {
            color = opencv_imgcodecs.imdecode(buffer, opencv_imgcodecs.IMREAD_COLOR);
        }
        if (color == null || color.empty()) {
            if (color != null) {
                color.close();
            }
            throw new InvalidInputException("Unable to decode image payload: " + name);
        }
        return color;
    }

    public static byte[] encodePng(Mat image) {
        try (BytePointer buffer = new BytePointer()) {
            boolean encoded = opencv_imgcodecs.imencode(".png", image, buffer);
            if (!encoded) {
                throw new IllegalStateException("Failed to encode image as PNG");
            }
            byte[] bytes = new byte[(int) buffer.limit()];
            buffer.get(bytes);
            return bytes;
        }
    }

    private static Mat toGray(Mat color) {
        Mat gray = new Mat();
        try {
            opencv_imgproc.cvtColor(color, gray, opencv_imgproc.COLOR_BGR2GRAY);
        } finally {
            color.close();
        }
        return gray;
    }
}
