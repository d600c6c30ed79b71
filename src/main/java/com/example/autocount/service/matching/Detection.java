package com.example.autocount.service.matching;

import java.util.Comparator;

/**
 * A single window that passed the confidence threshold during a scan. The sequence number
 * reflects scan order and is only used to keep ordering stable between equal confidences.
 */
public record Detection(int x, int y, int width, int height, double confidence,
                        Orientation orientation, long sequence) {

    /**
     * Best first: descending confidence, then ascending scan order.
     */
    public static final Comparator<Detection> RANKING = Comparator
            .comparingDouble(Detection::confidence).reversed()
            .thenComparingLong(Detection::sequence);

    public double centerX() {
        return x + width / 2.0;
    }

    public double centerY() {
        return y + height / 2.0;
    }

    public long area() {
        return (long) width * height;
    }
}
