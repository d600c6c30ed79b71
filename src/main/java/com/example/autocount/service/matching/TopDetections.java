package com.example.autocount.service.matching;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.PriorityQueue;

/**
 * Keeps the best {@code capacity} detections offered to it. The head of the backing heap is
 * always the weakest retained detection, so an incoming one only has to beat the head.
 */
class TopDetections {

    private final int capacity;
    private final PriorityQueue<Detection> heap;

    TopDetections(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Detection capacity must be positive");
        }
        this.capacity = capacity;
        this.heap = new PriorityQueue<>(Math.min(capacity, 1024), Detection.RANKING.reversed());
    }

    void offer(Detection detection) {
        if (heap.size() < capacity) {
            heap.add(detection);
            return;
        }
        if (Detection.RANKING.compare(detection, heap.peek()) < 0) {
            heap.poll();
            heap.add(detection);
        }
    }

    void offerAll(Collection<Detection> detections) {
        for (Detection detection : detections) {
            offer(detection);
        }
    }

    int size() {
        return heap.size();
    }

    List<Detection> toRankedList() {
        List<Detection> ranked = new ArrayList<>(heap);
        ranked.sort(Detection.RANKING);
        return ranked;
    }
}
