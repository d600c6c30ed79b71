package com.example.autocount.service.matching;

import com.example.autocount.model.BoundingBox;
import com.example.autocount.model.NormalizedBox;

/**
 * A detection that survived reduction. Ids follow the order of the list the match belongs to.
 */
public record Match(int id, double confidence, NormalizedBox boundingBox, BoundingBox pixelBoundingBox,
                    Orientation orientation) {

    public Match withId(int newId) {
        return new Match(newId, confidence, boundingBox, pixelBoundingBox, orientation);
    }
}
