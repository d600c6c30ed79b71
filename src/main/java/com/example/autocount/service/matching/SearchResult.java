package com.example.autocount.service.matching;

import java.util.List;

public record SearchResult(List<Match> matches, int imageWidth, int imageHeight, int templateWidth,
                           int templateHeight, int rawDetections) {
}
