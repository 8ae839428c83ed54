package org.lite.dispatch.model;

import lombok.Value;

@Value
public class TimeSeriesPoint {
    long timestamp;
    double value;
    long count;
}
