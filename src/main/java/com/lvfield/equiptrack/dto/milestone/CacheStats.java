package com.lvfield.equiptrack.dto.milestone;

import lombok.Value;

@Value
public class CacheStats {

    int total;

    int fresh;

    int stale;

    long freshnessWindowMillis;
}
