package com.ai.trainingstudio.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Which auxiliary datasets the generation service has received in this
 * process lifetime. Flags only ever go from false to true.
 */
@Value
@With
@Builder
@AllArgsConstructor
public class ReadinessStatus {

    boolean courses;

    boolean holidays;

    boolean guidelines;

    int documentCount;

    public static ReadinessStatus initial() {
        return new ReadinessStatus(false, false, false, 0);
    }
}
