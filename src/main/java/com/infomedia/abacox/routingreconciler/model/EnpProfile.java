package com.infomedia.abacox.routingreconciler.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Routing platforms a number can be reassigned to in the numbers table.
 */
@Getter
@RequiredArgsConstructor
public enum EnpProfile {
    NXP1(500, 98067),
    NXP2(510, 98019);

    private final int systemId;
    private final int nprnId;
}
