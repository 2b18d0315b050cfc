/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 *
 * Legal Notice: This module and the associated software architecture are proprietary
 * and confidential. Unauthorized copying, distribution, modification, or use is
 * strictly prohibited without explicit written permission from the copyright holder.
 *
 * Patent Pending: Certain architectural patterns and implementations described in
 * this module may be subject to patent applications.
 */
package com.vahak.core.model;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class DeliveryLevelTest {

    @Test
    void mapsProtocolCodes() {
        assertThat(DeliveryLevel.fromCode(0)).isEqualTo(DeliveryLevel.AT_MOST_ONCE);
        assertThat(DeliveryLevel.fromCode(1)).isEqualTo(DeliveryLevel.AT_LEAST_ONCE);
        assertThat(DeliveryLevel.fromCode(2)).isEqualTo(DeliveryLevel.EXACTLY_ONCE);
    }

    @ParameterizedTest
    @ValueSource(ints = {3, 9, -1, 255, Integer.MAX_VALUE})
    void outOfRangeFallsBackToAtMostOnce(int code) {
        assertThat(DeliveryLevel.fromCode(code)).isEqualTo(DeliveryLevel.AT_MOST_ONCE);
    }

    @Test
    void codeRoundTripsForEveryLevel() {
        for (DeliveryLevel level : DeliveryLevel.values()) {
            assertThat(DeliveryLevel.fromCode(level.getCode())).isEqualTo(level);
        }
    }
}
