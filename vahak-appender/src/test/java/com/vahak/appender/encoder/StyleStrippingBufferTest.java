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
package com.vahak.appender.encoder;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class StyleStrippingBufferTest {

    private static String strip(String input) {
        final var buffer = new StyleStrippingBuffer();
        final byte[] bytes = input.getBytes(StandardCharsets.UTF_8);
        buffer.write(bytes, 0, bytes.length);
        return new String(buffer.toByteArray(), StandardCharsets.UTF_8);
    }

    @Test
    void plainTextPassesThrough() {
        assertThat(strip("2024-01-01 INFO main - started\n")).isEqualTo("2024-01-01 INFO main - started\n");
    }

    @Test
    void dropsColourSequences() {
        assertThat(strip("\u001b[31mERROR\u001b[0m boom")).isEqualTo("ERROR boom");
        assertThat(strip("\u001b[1;32mINFO\u001b[0;39m ok")).isEqualTo("INFO ok");
    }

    @Test
    void keepsMultiByteCharacters() {
        assertThat(strip("\u001b[33mwarn\u001b[0m: café ✓")).isEqualTo("warn: café ✓");
    }

    @Test
    void escapeWithoutBracketIsKept() {
        assertThat(strip("a\u001bb")).isEqualTo("a\u001bb");
    }

    @Test
    void trailingEscapeIsKept() {
        final var buffer = new StyleStrippingBuffer();
        buffer.write('x');
        buffer.write(0x1B);

        assertThat(buffer.toByteArray()).containsExactly('x', 0x1B);
        assertThat(buffer.size()).isEqualTo(2);
    }

    @Test
    void writesOnlyTheRequestedSlice() {
        final var buffer = new StyleStrippingBuffer(4);
        final byte[] bytes = "xx\u001b[1mbold\u001b[0myy".getBytes(StandardCharsets.UTF_8);

        buffer.write(bytes, 2, bytes.length - 4);
        buffer.write("!".getBytes(StandardCharsets.UTF_8));

        assertThat(new String(buffer.toByteArray(), StandardCharsets.UTF_8)).isEqualTo("bold!");
    }

    @Test
    void rejectsSliceOutsideArray() {
        final var buffer = new StyleStrippingBuffer();

        assertThatThrownBy(() -> buffer.write(new byte[4], 2, 3)).isInstanceOf(IndexOutOfBoundsException.class);
    }

    @Test
    void unfinishedSequenceIsDropped() {
        assertThat(strip("text\u001b[38;5")).isEqualTo("text");
    }
}
