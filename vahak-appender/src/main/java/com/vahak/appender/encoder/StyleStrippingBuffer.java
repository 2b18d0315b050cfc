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

import java.io.ByteArrayOutputStream;
import java.io.OutputStream;
import java.util.Objects;

/**
 * In-memory payload buffer that accepts terminal styling and drops it.
 * 
 * <p>Encoders may emit ANSI control sequences (for example through
 * {@code %highlight} or {@code %red}). A message payload is not a terminal, so
 * every {@code ESC [ ... final-byte} sequence is consumed without output and the
 * remaining text is kept byte for byte.</p>
 */
public class StyleStrippingBuffer extends OutputStream {
    
    private static final int ESC = 0x1B;
    private static final int CSI_OPEN = '[';
    private static final int FINAL_BYTE_MIN = 0x40;
    private static final int FINAL_BYTE_MAX = 0x7E;
    
    private enum State { TEXT, ESCAPE, CONTROL }
    
    private final ByteArrayOutputStream out;
    private State state = State.TEXT;
    
    public StyleStrippingBuffer() {
        this(256);
    }
    
    public StyleStrippingBuffer(int initialCapacity) {
        this.out = new ByteArrayOutputStream(initialCapacity);
    }
    
    @Override
    public void write(int b) {
        int value = b & 0xFF;
        switch (state) {
            case TEXT:
                if (value == ESC) {
                    state = State.ESCAPE;
                } else {
                    out.write(value);
                }
                break;
            case ESCAPE:
                if (value == CSI_OPEN) {
                    state = State.CONTROL;
                } else if (value == ESC) {
                    out.write(ESC);
                } else {
                    out.write(ESC);
                    out.write(value);
                    state = State.TEXT;
                }
                break;
            case CONTROL:
                if (value >= FINAL_BYTE_MIN && value <= FINAL_BYTE_MAX) {
                    state = State.TEXT;
                }
                break;
            default:
                break;
        }
    }
    
    @Override
    public void write(byte[] b, int off, int len) {
        Objects.checkFromIndexSize(off, len, b.length);
        for (int i = off; i < off + len; i++) {
            write(b[i]);
        }
    }

    @Override
    public void write(byte[] b) {
        write(b, 0, b.length);
    }

    /**
     * The buffered payload. A lone trailing ESC is kept; an unfinished
     * control sequence is not.
     */
    public byte[] toByteArray() {
        if (state == State.ESCAPE) {
            byte[] body = out.toByteArray();
            byte[] result = new byte[body.length + 1];
            System.arraycopy(body, 0, result, 0, body.length);
            result[body.length] = ESC;
            return result;
        }
        return out.toByteArray();
    }
    
    public int size() {
        return out.size() + (state == State.ESCAPE ? 1 : 0);
    }
}
