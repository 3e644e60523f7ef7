//
//  ========================================================================
//  Copyright (c) 1995-2014 Mort Bay Consulting Pty. Ltd.
//  ------------------------------------------------------------------------
//  All rights reserved. This program and the accompanying materials
//  are made available under the terms of the Eclipse Public License v1.0
//  and Apache License v2.0 which accompanies this distribution.
//
//      The Eclipse Public License is available at
//      http://www.eclipse.org/legal/epl-v10.html
//
//      The Apache License v2.0 is available at
//      http://www.opensource.org/licenses/apache2.0.php
//
//  You may elect to redistribute this code under either of these licenses.
//  ========================================================================
//

package org.wsread.websocket;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;

import org.eclipse.jetty.util.StringUtil;

/**
 * Writes raw frames for the reader tests.
 */
public class FrameBuilder
{
    public static final int LENGTH_7 = 7;
    public static final int LENGTH_16 = 16;
    public static final int LENGTH_64 = 64;

    private final ByteArrayOutputStream _out = new ByteArrayOutputStream();
    private byte[] _mask;

    /* ------------------------------------------------------------ */
    /**
     * @param mask the key to mask the following frames with, or null to stop masking
     */
    public FrameBuilder mask(byte[] mask)
    {
        _mask = mask;
        return this;
    }

    public FrameBuilder text(boolean fin, String text)
    {
        return frame(fin, 0, OpCode.TEXT, StringUtil.getUtf8Bytes(text));
    }

    public FrameBuilder binary(boolean fin, byte[] payload)
    {
        return frame(fin, 0, OpCode.BINARY, payload);
    }

    public FrameBuilder continuation(boolean fin, String text)
    {
        return frame(fin, 0, OpCode.CONTINUATION, StringUtil.getUtf8Bytes(text));
    }

    public FrameBuilder continuation(boolean fin, byte[] payload)
    {
        return frame(fin, 0, OpCode.CONTINUATION, payload);
    }

    public FrameBuilder ping(String text)
    {
        return frame(true, 0, OpCode.PING, StringUtil.getUtf8Bytes(text));
    }

    public FrameBuilder frame(boolean fin, int rsv, byte opcode, byte[] payload)
    {
        int form = payload.length < 126 ? LENGTH_7 : payload.length <= 0xFFFF ? LENGTH_16 : LENGTH_64;
        return frame(fin, rsv, opcode, payload, form);
    }

    /* ------------------------------------------------------------ */
    /**
     * Writes a frame with the given length encoding, not necessarily the shortest.
     */
    public FrameBuilder frame(boolean fin, int rsv, byte opcode, byte[] payload, int lengthForm)
    {
        _out.write((fin ? 0x80 : 0) | ((rsv & 0x7) << 4) | (opcode & 0xF));
        int maskBit = _mask == null ? 0 : 0x80;
        long length = payload.length;
        switch (lengthForm)
        {
            case LENGTH_7:
                _out.write(maskBit | (int)length);
                break;
            case LENGTH_16:
                _out.write(maskBit | 126);
                _out.write((int)(length >> 8) & 0xFF);
                _out.write((int)length & 0xFF);
                break;
            case LENGTH_64:
                _out.write(maskBit | 127);
                for (int shift = 56; shift >= 0; shift -= 8)
                    _out.write((int)(length >> shift) & 0xFF);
                break;
            default:
                throw new IllegalArgumentException("form " + lengthForm);
        }

        byte[] data = payload.clone();
        if (_mask != null)
        {
            _out.write(_mask, 0, 4);
            MaskingInputStream.mask(_mask, 0, data, 0, data.length);
        }
        _out.write(data, 0, data.length);
        return this;
    }

    public FrameBuilder raw(int... bytes)
    {
        for (int b : bytes)
            _out.write(b);
        return this;
    }

    public byte[] toByteArray()
    {
        return _out.toByteArray();
    }

    public ByteArrayInputStream toInputStream()
    {
        return new ByteArrayInputStream(_out.toByteArray());
    }
}
