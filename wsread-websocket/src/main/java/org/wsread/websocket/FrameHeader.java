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

import org.eclipse.jetty.util.TypeUtil;

/* ------------------------------------------------------------ */
/**
 * A decoded websocket frame header.
 * <p>
 * The reserved bits are kept as a 3 bit field, RSV1 being the most
 * significant bit (0x4) and RSV3 the least (0x1).
 */
public class FrameHeader
{
    public static final int RSV1 = 0x4;
    public static final int RSV2 = 0x2;
    public static final int RSV3 = 0x1;

    private final boolean _fin;
    private final int _rsv;
    private final byte _opcode;
    private final boolean _masked;
    private final byte[] _mask;
    private final long _length;

    /* ------------------------------------------------------------ */
    /**
     * @param fin the final fragment flag
     * @param rsv the 3 reserved bits
     * @param opcode the 4 bit opcode
     * @param mask the 4 byte masking key, or null if the payload is not masked
     * @param length the payload length
     */
    public FrameHeader(boolean fin, int rsv, byte opcode, byte[] mask, long length)
    {
        if (mask != null && mask.length != 4)
            throw new IllegalArgumentException("mask length " + mask.length);
        if (length < 0)
            throw new IllegalArgumentException("length " + length);
        _fin = fin;
        _rsv = rsv & 0x7;
        _opcode = (byte)(opcode & 0xF);
        _masked = mask != null;
        _mask = mask == null ? null : mask.clone();
        _length = length;
    }

    public boolean isFin()
    {
        return _fin;
    }

    public int getRsv()
    {
        return _rsv;
    }

    public byte getOpCode()
    {
        return _opcode;
    }

    public boolean isControl()
    {
        return OpCode.isControl(_opcode);
    }

    public boolean isMasked()
    {
        return _masked;
    }

    /* ------------------------------------------------------------ */
    /**
     * @return a copy of the masking key, or null if not masked
     */
    public byte[] getMask()
    {
        return _mask == null ? null : _mask.clone();
    }

    public long getPayloadLength()
    {
        return _length;
    }

    /* ------------------------------------------------------------ */
    /**
     * @param rsv the new reserved bits
     * @return a header identical to this one but for the reserved bits
     */
    public FrameHeader withRsv(int rsv)
    {
        if ((rsv & 0x7) == _rsv)
            return this;
        return new FrameHeader(_fin, rsv, _opcode, _mask, _length);
    }

    /* ------------------------------------------------------------ */
    @Override
    public String toString()
    {
        return String.format("%s[%s,fin=%b,rsv=%s,len=%d,mask=%s]",
                getClass().getSimpleName(),
                OpCode.name(_opcode),
                _fin,
                Integer.toBinaryString(0x8 | _rsv).substring(1),
                _length,
                _masked ? TypeUtil.toHexString(_mask) : "-");
    }
}
