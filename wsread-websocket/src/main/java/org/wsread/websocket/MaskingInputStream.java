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

import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;

/* ------------------------------------------------------------ */
/**
 * Unmasks a frame payload as it is read.
 * <p>
 * Each payload byte is XOR'ed with the masking key byte at its position
 * modulo 4. The position runs across reads, and is restarted for every frame
 * by {@link #reset(InputStream, byte[])}.
 */
public class MaskingInputStream extends FilterInputStream
{
    private final byte[] _mask = new byte[4];
    private long _position;

    public MaskingInputStream(InputStream in, byte[] mask)
    {
        super(in);
        reset(in, mask);
    }

    /* ------------------------------------------------------------ */
    public void reset(InputStream in, byte[] mask)
    {
        this.in = in;
        System.arraycopy(mask, 0, _mask, 0, 4);
        _position = 0;
    }

    /* ------------------------------------------------------------ */
    @Override
    public int read() throws IOException
    {
        int b = in.read();
        if (b < 0)
            return b;
        return (b ^ _mask[(int)(_position++ & 3)]) & 0xFF;
    }

    /* ------------------------------------------------------------ */
    @Override
    public int read(byte[] b, int off, int len) throws IOException
    {
        int n = in.read(b, off, len);
        if (n > 0)
        {
            mask(_mask, _position, b, off, n);
            _position += n;
        }
        return n;
    }

    /* ------------------------------------------------------------ */
    @Override
    public long skip(long n) throws IOException
    {
        long skipped = in.skip(n);
        _position += skipped;
        return skipped;
    }

    /* ------------------------------------------------------------ */
    @Override
    public boolean markSupported()
    {
        return false;
    }

    /* ------------------------------------------------------------ */
    /**
     * Masks or unmasks bytes in place; applying it twice restores the input.
     * @param mask the 4 byte key
     * @param position the offset of {@code b[off]} within the payload
     * @param b the bytes
     * @param off the first byte to transform
     * @param len the number of bytes to transform
     */
    public static void mask(byte[] mask, long position, byte[] b, int off, int len)
    {
        int m = (int)(position & 3);
        final int end = off + len;
        for (int i = off; i < end; i++)
        {
            b[i] ^= mask[m];
            m = (m + 1) & 3;
        }
    }
}
