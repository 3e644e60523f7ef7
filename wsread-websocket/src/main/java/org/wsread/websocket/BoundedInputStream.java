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

import java.io.IOException;
import java.io.InputStream;

import org.eclipse.jetty.io.EofException;

/* ------------------------------------------------------------ */
/**
 * Exposes exactly the payload bytes of one frame from the connection stream.
 * <p>
 * Returns -1 once the frame is exhausted, or when the source ends early, in
 * which case {@link #remaining()} is still positive. The instance is rebound
 * to every new frame with {@link #reset(InputStream, long)}.
 */
public class BoundedInputStream extends InputStream
{
    private static final int DRAIN_BUFFER = 4096;

    private InputStream _in;
    private long _remaining;
    private byte[] _drain;

    /* ------------------------------------------------------------ */
    public void reset(InputStream in, long length)
    {
        _in = in;
        _remaining = length;
    }

    /* ------------------------------------------------------------ */
    public void clear()
    {
        _in = null;
        _remaining = 0;
    }

    /* ------------------------------------------------------------ */
    /**
     * @return the number of frame bytes not yet taken from the source
     */
    public long remaining()
    {
        return _remaining;
    }

    /* ------------------------------------------------------------ */
    @Override
    public int read() throws IOException
    {
        if (_remaining <= 0)
            return -1;
        int b = _in.read();
        if (b >= 0)
            _remaining--;
        return b;
    }

    /* ------------------------------------------------------------ */
    @Override
    public int read(byte[] b, int off, int len) throws IOException
    {
        if (len == 0)
            return 0;
        if (_remaining <= 0)
            return -1;
        int n = _in.read(b, off, (int)Math.min(len, _remaining));
        if (n > 0)
            _remaining -= n;
        return n;
    }

    /* ------------------------------------------------------------ */
    @Override
    public int available() throws IOException
    {
        if (_remaining <= 0)
            return 0;
        return (int)Math.min(_in.available(), _remaining);
    }

    /* ------------------------------------------------------------ */
    /**
     * Skips the unread rest of the frame, bypassing any transformation.
     * @throws EofException if the source ends before the frame does
     * @throws IOException if the source failed
     */
    public void drain() throws IOException
    {
        if (_remaining <= 0)
            return;
        if (_drain == null)
            _drain = new byte[DRAIN_BUFFER];
        while (_remaining > 0)
        {
            if (read(_drain, 0, _drain.length) < 0)
                throw new EofException("frame truncated, " + _remaining + " bytes missing");
        }
    }

    /* ------------------------------------------------------------ */
    @Override
    public String toString()
    {
        return String.format("%s@%x remaining=%d", getClass().getSimpleName(), hashCode(), _remaining);
    }
}
