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

import org.eclipse.jetty.util.Utf8Appendable;
import org.eclipse.jetty.util.Utf8StringBuilder;

/* ------------------------------------------------------------ */
/**
 * Passes bytes through unchanged while validating them as UTF-8.
 * <p>
 * Validation runs incrementally over any number of reads and sources, so a
 * text message split over several frames is checked as a whole. An invalid
 * byte does not fail the read: the validity is queried once the message is
 * complete, since a partial message may legitimately end inside a sequence.
 */
public class Utf8CheckingInputStream extends InputStream
{
    private final Utf8StringBuilder _utf8 = new Utf8StringBuilder();
    private InputStream _in;
    private boolean _invalid;
    private long _fed;
    private long _accepted;

    /* ------------------------------------------------------------ */
    /**
     * Rebinds the validator to the next fragment, keeping validation state.
     * @param in the payload of the next frame, or null
     */
    public void setSource(InputStream in)
    {
        _in = in;
    }

    /* ------------------------------------------------------------ */
    /**
     * Forgets all validation state, ready for a new message.
     */
    public void reset()
    {
        _in = null;
        _utf8.reset();
        _invalid = false;
        _fed = 0;
        _accepted = 0;
    }

    /* ------------------------------------------------------------ */
    /**
     * @return true if no invalid byte was seen and the bytes so far end on a complete sequence
     */
    public boolean isValid()
    {
        return !_invalid && _utf8.isUtf8SequenceComplete();
    }

    /* ------------------------------------------------------------ */
    /**
     * @return the number of leading bytes that form complete, valid UTF-8 sequences
     */
    public long getAccepted()
    {
        return _accepted;
    }

    /* ------------------------------------------------------------ */
    @Override
    public int read() throws IOException
    {
        int b = _in.read();
        if (b >= 0)
            check((byte)b);
        return b;
    }

    /* ------------------------------------------------------------ */
    @Override
    public int read(byte[] b, int off, int len) throws IOException
    {
        int n = _in.read(b, off, len);
        for (int i = 0; i < n; i++)
            check(b[off + i]);
        return n;
    }

    /* ------------------------------------------------------------ */
    @Override
    public int available() throws IOException
    {
        return _in == null ? 0 : _in.available();
    }

    /* ------------------------------------------------------------ */
    private void check(byte b)
    {
        if (_invalid)
            return;
        try
        {
            _utf8.append(b);
            _fed++;
            if (_utf8.isUtf8SequenceComplete())
            {
                _accepted = _fed;
                // Only the validation state is of interest, not the decoded characters
                _utf8.reset();
            }
        }
        catch (Utf8Appendable.NotUtf8Exception e)
        {
            _invalid = true;
        }
    }
}
