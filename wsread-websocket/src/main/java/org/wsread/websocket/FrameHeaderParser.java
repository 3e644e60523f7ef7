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
import java.util.Arrays;

import org.eclipse.jetty.io.EofException;

/* ------------------------------------------------------------ */
/**
 * Decodes RFC6455 frame headers from a blocking stream.
 * <pre>
 *   byte0: FIN(1) RSV(3) OPCODE(4)
 *   byte1: MASK(1) LEN7(7)
 *   LEN7==126: 16 bit length, LEN7==127: 64 bit length (MSB clear)
 *   MASK==1: 4 byte masking key
 * </pre>
 * The header is read in two hops: the 2 fixed bytes, then the 0 to 12
 * extended length and mask bytes in a single read. The scratch buffer is
 * owned by the parser and overwritten by every call, so an instance must
 * not be shared between connections.
 */
public class FrameHeaderParser
{
    public static final int MAX_HEADER_SIZE = 14;

    private final byte[] _bytes = new byte[MAX_HEADER_SIZE - 2];

    /* ------------------------------------------------------------ */
    /**
     * @param in the source positioned at a frame boundary
     * @return the header, or null if the source ended before the first header byte
     * @throws EofException if the source ended inside the header
     * @throws ProtocolException if the length encoding is illegal
     * @throws IOException if the source failed
     */
    public FrameHeader parse(InputStream in) throws IOException
    {
        byte[] b = _bytes;

        int filled = fill(in, b, 2);
        if (filled == 0)
            return null;
        if (filled < 2)
            throw new EofException("frame header truncated");

        boolean fin = (b[0] & 0x80) != 0;
        int rsv = (b[0] & 0x70) >> 4;
        byte opcode = (byte)(b[0] & 0x0F);
        boolean masked = (b[1] & 0x80) != 0;
        int len7 = b[1] & 0x7F;

        int extra = masked ? 4 : 0;
        long length = 0;
        if (len7 < 126)
            length = len7;
        else if (len7 == 126)
            extra += 2;
        else if (len7 == 127)
            extra += 8;
        else
            throw new ProtocolException(ProtocolException.Violation.HEADER_LENGTH_UNEXPECTED);

        if (extra == 0)
            return new FrameHeader(fin, rsv, opcode, null, length);

        // Overwrites the 2 bytes already consumed
        if (fill(in, b, extra) < extra)
            throw new EofException("frame header truncated");

        int offset = 0;
        if (len7 == 126)
        {
            length = ((b[0] & 0xFF) << 8) | (b[1] & 0xFF);
            offset = 2;
        }
        else if (len7 == 127)
        {
            if ((b[0] & 0x80) != 0)
                throw new ProtocolException(ProtocolException.Violation.HEADER_LENGTH_MSB);
            for (int i = 0; i < 8; i++)
                length = (length << 8) | (b[i] & 0xFF);
            offset = 8;
        }

        byte[] mask = masked ? Arrays.copyOfRange(b, offset, offset + 4) : null;
        return new FrameHeader(fin, rsv, opcode, mask, length);
    }

    /* ------------------------------------------------------------ */
    private static int fill(InputStream in, byte[] b, int length) throws IOException
    {
        int filled = 0;
        while (filled < length)
        {
            int n = in.read(b, filled, length - filled);
            if (n < 0)
                break;
            filled += n;
        }
        return filled;
    }
}
