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

import org.wsread.websocket.ProtocolException.Violation;

/* ------------------------------------------------------------ */
/**
 * Checks a received frame header against RFC6455 and the state of the
 * connection it arrived on.
 */
public final class FrameHeaderValidator
{
    public static final int MAX_CONTROL_FRAME_PAYLOAD = 125;

    private FrameHeaderValidator()
    {
    }

    /* ------------------------------------------------------------ */
    /**
     * @param header the received header
     * @param role the side of the connection reading the frame
     * @param fragmented true if a fragmented message is in progress
     * @param extended true if extensions were negotiated, which may claim the reserved bits
     * @throws ProtocolException if the header is not legal here
     */
    public static void check(FrameHeader header, Role role, boolean fragmented, boolean extended) throws ProtocolException
    {
        byte opcode = header.getOpCode();
        if (OpCode.isReserved(opcode))
            throw new ProtocolException(Violation.OPCODE_RESERVED);

        if (OpCode.isControl(opcode))
        {
            if (header.getPayloadLength() > MAX_CONTROL_FRAME_PAYLOAD)
                throw new ProtocolException(Violation.CONTROL_PAYLOAD_OVERFLOW);
            if (!header.isFin())
                throw new ProtocolException(Violation.CONTROL_NOT_FINAL);
        }

        if (header.getRsv() != 0 && !extended)
            throw new ProtocolException(Violation.NON_ZERO_RSV);

        if (header.isMasked() != role.expectsMasked())
            throw new ProtocolException(role.expectsMasked() ? Violation.MASK_REQUIRED : Violation.MASK_UNEXPECTED);

        if (fragmented && !OpCode.isControl(opcode) && opcode != OpCode.CONTINUATION)
            throw new ProtocolException(Violation.CONTINUATION_EXPECTED);

        if (!fragmented && opcode == OpCode.CONTINUATION)
            throw new ProtocolException(Violation.CONTINUATION_UNEXPECTED);
    }
}
