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

/* ------------------------------------------------------------ */
/**
 * A frame header broke the RFC6455 framing rules.
 */
public class ProtocolException extends WebSocketReadException
{
    public enum Violation
    {
        HEADER_LENGTH_UNEXPECTED("unexpected payload length bits"),
        HEADER_LENGTH_MSB("payload length most significant bit set"),
        OPCODE_RESERVED("use of reserved opcode"),
        CONTROL_PAYLOAD_OVERFLOW("control frame payload limit exceeded"),
        CONTROL_NOT_FINAL("control frame is not final"),
        NON_ZERO_RSV("non-zero rsv bits with no extension negotiated"),
        MASK_REQUIRED("frames from client to server must be masked"),
        MASK_UNEXPECTED("frames from server to client must be not masked"),
        CONTINUATION_EXPECTED("unexpected non-continuation data frame"),
        CONTINUATION_UNEXPECTED("unexpected continuation data frame"),
        COMPRESSION_BIT_UNEXPECTED("unexpected compression bit");

        private final String _reason;

        Violation(String reason)
        {
            _reason = reason;
        }

        public String getReason()
        {
            return _reason;
        }
    }

    private final Violation _violation;

    public ProtocolException(Violation violation)
    {
        this(violation, violation.getReason());
    }

    public ProtocolException(Violation violation, String message)
    {
        super(CloseCodes.PROTOCOL, message);
        _violation = violation;
    }

    public Violation getViolation()
    {
        return _violation;
    }
}
