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
 * A text message was not valid UTF-8.
 * <p>
 * The exception is raised once the whole message has been read, so every
 * byte of the message has already been delivered. {@link #getAccepted()}
 * tells how many of those leading bytes form valid UTF-8, letting the caller
 * keep or drop that prefix.
 */
public class BadPayloadException extends WebSocketReadException
{
    private final long _accepted;

    public BadPayloadException(long accepted)
    {
        super(CloseCodes.BAD_PAYLOAD, "invalid utf8 after " + accepted + " bytes");
        _accepted = accepted;
    }

    public long getAccepted()
    {
        return _accepted;
    }
}
