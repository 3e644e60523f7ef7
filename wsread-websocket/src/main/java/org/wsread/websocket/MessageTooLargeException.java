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
 * A frame declared a payload longer than the configured maximum frame size.
 */
public class MessageTooLargeException extends WebSocketReadException
{
    private final long _length;
    private final long _maxFrameSize;

    public MessageTooLargeException(long length, long maxFrameSize)
    {
        super(CloseCodes.MESSAGE_TOO_LARGE, "frame too large: " + length + ">" + maxFrameSize);
        _length = length;
        _maxFrameSize = maxFrameSize;
    }

    public long getLength()
    {
        return _length;
    }

    public long getMaxFrameSize()
    {
        return _maxFrameSize;
    }
}
