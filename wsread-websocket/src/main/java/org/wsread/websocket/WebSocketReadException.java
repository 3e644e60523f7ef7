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

/* ------------------------------------------------------------ */
/**
 * Base of the failures a {@link WebSocketReader} reports for the inbound
 * stream. All of them are fatal for the connection; {@link #getCloseCode()}
 * is the status a caller should close it with.
 */
public class WebSocketReadException extends IOException
{
    private final int _closeCode;

    public WebSocketReadException(int closeCode, String message)
    {
        super(message);
        _closeCode = closeCode;
    }

    public int getCloseCode()
    {
        return _closeCode;
    }
}
