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
 * The side of the connection a reader runs on.
 * <p>
 * A server reads frames sent by a client, which must be masked; a client
 * reads frames sent by a server, which must not be.
 */
public enum Role
{
    CLIENT(false),
    SERVER(true);

    private final boolean _expectsMasked;

    Role(boolean expectsMasked)
    {
        _expectsMasked = expectsMasked;
    }

    /* ------------------------------------------------------------ */
    /**
     * @return true if frames received on this side must be masked
     */
    public boolean expectsMasked()
    {
        return _expectsMasked;
    }
}
