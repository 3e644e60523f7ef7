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

/**
 * The RFC6455 close status codes a reader failure maps to.
 */
public final class CloseCodes
{
    public final static int PROTOCOL=1002;
    public final static int BAD_PAYLOAD=1007;
    public final static int MESSAGE_TOO_LARGE=1009;

    private CloseCodes()
    {
    }
}
