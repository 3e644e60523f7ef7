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
 * {@link WebSocketReader#read(byte[], int, int)} was called with no frame
 * open and no fragmented message in progress.
 * {@link WebSocketReader#nextFrame()} has to be called first.
 */
public class NoFrameAdvanceException extends IllegalStateException
{
    public NoFrameAdvanceException()
    {
        super("no frame advance");
    }
}
