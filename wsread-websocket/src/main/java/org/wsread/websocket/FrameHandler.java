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

/* ------------------------------------------------------------ */
/**
 * Receives a frame met by {@link WebSocketReader#nextFrame()}.
 * <p>
 * Called synchronously on the reading thread, before {@code nextFrame()}
 * returns. A failure thrown here aborts that {@code nextFrame()} call.
 */
public interface FrameHandler
{
    /**
     * @param header the frame header, after extensions have processed it
     * @param payload the unmasked payload, limited to this frame
     * @throws IOException to abort the frame
     */
    void onFrame(FrameHeader header, InputStream payload) throws IOException;
}
