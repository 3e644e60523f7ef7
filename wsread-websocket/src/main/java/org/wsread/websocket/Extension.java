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

import java.util.Map;

/* ------------------------------------------------------------ */
/**
 * The receive side of a negotiated extension.
 * <p>
 * Extensions are applied to every frame header in the order they were
 * negotiated. They may clear the reserved bits they own and may reject a
 * frame that misuses them.
 */
public interface Extension
{
    public String getName();

    public boolean init(Map<String,String> parameters);

    /**
     * @param header the header as received, or as left by the previous extension
     * @return the header with the bits owned by this extension cleared
     * @throws ProtocolException if the frame misuses the extension
     */
    public FrameHeader unsetBits(FrameHeader header) throws ProtocolException;
}
