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

import org.eclipse.jetty.util.log.Log;
import org.eclipse.jetty.util.log.Logger;

/* ------------------------------------------------------------ */
/**
 * Receive side bit handling of the permessage-deflate extension (RFC7692).
 * <p>
 * RSV1 on the first frame of a data message marks the whole message as
 * compressed. The bit is cleared and remembered in {@link #isCompressed()}.
 * RSV1 is illegal on continuation and control frames. Inflating the payload
 * is left to the consumer of the message.
 */
public class DeflateBitExtension extends AbstractExtension
{
    private static final Logger LOG = Log.getLogger(DeflateBitExtension.class);

    public static final String NAME="permessage-deflate";

    private boolean _compressed;

    public DeflateBitExtension()
    {
        super(NAME);
    }

    /* ------------------------------------------------------------ */
    /**
     * @return true if the current (or last) data message was sent compressed
     */
    public boolean isCompressed()
    {
        return _compressed;
    }

    /* ------------------------------------------------------------ */
    @Override
    public FrameHeader unsetBits(FrameHeader header) throws ProtocolException
    {
        int rsv=header.getRsv();
        boolean rsv1=isFlag(rsv,1);
        byte opcode=header.getOpCode();

        if (!OpCode.isData(opcode))
        {
            if (rsv1)
                throw new ProtocolException(ProtocolException.Violation.COMPRESSION_BIT_UNEXPECTED,
                        "rsv1 set on " + OpCode.name(opcode) + " frame");
            return header;
        }

        _compressed=rsv1;
        if (LOG.isDebugEnabled())
            LOG.debug("{} message compressed={}",OpCode.name(opcode),_compressed);
        return header.withRsv(clearFlag(rsv,1));
    }
}
