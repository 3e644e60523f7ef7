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

import java.util.HashMap;
import java.util.Map;

import org.eclipse.jetty.util.QuotedStringTokenizer;

public abstract class AbstractExtension implements Extension
{
    private static final int[] __mask = { -1, FrameHeader.RSV1, FrameHeader.RSV2, FrameHeader.RSV3};
    private final String _name;
    private final Map<String,String> _parameters=new HashMap<String, String>();

    public AbstractExtension(String name)
    {
        _name = name;
    }

    public boolean init(Map<String, String> parameters)
    {
        _parameters.putAll(parameters);
        return true;
    }

    public String getInitParameter(String name)
    {
        return _parameters.get(name);
    }

    public String getInitParameter(String name,String dft)
    {
        if (!_parameters.containsKey(name))
            return dft;
        return _parameters.get(name);
    }

    public int getInitParameter(String name, int dft)
    {
        String v=_parameters.get(name);
        if (v==null)
            return dft;
        return Integer.valueOf(v);
    }

    public String getName()
    {
        return _name;
    }

    public String getParameterizedName()
    {
        StringBuilder name = new StringBuilder();
        name.append(_name);
        for (String param : _parameters.keySet())
        {
            String value=_parameters.get(param);
            name.append(';').append(param);
            if (value!=null)
                name.append('=').append(QuotedStringTokenizer.quoteIfNeeded(value,";="));
        }
        return name.toString();
    }

    public int setFlag(int rsvBits,int rsv)
    {
        if (rsv<1||rsv>3)
            throw new IllegalArgumentException("rsv"+rsv);
        return rsvBits | __mask[rsv];
    }

    public int clearFlag(int rsvBits,int rsv)
    {
        if (rsv<1||rsv>3)
            throw new IllegalArgumentException("rsv"+rsv);
        return rsvBits & ~__mask[rsv];
    }

    public boolean isFlag(int rsvBits,int rsv)
    {
        if (rsv<1||rsv>3)
            throw new IllegalArgumentException("rsv"+rsv);
        return (rsvBits & __mask[rsv])!=0;
    }

    @Override
    public String toString()
    {
        return getParameterizedName();
    }
}
