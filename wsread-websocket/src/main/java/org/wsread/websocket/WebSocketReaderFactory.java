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

import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.eclipse.jetty.util.QuotedStringTokenizer;
import org.eclipse.jetty.util.log.Log;
import org.eclipse.jetty.util.log.Logger;

/* ------------------------------------------------------------ */
/**
 * Creates {@link WebSocketReader}s sharing one configuration.
 * <p>
 * The configuration may be given as init parameters:
 * <dl>
 * <dt>role</dt><dd>client or server (default server)</dd>
 * <dt>maxFrameSize</dt><dd>largest accepted frame payload, 0 for no limit (default 0)</dd>
 * <dt>checkUtf8</dt><dd>validate text messages as UTF-8 (default false)</dd>
 * <dt>headerValidation</dt><dd>check headers against RFC6455 (default true)</dd>
 * </dl>
 */
public class WebSocketReaderFactory
{
    private static final Logger LOG = Log.getLogger(WebSocketReaderFactory.class);

    private final Map<String,Class<? extends Extension>> _extensionClasses = new HashMap<String, Class<? extends Extension>>();
    {
        _extensionClasses.put(DeflateBitExtension.NAME,DeflateBitExtension.class);
    }

    private Role _role = Role.SERVER;
    private long _maxFrameSize;
    private boolean _checkUtf8;
    private boolean _headerValidation = true;

    /* ------------------------------------------------------------ */
    /**
     * @param parameters the init parameters, unknown names are ignored
     */
    public void init(Map<String,String> parameters)
    {
        String role = parameters.get("role");
        if (role != null)
            setRole(Role.valueOf(role.trim().toUpperCase(Locale.ENGLISH)));

        String max = parameters.get("maxFrameSize");
        if (max != null)
            setMaxFrameSize(Long.parseLong(max.trim()));

        String utf8 = parameters.get("checkUtf8");
        if (utf8 != null)
            setCheckUtf8(Boolean.parseBoolean(utf8.trim()));

        String validation = parameters.get("headerValidation");
        if (validation != null)
            setHeaderValidation(Boolean.parseBoolean(validation.trim()));

        LOG.debug("init {}",this);
    }

    public Role getRole()
    {
        return _role;
    }

    public void setRole(Role role)
    {
        if (role == null)
            throw new NullPointerException("role");
        _role = role;
    }

    public long getMaxFrameSize()
    {
        return _maxFrameSize;
    }

    public void setMaxFrameSize(long maxFrameSize)
    {
        if (maxFrameSize < 0)
            throw new IllegalArgumentException("maxFrameSize " + maxFrameSize);
        _maxFrameSize = maxFrameSize;
    }

    public boolean isCheckUtf8()
    {
        return _checkUtf8;
    }

    public void setCheckUtf8(boolean checkUtf8)
    {
        _checkUtf8 = checkUtf8;
    }

    public boolean isHeaderValidation()
    {
        return _headerValidation;
    }

    public void setHeaderValidation(boolean headerValidation)
    {
        _headerValidation = headerValidation;
    }

    /**
     * @return A modifiable map of extension name to extension class
     */
    public Map<String,Class<? extends Extension>> getExtensionClassesMap()
    {
        return _extensionClasses;
    }

    /* ------------------------------------------------------------ */
    /**
     * @param negotiated extension descriptions as in the Sec-WebSocket-Extensions
     * header, such as {@code permessage-deflate;client_max_window_bits=10}
     * @return the initialized extensions, in order; unknown ones are left out
     */
    public List<Extension> initExtensions(List<String> negotiated)
    {
        List<Extension> extensions = new ArrayList<Extension>();
        for (String rExt : negotiated)
        {
            QuotedStringTokenizer tok = new QuotedStringTokenizer(rExt,";");
            String extName=tok.nextToken().trim();
            Map<String,String> parameters = new HashMap<String,String>();
            while (tok.hasMoreTokens())
            {
                QuotedStringTokenizer nv = new QuotedStringTokenizer(tok.nextToken().trim(),"=");
                String name=nv.nextToken().trim();
                String value=nv.hasMoreTokens()?nv.nextToken().trim():null;
                parameters.put(name,value);
            }

            Extension extension = newExtension(extName);

            if (extension==null)
            {
                LOG.debug("unknown extension {}",extName);
                continue;
            }

            if (extension.init(parameters))
            {
                LOG.debug("add {} {}",extName,parameters);
                extensions.add(extension);
            }
        }
        LOG.debug("extensions={}",extensions);
        return extensions;
    }

    /* ------------------------------------------------------------ */
    private Extension newExtension(String name)
    {
        Class<? extends Extension> extClass = _extensionClasses.get(name);
        if (extClass==null)
            return null;
        try
        {
            return extClass.getDeclaredConstructor().newInstance();
        }
        catch (ReflectiveOperationException e)
        {
            throw new IllegalStateException("cannot create extension "+name,e);
        }
    }

    /* ------------------------------------------------------------ */
    public WebSocketReader newReader(InputStream source)
    {
        return newReader(source,Collections.<String>emptyList());
    }

    /* ------------------------------------------------------------ */
    /**
     * @param source the inbound stream of the connection
     * @param negotiated the negotiated extension descriptions
     * @return a reader configured by this factory
     */
    public WebSocketReader newReader(InputStream source, List<String> negotiated)
    {
        WebSocketReader reader = new WebSocketReader(source,_role);
        reader.setMaxFrameSize(_maxFrameSize);
        reader.setCheckUtf8(_checkUtf8);
        reader.setHeaderValidation(_headerValidation);
        reader.setExtensions(initExtensions(negotiated));
        return reader;
    }

    /* ------------------------------------------------------------ */
    @Override
    public String toString()
    {
        return String.format("%s@%x role=%s maxFrameSize=%d checkUtf8=%b headerValidation=%b",
                getClass().getSimpleName(),
                hashCode(),
                _role,
                _maxFrameSize,
                _checkUtf8,
                _headerValidation);
    }
}
