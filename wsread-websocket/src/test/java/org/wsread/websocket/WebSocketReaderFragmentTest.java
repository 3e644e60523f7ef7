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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

import org.eclipse.jetty.io.EofException;
import org.eclipse.jetty.util.IO;
import org.eclipse.jetty.util.TypeUtil;
import org.junit.Before;
import org.junit.Test;

public class WebSocketReaderFragmentTest
{
    private byte[] _mask = new byte[] {(byte)0x00,(byte)0xF0,(byte)0x0F,(byte)0xFF};
    private Handler _intermediate;
    private Handler _continuation;

    @Before
    public void setUp() throws Exception
    {
        _intermediate = new Handler(true);
        _continuation = new Handler(false);
    }

    private WebSocketReader newReader(InputStream in, Role role)
    {
        WebSocketReader reader = new WebSocketReader(in,role);
        reader.setOnIntermediate(_intermediate);
        reader.setOnContinuation(_continuation);
        return reader;
    }

    private static String readText(WebSocketReader reader, int chunk) throws IOException
    {
        return new String(WebSocketReaderTest.readMessage(reader,chunk),"UTF-8");
    }

    @Test
    public void testShortFragments() throws Exception
    {
        WebSocketReader reader = newReader(new FrameBuilder()
                .text(false,"Hello ")
                .continuation(false,"big ")
                .continuation(true,"World")
                .toInputStream(),Role.CLIENT);

        FrameHeader header = reader.nextFrame();

        assertFalse(header.isFin());
        assertTrue(reader.isFragmented());
        assertEquals("Hello big World",readText(reader,3));
        assertFalse(reader.isFragmented());
        assertEquals(2,_continuation._headers.size());
        assertTrue(_continuation._headers.get(1).isFin());
    }

    @Test
    public void testIntermediatePing() throws Exception
    {
        WebSocketReader reader = newReader(new FrameBuilder().mask(_mask)
                .text(false,"Hello ")
                .ping("ping 1")
                .continuation(false,"big ")
                .ping("ping 2")
                .continuation(true,"World")
                .toInputStream(),Role.SERVER);

        reader.nextFrame();

        assertEquals("Hello big World",readText(reader,64));
        assertThat(_intermediate._data,contains("ping 1","ping 2"));
        assertEquals(OpCode.PING,_intermediate._headers.get(0).getOpCode());
        assertFalse(reader.isFragmented());
    }

    @Test
    public void testIntermediateLeftUnread() throws Exception
    {
        _intermediate = new Handler(false);
        WebSocketReader reader = newReader(new FrameBuilder()
                .binary(false,new byte[]{1,2,3})
                .frame(true,0,OpCode.PONG,new byte[125])
                .continuation(true,new byte[]{4})
                .text(true,"next")
                .toInputStream(),Role.CLIENT);

        reader.nextFrame();
        assertEquals(4,WebSocketReaderTest.readMessage(reader,2).length);
        assertEquals(1,_intermediate._headers.size());

        reader.nextFrame();
        assertEquals("next",readText(reader,64));
    }

    @Test
    public void testIntermediateWithoutHandler() throws Exception
    {
        WebSocketReader reader = new WebSocketReader(new FrameBuilder()
                .text(false,"a")
                .ping("")
                .ping("x")
                .continuation(true,"b")
                .toInputStream(),Role.CLIENT);

        reader.nextFrame();

        assertEquals("ab",IO.toString(reader,"UTF-8"));
    }

    @Test
    public void testEndOfStreamAfterNonFinalFrame() throws Exception
    {
        WebSocketReader reader = newReader(new FrameBuilder().text(false,"Hello").toInputStream(),Role.CLIENT);
        reader.nextFrame();

        byte[] buf = new byte[64];
        assertEquals(5,reader.read(buf,0,buf.length));
        try
        {
            reader.read(buf,0,buf.length);
            fail();
        }
        catch (EofException e)
        {
            assertThat(e.getMessage(),is("stream ended inside a fragmented message"));
        }
    }

    @Test
    public void testNextFrameAfterNonFinalFrame() throws Exception
    {
        WebSocketReader reader = newReader(new FrameBuilder().binary(false,new byte[0]).toInputStream(),Role.CLIENT);
        reader.nextFrame();
        try
        {
            reader.nextFrame();
            fail();
        }
        catch (EofException e)
        {
            assertTrue(reader.isFragmented());
        }
    }

    @Test
    public void testHeaderTruncatedAfterNonFinalFrame() throws Exception
    {
        WebSocketReader reader = newReader(new FrameBuilder()
                .text(false,"Hello")
                .raw(0x80)
                .toInputStream(),Role.CLIENT);
        reader.nextFrame();

        byte[] buf = new byte[64];
        assertEquals(5,reader.read(buf,0,buf.length));
        try
        {
            reader.read(buf,0,buf.length);
            fail();
        }
        catch (EofException e)
        {
            assertThat(e.getMessage(),is("frame header truncated"));
        }
    }

    @Test
    public void testStreamResetKeepsMessage() throws Exception
    {
        WebSocketReader reader = newReader(new FrameBuilder()
                .text(false,"Hello ")
                .continuation(true,"World")
                .toInputStream(),Role.CLIENT);
        reader.nextFrame();
        assertEquals('H',reader.read());

        assertFalse(reader.markSupported());
        reader.mark(64);
        try
        {
            reader.reset();
            fail();
        }
        catch (IOException e)
        {
            assertTrue(reader.isFragmented());
        }

        assertEquals("ello World",readText(reader,4));
        assertFalse(reader.isFragmented());
    }

    @Test
    public void testMaxFrameSizeKeepsFragmentation() throws Exception
    {
        WebSocketReader reader = newReader(new FrameBuilder()
                .binary(false,new byte[5])
                .continuation(true,new byte[11])
                .toInputStream(),Role.CLIENT);
        reader.setMaxFrameSize(10);
        reader.nextFrame();

        byte[] buf = new byte[64];
        assertEquals(5,reader.read(buf,0,buf.length));
        try
        {
            reader.read(buf,0,buf.length);
            fail();
        }
        catch (MessageTooLargeException e)
        {
            assertTrue(reader.isFragmented());
        }
    }

    @Test
    public void testDataFrameInsideFragmentedMessage() throws Exception
    {
        WebSocketReader reader = newReader(new FrameBuilder()
                .text(false,"Hello")
                .text(true,"World")
                .toInputStream(),Role.CLIENT);
        reader.nextFrame();

        byte[] buf = new byte[64];
        assertEquals(5,reader.read(buf,0,buf.length));
        try
        {
            reader.read(buf,0,buf.length);
            fail();
        }
        catch (ProtocolException e)
        {
            assertEquals(ProtocolException.Violation.CONTINUATION_EXPECTED,e.getViolation());
        }
    }

    @Test
    public void testContinuationHandlerFailure() throws Exception
    {
        WebSocketReader reader = new WebSocketReader(new FrameBuilder()
                .binary(false,new byte[1])
                .continuation(true,new byte[1])
                .toInputStream(),Role.CLIENT);
        final IOException failure = new IOException("rejected");
        reader.setOnContinuation(new FrameHandler()
        {
            @Override
            public void onFrame(FrameHeader header, InputStream payload) throws IOException
            {
                throw failure;
            }
        });

        reader.nextFrame();
        assertEquals(0,reader.read());
        try
        {
            reader.nextFrame();
            fail();
        }
        catch (IOException e)
        {
            assertTrue(e == failure);
            assertFalse(reader.isFragmented());
        }
    }

    @Test
    public void testIntermediateHandlerFailure() throws Exception
    {
        WebSocketReader reader = new WebSocketReader(new FrameBuilder()
                .binary(false,new byte[1])
                .ping("boom")
                .toInputStream(),Role.CLIENT);
        reader.setOnIntermediate(new FrameHandler()
        {
            @Override
            public void onFrame(FrameHeader header, InputStream payload) throws IOException
            {
                throw new IOException(IO.toString(payload,"UTF-8"));
            }
        });

        reader.nextFrame();
        reader.read();
        try
        {
            reader.read();
            fail();
        }
        catch (IOException e)
        {
            assertThat(e.getMessage(),is("boom"));
            assertTrue(reader.isFragmented());
        }
    }

    @Test
    public void testDiscardFragmented() throws Exception
    {
        ByteArrayInputStream in = new FrameBuilder().mask(_mask)
                .text(false,"Hello ")
                .ping("ping")
                .continuation(false,"big ")
                .continuation(true,"World")
                .text(true,"next")
                .toInputStream();
        WebSocketReader reader = newReader(in,Role.SERVER);
        reader.nextFrame();
        assertEquals(2,reader.read(new byte[2],0,2));

        reader.discard();

        assertFalse(reader.isFragmented());
        FrameHeader header = reader.nextFrame();
        assertEquals(OpCode.TEXT,header.getOpCode());
        assertTrue(header.isFin());
        assertEquals("next",readText(reader,64));
        assertEquals(0,in.available());
    }

    @Test
    public void testDiscardBeforeReading() throws Exception
    {
        WebSocketReader reader = newReader(new FrameBuilder()
                .binary(false,new byte[1000])
                .continuation(true,new byte[1000])
                .binary(true,new byte[]{42})
                .toInputStream(),Role.CLIENT);

        reader.nextFrame();
        reader.discard();

        reader.nextFrame();
        assertEquals(42,reader.read());
        assertEquals(-1,reader.read());
    }

    @Test
    public void testUtf8SplitAcrossFragments() throws Exception
    {
        WebSocketReader reader = newReader(new FrameBuilder()
                .frame(false,0,OpCode.TEXT,TypeUtil.fromHexString("41e2"))
                .ping("p")
                .frame(true,0,OpCode.CONTINUATION,TypeUtil.fromHexString("82ac42"))
                .toInputStream(),Role.CLIENT);
        reader.setCheckUtf8(true);

        reader.nextFrame();

        assertEquals("A€B",readText(reader,1));
    }

    @Test
    public void testInvalidUtf8InLastFragment() throws Exception
    {
        WebSocketReader reader = newReader(new FrameBuilder()
                .text(false,"abc")
                .frame(true,0,OpCode.CONTINUATION,TypeUtil.fromHexString("64e282"))
                .toInputStream(),Role.CLIENT);
        reader.setCheckUtf8(true);
        reader.nextFrame();

        byte[] buf = new byte[64];
        assertEquals(3,reader.read(buf,0,buf.length));
        assertEquals(3,reader.read(buf,0,buf.length));
        try
        {
            reader.read(buf,0,buf.length);
            fail();
        }
        catch (BadPayloadException e)
        {
            assertEquals(4,e.getAccepted());
        }
    }

    @Test
    public void testCompressedFragmentedMessage() throws Exception
    {
        DeflateBitExtension deflate = new DeflateBitExtension();
        WebSocketReader reader = newReader(new FrameBuilder()
                .frame(false,FrameHeader.RSV1,OpCode.BINARY,new byte[]{1})
                .frame(true,FrameHeader.RSV1,OpCode.CONTINUATION,new byte[]{2})
                .toInputStream(),Role.CLIENT);
        reader.addExtension(deflate);

        FrameHeader header = reader.nextFrame();
        assertEquals(0,header.getRsv());
        assertTrue(deflate.isCompressed());
        assertEquals(1,reader.read());
        try
        {
            reader.read();
            fail();
        }
        catch (ProtocolException e)
        {
            assertEquals(ProtocolException.Violation.COMPRESSION_BIT_UNEXPECTED,e.getViolation());
        }
    }

    private static class Handler implements FrameHandler
    {
        final List<FrameHeader> _headers = new ArrayList<FrameHeader>();
        final List<String> _data = new ArrayList<String>();
        final boolean _read;

        Handler(boolean read)
        {
            _read = read;
        }

        @Override
        public void onFrame(FrameHeader header, InputStream payload) throws IOException
        {
            _headers.add(header);
            if (_read)
                _data.add(IO.toString(payload,"UTF-8"));
        }
    }
}
