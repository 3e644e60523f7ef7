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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.eclipse.jetty.io.EofException;
import org.eclipse.jetty.util.log.Log;
import org.eclipse.jetty.util.log.Logger;



/* ------------------------------------------------------------ */
/**
 * Reads websocket messages from the inbound stream of a connection.
 * <p>
 * {@link #nextFrame()} positions the reader at the next message, after which
 * the {@code read} methods return the unmasked payload of that message,
 * crossing the frames of a fragmented message transparently. {@code read}
 * returns -1 if and only if the whole message was consumed. A stream that
 * ends before that raises an {@link EofException}.
 * <p>
 * Control frames interleaved with the fragments of a message are never
 * exposed through {@code read}: they are given to the intermediate
 * {@link FrameHandler}, if any, and then skipped.
 * <p>
 * A reader is bound to one connection and is not thread safe; calls must be
 * serialized by the caller. All reads block on the source.
 */
public class WebSocketReader extends InputStream
{
    private static final Logger LOG = Log.getLogger(WebSocketReader.class);

    private final InputStream _source;
    private final Role _role;
    private final FrameHeaderParser _parser = new FrameHeaderParser();
    private final BoundedInputStream _raw = new BoundedInputStream();
    private final Utf8CheckingInputStream _utf8 = new Utf8CheckingInputStream();
    private final List<Extension> _extensions = new ArrayList<Extension>();
    private final byte[] _one = new byte[1];
    private MaskingInputStream _masking;

    private boolean _headerValidation = true;
    private boolean _checkUtf8;
    private long _maxFrameSize;
    private FrameHandler _onContinuation;
    private FrameHandler _onIntermediate;

    private boolean _fragmented;
    private byte _opcode;
    private InputStream _frame;

    /* ------------------------------------------------------------ */
    /**
     * @param source the inbound stream of the connection
     * @param role the side of the connection this reader runs on
     */
    public WebSocketReader(InputStream source, Role role)
    {
        if (source == null)
            throw new NullPointerException("source");
        if (role == null)
            throw new NullPointerException("role");
        _source = source;
        _role = role;
    }

    /* ------------------------------------------------------------ */
    public static WebSocketReader newClientSideReader(InputStream source)
    {
        return new WebSocketReader(source, Role.CLIENT);
    }

    /* ------------------------------------------------------------ */
    public static WebSocketReader newServerSideReader(InputStream source)
    {
        return new WebSocketReader(source, Role.SERVER);
    }

    /* ------------------------------------------------------------ */
    /**
     * Reads the first frame of the next message from a stream.
     * <p>
     * This does not handle control frames interleaved with the fragments of
     * the message: they are skipped without notice. Use a
     * {@link WebSocketReader} with an intermediate {@link FrameHandler} when
     * the peer may send them.
     * @param source the inbound stream of the connection
     * @param role the side of the connection
     * @return the message, or null if the stream ended cleanly
     * @throws IOException if the frame could not be read
     */
    public static Message nextReader(InputStream source, Role role) throws IOException
    {
        WebSocketReader reader = new WebSocketReader(source, role);
        FrameHeader header = reader.nextFrame();
        if (header == null)
            return null;
        return new Message(header, reader);
    }

    public Role getRole()
    {
        return _role;
    }

    public boolean isHeaderValidation()
    {
        return _headerValidation;
    }

    /* ------------------------------------------------------------ */
    /**
     * @param headerValidation false to skip the RFC6455 header checks
     */
    public void setHeaderValidation(boolean headerValidation)
    {
        _headerValidation = headerValidation;
    }

    public boolean isCheckUtf8()
    {
        return _checkUtf8;
    }

    /* ------------------------------------------------------------ */
    /**
     * @param checkUtf8 true to validate the payload of text messages as UTF-8
     */
    public void setCheckUtf8(boolean checkUtf8)
    {
        _checkUtf8 = checkUtf8;
    }

    public long getMaxFrameSize()
    {
        return _maxFrameSize;
    }

    /* ------------------------------------------------------------ */
    /**
     * @param maxFrameSize the largest payload length accepted for a frame, 0 for no limit
     */
    public void setMaxFrameSize(long maxFrameSize)
    {
        if (maxFrameSize < 0)
            throw new IllegalArgumentException("maxFrameSize " + maxFrameSize);
        _maxFrameSize = maxFrameSize;
    }

    public List<Extension> getExtensions()
    {
        return Collections.unmodifiableList(_extensions);
    }

    /* ------------------------------------------------------------ */
    /**
     * @param extensions the negotiated extensions, in negotiation order
     */
    public void setExtensions(List<Extension> extensions)
    {
        _extensions.clear();
        if (extensions != null)
            _extensions.addAll(extensions);
    }

    public void addExtension(Extension extension)
    {
        _extensions.add(extension);
    }

    public FrameHandler getOnContinuation()
    {
        return _onContinuation;
    }

    /* ------------------------------------------------------------ */
    /**
     * @param onContinuation called with every continuation frame of a fragmented message
     */
    public void setOnContinuation(FrameHandler onContinuation)
    {
        _onContinuation = onContinuation;
    }

    public FrameHandler getOnIntermediate()
    {
        return _onIntermediate;
    }

    /* ------------------------------------------------------------ */
    /**
     * @param onIntermediate called with every control frame received between
     * the fragments of a message. Payload it leaves unread is skipped.
     */
    public void setOnIntermediate(FrameHandler onIntermediate)
    {
        _onIntermediate = onIntermediate;
    }

    /* ------------------------------------------------------------ */
    /**
     * @return true while a fragmented message has not received its final frame
     */
    public boolean isFragmented()
    {
        return _fragmented;
    }

    /* ------------------------------------------------------------ */
    /**
     * Reads the header of the next frame and prepares its payload for reading.
     * <p>
     * The payload of the previous frame must have been consumed or
     * {@link #discard() discarded}. Control frames received while a message
     * is fragmented are handled here and leave the read state untouched.
     * @return the header, after extensions processed it, or null if the
     * stream ended cleanly on a frame boundary outside of a fragmented message
     * @throws EofException if the stream ended inside a header or a fragmented message
     * @throws ProtocolException if the header is not legal
     * @throws MessageTooLargeException if the frame exceeds the maximum frame size
     * @throws IOException if the source or a {@link FrameHandler} failed
     */
    public FrameHeader nextFrame() throws IOException
    {
        FrameHeader header = _parser.parse(_source);
        if (header == null)
        {
            if (_fragmented)
                throw new EofException("stream ended inside a fragmented message");
            LOG.debug("{} end of stream",this);
            return null;
        }

        if (_headerValidation)
            FrameHeaderValidator.check(header, _role, _fragmented, !_extensions.isEmpty());

        if (_maxFrameSize > 0 && header.getPayloadLength() > _maxFrameSize)
            throw new MessageTooLargeException(header.getPayloadLength(), _maxFrameSize);

        _raw.reset(_source, header.getPayloadLength());

        InputStream frame = _raw;
        if (header.isMasked())
        {
            if (_masking == null)
                _masking = new MaskingInputStream(_raw, header.getMask());
            else
                _masking.reset(_raw, header.getMask());
            frame = _masking;
        }

        for (Extension extension : _extensions)
            header = extension.unsetBits(header);

        if (_headerValidation && header.getRsv() != 0)
            throw new ProtocolException(ProtocolException.Violation.NON_ZERO_RSV,
                    "rsv bits not claimed by any extension: " + header);

        if (_fragmented)
        {
            if (header.isControl())
            {
                if (LOG.isDebugEnabled())
                    LOG.debug("{} intermediate {}",this,header);
                if (_onIntermediate != null)
                    _onIntermediate.onFrame(header, frame);
                _raw.drain();
                return header;
            }
        }
        else
        {
            _opcode = header.getOpCode();
            _utf8.reset();
        }

        if (_checkUtf8 && _opcode == OpCode.TEXT)
        {
            _utf8.setSource(frame);
            frame = _utf8;
        }
        _frame = frame;

        try
        {
            if (header.getOpCode() == OpCode.CONTINUATION && _onContinuation != null)
                _onContinuation.onFrame(header, frame);
        }
        finally
        {
            _fragmented = !header.isFin();
        }

        if (LOG.isDebugEnabled())
            LOG.debug("{} next {}",this,header);
        return header;
    }

    /* ------------------------------------------------------------ */
    /**
     * Reads payload bytes of the current message.
     * @return the number of bytes read, or -1 once the whole message was read
     * @throws NoFrameAdvanceException if no message was opened by {@link #nextFrame()}
     * @throws EofException if the stream ended before the message did
     * @throws BadPayloadException if UTF-8 checking is on and the text message was invalid
     * @throws IOException if the source failed or the next fragment was illegal
     */
    @Override
    public int read(byte[] b, int off, int len) throws IOException
    {
        if (off < 0 || len < 0 || len > b.length - off)
            throw new IndexOutOfBoundsException();

        if (_frame == null && !_fragmented)
            throw new NoFrameAdvanceException();
        if (len == 0)
            return 0;

        while (true)
        {
            if (_frame == null)
            {
                // Next continuation, or an intermediate control frame
                nextFrame();
                if (_frame == null)
                    continue;
            }

            int n = _frame.read(b, off, len);
            if (n >= 0)
                return n;

            // End of frame
            if (_raw.remaining() > 0)
                throw new EofException("stream ended inside a frame, " + _raw.remaining() + " bytes missing");

            if (_fragmented)
            {
                resetFragment();
                continue;
            }

            // The whole message is in, partial text may have ended mid sequence before
            if (_checkUtf8 && _opcode == OpCode.TEXT && !_utf8.isValid())
                throw new BadPayloadException(_utf8.getAccepted());

            resetMessage();
            return -1;
        }
    }

    /* ------------------------------------------------------------ */
    @Override
    public int read() throws IOException
    {
        int n = read(_one, 0, 1);
        if (n < 0)
            return -1;
        return _one[0] & 0xFF;
    }

    /* ------------------------------------------------------------ */
    @Override
    public int available() throws IOException
    {
        return _frame == null ? 0 : _frame.available();
    }

    /* ------------------------------------------------------------ */
    /**
     * Skips the rest of the current message, including the fragments not
     * yet received, without unmasking or validating it. The read state is
     * reset even when skipping fails.
     * @throws IOException if the stream failed or ended inside the message
     */
    public void discard() throws IOException
    {
        try
        {
            while (true)
            {
                _raw.drain();
                if (!_fragmented)
                    break;
                nextFrame();
            }
            LOG.debug("{} discarded",this);
        }
        finally
        {
            resetMessage();
        }
    }

    /* ------------------------------------------------------------ */
    private void resetFragment()
    {
        _raw.clear();
        _frame = null;
        // The validator keeps its state across the fragments of a message
        _utf8.setSource(null);
    }

    /* ------------------------------------------------------------ */
    private void resetMessage()
    {
        _raw.clear();
        _frame = null;
        _utf8.reset();
        _opcode = OpCode.CONTINUATION;
        _fragmented = false;
    }

    /* ------------------------------------------------------------ */
    @Override
    public String toString()
    {
        return String.format("%s@%x role=%s fragmented=%b opcode=%s raw=%d",
                getClass().getSimpleName(),
                hashCode(),
                _role,
                _fragmented,
                OpCode.name(_opcode),
                _raw.remaining());
    }

    /* ------------------------------------------------------------ */
    /* ------------------------------------------------------------ */
    /**
     * The first frame header of a message with the stream of its payload.
     */
    public static class Message
    {
        private final FrameHeader _header;
        private final InputStream _payload;

        public Message(FrameHeader header, InputStream payload)
        {
            _header = header;
            _payload = payload;
        }

        public FrameHeader getHeader()
        {
            return _header;
        }

        public InputStream getPayload()
        {
            return _payload;
        }
    }
}
