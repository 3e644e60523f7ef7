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
 * The RFC6455 frame opcodes.
 * <p>
 * Opcodes are kept as bytes, as they appear on the wire, so that a reader
 * running without header validation can still report reserved values.
 */
public final class OpCode
{
    public static final byte CONTINUATION = 0x00;
    public static final byte TEXT = 0x01;
    public static final byte BINARY = 0x02;
    public static final byte CLOSE = 0x08;
    public static final byte PING = 0x09;
    public static final byte PONG = 0x0A;

    private static final byte CONTROL = 0x08;

    private OpCode()
    {
    }

    /* ------------------------------------------------------------ */
    public static boolean isControl(byte opcode)
    {
        return (opcode & CONTROL) != 0;
    }

    /* ------------------------------------------------------------ */
    public static boolean isData(byte opcode)
    {
        return opcode == TEXT || opcode == BINARY;
    }

    /* ------------------------------------------------------------ */
    /**
     * @param opcode the 4 bit opcode
     * @return true for the values RFC6455 keeps for future use (0x3-0x7, 0xB-0xF)
     */
    public static boolean isReserved(byte opcode)
    {
        switch (opcode)
        {
            case CONTINUATION:
            case TEXT:
            case BINARY:
            case CLOSE:
            case PING:
            case PONG:
                return false;
            default:
                return true;
        }
    }

    /* ------------------------------------------------------------ */
    public static String name(byte opcode)
    {
        switch (opcode)
        {
            case CONTINUATION:
                return "CONTINUATION";
            case TEXT:
                return "TEXT";
            case BINARY:
                return "BINARY";
            case CLOSE:
                return "CLOSE";
            case PING:
                return "PING";
            case PONG:
                return "PONG";
            default:
                return "RESERVED(0x" + Integer.toHexString(opcode & 0xF) + ")";
        }
    }
}
