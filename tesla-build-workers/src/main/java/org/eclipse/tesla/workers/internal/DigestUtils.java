package org.eclipse.tesla.workers.internal;

/*******************************************************************************
 * Copyright (c) 2011 Sonatype, Inc.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Public License v1.0
 * which accompanies this distribution, and is available at
 *   http://www.eclipse.org/legal/epl-v10.html
 *******************************************************************************/

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

public class DigestUtils
{

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private DigestUtils()
    {
        // hide
    }

    public static MessageDigest newDigest( String algorithm )
    {
        try
        {
            return MessageDigest.getInstance( algorithm );
        }
        catch ( NoSuchAlgorithmException e )
        {
            throw new IllegalStateException( "Digest algorithm " + algorithm + " not available", e );
        }
    }

    public static String toHexString( byte[] bytes )
    {
        if ( bytes == null )
        {
            return null;
        }

        StringBuilder buffer = new StringBuilder( bytes.length * 2 );

        for ( byte b : bytes )
        {
            buffer.append( HEX[( b >> 4 ) & 0x0F] );
            buffer.append( HEX[b & 0x0F] );
        }

        return buffer.toString();
    }

}
