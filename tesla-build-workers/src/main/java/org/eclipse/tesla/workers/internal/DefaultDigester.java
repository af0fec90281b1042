package org.eclipse.tesla.workers.internal;

/*******************************************************************************
 * Copyright (c) 2011 Sonatype, Inc.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Public License v1.0
 * which accompanies this distribution, and is available at
 *   http://www.eclipse.org/legal/epl-v10.html
 *******************************************************************************/

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

import org.eclipse.tesla.workers.Digester;

/**
 * SHA-1 based digester. Each value is terminated so that adjacent values cannot run into each other.
 */
public class DefaultDigester
    implements Digester
{

    private static final byte SEPARATOR = 0;

    private final MessageDigest digest;

    public DefaultDigester()
    {
        digest = DigestUtils.newDigest( "SHA-1" );
    }

    public Digester string( String string )
    {
        if ( string != null )
        {
            digest.update( string.getBytes( StandardCharsets.UTF_8 ) );
        }
        digest.update( SEPARATOR );
        return this;
    }

    public Digester strings( String... strings )
    {
        if ( strings != null )
        {
            for ( String string : strings )
            {
                string( string );
            }
        }
        return this;
    }

    public Digester bytes( byte[] bytes )
    {
        if ( bytes != null )
        {
            digest.update( bytes );
        }
        digest.update( SEPARATOR );
        return this;
    }

    public Digester file( File file )
    {
        if ( file != null )
        {
            string( file.getAbsolutePath() );
            string( Long.toString( file.length() ) );
            string( Long.toString( file.lastModified() ) );
        }
        else
        {
            string( null );
        }
        return this;
    }

    public byte[] finish()
    {
        return digest.digest();
    }

}
