package org.eclipse.tesla.workers;

/*******************************************************************************
 * Copyright (c) 2011 Sonatype, Inc.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Public License v1.0
 * which accompanies this distribution, and is available at
 *   http://www.eclipse.org/legal/epl-v10.html
 *******************************************************************************/

import java.io.File;
import java.util.Arrays;
import java.util.Collection;
import java.util.Set;
import java.util.TreeSet;

import org.eclipse.tesla.workers.internal.DefaultDigester;
import org.eclipse.tesla.workers.internal.DigestUtils;
import org.eclipse.tesla.workers.internal.FileUtils;

/**
 * An opaque summary of a set of files and their last-modified times. Fingerprints are independent of the order in
 * which the files are given and are never persisted.
 */
public final class Fingerprint
{

    private final byte[] digest;

    private final int hash;

    public Fingerprint( byte[] digest )
    {
        if ( digest == null )
        {
            throw new IllegalArgumentException( "digest not specified" );
        }
        this.digest = digest.clone();
        this.hash = Arrays.hashCode( digest );
    }

    /**
     * Computes the fingerprint of the specified files.
     * 
     * @param files The files to fingerprint, must not be {@code null}. Each file must exist.
     * @return The fingerprint, never {@code null}.
     * @throws InputNotFoundException If any of the files does not exist.
     */
    public static Fingerprint of( Collection<File> files )
    {
        return of( files, new DefaultDigester() );
    }

    public static Fingerprint of( Collection<File> files, Digester digester )
    {
        if ( files == null )
        {
            throw new IllegalArgumentException( "files not specified" );
        }

        Set<File> sorted = new TreeSet<File>();
        for ( File file : files )
        {
            if ( file != null )
            {
                sorted.add( FileUtils.resolve( file, null ) );
            }
        }

        digester.string( Integer.toString( sorted.size() ) );
        for ( File file : sorted )
        {
            if ( !file.exists() )
            {
                throw new InputNotFoundException( file );
            }
            digester.file( file );
        }

        return new Fingerprint( digester.finish() );
    }

    public byte[] getDigest()
    {
        return digest.clone();
    }

    @Override
    public boolean equals( Object obj )
    {
        if ( this == obj )
        {
            return true;
        }
        if ( !( obj instanceof Fingerprint ) )
        {
            return false;
        }
        return Arrays.equals( digest, ( (Fingerprint) obj ).digest );
    }

    @Override
    public int hashCode()
    {
        return hash;
    }

    @Override
    public String toString()
    {
        return DigestUtils.toHexString( digest );
    }

}
