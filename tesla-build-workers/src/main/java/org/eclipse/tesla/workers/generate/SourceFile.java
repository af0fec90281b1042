package org.eclipse.tesla.workers.generate;

/*******************************************************************************
 * Copyright (c) 2011 Sonatype, Inc.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Public License v1.0
 * which accompanies this distribution, and is available at
 *   http://www.eclipse.org/legal/epl-v10.html
 *******************************************************************************/

import java.io.File;

import org.eclipse.tesla.workers.internal.FileUtils;

/**
 * An input file together with the source directory it belongs to.
 */
public final class SourceFile
{

    private final File file;

    private final File sourceDirectory;

    public SourceFile( File file, File sourceDirectory )
    {
        if ( file == null )
        {
            throw new IllegalArgumentException( "source file not specified" );
        }
        if ( sourceDirectory == null )
        {
            throw new IllegalArgumentException( "source directory of " + file + " not specified" );
        }
        this.file = FileUtils.resolve( file, null );
        this.sourceDirectory = FileUtils.resolve( sourceDirectory, null );
    }

    public File getFile()
    {
        return file;
    }

    public File getSourceDirectory()
    {
        return sourceDirectory;
    }

    /**
     * @return The path of the file relative to its source directory, using forward slashes.
     */
    public String getPath()
    {
        return FileUtils.relativize( file, sourceDirectory );
    }

    @Override
    public boolean equals( Object obj )
    {
        if ( this == obj )
        {
            return true;
        }
        if ( !( obj instanceof SourceFile ) )
        {
            return false;
        }
        SourceFile that = (SourceFile) obj;
        return file.equals( that.file ) && sourceDirectory.equals( that.sourceDirectory );
    }

    @Override
    public int hashCode()
    {
        return file.hashCode() * 31 + sourceDirectory.hashCode();
    }

    @Override
    public String toString()
    {
        return file.getPath();
    }

}
