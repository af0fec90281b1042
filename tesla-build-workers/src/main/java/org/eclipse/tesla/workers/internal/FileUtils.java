package org.eclipse.tesla.workers.internal;

/*******************************************************************************
 * Copyright (c) 2011 Sonatype, Inc.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Public License v1.0
 * which accompanies this distribution, and is available at
 *   http://www.eclipse.org/legal/epl-v10.html
 *******************************************************************************/

import java.io.File;

public class FileUtils
{

    private FileUtils()
    {
        // hide
    }

    /**
     * Resolves the specified file against a base directory and normalizes the result.
     * 
     * @param file The file to resolve, may be {@code null}.
     * @param basedir The base directory for relative files, may be {@code null} to use the current directory.
     * @return The absolute and normalized file or {@code null} if the input was {@code null}.
     */
    public static File resolve( File file, File basedir )
    {
        if ( file == null )
        {
            return null;
        }
        if ( !file.isAbsolute() && basedir != null )
        {
            file = new File( basedir, file.getPath() );
        }
        return normalize( file.getAbsoluteFile() );
    }

    public static File normalize( File file )
    {
        return file.toPath().normalize().toFile();
    }

    /**
     * Gets the path of a file relative to a directory using forward slashes.
     * 
     * @return The relative path or the plain file name if the file does not reside in the directory.
     */
    public static String relativize( File file, File basedir )
    {
        File resolvedFile = resolve( file, null );
        if ( basedir != null )
        {
            File resolvedBasedir = resolve( basedir, null );
            if ( resolvedFile.toPath().startsWith( resolvedBasedir.toPath() ) )
            {
                String path = resolvedBasedir.toPath().relativize( resolvedFile.toPath() ).toString();
                return path.replace( File.separatorChar, '/' );
            }
        }
        return resolvedFile.getName();
    }

}
