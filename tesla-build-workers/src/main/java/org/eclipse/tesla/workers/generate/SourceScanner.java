package org.eclipse.tesla.workers.generate;

/*******************************************************************************
 * Copyright (c) 2011 Sonatype, Inc.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Public License v1.0
 * which accompanies this distribution, and is available at
 *   http://www.eclipse.org/legal/epl-v10.html
 *******************************************************************************/

import java.io.File;
import java.io.IOException;
import java.nio.file.FileSystem;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import org.eclipse.tesla.workers.internal.FileUtils;

/**
 * Finds the input files below a source directory. Patterns use the glob syntax of {@link FileSystem#getPathMatcher}
 * and are matched against paths relative to the directory, a leading <code>**&#47;</code> also matches files directly
 * inside the directory.
 */
public class SourceScanner
{

    private SourceScanner()
    {
        // hide
    }

    /**
     * Scans the specified directory.
     * 
     * @param directory The source directory, must not be {@code null}. A missing directory yields no files.
     * @param includes The glob patterns of the files to select, may be empty to select all files.
     * @return The selected files sorted by path, never {@code null}.
     * @throws IOException If the directory could not be scanned.
     */
    public static List<SourceFile> scan( File directory, String... includes )
        throws IOException
    {
        if ( directory == null )
        {
            throw new IllegalArgumentException( "source directory not specified" );
        }

        final File basedir = FileUtils.resolve( directory, null );
        final List<SourceFile> files = new ArrayList<SourceFile>();

        if ( !basedir.isDirectory() )
        {
            return files;
        }

        final List<PathMatcher> matchers = newMatchers( includes );
        final Path root = basedir.toPath();

        Files.walkFileTree( root, new SimpleFileVisitor<Path>()
        {
            @Override
            public FileVisitResult visitFile( Path file, BasicFileAttributes attrs )
            {
                if ( attrs.isRegularFile() && isSelected( matchers, root.relativize( file ) ) )
                {
                    files.add( new SourceFile( file.toFile(), basedir ) );
                }
                return FileVisitResult.CONTINUE;
            }
        } );

        Collections.sort( files, new Comparator<SourceFile>()
        {
            public int compare( SourceFile o1, SourceFile o2 )
            {
                return o1.getPath().compareTo( o2.getPath() );
            }
        } );

        return files;
    }

    private static List<PathMatcher> newMatchers( String... includes )
    {
        FileSystem fs = FileSystems.getDefault();
        List<PathMatcher> matchers = new ArrayList<PathMatcher>();
        if ( includes != null )
        {
            for ( String include : includes )
            {
                if ( include == null || include.length() <= 0 )
                {
                    continue;
                }
                matchers.add( fs.getPathMatcher( "glob:" + include ) );
                if ( include.startsWith( "**/" ) )
                {
                    matchers.add( fs.getPathMatcher( "glob:" + include.substring( 3 ) ) );
                }
            }
        }
        return matchers;
    }

    private static boolean isSelected( List<PathMatcher> matchers, Path path )
    {
        if ( matchers.isEmpty() )
        {
            return true;
        }
        for ( PathMatcher matcher : matchers )
        {
            if ( matcher.matches( path ) )
            {
                return true;
            }
        }
        return false;
    }

}
