package org.eclipse.tesla.workers.manifest;

/*******************************************************************************
 * Copyright (c) 2011 Sonatype, Inc.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Public License v1.0
 * which accompanies this distribution, and is available at
 *   http://www.eclipse.org/legal/epl-v10.html
 *******************************************************************************/

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.eclipse.tesla.workers.aggregate.AggregateResult;
import org.eclipse.tesla.workers.internal.FileUtils;

/**
 * Writes each aggregated source fragment to the file named by its identifier, relative to the output directory.
 */
public class SourceFragmentWriter
{

    /**
     * @return The written files in fragment order, never {@code null}.
     */
    public List<File> write( AggregateResult aggregate, File outputDirectory )
        throws IOException
    {
        if ( aggregate == null )
        {
            throw new IllegalArgumentException( "aggregate not specified" );
        }
        if ( outputDirectory == null )
        {
            throw new IllegalArgumentException( "output directory not specified" );
        }

        File basedir = FileUtils.resolve( outputDirectory, null );
        List<File> files = new ArrayList<File>();
        for ( Map.Entry<String, String> fragment : aggregate.getFragments().entrySet() )
        {
            File file = FileUtils.resolve( new File( fragment.getKey() ), basedir );
            if ( !file.toPath().startsWith( basedir.toPath() ) )
            {
                throw new IOException( "Source fragment " + fragment.getKey() + " escapes output directory " + basedir );
            }
            Files.createDirectories( file.getParentFile().toPath() );
            Files.write( file.toPath(), fragment.getValue().getBytes( StandardCharsets.UTF_8 ) );
            files.add( file );
        }
        return files;
    }

}
