package org.eclipse.tesla.workers.maven.plugin;

/*******************************************************************************
 * Copyright (c) 2011 Sonatype, Inc.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Public License v1.0
 * which accompanies this distribution, and is available at
 *   http://www.eclipse.org/legal/epl-v10.html
 *******************************************************************************/

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import javax.inject.Inject;

import org.apache.maven.plugin.MojoFailureException;
import org.apache.maven.plugins.annotations.LifecyclePhase;
import org.apache.maven.plugins.annotations.Mojo;
import org.apache.maven.plugins.annotations.Parameter;
import org.eclipse.tesla.workers.InputNotFoundException;
import org.eclipse.tesla.workers.WorkerSession;
import org.eclipse.tesla.workers.generate.FormatResolver;
import org.eclipse.tesla.workers.generate.GenerationRequest;
import org.eclipse.tesla.workers.generate.GenerationResult;
import org.eclipse.tesla.workers.generate.GenerationStep;
import org.eclipse.tesla.workers.generate.SourceFile;
import org.eclipse.tesla.workers.generate.SourceScanner;
import org.eclipse.tesla.workers.maven.internal.MavenWorkerSessionManager;
import org.eclipse.tesla.workers.tool.IsolatedToolHandleFactory;
import org.slf4j.Logger;

/**
 * Formats Scala sources in place. The formatter is reloaded whenever its class path or its configuration file
 * changes.
 */
@Mojo( name = "format", defaultPhase = LifecyclePhase.PROCESS_SOURCES, threadSafe = true )
public class FormatMojo
    extends AbstractWorkerMojo
{

    static final String TOOL_ID = "scalafmt";

    static final String FORMAT = "scala";

    @Parameter( property = "scalafmt.configFile", defaultValue = "${project.basedir}/.scalafmt.conf", required = true )
    File configFile;

    /**
     * The source roots to format, defaults to the compile and test compile source roots of the project.
     */
    @Parameter
    List<File> sourceDirectories;

    @Parameter
    String[] includes;

    @Parameter( property = "scalafmt.version", defaultValue = "2.7.5" )
    String scalafmtVersion;

    private final GenerationStep step;

    @Inject
    public FormatMojo( MavenWorkerSessionManager sessionManager, Logger logger )
    {
        super( sessionManager, logger );
        step = new GenerationStep( logger );
    }

    @Override
    protected List<String> getDefaultToolArtifacts()
    {
        return keys( "org.scalameta", "org.scala-lang" );
    }

    @Override
    protected void doExecute()
        throws IOException, MojoFailureException
    {
        if ( !configFile.isFile() )
        {
            throw new InputNotFoundException( configFile );
        }

        List<File> inputs = new ArrayList<File>( getToolClasspath( TOOL_ID ) );
        inputs.add( configFile.getAbsoluteFile() );

        WorkerSession session =
            getSession( TOOL_ID + ":" + scalafmtVersion,
                        new ClasspathFilter( new IsolatedToolHandleFactory( TOOL_ID, scalafmtVersion,
                                                                            getToolParentLoader(), logger ) ) );

        FormatResolver resolver = new FormatResolver()
        {
            public String resolve( String fileName )
            {
                return FORMAT;
            }
        };

        boolean found = false;
        List<String> failures = new ArrayList<String>();
        for ( File directory : getSourceDirectories() )
        {
            List<SourceFile> sources = SourceScanner.scan( directory, getIncludes() );
            if ( sources.isEmpty() )
            {
                continue;
            }
            found = true;

            // sources are rewritten in place
            GenerationRequest request = new GenerationRequest( inputs, sources, directory );
            request.setOptions( Collections.singletonMap( "config", configFile.getAbsolutePath() ) );
            request.setFormatResolver( resolver );

            GenerationResult result = step.run( session, configure( request ) );
            try
            {
                report( result, "Formatted" );
            }
            catch ( MojoFailureException e )
            {
                if ( failFast )
                {
                    throw e;
                }
                failures.add( e.getMessage() );
            }
        }

        if ( !found )
        {
            getLog().info( "No sources to format" );
        }
        if ( !failures.isEmpty() )
        {
            throw new MojoFailureException( "Formatting failed: " + failures );
        }
    }

    List<File> getSourceDirectories()
    {
        if ( sourceDirectories != null && !sourceDirectories.isEmpty() )
        {
            return sourceDirectories;
        }

        Set<File> directories = new LinkedHashSet<File>();
        for ( String root : project.getCompileSourceRoots() )
        {
            directories.add( new File( root ) );
        }
        for ( String root : project.getTestCompileSourceRoots() )
        {
            directories.add( new File( root ) );
        }
        return new ArrayList<File>( directories );
    }

    String[] getIncludes()
    {
        if ( includes != null && includes.length > 0 )
        {
            return includes;
        }
        return new String[] { "**/*.scala" };
    }

}
