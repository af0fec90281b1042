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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import javax.inject.Inject;

import org.apache.maven.plugin.MojoFailureException;
import org.apache.maven.plugins.annotations.LifecyclePhase;
import org.apache.maven.plugins.annotations.Mojo;
import org.apache.maven.plugins.annotations.Parameter;
import org.eclipse.tesla.workers.WorkerSession;
import org.eclipse.tesla.workers.generate.GenerationRequest;
import org.eclipse.tesla.workers.generate.GenerationResult;
import org.eclipse.tesla.workers.generate.GenerationStep;
import org.eclipse.tesla.workers.generate.SourceFile;
import org.eclipse.tesla.workers.generate.SourceScanner;
import org.eclipse.tesla.workers.generate.SuffixFormatResolver;
import org.eclipse.tesla.workers.maven.internal.MavenWorkerSessionManager;
import org.eclipse.tesla.workers.tool.IsolatedToolHandleFactory;
import org.slf4j.Logger;

/**
 * Compiles Twirl templates into Scala sources. The template compiler stays loaded across executions and is only
 * reloaded when its class path changes.
 */
@Mojo( name = "compile-templates", defaultPhase = LifecyclePhase.GENERATE_SOURCES, threadSafe = true )
public class TemplateCompileMojo
    extends AbstractWorkerMojo
{

    static final String TOOL_ID = "twirl";

    static final String FORMAT_PREFIX = "play.twirl.api.";

    /**
     * The directories holding the templates, defaults to {@code src/main/twirl}.
     */
    @Parameter
    List<File> sourceDirectories;

    @Parameter
    String[] includes;

    @Parameter( defaultValue = "${project.build.directory}/generated-sources/twirl", required = true )
    File outputDirectory;

    /**
     * Imports added to every generated template.
     */
    @Parameter
    List<String> additionalImports;

    /**
     * Annotations added to the constructor of every generated template class.
     */
    @Parameter
    List<String> constructorAnnotations;

    @Parameter( defaultValue = "${project.build.sourceEncoding}" )
    String encoding;

    @Parameter( property = "twirl.version", defaultValue = "1.5.1" )
    String twirlVersion;

    private final GenerationStep step;

    @Inject
    public TemplateCompileMojo( MavenWorkerSessionManager sessionManager, Logger logger )
    {
        super( sessionManager, logger );
        step = new GenerationStep( logger );
    }

    @Override
    protected List<String> getDefaultToolArtifacts()
    {
        return keys( "com.typesafe.play", "org.scala-lang" );
    }

    @Override
    protected void doExecute()
        throws IOException, MojoFailureException
    {
        List<SourceFile> sources = new ArrayList<SourceFile>();
        for ( File directory : getSourceDirectories() )
        {
            sources.addAll( SourceScanner.scan( directory, getIncludes() ) );
        }

        if ( sources.isEmpty() )
        {
            getLog().info( "No templates to compile" );
            return;
        }

        List<File> classpath = getToolClasspath( TOOL_ID );
        WorkerSession session =
            getSession( TOOL_ID + ":" + twirlVersion, new IsolatedToolHandleFactory( TOOL_ID, twirlVersion,
                                                                                     getToolParentLoader(), logger ) );

        GenerationRequest request = new GenerationRequest( classpath, sources, outputDirectory );
        request.setOptions( getOptions() );
        request.setFormatResolver( SuffixFormatResolver.templates().withPrefix( FORMAT_PREFIX ) );

        GenerationResult result = step.run( session, configure( request ) );

        project.addCompileSourceRoot( result.getOutputDirectory().getPath() );

        report( result, "Compiled" );
    }

    List<File> getSourceDirectories()
    {
        if ( sourceDirectories != null && !sourceDirectories.isEmpty() )
        {
            return sourceDirectories;
        }
        return Collections.singletonList( new File( project.getBasedir(), "src/main/twirl" ) );
    }

    String[] getIncludes()
    {
        if ( includes != null && includes.length > 0 )
        {
            return includes;
        }
        return new String[] { "**/*.scala.*" };
    }

    Map<String, String> getOptions()
    {
        Map<String, String> options = new LinkedHashMap<String, String>();
        if ( additionalImports != null && !additionalImports.isEmpty() )
        {
            options.put( "additionalImports", join( additionalImports ) );
        }
        if ( constructorAnnotations != null && !constructorAnnotations.isEmpty() )
        {
            options.put( "constructorAnnotations", join( constructorAnnotations ) );
        }
        options.put( "codec", ( encoding != null && encoding.length() > 0 ) ? encoding : "UTF-8" );
        return options;
    }

    private static String join( List<String> values )
    {
        StringBuilder buffer = new StringBuilder( 128 );
        for ( String value : values )
        {
            if ( buffer.length() > 0 )
            {
                buffer.append( ',' );
            }
            buffer.append( value.trim() );
        }
        return buffer.toString();
    }

}
