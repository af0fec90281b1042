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
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import javax.inject.Inject;

import org.apache.maven.plugin.MojoExecutionException;
import org.apache.maven.plugin.MojoFailureException;
import org.apache.maven.plugins.annotations.LifecyclePhase;
import org.apache.maven.plugins.annotations.Mojo;
import org.apache.maven.plugins.annotations.Parameter;
import org.eclipse.tesla.workers.WorkerSession;
import org.eclipse.tesla.workers.generate.FormatResolver;
import org.eclipse.tesla.workers.generate.GenerationRequest;
import org.eclipse.tesla.workers.generate.GenerationResult;
import org.eclipse.tesla.workers.generate.GenerationStep;
import org.eclipse.tesla.workers.generate.SourceFile;
import org.eclipse.tesla.workers.maven.internal.MavenWorkerSessionManager;
import org.eclipse.tesla.workers.tool.ProcessToolHandleFactory;
import org.slf4j.Logger;

/**
 * Runs a JavaScript bundler over the entry point of a bundle, inside the directory prepared by the
 * {@code bundle-manifest} goal.
 */
@Mojo( name = "bundle", defaultPhase = LifecyclePhase.PREPARE_PACKAGE, threadSafe = true )
public class BundleMojo
    extends AbstractWorkerMojo
{

    static final String TOOL_ID = "bundler";

    static final List<String> DEFAULT_COMMAND =
        Collections.unmodifiableList( Arrays.asList( "npx", "webpack", "--entry", "{input}", "--output-path",
                                                     "{outputDir}", "--mode", "{format}" ) );

    @Parameter( required = true )
    File entryPoint;

    /**
     * The bundler command line. The placeholders {@code {input}}, {@code {inputDir}}, {@code {output}},
     * {@code {outputDir}} and {@code {format}} are replaced for each invocation. Defaults to a webpack invocation.
     */
    @Parameter
    List<String> command;

    @Parameter( defaultValue = "${project.build.directory}/webpack", required = true )
    File workingDirectory;

    @Parameter( defaultValue = "${project.build.directory}/webpack/dist", required = true )
    File outputDirectory;

    @Parameter( property = "bundle.mode", defaultValue = "production" )
    String mode;

    /**
     * Files whose changes invalidate the bundler session, defaults to the {@code package.json} of the working
     * directory.
     */
    @Parameter
    List<File> configFiles;

    /**
     * Additional bundler options, passed as {@code --key=value}.
     */
    @Parameter
    Map<String, String> options;

    private final GenerationStep step;

    @Inject
    public BundleMojo( MavenWorkerSessionManager sessionManager, Logger logger )
    {
        super( sessionManager, logger );
        step = new GenerationStep( logger );
    }

    @Override
    protected List<String> getDefaultToolArtifacts()
    {
        return Collections.emptyList();
    }

    @Override
    protected void doExecute()
        throws IOException, MojoExecutionException, MojoFailureException
    {
        if ( !workingDirectory.isDirectory() )
        {
            throw new MojoExecutionException( "Missing bundle directory " + workingDirectory
                + ", run the bundle-manifest goal first" );
        }

        List<String> commandLine = ( command != null && !command.isEmpty() ) ? command : DEFAULT_COMMAND;

        WorkerSession session =
            getSession( TOOL_ID + ":" + workingDirectory.getAbsolutePath() + ":" + commandLine,
                        new ProcessToolHandleFactory( TOOL_ID, commandLine, workingDirectory, logger ) );

        final String bundleMode = mode;
        GenerationRequest request =
            new GenerationRequest( getConfigFiles(), Collections.singletonList( new SourceFile( entryPoint,
                                                                                              entryPoint.getParentFile() ) ),
                                   outputDirectory );
        request.setFormatResolver( new FormatResolver()
        {
            public String resolve( String fileName )
            {
                return bundleMode;
            }
        } );
        if ( options != null )
        {
            request.setOptions( options );
        }

        GenerationResult result = step.run( session, configure( request ) );

        report( result, "Bundled" );
    }

    List<File> getConfigFiles()
    {
        if ( configFiles != null )
        {
            return configFiles;
        }

        List<File> files = new ArrayList<File>();
        File packageJson = new File( workingDirectory, "package.json" );
        if ( packageJson.isFile() )
        {
            files.add( packageJson );
        }
        return files;
    }

}
