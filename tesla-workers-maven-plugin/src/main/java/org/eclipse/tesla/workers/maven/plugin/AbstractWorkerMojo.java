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
import java.util.Collection;
import java.util.List;

import org.apache.maven.artifact.Artifact;
import org.apache.maven.plugin.AbstractMojo;
import org.apache.maven.plugin.MojoExecution;
import org.apache.maven.plugin.MojoExecutionException;
import org.apache.maven.plugin.MojoFailureException;
import org.apache.maven.plugins.annotations.Parameter;
import org.apache.maven.project.MavenProject;
import org.eclipse.tesla.workers.BuildException;
import org.eclipse.tesla.workers.InvocationException;
import org.eclipse.tesla.workers.ToolHandle;
import org.eclipse.tesla.workers.ToolHandleFactory;
import org.eclipse.tesla.workers.WorkerSession;
import org.eclipse.tesla.workers.generate.FailurePolicy;
import org.eclipse.tesla.workers.generate.GenerationRequest;
import org.eclipse.tesla.workers.generate.GenerationResult;
import org.eclipse.tesla.workers.maven.MavenToolClasspath;
import org.eclipse.tesla.workers.maven.internal.MavenWorkerSessionManager;
import org.eclipse.tesla.workers.tool.ToolAdapter;
import org.slf4j.Logger;

/**
 * Base class of the goals that drive a tool through a worker session.
 */
public abstract class AbstractWorkerMojo
    extends AbstractMojo
{

    // --- usual plugin parameters ----------------------------------

    @Parameter( defaultValue = "${project}", readonly = true, required = true )
    protected MavenProject project;

    @Parameter( defaultValue = "${mojoExecution}", readonly = true, required = true )
    protected MojoExecution mojoExecution;

    @Parameter( defaultValue = "${plugin.artifacts}", readonly = true, required = true )
    protected List<Artifact> pluginArtifacts;

    /**
     * The plugin dependencies that make up the tool classpath, given as {@code groupId:artifactId} or {@code groupId}.
     * Defaults to the artifacts of the tool driven by the goal.
     */
    @Parameter
    protected List<String> toolArtifacts;

    /**
     * Whether to stop at the first input that fails to process instead of reporting all failures.
     */
    @Parameter( property = "tesla.workers.failFast", defaultValue = "false" )
    protected boolean failFast;

    /**
     * The number of inputs processed concurrently, honoured only by tools that tolerate concurrent invocations.
     */
    @Parameter( property = "tesla.workers.parallelism", defaultValue = "1" )
    protected int parallelism;

    @Parameter( property = "tesla.workers.skip", defaultValue = "false" )
    protected boolean skip;

    // --- components -----------------------------------------------

    protected final MavenWorkerSessionManager sessionManager;

    protected final Logger logger;

    protected AbstractWorkerMojo( MavenWorkerSessionManager sessionManager, Logger logger )
    {
        this.sessionManager = sessionManager;
        this.logger = logger;
    }

    // --- mojo logic -----------------------------------------------

    public void execute()
        throws MojoExecutionException, MojoFailureException
    {
        if ( skip )
        {
            getLog().info( "Skipping " + getClass().getSimpleName() );
            return;
        }

        try
        {
            doExecute();
        }
        catch ( IOException e )
        {
            throw new MojoExecutionException( e.getMessage(), e );
        }
        catch ( BuildException e )
        {
            throw new MojoExecutionException( e.getMessage(), e );
        }
    }

    protected abstract void doExecute()
        throws IOException, MojoExecutionException, MojoFailureException;

    /**
     * Gets the default keys of the plugin dependencies that make up the tool classpath.
     */
    protected abstract List<String> getDefaultToolArtifacts();

    protected List<File> getToolClasspath( String toolId )
    {
        Collection<String> keys =
            ( toolArtifacts != null && !toolArtifacts.isEmpty() ) ? toolArtifacts : getDefaultToolArtifacts();
        return MavenToolClasspath.select( toolId, pluginArtifacts, keys );
    }

    protected WorkerSession getSession( String sessionId, ToolHandleFactory factory )
    {
        return sessionManager.getSession( mojoExecution, sessionId, factory );
    }

    protected ClassLoader getToolParentLoader()
    {
        return ToolAdapter.class.getClassLoader();
    }

    protected GenerationRequest configure( GenerationRequest request )
    {
        request.setFailurePolicy( failFast ? FailurePolicy.FAIL_FAST : FailurePolicy.COLLECT_ALL );
        return request.setParallelism( Math.max( 1, parallelism ) );
    }

    /**
     * Reports the outcome of a generation step to the build log.
     * 
     * @throws MojoFailureException If any input failed to process.
     */
    protected void report( GenerationResult result, String verb )
        throws MojoFailureException
    {
        for ( String line : result.getLog() )
        {
            getLog().debug( line );
        }

        List<InvocationException> errors = result.getErrors();
        for ( InvocationException error : errors )
        {
            getLog().error( error.getMessage() );
        }

        getLog().info( verb + " " + result.getProcessedFiles().size() + " file(s) to " + result.getOutputDirectory()
            + ( errors.isEmpty() ? "" : ", " + errors.size() + " failed" ) );

        if ( !errors.isEmpty() )
        {
            List<String> inputs = new ArrayList<String>();
            for ( InvocationException error : errors )
            {
                inputs.add( error.getInput().getName() );
            }
            throw new MojoFailureException( errors.size() + " error(s) encountered: " + inputs );
        }
    }

    static List<String> keys( String... keys )
    {
        return Arrays.asList( keys );
    }

    /**
     * Limits the construction inputs of a tool to its class path, configuration files only feed the fingerprint.
     */
    static class ClasspathFilter
        implements ToolHandleFactory
    {

        private final ToolHandleFactory delegate;

        ClasspathFilter( ToolHandleFactory delegate )
        {
            this.delegate = delegate;
        }

        public ToolHandle newHandle( Collection<File> inputs )
        {
            List<File> classpath = new ArrayList<File>();
            for ( File input : inputs )
            {
                if ( input.isDirectory() || input.getName().endsWith( ".jar" ) )
                {
                    classpath.add( input );
                }
            }
            return delegate.newHandle( classpath );
        }

        @Override
        public String toString()
        {
            return delegate.toString();
        }

    }

}
