package org.eclipse.tesla.workers.generate;

/*******************************************************************************
 * Copyright (c) 2011 Sonatype, Inc.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Public License v1.0
 * which accompanies this distribution, and is available at
 *   http://www.eclipse.org/legal/epl-v10.html
 *******************************************************************************/

import java.io.File;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

import org.eclipse.tesla.workers.BuildException;
import org.eclipse.tesla.workers.InputNotFoundException;
import org.eclipse.tesla.workers.InvocationException;
import org.eclipse.tesla.workers.SessionInitException;
import org.eclipse.tesla.workers.ToolHandle;
import org.eclipse.tesla.workers.WorkerSession;
import org.eclipse.tesla.workers.internal.FileUtils;
import org.slf4j.Logger;
import org.slf4j.helpers.NOPLogger;

/**
 * Runs a tool over a set of input files. The general usage pattern is:
 * 
 * <pre>
 * List&lt;SourceFile&gt; sources = SourceScanner.scan( templateDir, &quot;**&#47;*.scala.*&quot; );
 * GenerationRequest request = new GenerationRequest( toolClasspath, sources, outputDir );
 * GenerationResult result = new GenerationStep( log ).run( session, request );
 * result.failIfErrors();
 * </pre>
 * 
 * The tool is invoked once per input file. A failing file does not affect the output of the other files and is
 * reported with the file and output directory, so callers can retry it alone. The output directory is created if
 * needed, existing files in it are never deleted.
 */
public class GenerationStep
{

    private final Logger log;

    public GenerationStep()
    {
        this( null );
    }

    public GenerationStep( Logger log )
    {
        this.log = ( log != null ) ? log : NOPLogger.NOP_LOGGER;
    }

    /**
     * Runs the step.
     * 
     * @param session The session providing the tool handle, must not be {@code null}.
     * @param request The generation request, must not be {@code null}.
     * @return The result listing the processed files and the per-file errors, never {@code null}.
     * @throws InputNotFoundException If any of the source files does not exist. No file is processed in this case.
     * @throws SessionInitException If the tool handle could not be constructed. No file is processed in this case.
     */
    public GenerationResult run( WorkerSession session, GenerationRequest request )
    {
        if ( session == null )
        {
            throw new IllegalArgumentException( "worker session not specified" );
        }
        if ( request == null )
        {
            throw new IllegalArgumentException( "generation request not specified" );
        }

        long start = System.currentTimeMillis();

        for ( SourceFile source : request.getSources() )
        {
            if ( !source.getFile().isFile() )
            {
                throw new InputNotFoundException( source.getFile() );
            }
        }

        ToolHandle handle = session.get( request.getToolInputs() );

        File outputDirectory = FileUtils.resolve( request.getOutputDirectory(), null );
        if ( !outputDirectory.isDirectory() && !outputDirectory.mkdirs() && !outputDirectory.isDirectory() )
        {
            throw new BuildException( "Could not create output directory " + outputDirectory );
        }

        GenerationResult result = new GenerationResult( outputDirectory );

        if ( request.getParallelism() > 1 && request.getSources().size() > 1 && handle.isThreadSafe() )
        {
            runConcurrently( handle, request, result );
        }
        else
        {
            runSequentially( handle, request, result );
        }

        if ( log.isDebugEnabled() )
        {
            log.debug( result.getProcessedFiles().size() + " inputs processed, " + result.getErrors().size()
                + " failed, " + ( System.currentTimeMillis() - start ) + " ms" );
        }

        return result;
    }

    private void runSequentially( ToolHandle handle, GenerationRequest request, GenerationResult result )
    {
        for ( SourceFile source : request.getSources() )
        {
            if ( !process( handle, source, request, result ) && request.getFailurePolicy() == FailurePolicy.FAIL_FAST )
            {
                break;
            }
        }
    }

    private void runConcurrently( final ToolHandle handle, final GenerationRequest request,
                                  final GenerationResult result )
    {
        final AtomicBoolean aborted = new AtomicBoolean();

        int threads = Math.min( request.getParallelism(), request.getSources().size() );
        ExecutorService executor = Executors.newFixedThreadPool( threads );
        try
        {
            List<Future<?>> futures = new ArrayList<Future<?>>();
            for ( final SourceFile source : request.getSources() )
            {
                futures.add( executor.submit( new Callable<Void>()
                {
                    public Void call()
                    {
                        if ( !aborted.get() && !process( handle, source, request, result )
                            && request.getFailurePolicy() == FailurePolicy.FAIL_FAST )
                        {
                            aborted.set( true );
                        }
                        return null;
                    }
                } ) );
            }

            for ( Future<?> future : futures )
            {
                await( future );
            }
        }
        finally
        {
            executor.shutdownNow();
        }
    }

    private void await( Future<?> future )
    {
        try
        {
            future.get();
        }
        catch ( InterruptedException e )
        {
            Thread.currentThread().interrupt();
            throw new BuildException( "Interrupted while waiting for tool invocations", e );
        }
        catch ( ExecutionException e )
        {
            Throwable cause = e.getCause();
            if ( cause instanceof RuntimeException )
            {
                throw (RuntimeException) cause;
            }
            if ( cause instanceof Error )
            {
                throw (Error) cause;
            }
            throw new BuildException( "Tool invocation failed", cause );
        }
    }

    boolean process( ToolHandle handle, SourceFile source, GenerationRequest request, GenerationResult result )
    {
        File input = source.getFile();
        File outputDirectory = result.getOutputDirectory();
        String format = request.getFormatResolver().resolve( input.getName() );

        try
        {
            if ( handle.isThreadSafe() )
            {
                handle.invoke( input, source.getSourceDirectory(), outputDirectory, format, request.getOptions() );
            }
            else
            {
                synchronized ( handle )
                {
                    handle.invoke( input, source.getSourceDirectory(), outputDirectory, format, request.getOptions() );
                }
            }
        }
        catch ( Exception e )
        {
            InvocationException error = new InvocationException( input, outputDirectory, e );
            log.error( error.getMessage(), log.isDebugEnabled() ? e : null );
            result.addError( error );
            return false;
        }

        result.addProcessed( input, "Processed " + source.getPath() + " as " + format );
        return true;
    }

}
