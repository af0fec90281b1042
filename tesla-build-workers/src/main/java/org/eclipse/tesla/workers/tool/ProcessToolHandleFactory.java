package org.eclipse.tesla.workers.tool;

/*******************************************************************************
 * Copyright (c) 2011 Sonatype, Inc.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Public License v1.0
 * which accompanies this distribution, and is available at
 *   http://www.eclipse.org/legal/epl-v10.html
 *******************************************************************************/

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.eclipse.tesla.workers.SessionInitException;
import org.eclipse.tesla.workers.ToolHandle;
import org.eclipse.tesla.workers.ToolHandleFactory;
import org.eclipse.tesla.workers.internal.FileUtils;
import org.slf4j.Logger;
import org.slf4j.helpers.NOPLogger;

/**
 * Drives an external executable, e.g. a bundler or a formatter command line. Each invocation starts a new process from
 * a command template in which the following placeholders are replaced:
 * <ul>
 * <li>{@code {input}} the input file</li>
 * <li>{@code {inputDir}} the source directory of the input file</li>
 * <li>{@code {outputDir}} the output directory</li>
 * <li>{@code {output}} the input's relative path resolved against the output directory</li>
 * <li>{@code {format}} the format tag of the input</li>
 * </ul>
 * Options are appended as {@code --key=value} arguments in key order. The fingerprinted inputs are the executable and
 * its configuration files, each of which must exist when the handle is created. The output of the process is decoded
 * with the configured charset, UTF-8 unless specified.
 */
public class ProcessToolHandleFactory
    implements ToolHandleFactory
{

    private final Logger log;

    private final String toolId;

    private final List<String> command;

    private final File workingDirectory;

    private final Charset outputCharset;

    public ProcessToolHandleFactory( String toolId, List<String> command, File workingDirectory )
    {
        this( toolId, command, workingDirectory, null );
    }

    public ProcessToolHandleFactory( String toolId, List<String> command, File workingDirectory, Logger log )
    {
        this( toolId, command, workingDirectory, null, log );
    }

    public ProcessToolHandleFactory( String toolId, List<String> command, File workingDirectory, Charset outputCharset,
                                     Logger log )
    {
        if ( toolId == null )
        {
            throw new IllegalArgumentException( "tool identifier not specified" );
        }
        if ( command == null || command.isEmpty() )
        {
            throw new IllegalArgumentException( "command not specified" );
        }
        this.toolId = toolId;
        this.command = Collections.unmodifiableList( new ArrayList<String>( command ) );
        this.workingDirectory = workingDirectory;
        this.outputCharset = ( outputCharset != null ) ? outputCharset : StandardCharsets.UTF_8;
        this.log = ( log != null ) ? log : NOPLogger.NOP_LOGGER;
    }

    public ToolHandle newHandle( Collection<File> inputs )
        throws SessionInitException
    {
        if ( inputs == null )
        {
            throw new IllegalArgumentException( "tool inputs not specified" );
        }
        for ( File input : inputs )
        {
            if ( !input.exists() )
            {
                throw new SessionInitException( toolId, inputs, "missing " + input );
            }
        }
        if ( workingDirectory != null && !workingDirectory.isDirectory() )
        {
            throw new SessionInitException( toolId, inputs, "missing working directory " + workingDirectory );
        }
        return new ProcessToolHandle();
    }

    List<String> newCommandLine( File input, File inputDirectory, File outputDirectory, String format,
                                 Map<String, String> options )
    {
        File output = new File( outputDirectory, FileUtils.relativize( input, inputDirectory ) );

        List<String> args = new ArrayList<String>( command.size() + options.size() );
        for ( String arg : command )
        {
            arg = arg.replace( "{inputDir}", inputDirectory.getAbsolutePath() );
            arg = arg.replace( "{input}", input.getAbsolutePath() );
            arg = arg.replace( "{outputDir}", outputDirectory.getAbsolutePath() );
            arg = arg.replace( "{output}", output.getAbsolutePath() );
            arg = arg.replace( "{format}", format );
            args.add( arg );
        }
        for ( Map.Entry<String, String> option : new TreeMap<String, String>( options ).entrySet() )
        {
            args.add( "--" + option.getKey() + "=" + option.getValue() );
        }
        return args;
    }

    @Override
    public String toString()
    {
        return toolId + command;
    }

    class ProcessToolHandle
        implements ToolHandle
    {

        public void invoke( File input, File inputDirectory, File outputDirectory, String format,
                            Map<String, String> options )
            throws IOException
        {
            List<String> args = newCommandLine( input, inputDirectory, outputDirectory, format, options );

            if ( log.isDebugEnabled() )
            {
                log.debug( "Executing " + args );
            }

            ProcessBuilder builder = new ProcessBuilder( args );
            builder.redirectErrorStream( true );
            if ( workingDirectory != null )
            {
                builder.directory( workingDirectory );
            }

            Process process = builder.start();
            String output;
            int exitCode;
            try
            {
                process.getOutputStream().close();
                output = read( process.getInputStream() );
                exitCode = process.waitFor();
            }
            catch ( InterruptedException e )
            {
                process.destroy();
                Thread.currentThread().interrupt();
                throw new InterruptedIOException( toolId + " interrupted while processing " + input );
            }

            if ( exitCode != 0 )
            {
                throw new IOException( toolId + " exited with code " + exitCode
                    + ( output.length() > 0 ? ": " + output.trim() : "" ) );
            }
            if ( output.length() > 0 && log.isDebugEnabled() )
            {
                log.debug( output.trim() );
            }
        }

        public boolean isThreadSafe()
        {
            return true;
        }

        public void close()
        {
            // every invocation owns its process
        }

        private String read( InputStream is )
            throws IOException
        {
            try
            {
                ByteArrayOutputStream buffer = new ByteArrayOutputStream( 1024 );
                byte[] bytes = new byte[8192];
                for ( int n; ( n = is.read( bytes ) ) >= 0; )
                {
                    buffer.write( bytes, 0, n );
                }
                return new String( buffer.toByteArray(), outputCharset );
            }
            finally
            {
                is.close();
            }
        }

    }

}
