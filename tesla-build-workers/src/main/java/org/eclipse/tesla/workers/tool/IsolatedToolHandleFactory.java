package org.eclipse.tesla.workers.tool;

/*******************************************************************************
 * Copyright (c) 2011 Sonatype, Inc.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Public License v1.0
 * which accompanies this distribution, and is available at
 *   http://www.eclipse.org/legal/epl-v10.html
 *******************************************************************************/

import java.io.File;
import java.io.IOException;
import java.net.MalformedURLException;
import java.net.URL;
import java.net.URLClassLoader;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;

import org.eclipse.tesla.workers.SessionInitException;
import org.eclipse.tesla.workers.ToolHandle;
import org.eclipse.tesla.workers.ToolHandleFactory;
import org.slf4j.Logger;
import org.slf4j.helpers.NOPLogger;

/**
 * Loads a tool into its own class loader and selects the {@link ToolAdapter} matching the requested tool identifier
 * and version. Closing the resulting handle also closes the class loader.
 */
public class IsolatedToolHandleFactory
    implements ToolHandleFactory
{

    private final Logger log;

    private final String toolId;

    private final String toolVersion;

    private final ClassLoader parent;

    public IsolatedToolHandleFactory( String toolId, String toolVersion, ClassLoader parent )
    {
        this( toolId, toolVersion, parent, null );
    }

    public IsolatedToolHandleFactory( String toolId, String toolVersion, ClassLoader parent, Logger log )
    {
        if ( toolId == null )
        {
            throw new IllegalArgumentException( "tool identifier not specified" );
        }
        if ( parent == null )
        {
            throw new IllegalArgumentException( "parent class loader not specified" );
        }
        this.toolId = toolId;
        this.toolVersion = toolVersion;
        this.parent = parent;
        this.log = ( log != null ) ? log : NOPLogger.NOP_LOGGER;
    }

    public ToolHandle newHandle( Collection<File> inputs )
        throws SessionInitException
    {
        URLClassLoader loader = new URLClassLoader( toUrls( inputs ), parent );
        try
        {
            ToolAdapter adapter = selectAdapter( loader, inputs );

            if ( log.isDebugEnabled() )
            {
                log.debug( "Using " + adapter.getClass().getName() + " for " + toolId + " "
                    + ( toolVersion != null ? toolVersion : "(unspecified version)" ) );
            }

            ToolHandle handle = adapter.newHandle( loader );
            if ( handle == null )
            {
                throw new SessionInitException( toolId, inputs, adapter.getClass().getName()
                    + " did not create a tool handle" );
            }
            return new IsolatedToolHandle( handle, loader );
        }
        catch ( SessionInitException e )
        {
            closeQuietly( loader, e );
            throw e;
        }
        catch ( ServiceConfigurationError e )
        {
            SessionInitException sie = new SessionInitException( toolId, inputs, "broken tool adapter registration", e );
            closeQuietly( loader, sie );
            throw sie;
        }
        catch ( Exception e )
        {
            SessionInitException sie = new SessionInitException( toolId, inputs, "tool adapter failed", e );
            closeQuietly( loader, sie );
            throw sie;
        }
        catch ( LinkageError e )
        {
            SessionInitException sie = new SessionInitException( toolId, inputs, "incompatible tool classpath", e );
            closeQuietly( loader, sie );
            throw sie;
        }
    }

    /**
     * Selects the adapter for the configured tool. Adapters that bridge other tools are skipped, the first adapter that
     * supports the configured tool version wins.
     */
    protected ToolAdapter selectAdapter( ClassLoader loader, Collection<File> inputs )
    {
        List<String> candidates = new ArrayList<String>();

        for ( Iterator<ToolAdapter> it = ServiceLoader.load( ToolAdapter.class, loader ).iterator(); it.hasNext(); )
        {
            ToolAdapter adapter = it.next();
            if ( !toolId.equals( adapter.getToolId() ) )
            {
                continue;
            }
            if ( adapter.supports( toolVersion ) )
            {
                return adapter;
            }
            candidates.add( adapter.getClass().getName() );
        }

        if ( candidates.isEmpty() )
        {
            throw new SessionInitException( toolId, inputs, "no tool adapter found" );
        }
        throw new SessionInitException( toolId, inputs, "version " + toolVersion + " not supported by any of "
            + candidates );
    }

    private URL[] toUrls( Collection<File> inputs )
    {
        if ( inputs == null )
        {
            throw new IllegalArgumentException( "tool classpath not specified" );
        }

        List<URL> urls = new ArrayList<URL>( inputs.size() );
        for ( File input : inputs )
        {
            try
            {
                urls.add( input.getAbsoluteFile().toURI().toURL() );
            }
            catch ( MalformedURLException e )
            {
                throw new SessionInitException( toolId, inputs, "malformed classpath entry " + input, e );
            }
        }
        return urls.toArray( new URL[urls.size()] );
    }

    private static void closeQuietly( URLClassLoader loader, Exception failure )
    {
        try
        {
            loader.close();
        }
        catch ( IOException e )
        {
            failure.addSuppressed( e );
        }
    }

    @Override
    public String toString()
    {
        return toolId + ( toolVersion != null ? ":" + toolVersion : "" );
    }

    static class IsolatedToolHandle
        implements ToolHandle
    {

        private final ToolHandle delegate;

        private final URLClassLoader loader;

        IsolatedToolHandle( ToolHandle delegate, URLClassLoader loader )
        {
            this.delegate = delegate;
            this.loader = loader;
        }

        ToolHandle getDelegate()
        {
            return delegate;
        }

        public void invoke( File input, File inputDirectory, File outputDirectory, String format,
                            Map<String, String> options )
            throws IOException
        {
            delegate.invoke( input, inputDirectory, outputDirectory, format, options );
        }

        public boolean isThreadSafe()
        {
            return delegate.isThreadSafe();
        }

        public void close()
            throws IOException
        {
            try
            {
                delegate.close();
            }
            finally
            {
                loader.close();
            }
        }

    }

}
