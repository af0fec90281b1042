package org.eclipse.tesla.workers.internal;

/*******************************************************************************
 * Copyright (c) 2011 Sonatype, Inc.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Public License v1.0
 * which accompanies this distribution, and is available at
 *   http://www.eclipse.org/legal/epl-v10.html
 *******************************************************************************/

import java.io.File;
import java.io.IOException;
import java.util.Collection;

import org.eclipse.tesla.workers.Fingerprint;
import org.eclipse.tesla.workers.SessionInitException;
import org.eclipse.tesla.workers.ToolHandle;
import org.eclipse.tesla.workers.ToolHandleFactory;
import org.eclipse.tesla.workers.WorkerSession;
import org.slf4j.Logger;

class DefaultWorkerSession
    implements WorkerSession
{

    private final DefaultWorkerSessionManager manager;

    private final Logger log;

    private final String toolId;

    private final ToolHandleFactory factory;

    private final Object lock = new Object();

    private volatile Entry current;

    private volatile boolean closed;

    public DefaultWorkerSession( DefaultWorkerSessionManager manager, String toolId, ToolHandleFactory factory )
    {
        if ( manager == null )
        {
            throw new IllegalArgumentException( "session manager not specified" );
        }
        if ( toolId == null )
        {
            throw new IllegalArgumentException( "tool identifier not specified" );
        }
        if ( factory == null )
        {
            throw new IllegalArgumentException( "tool handle factory not specified" );
        }

        this.manager = manager;
        this.log = manager.log;
        this.toolId = toolId;
        this.factory = factory;
    }

    public String getToolId()
    {
        return toolId;
    }

    ToolHandleFactory getFactory()
    {
        return factory;
    }

    boolean isClosed()
    {
        return closed;
    }

    public Fingerprint getFingerprint()
    {
        Entry entry = current;
        return ( entry != null ) ? entry.fingerprint : null;
    }

    public ToolHandle get( Collection<File> inputs )
    {
        if ( inputs == null )
        {
            throw new IllegalArgumentException( "tool inputs not specified" );
        }

        return get( Fingerprint.of( inputs, manager.newDigester() ), inputs );
    }

    public ToolHandle get( Fingerprint fingerprint, Collection<File> inputs )
    {
        if ( fingerprint == null )
        {
            throw new IllegalArgumentException( "fingerprint not specified" );
        }
        if ( inputs == null )
        {
            throw new IllegalArgumentException( "tool inputs not specified" );
        }

        failIfClosed();

        Entry entry = current;
        if ( entry != null && entry.fingerprint.equals( fingerprint ) )
        {
            return entry.handle;
        }

        synchronized ( lock )
        {
            failIfClosed();

            Entry previous = current;
            if ( previous != null && previous.fingerprint.equals( fingerprint ) )
            {
                return previous.handle;
            }

            long start = System.currentTimeMillis();

            ToolHandle handle;
            try
            {
                handle = factory.newHandle( inputs );
            }
            catch ( SessionInitException e )
            {
                throw e;
            }
            catch ( RuntimeException e )
            {
                throw new SessionInitException( toolId, inputs, Messages.describe( e ), e );
            }
            if ( handle == null )
            {
                throw new SessionInitException( toolId, inputs, "no tool handle constructed" );
            }

            current = new Entry( fingerprint, handle );

            if ( previous != null )
            {
                log.info( "Recreated " + toolId + " handle, its inputs changed" );
            }
            if ( log.isDebugEnabled() )
            {
                log.debug( ( previous == null ? "Created" : "Recreated" ) + " " + toolId + " handle with fingerprint "
                    + fingerprint + " in " + ( System.currentTimeMillis() - start ) + " ms" );
            }

            if ( previous != null )
            {
                release( previous.handle );
            }

            return handle;
        }
    }

    public void close()
    {
        synchronized ( lock )
        {
            if ( closed )
            {
                return;
            }
            closed = true;

            Entry entry = current;
            current = null;
            if ( entry != null )
            {
                release( entry.handle );
            }
        }

        manager.destroy( this );
    }

    private void release( ToolHandle handle )
    {
        try
        {
            handle.close();
        }
        catch ( IOException e )
        {
            log.warn( "Could not release " + toolId + " handle", log.isDebugEnabled() ? e : null );
        }
        catch ( RuntimeException e )
        {
            log.warn( "Could not release " + toolId + " handle", log.isDebugEnabled() ? e : null );
        }
    }

    private void failIfClosed()
    {
        if ( closed )
        {
            throw new IllegalStateException( "worker session for " + toolId + " has already been closed" );
        }
    }

    private static final class Entry
    {

        final Fingerprint fingerprint;

        final ToolHandle handle;

        Entry( Fingerprint fingerprint, ToolHandle handle )
        {
            this.fingerprint = fingerprint;
            this.handle = handle;
        }

    }

}
