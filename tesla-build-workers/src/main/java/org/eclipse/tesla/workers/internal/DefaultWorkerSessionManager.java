package org.eclipse.tesla.workers.internal;

/*******************************************************************************
 * Copyright (c) 2011 Sonatype, Inc.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Public License v1.0
 * which accompanies this distribution, and is available at
 *   http://www.eclipse.org/legal/epl-v10.html
 *******************************************************************************/

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

import org.eclipse.tesla.workers.Digester;
import org.eclipse.tesla.workers.ToolHandleFactory;
import org.eclipse.tesla.workers.WorkerSession;
import org.eclipse.tesla.workers.WorkerSessionManager;
import org.slf4j.Logger;
import org.slf4j.helpers.NOPLogger;

public class DefaultWorkerSessionManager
    implements WorkerSessionManager
{

    protected Logger log;

    final Map<String, DefaultWorkerSession> sessions;

    public DefaultWorkerSessionManager()
    {
        this( null );
    }

    public DefaultWorkerSessionManager( Logger log )
    {
        this.log = ( log != null ) ? log : NOPLogger.NOP_LOGGER;
        sessions = new LinkedHashMap<String, DefaultWorkerSession>();
    }

    public WorkerSession getSession( String toolId, ToolHandleFactory factory )
    {
        if ( toolId == null )
        {
            throw new IllegalArgumentException( "tool identifier not specified" );
        }
        if ( factory == null )
        {
            throw new IllegalArgumentException( "tool handle factory not specified" );
        }

        synchronized ( sessions )
        {
            purgeSessions();

            DefaultWorkerSession session = sessions.get( toolId );
            if ( session == null )
            {
                session = new DefaultWorkerSession( this, toolId, factory );
                sessions.put( toolId, session );
            }
            else if ( session.getFactory() != factory && log.isDebugEnabled() )
            {
                log.debug( "Reusing worker session for " + toolId + ", ignoring new tool handle factory " + factory );
            }

            return session;
        }
    }

    public void close()
    {
        Collection<DefaultWorkerSession> open;
        synchronized ( sessions )
        {
            open = new ArrayList<DefaultWorkerSession>( sessions.values() );
            sessions.clear();
        }

        for ( DefaultWorkerSession session : open )
        {
            session.close();
        }
    }

    protected Digester newDigester()
    {
        return new DefaultDigester();
    }

    void destroy( DefaultWorkerSession session )
    {
        synchronized ( sessions )
        {
            if ( sessions.get( session.getToolId() ) == session )
            {
                sessions.remove( session.getToolId() );
            }
        }
    }

    private void purgeSessions()
    {
        for ( Iterator<Map.Entry<String, DefaultWorkerSession>> it = sessions.entrySet().iterator(); it.hasNext(); )
        {
            if ( it.next().getValue().isClosed() )
            {
                it.remove();
            }
        }
    }

}
