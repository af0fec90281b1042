package org.eclipse.tesla.workers.maven.internal;

/*******************************************************************************
 * Copyright (c) 2011 Sonatype, Inc.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Public License v1.0
 * which accompanies this distribution, and is available at
 *   http://www.eclipse.org/legal/epl-v10.html
 *******************************************************************************/

import javax.inject.Inject;
import javax.inject.Named;
import javax.inject.Singleton;

import org.apache.maven.plugin.MojoExecution;
import org.apache.maven.plugin.descriptor.MojoDescriptor;
import org.eclipse.tesla.workers.ToolHandleFactory;
import org.eclipse.tesla.workers.WorkerSession;
import org.eclipse.tesla.workers.internal.DefaultWorkerSessionManager;
import org.slf4j.Logger;

/**
 * Worker session manager bound to the plugin realm. Being a singleton, the sessions it hands out survive across mojo
 * executions and reactor projects, so a tool is only reloaded when its classpath changes.
 */
@Named
@Singleton
public class MavenWorkerSessionManager
    extends DefaultWorkerSessionManager
{

    @Inject
    public MavenWorkerSessionManager( Logger log )
    {
        super( log );
    }

    /**
     * Gets the session of the specified tool on behalf of a mojo execution. Sessions are scoped to the plugin that
     * executes the mojo, different plugins driving the same tool get separate sessions.
     */
    public WorkerSession getSession( MojoExecution execution, String toolId, ToolHandleFactory factory )
    {
        if ( execution == null )
        {
            throw new IllegalArgumentException( "mojo execution not specified" );
        }
        return getSession( sessionKey( execution, toolId ), factory );
    }

    static String sessionKey( MojoExecution execution, String toolId )
    {
        if ( toolId == null )
        {
            throw new IllegalArgumentException( "tool identifier not specified" );
        }

        MojoDescriptor mojoDescriptor = execution.getMojoDescriptor();
        if ( mojoDescriptor == null || mojoDescriptor.getPluginDescriptor() == null )
        {
            return toolId;
        }
        return mojoDescriptor.getPluginDescriptor().getPluginLookupKey() + ":" + toolId;
    }

}
