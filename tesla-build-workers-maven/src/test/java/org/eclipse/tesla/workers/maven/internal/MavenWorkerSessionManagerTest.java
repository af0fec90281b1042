package org.eclipse.tesla.workers.maven.internal;

/*******************************************************************************
 * Copyright (c) 2011 Sonatype, Inc.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Public License v1.0
 * which accompanies this distribution, and is available at
 *   http://www.eclipse.org/legal/epl-v10.html
 *******************************************************************************/

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

import org.apache.maven.plugin.MojoExecution;
import org.apache.maven.plugin.descriptor.MojoDescriptor;
import org.apache.maven.plugin.descriptor.PluginDescriptor;
import org.eclipse.tesla.workers.ToolHandleFactory;
import org.eclipse.tesla.workers.WorkerSession;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;

public class MavenWorkerSessionManagerTest
{

    private MavenWorkerSessionManager manager;

    @BeforeEach
    public void setUp()
    {
        manager = new MavenWorkerSessionManager( mock( Logger.class ) );
    }

    @AfterEach
    public void tearDown()
    {
        manager.close();
    }

    private static MojoExecution execution( String artifactId, String goal, String executionId )
    {
        PluginDescriptor plugin = new PluginDescriptor();
        plugin.setGroupId( "org.eclipse.tesla.workers" );
        plugin.setArtifactId( artifactId );
        plugin.setVersion( "0.1.0" );

        MojoDescriptor mojo = new MojoDescriptor();
        mojo.setGoal( goal );
        mojo.setPluginDescriptor( plugin );

        return new MojoExecution( mojo, executionId );
    }

    @Test
    public void testSessionIsSharedAcrossExecutionsOfPlugin()
    {
        ToolHandleFactory factory = mock( ToolHandleFactory.class );

        WorkerSession main =
            manager.getSession( execution( "tesla-workers-maven-plugin", "compile-templates", "default" ), "twirl", factory );
        WorkerSession test =
            manager.getSession( execution( "tesla-workers-maven-plugin", "compile-templates", "test" ), "twirl", factory );

        assertThat( test ).isSameAs( main );
        assertThat( main.getToolId() ).isEqualTo( "org.eclipse.tesla.workers:tesla-workers-maven-plugin:twirl" );
    }

    @Test
    public void testSessionsAreSeparatedByPlugin()
    {
        ToolHandleFactory factory = mock( ToolHandleFactory.class );

        WorkerSession ours = manager.getSession( execution( "tesla-workers-maven-plugin", "format", "default" ), "scalafmt", factory );
        WorkerSession theirs = manager.getSession( execution( "other-maven-plugin", "format", "default" ), "scalafmt", factory );

        assertThat( theirs ).isNotSameAs( ours );
    }

}
