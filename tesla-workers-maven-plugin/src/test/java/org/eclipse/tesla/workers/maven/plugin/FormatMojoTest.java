package org.eclipse.tesla.workers.maven.plugin;

/*******************************************************************************
 * Copyright (c) 2011 Sonatype, Inc.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Public License v1.0
 * which accompanies this distribution, and is available at
 *   http://www.eclipse.org/legal/epl-v10.html
 *******************************************************************************/

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.eclipse.tesla.workers.maven.plugin.MojoFixtures.artifact;
import static org.eclipse.tesla.workers.maven.plugin.MojoFixtures.read;
import static org.eclipse.tesla.workers.maven.plugin.MojoFixtures.write;

import java.io.File;
import java.util.Arrays;
import java.util.Collections;

import org.apache.maven.plugin.MojoExecutionException;
import org.eclipse.tesla.workers.maven.internal.MavenWorkerSessionManager;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class FormatMojoTest
{

    @TempDir
    File tmp;

    private MavenWorkerSessionManager sessionManager;

    private File sources;

    private File config;

    @BeforeEach
    public void setUp()
        throws Exception
    {
        sessionManager = new MavenWorkerSessionManager( null );
        sources = new File( tmp, "src/main/scala" );
        config = write( new File( tmp, ".scalafmt.conf" ), "version = 2.7.5\n" );
        new File( tmp, "scalafmt-classes" ).mkdirs();
    }

    @AfterEach
    public void tearDown()
    {
        sessionManager.close();
    }

    private FormatMojo newMojo()
    {
        FormatMojo mojo = new FormatMojo( sessionManager, null );
        mojo.project = MojoFixtures.project( tmp, "core" );
        mojo.mojoExecution = MojoFixtures.execution( "format" );
        mojo.pluginArtifacts =
            Collections.singletonList( artifact( "org.scalameta", "scalafmt-dynamic_2.13",
                                                 new File( tmp, "scalafmt-classes" ) ) );
        mojo.toolArtifacts = Arrays.asList( "org.scalameta" );
        mojo.configFile = config;
        mojo.sourceDirectories = Collections.singletonList( sources );
        mojo.scalafmtVersion = "2.7.5";
        mojo.parallelism = 2;
        return mojo;
    }

    @Test
    public void testFormatsInPlace()
        throws Exception
    {
        File a = write( new File( sources, "a/A.scala" ), "object A {   \n  val x = 1 \n}\n" );
        File b = write( new File( sources, "B.scala" ), "object B\t\n" );
        File notes = write( new File( sources, "notes.txt" ), "trailing   \n" );

        newMojo().execute();

        assertThat( read( a ) ).isEqualTo( "object A {\n  val x = 1\n}\n" );
        assertThat( read( b ) ).isEqualTo( "object B\n" );
        assertThat( read( notes ) ).isEqualTo( "trailing   \n" );
    }

    @Test
    public void testConfigChangeReloadsFormatter()
        throws Exception
    {
        write( new File( sources, "A.scala" ), "object A\n" );

        int before = FakeScalafmtAdapter.HANDLES.get();
        newMojo().execute();
        newMojo().execute();
        assertThat( FakeScalafmtAdapter.HANDLES.get() - before ).isEqualTo( 1 );

        assertThat( config.setLastModified( config.lastModified() + 10000 ) ).isTrue();
        newMojo().execute();
        assertThat( FakeScalafmtAdapter.HANDLES.get() - before ).isEqualTo( 2 );
    }

    @Test
    public void testMissingConfigFailsExecution()
    {
        FormatMojo mojo = newMojo();
        mojo.configFile = new File( tmp, "missing.conf" );

        assertThatThrownBy( () -> mojo.execute() ).isInstanceOf( MojoExecutionException.class ).hasMessageContaining( "missing.conf" );
    }

    @Test
    public void testUnsupportedVersionFailsExecution()
        throws Exception
    {
        write( new File( sources, "A.scala" ), "object A\n" );

        FormatMojo mojo = newMojo();
        mojo.scalafmtVersion = "3.0.0";

        assertThatThrownBy( () -> mojo.execute() ).isInstanceOf( MojoExecutionException.class ).hasMessageContaining( "version 3.0.0 not supported" );
    }

}
