package org.eclipse.tesla.workers.generate;

/*******************************************************************************
 * Copyright (c) 2011 Sonatype, Inc.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Public License v1.0
 * which accompanies this distribution, and is available at
 *   http://www.eclipse.org/legal/epl-v10.html
 *******************************************************************************/

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.eclipse.tesla.workers.GenerationException;
import org.eclipse.tesla.workers.InputNotFoundException;
import org.eclipse.tesla.workers.InvocationException;
import org.eclipse.tesla.workers.RecordingToolHandleFactory;
import org.eclipse.tesla.workers.SessionInitException;
import org.eclipse.tesla.workers.WorkerSession;
import org.eclipse.tesla.workers.internal.DefaultWorkerSessionManager;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class GenerationStepTest
{

    @TempDir
    File tmp;

    private File sourceDirectory;

    private File outputDirectory;

    private List<File> classpath;

    private DefaultWorkerSessionManager manager;

    private RecordingToolHandleFactory factory;

    private WorkerSession session;

    @BeforeEach
    public void setUp()
        throws IOException
    {
        sourceDirectory = new File( tmp, "src/main/twirl" );
        outputDirectory = new File( tmp, "target/generated-sources/twirl" );

        File jar = new File( tmp, "twirl-compiler.jar" );
        Files.write( jar.toPath(), new byte[] { 1 } );
        classpath = Collections.singletonList( jar );

        manager = new DefaultWorkerSessionManager();
        factory = new RecordingToolHandleFactory();
        session = manager.getSession( "twirl", factory );
    }

    @AfterEach
    public void tearDown()
    {
        manager.close();
    }

    private SourceFile source( String path )
        throws IOException
    {
        File file = new File( sourceDirectory, path );
        file.getParentFile().mkdirs();
        Files.write( file.toPath(), path.getBytes( StandardCharsets.UTF_8 ) );
        return new SourceFile( file, sourceDirectory );
    }

    private String output( String path )
        throws IOException
    {
        return new String( Files.readAllBytes( new File( outputDirectory, path + ".out" ).toPath() ),
                           StandardCharsets.UTF_8 );
    }

    @Test
    public void testInvokesToolPerFileWithResolvedFormat()
        throws IOException
    {
        List<SourceFile> sources = new ArrayList<SourceFile>();
        sources.add( source( "a.scala.html" ) );
        sources.add( source( "b.scala.js" ) );
        sources.add( source( "views/c.scala.xml" ) );
        sources.add( source( "d.txt" ) );

        GenerationResult result =
            new GenerationStep().run( session, new GenerationRequest( classpath, sources, outputDirectory ) );

        assertThat( result.isSuccessful() ).isTrue();
        assertThat( result.getProcessedFiles() ).hasSize( 4 );
        assertThat( result.getOutputDirectory() ).isEqualTo( outputDirectory.getAbsoluteFile() );
        assertThat( output( "a.scala.html" ) ).isEqualTo( "HtmlFormat:a.scala.html" );
        assertThat( output( "b.scala.js" ) ).isEqualTo( "JavaScriptFormat:b.scala.js" );
        assertThat( output( "views/c.scala.xml" ) ).isEqualTo( "XmlFormat:views/c.scala.xml" );
        assertThat( output( "d.txt" ) ).isEqualTo( "TxtFormat:d.txt" );
        assertThat( result.getLog() ).contains( "Processed views/c.scala.xml as XmlFormat" );
    }

    @Test
    public void testCollectAllReportsFailedFileAndProcessesTheRest()
        throws IOException
    {
        List<SourceFile> sources = new ArrayList<SourceFile>();
        for ( String name : new String[] { "one.scala.html", "two.scala.html", "three.scala.html", "four.scala.html",
            "five.scala.html" } )
        {
            sources.add( source( name ) );
        }
        factory.failOn( "three.scala.html" );

        GenerationResult result =
            new GenerationStep().run( session, new GenerationRequest( classpath, sources, outputDirectory ) );

        assertThat( result.getProcessedFiles() ).hasSize( 4 );
        assertThat( result.getErrors() ).hasSize( 1 );
        InvocationException error = result.getErrors().get( 0 );
        assertThat( error.getInput() ).isEqualTo( sources.get( 2 ).getFile() );
        assertThat( error.getOutputDirectory() ).isEqualTo( outputDirectory.getAbsoluteFile() );
        assertThat( error.getMessage() ).contains( "three.scala.html" ).contains( "syntax error" );
        assertThat( new File( outputDirectory, "five.scala.html.out" ) ).exists();
        assertThat( new File( outputDirectory, "three.scala.html.out" ) ).doesNotExist();

        assertThatThrownBy( () -> result.failIfErrors() ).isInstanceOf( GenerationException.class ).hasMessageContaining( "three.scala.html" );
    }

    @Test
    public void testFailFastStopsAtFirstFailure()
        throws IOException
    {
        List<SourceFile> sources = new ArrayList<SourceFile>();
        sources.add( source( "a.scala.html" ) );
        sources.add( source( "b.scala.html" ) );
        sources.add( source( "c.scala.html" ) );
        factory.failOn( "b.scala.html" );

        GenerationResult result =
            new GenerationStep().run( session, new GenerationRequest( classpath, sources, outputDirectory ).setFailurePolicy( FailurePolicy.FAIL_FAST ) );

        assertThat( result.getProcessedFiles() ).containsExactly( sources.get( 0 ).getFile() );
        assertThat( result.getErrors() ).hasSize( 1 );
        assertThat( new File( outputDirectory, "c.scala.html.out" ) ).doesNotExist();
    }

    @Test
    public void testMissingInputAbortsBeforeAnyInvocation()
        throws IOException
    {
        List<SourceFile> sources = new ArrayList<SourceFile>();
        sources.add( source( "a.scala.html" ) );
        sources.add( new SourceFile( new File( sourceDirectory, "gone.scala.html" ), sourceDirectory ) );

        assertThatThrownBy( () -> new GenerationStep().run( session, new GenerationRequest( classpath, sources, outputDirectory ) ) ).isInstanceOf( InputNotFoundException.class ).hasMessageContaining( "gone.scala.html" );
        assertThat( factory.constructions.get() ).isEqualTo( 0 );
        assertThat( outputDirectory ).doesNotExist();
    }

    @Test
    public void testSessionFailureAbortsStep()
        throws IOException
    {
        List<SourceFile> sources = Collections.singletonList( source( "a.scala.html" ) );
        factory.setFailing( true );

        assertThatThrownBy( () -> new GenerationStep().run( session, new GenerationRequest( classpath, sources, outputDirectory ) ) ).isInstanceOf( SessionInitException.class );
        assertThat( outputDirectory ).doesNotExist();
    }

    @Test
    public void testExistingOutputIsKept()
        throws IOException
    {
        outputDirectory.mkdirs();
        File unrelated = new File( outputDirectory, "unrelated.scala" );
        Files.write( unrelated.toPath(), new byte[] { 1 } );

        new GenerationStep().run( session, new GenerationRequest( classpath, Collections.singletonList( source( "a.scala.html" ) ), outputDirectory ) );

        assertThat( unrelated ).exists();
        assertThat( new File( outputDirectory, "a.scala.html.out" ) ).exists();
    }

    @Test
    public void testRepeatedRunsReuseToolHandle()
        throws IOException
    {
        List<SourceFile> sources = Collections.singletonList( source( "a.scala.html" ) );

        new GenerationStep().run( session, new GenerationRequest( classpath, sources, outputDirectory ) );
        new GenerationStep().run( session, new GenerationRequest( classpath, sources, outputDirectory ) );

        assertThat( factory.constructions.get() ).isEqualTo( 1 );
    }

    @Test
    public void testThreadSafeHandleProcessesFilesConcurrently()
        throws IOException
    {
        factory.setThreadSafe( true );
        factory.failOn( "f3.scala.html" );
        List<SourceFile> sources = new ArrayList<SourceFile>();
        for ( int i = 0; i < 12; i++ )
        {
            sources.add( source( "f" + i + ".scala.html" ) );
        }

        GenerationResult result =
            new GenerationStep().run( session, new GenerationRequest( classpath, sources, outputDirectory ).setParallelism( 4 ) );

        assertThat( result.getProcessedFiles() ).hasSize( 11 );
        assertThat( result.getErrors() ).hasSize( 1 );
        assertThat( result.getErrors().get( 0 ).getInput().getName() ).isEqualTo( "f3.scala.html" );
        assertThat( factory.handles.get( 0 ).formats ).hasSize( 11 );
    }

}
