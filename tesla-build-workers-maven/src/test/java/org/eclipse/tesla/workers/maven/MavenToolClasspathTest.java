package org.eclipse.tesla.workers.maven;

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
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.apache.maven.artifact.Artifact;
import org.apache.maven.artifact.DefaultArtifact;
import org.apache.maven.artifact.handler.DefaultArtifactHandler;
import org.eclipse.tesla.workers.SessionInitException;
import org.junit.jupiter.api.Test;

public class MavenToolClasspathTest
{

    private static Artifact artifact( String groupId, String artifactId, File file )
    {
        Artifact artifact =
            new DefaultArtifact( groupId, artifactId, "1.0", "runtime", "jar", null, new DefaultArtifactHandler( "jar" ) );
        artifact.setFile( file );
        return artifact;
    }

    @Test
    public void testSelectsByGroupAndArtifact()
    {
        File compiler = new File( "twirl-compiler.jar" );
        File parser = new File( "twirl-parser.jar" );
        File scala = new File( "scala-library.jar" );
        List<Artifact> artifacts =
            Arrays.asList( artifact( "com.typesafe.play", "twirl-compiler_2.13", compiler ),
                           artifact( "org.scala-lang", "scala-library", scala ),
                           artifact( "com.typesafe.play", "twirl-parser_2.13", parser ),
                           artifact( "org.slf4j", "slf4j-api", new File( "slf4j-api.jar" ) ) );

        List<File> files =
            MavenToolClasspath.select( "twirl", artifacts, Arrays.asList( "com.typesafe.play", "org.scala-lang:scala-library" ) );

        assertThat( files ).containsExactly( compiler, parser, scala );
    }

    @Test
    public void testUnmatchedKeyFails()
    {
        List<Artifact> artifacts =
            Collections.singletonList( artifact( "org.scala-lang", "scala-library", new File( "scala-library.jar" ) ) );

        assertThatThrownBy( () -> MavenToolClasspath.select( "scalafmt", artifacts, Collections.singletonList( "org.scalameta:scalafmt-dynamic_2.13" ) ) ).isInstanceOf( SessionInitException.class ).hasMessageContaining( "org.scalameta:scalafmt-dynamic_2.13" );
    }

    @Test
    public void testUnresolvedArtifactFails()
    {
        List<Artifact> artifacts = Collections.singletonList( artifact( "org.scala-lang", "scala-library", null ) );

        assertThatThrownBy( () -> MavenToolClasspath.select( "twirl", artifacts, Collections.singletonList( "org.scala-lang" ) ) ).isInstanceOf( SessionInitException.class ).hasMessageContaining( "has not been resolved" );
    }

}
