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
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.io.File;
import java.io.FileOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

import org.apache.maven.execution.MavenSession;
import org.apache.maven.model.Dependency;
import org.apache.maven.plugin.MojoExecutionException;
import org.apache.maven.project.MavenProject;
import org.eclipse.tesla.workers.maven.MavenModuleGraphBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

public class BundleManifestMojoTest
{

    @TempDir
    File tmp;

    private MavenProject core;

    private MavenProject app;

    private BundleManifestMojo mojo;

    @BeforeEach
    public void setUp()
        throws Exception
    {
        core = MojoFixtures.project( new File( tmp, "core" ), "core" );
        core.getProperties().setProperty( "npm.dependency.lodash", "4.17.15" );
        core.getProperties().setProperty( "npm.dependency.react", "16.13.0" );

        app = MojoFixtures.project( new File( tmp, "app" ), "app" );
        Dependency dependency = new Dependency();
        dependency.setGroupId( "org.example" );
        dependency.setArtifactId( "core" );
        dependency.setVersion( "1.0" );
        app.getModel().addDependency( dependency );
        app.getProperties().setProperty( "npm.devDependency.jsdom", "16.2.2" );

        File facade = jar( new File( tmp, "facade.jar" ) );
        app.setArtifacts( Collections.singleton( artifact( "org.example", "facade", facade ) ) );

        MavenSession session = mock( MavenSession.class );
        when( session.getProjects() ).thenReturn( Arrays.asList( core, app ) );

        mojo = new BundleManifestMojo( new MavenModuleGraphBuilder(), null );
        mojo.project = app;
        mojo.session = session;
        mojo.outputDirectory = new File( tmp, "app/target/webpack" );
        mojo.scanDependencyJars = true;
    }

    private static File jar( File file )
        throws Exception
    {
        ZipOutputStream zip = new ZipOutputStream( new FileOutputStream( file ) );
        try
        {
            entry( zip, "NPM_DEPENDENCIES",
                   "{\"compileDependencies\":[{\"react\":\"16.12.0\"},{\"react-dom\":\"16.12.0\"}],"
                       + "\"compile-devDependencies\":[{\"expose-loader\":\"0.7.5\"}]}" );
            entry( zip, "lib/facade.js", "module.exports = {};" );
            entry( zip, "scala/scalajs/js/Any.js", "// runtime" );
        }
        finally
        {
            zip.close();
        }
        return file;
    }

    private static void entry( ZipOutputStream zip, String name, String content )
        throws Exception
    {
        zip.putNextEntry( new ZipEntry( name ) );
        zip.write( content.getBytes( StandardCharsets.UTF_8 ) );
        zip.closeEntry();
    }

    @Test
    public void testWritesManifestAndBundleSources()
        throws Exception
    {
        Map<String, String> local = new LinkedHashMap<String, String>();
        local.put( "react", "16.13.1" );
        mojo.npmDependencies = local;
        mojo.bundlerDependencies = Collections.singletonMap( "webpack", "4.44.0" );

        mojo.execute();

        File outputDirectory = new File( tmp, "app/target/webpack" );
        JsonNode manifest = new ObjectMapper().readTree( new File( outputDirectory, "package.json" ) );

        assertThat( manifest.get( "dependencies" ).get( "react" ).asText() ).isEqualTo( "16.13.1" );
        assertThat( manifest.get( "dependencies" ).get( "react-dom" ).asText() ).isEqualTo( "16.12.0" );
        assertThat( manifest.get( "dependencies" ).get( "lodash" ).asText() ).isEqualTo( "4.17.15" );
        assertThat( manifest.get( "devDependencies" ).get( "jsdom" ).asText() ).isEqualTo( "16.2.2" );
        assertThat( manifest.get( "devDependencies" ).get( "expose-loader" ).asText() ).isEqualTo( "0.7.5" );
        assertThat( manifest.get( "devDependencies" ).get( "webpack" ).asText() ).isEqualTo( "4.44.0" );
        assertThat( manifest.get( "devDependencies" ).get( "webpack-cli" ).asText() ).isEqualTo( "3.3.11" );

        assertThat( read( new File( outputDirectory, "lib/facade.js" ) ) ).isEqualTo( "module.exports = {};" );
        assertThat( new File( outputDirectory, "scala/scalajs/js/Any.js" ) ).doesNotExist();
    }

    @Test
    public void testUpstreamOverridesDependencyJars()
        throws Exception
    {
        mojo.execute();

        JsonNode manifest = new ObjectMapper().readTree( new File( tmp, "app/target/webpack/package.json" ) );

        assertThat( manifest.get( "dependencies" ).get( "react" ).asText() ).isEqualTo( "16.13.0" );
    }

    @Test
    public void testCyclicReactorFailsExecution()
    {
        Dependency dependency = new Dependency();
        dependency.setGroupId( "org.example" );
        dependency.setArtifactId( "app" );
        dependency.setVersion( "1.0" );
        core.getModel().addDependency( dependency );

        assertThatThrownBy( () -> mojo.execute() ).isInstanceOf( MojoExecutionException.class ).hasMessageContaining( "org.example:app -> org.example:core -> org.example:app" );
    }

}
