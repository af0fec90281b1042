package org.eclipse.tesla.workers.maven.plugin;

/*******************************************************************************
 * Copyright (c) 2011 Sonatype, Inc.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Public License v1.0
 * which accompanies this distribution, and is available at
 *   http://www.eclipse.org/legal/epl-v10.html
 *******************************************************************************/

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import javax.inject.Inject;

import org.apache.maven.artifact.Artifact;
import org.apache.maven.execution.MavenSession;
import org.apache.maven.plugin.AbstractMojo;
import org.apache.maven.plugin.MojoExecutionException;
import org.apache.maven.plugins.annotations.LifecyclePhase;
import org.apache.maven.plugins.annotations.Mojo;
import org.apache.maven.plugins.annotations.Parameter;
import org.apache.maven.plugins.annotations.ResolutionScope;
import org.apache.maven.project.MavenProject;
import org.eclipse.tesla.workers.BuildException;
import org.eclipse.tesla.workers.aggregate.AggregateResult;
import org.eclipse.tesla.workers.aggregate.DependencyAggregator;
import org.eclipse.tesla.workers.aggregate.Fact;
import org.eclipse.tesla.workers.aggregate.JarFacts;
import org.eclipse.tesla.workers.aggregate.ModuleGraph;
import org.eclipse.tesla.workers.aggregate.NamedDependency;
import org.eclipse.tesla.workers.manifest.PackageJsonWriter;
import org.eclipse.tesla.workers.manifest.SourceFragmentWriter;
import org.eclipse.tesla.workers.maven.MavenModuleGraphBuilder;
import org.slf4j.Logger;

/**
 * Writes the {@code package.json} and the JavaScript sources of a bundle. The npm dependencies and sources are
 * collected from the dependency jars, then from the upstream reactor modules, then from the local configuration, a
 * later declaration overriding an earlier one.
 */
@Mojo( name = "bundle-manifest", defaultPhase = LifecyclePhase.GENERATE_RESOURCES, requiresDependencyResolution = ResolutionScope.COMPILE, threadSafe = true )
public class BundleManifestMojo
    extends AbstractMojo
{

    // --- usual plugin parameters ----------------------------------

    @Parameter( defaultValue = "${project}", readonly = true, required = true )
    MavenProject project;

    @Parameter( defaultValue = "${session}", readonly = true, required = true )
    MavenSession session;

    @Parameter( defaultValue = "${project.build.directory}/webpack", required = true )
    File outputDirectory;

    /**
     * Runtime npm dependencies of the bundle, keyed by package name.
     */
    @Parameter
    Map<String, String> npmDependencies;

    /**
     * Development npm dependencies of the bundle, keyed by package name.
     */
    @Parameter
    Map<String, String> npmDevDependencies;

    /**
     * Versions of the bundler packages, overriding the defaults for the packages they name.
     */
    @Parameter
    Map<String, String> bundlerDependencies;

    @Parameter( property = "tesla.workers.scanDependencyJars", defaultValue = "true" )
    boolean scanDependencyJars;

    @Parameter( property = "tesla.workers.skip", defaultValue = "false" )
    boolean skip;

    // --- components -----------------------------------------------

    private final MavenModuleGraphBuilder graphBuilder;

    private final Logger logger;

    @Inject
    public BundleManifestMojo( MavenModuleGraphBuilder graphBuilder, Logger logger )
    {
        this.graphBuilder = graphBuilder;
        this.logger = logger;
    }

    // --- mojo logic -----------------------------------------------

    public void execute()
        throws MojoExecutionException
    {
        if ( skip )
        {
            getLog().info( "Skipping bundle manifest" );
            return;
        }

        try
        {
            AggregateResult aggregate = aggregate();

            Map<String, String> bundler = PackageJsonWriter.webpackDefaults();
            if ( bundlerDependencies != null )
            {
                bundler.putAll( bundlerDependencies );
            }

            File manifest = new PackageJsonWriter( bundler ).write( aggregate, outputDirectory );
            List<File> fragments = new SourceFragmentWriter().write( aggregate, outputDirectory );

            getLog().info( "Wrote " + manifest + " with " + aggregate.getDependencies().size() + " dependencies, "
                + aggregate.getDevDependencies().size() + " dev dependencies and " + fragments.size()
                + " bundle sources" );
        }
        catch ( IOException e )
        {
            throw new MojoExecutionException( e.getMessage(), e );
        }
        catch ( BuildException e )
        {
            throw new MojoExecutionException( e.getMessage(), e );
        }
    }

    AggregateResult aggregate()
        throws IOException
    {
        AggregateResult external = AggregateResult.EMPTY;
        if ( scanDependencyJars )
        {
            JarFacts jarFacts = new JarFacts();
            for ( Artifact artifact : project.getArtifacts() )
            {
                File file = artifact.getFile();
                if ( file != null && file.isFile() && file.getName().endsWith( ".jar" ) )
                {
                    external = external.merge( AggregateResult.of( jarFacts.read( file ) ) );
                }
            }
        }

        List<MavenProject> projects = session.getProjects();
        if ( projects == null || !projects.contains( project ) )
        {
            projects = new ArrayList<MavenProject>( projects != null ? projects : new ArrayList<MavenProject>() );
            projects.add( project );
        }
        ModuleGraph graph = graphBuilder.build( projects );
        String moduleId = MavenModuleGraphBuilder.moduleId( project );
        List<String> upstream = graph.getModule( moduleId ).getDependencyIds();

        // the module's own properties are part of its graph node, consumed here as local configuration
        List<Fact> local = new ArrayList<Fact>( graph.getModule( moduleId ).getLocalFacts() );
        local.addAll( toFacts( npmDependencies, false ) );
        local.addAll( toFacts( npmDevDependencies, true ) );

        graph.checkAcyclic( moduleId );
        AggregateResult reactor = new DependencyAggregator( graph, logger ).aggregate( local, upstream );

        return external.merge( reactor );
    }

    private static List<Fact> toFacts( Map<String, String> dependencies, boolean dev )
    {
        List<Fact> facts = new ArrayList<Fact>();
        if ( dependencies != null )
        {
            for ( Map.Entry<String, String> dependency : dependencies.entrySet() )
            {
                facts.add( dev ? NamedDependency.dev( dependency.getKey(), dependency.getValue() )
                                : NamedDependency.runtime( dependency.getKey(), dependency.getValue() ) );
            }
        }
        return facts;
    }

}
