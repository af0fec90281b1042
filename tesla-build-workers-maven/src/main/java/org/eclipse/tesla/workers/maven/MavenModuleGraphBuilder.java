package org.eclipse.tesla.workers.maven;

/*******************************************************************************
 * Copyright (c) 2011 Sonatype, Inc.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Public License v1.0
 * which accompanies this distribution, and is available at
 *   http://www.eclipse.org/legal/epl-v10.html
 *******************************************************************************/

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.TreeMap;

import javax.inject.Inject;
import javax.inject.Named;

import org.apache.maven.model.Dependency;
import org.apache.maven.project.MavenProject;
import org.eclipse.tesla.workers.aggregate.Fact;
import org.eclipse.tesla.workers.aggregate.ModuleGraph;
import org.eclipse.tesla.workers.aggregate.NamedDependency;
import org.eclipse.tesla.workers.aggregate.SimpleBuildModule;
import org.slf4j.Logger;
import org.slf4j.helpers.NOPLogger;

/**
 * Builds the module graph of a reactor. Each project becomes a module whose dependencies are the reactor projects it
 * declares as dependencies and whose local facts are the npm dependencies declared through project properties.
 */
@Named
public class MavenModuleGraphBuilder
{

    public static final String DEPENDENCY_PREFIX = "npm.dependency.";

    public static final String DEV_DEPENDENCY_PREFIX = "npm.devDependency.";

    private final Logger log;

    public MavenModuleGraphBuilder()
    {
        this( null );
    }

    @Inject
    public MavenModuleGraphBuilder( Logger log )
    {
        this.log = ( log != null ) ? log : NOPLogger.NOP_LOGGER;
    }

    public ModuleGraph build( Collection<MavenProject> projects )
    {
        if ( projects == null )
        {
            throw new IllegalArgumentException( "projects not specified" );
        }

        Set<String> reactor = new HashSet<String>();
        for ( MavenProject project : projects )
        {
            reactor.add( moduleId( project ) );
        }

        ModuleGraph graph = new ModuleGraph();

        for ( MavenProject project : projects )
        {
            List<String> dependencyIds = new ArrayList<String>();
            for ( Dependency dependency : project.getDependencies() )
            {
                String id = dependency.getGroupId() + ":" + dependency.getArtifactId();
                if ( reactor.contains( id ) && !dependencyIds.contains( id ) )
                {
                    dependencyIds.add( id );
                }
            }

            List<Fact> facts = factsFromProperties( project.getProperties() );

            if ( log.isDebugEnabled() )
            {
                log.debug( "Module " + moduleId( project ) + " depends on " + dependencyIds + " with " + facts.size()
                    + " local facts" );
            }

            graph.addModule( new SimpleBuildModule( moduleId( project ), dependencyIds, facts ) );
        }

        return graph;
    }

    public static String moduleId( MavenProject project )
    {
        return project.getGroupId() + ":" + project.getArtifactId();
    }

    /**
     * Extracts the npm dependencies declared by properties of the form {@code npm.dependency.<name>=<version>} and
     * {@code npm.devDependency.<name>=<version>}. Runtime dependencies come first, each kind sorted by name.
     */
    public static List<Fact> factsFromProperties( Properties properties )
    {
        if ( properties == null || properties.isEmpty() )
        {
            return Collections.emptyList();
        }

        Map<String, String> runtime = new TreeMap<String, String>();
        Map<String, String> dev = new TreeMap<String, String>();

        for ( String key : properties.stringPropertyNames() )
        {
            if ( key.startsWith( DEPENDENCY_PREFIX ) && key.length() > DEPENDENCY_PREFIX.length() )
            {
                runtime.put( key.substring( DEPENDENCY_PREFIX.length() ), properties.getProperty( key ).trim() );
            }
            else if ( key.startsWith( DEV_DEPENDENCY_PREFIX ) && key.length() > DEV_DEPENDENCY_PREFIX.length() )
            {
                dev.put( key.substring( DEV_DEPENDENCY_PREFIX.length() ), properties.getProperty( key ).trim() );
            }
        }

        List<Fact> facts = new ArrayList<Fact>( runtime.size() + dev.size() );
        for ( Map.Entry<String, String> entry : runtime.entrySet() )
        {
            facts.add( NamedDependency.runtime( entry.getKey(), entry.getValue() ) );
        }
        for ( Map.Entry<String, String> entry : dev.entrySet() )
        {
            facts.add( NamedDependency.dev( entry.getKey(), entry.getValue() ) );
        }
        return facts;
    }

}
