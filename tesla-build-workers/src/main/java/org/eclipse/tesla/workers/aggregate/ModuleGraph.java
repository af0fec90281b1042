package org.eclipse.tesla.workers.aggregate;

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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.eclipse.tesla.workers.CyclicDependencyException;

/**
 * A directed graph of build modules, edges point from a module to the modules it depends on. The graph is populated
 * before it is traversed and is not modified afterwards.
 */
public class ModuleGraph
{

    private final Map<String, BuildModule> modules;

    public ModuleGraph()
    {
        modules = new LinkedHashMap<String, BuildModule>();
    }

    public ModuleGraph( Collection<? extends BuildModule> modules )
    {
        this();
        for ( BuildModule module : modules )
        {
            addModule( module );
        }
    }

    public ModuleGraph addModule( BuildModule module )
    {
        if ( module == null )
        {
            throw new IllegalArgumentException( "module not specified" );
        }
        if ( modules.containsKey( module.getId() ) )
        {
            throw new IllegalArgumentException( "duplicate module " + module.getId() );
        }
        modules.put( module.getId(), module );
        return this;
    }

    /**
     * Gets the module with the specified identifier.
     * 
     * @param id The module identifier, must not be {@code null}.
     * @return The module, never {@code null}.
     * @throws IllegalArgumentException If the graph has no such module.
     */
    public BuildModule getModule( String id )
    {
        BuildModule module = modules.get( id );
        if ( module == null )
        {
            throw new IllegalArgumentException( "unknown module " + id );
        }
        return module;
    }

    public boolean containsModule( String id )
    {
        return modules.containsKey( id );
    }

    public Collection<BuildModule> getModules()
    {
        return Collections.unmodifiableCollection( modules.values() );
    }

    /**
     * Verifies that no cycle is reachable from the specified module and computes its transitive closure.
     * 
     * @param id The identifier of the start module, must not be {@code null}.
     * @return The identifiers of the start module and all modules reachable from it, dependencies before dependents,
     *         never {@code null}.
     * @throws CyclicDependencyException If a cycle is reachable from the module.
     * @throws IllegalArgumentException If the module or one of its transitive dependencies is unknown.
     */
    public List<String> checkAcyclic( String id )
    {
        List<String> order = new ArrayList<String>();
        visit( getModule( id ), new ArrayList<String>(), new HashSet<String>(), order );
        return order;
    }

    private void visit( BuildModule module, List<String> path, Set<String> done, List<String> order )
    {
        String id = module.getId();
        if ( done.contains( id ) )
        {
            return;
        }

        int index = path.indexOf( id );
        if ( index >= 0 )
        {
            List<String> cycle = new ArrayList<String>( path.subList( index, path.size() ) );
            cycle.add( id );
            throw new CyclicDependencyException( cycle );
        }

        path.add( id );
        for ( String dependencyId : module.getDependencyIds() )
        {
            BuildModule dependency = modules.get( dependencyId );
            if ( dependency == null )
            {
                throw new IllegalArgumentException( "module " + id + " depends on unknown module " + dependencyId );
            }
            visit( dependency, path, done, order );
        }
        path.remove( path.size() - 1 );

        done.add( id );
        order.add( id );
    }

}
