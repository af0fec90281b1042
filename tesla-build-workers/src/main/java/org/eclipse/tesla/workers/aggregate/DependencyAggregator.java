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
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.FutureTask;

import org.eclipse.tesla.workers.BuildException;
import org.eclipse.tesla.workers.CyclicDependencyException;
import org.slf4j.Logger;
import org.slf4j.helpers.NOPLogger;

/**
 * Collects the facts of a module and of all modules it transitively depends on. The transitive modules are merged in
 * topological order, dependencies before their dependents and siblings in declaration order, each module exactly once.
 * The module's own local facts come last. A module thus wins fragment collisions against every module it depends on.
 * <p>
 * An aggregator memoizes the local facts and the aggregate of every module it visits and is meant to live for a single
 * build. It is safe for concurrent use, concurrent requests for the same module compute its aggregate once.
 */
public class DependencyAggregator
{

    private final Logger log;

    private final ModuleGraph graph;

    private final ConcurrentMap<String, FutureTask<AggregateResult>> locals;

    private final ConcurrentMap<String, FutureTask<AggregateResult>> aggregates;

    public DependencyAggregator( ModuleGraph graph )
    {
        this( graph, null );
    }

    public DependencyAggregator( ModuleGraph graph, Logger log )
    {
        if ( graph == null )
        {
            throw new IllegalArgumentException( "module graph not specified" );
        }
        this.graph = graph;
        this.log = ( log != null ) ? log : NOPLogger.NOP_LOGGER;
        this.locals = new ConcurrentHashMap<String, FutureTask<AggregateResult>>();
        this.aggregates = new ConcurrentHashMap<String, FutureTask<AggregateResult>>();
    }

    /**
     * Aggregates the facts of the specified module and its transitive dependencies.
     * 
     * @param moduleId The identifier of the module, must not be {@code null}.
     * @return The aggregate, never {@code null}.
     * @throws CyclicDependencyException If a cycle is reachable from the module.
     */
    public AggregateResult aggregate( final String moduleId )
    {
        final List<String> order = graph.checkAcyclic( moduleId );

        return memoize( aggregates, moduleId, new Callable<AggregateResult>()
        {
            public AggregateResult call()
            {
                AggregateResult result = mergeLocals( order );
                if ( log.isDebugEnabled() )
                {
                    log.debug( "Aggregated module " + moduleId + " over " + order + ": " + result );
                }
                return result;
            }
        } );
    }

    /**
     * Aggregates the specified modules with their transitive dependencies, followed by the specified local facts. The
     * modules are merged in topological order, a module shared by several of them is merged once.
     * 
     * @param localFacts The facts declared by the requesting module itself, may be {@code null}.
     * @param transitiveModuleIds The identifiers of the modules to aggregate first, must not be {@code null}.
     * @return The aggregate, never {@code null}.
     * @throws CyclicDependencyException If a cycle is reachable from any of the modules.
     */
    public AggregateResult aggregate( Collection<? extends Fact> localFacts, Collection<String> transitiveModuleIds )
    {
        if ( transitiveModuleIds == null )
        {
            throw new IllegalArgumentException( "modules not specified" );
        }

        // each closure lists dependencies first, so the union keeps every module behind its dependencies
        Set<String> order = new LinkedHashSet<String>();
        for ( String moduleId : transitiveModuleIds )
        {
            order.addAll( graph.checkAcyclic( moduleId ) );
        }

        AggregateResult result = mergeLocals( order );
        return merge( result, AggregateResult.of( localFacts ), "local configuration" );
    }

    private AggregateResult mergeLocals( Collection<String> order )
    {
        List<AggregateResult> parts = new ArrayList<AggregateResult>( order.size() );
        Map<String, String> fragments = new HashMap<String, String>();
        for ( String moduleId : order )
        {
            AggregateResult local = getLocal( moduleId );
            checkCollisions( fragments, local, moduleId );
            fragments.putAll( local.getFragments() );
            parts.add( local );
        }
        return AggregateResult.mergeAll( parts );
    }

    private AggregateResult getLocal( String moduleId )
    {
        final BuildModule module = graph.getModule( moduleId );
        return memoize( locals, moduleId, new Callable<AggregateResult>()
        {
            public AggregateResult call()
            {
                return AggregateResult.of( module.getLocalFacts() );
            }
        } );
    }

    private static AggregateResult memoize( ConcurrentMap<String, FutureTask<AggregateResult>> memo, String moduleId,
                                            Callable<AggregateResult> computation )
    {
        FutureTask<AggregateResult> task = memo.get( moduleId );
        if ( task == null )
        {
            FutureTask<AggregateResult> newTask = new FutureTask<AggregateResult>( computation );
            task = memo.putIfAbsent( moduleId, newTask );
            if ( task == null )
            {
                task = newTask;
                task.run();
            }
        }

        try
        {
            return task.get();
        }
        catch ( InterruptedException e )
        {
            Thread.currentThread().interrupt();
            throw new BuildException( "Interrupted while aggregating module " + moduleId, e );
        }
        catch ( ExecutionException e )
        {
            Throwable cause = e.getCause();
            if ( cause instanceof RuntimeException )
            {
                throw (RuntimeException) cause;
            }
            if ( cause instanceof Error )
            {
                throw (Error) cause;
            }
            throw new BuildException( "Could not aggregate module " + moduleId, cause );
        }
    }

    private AggregateResult merge( AggregateResult base, AggregateResult addition, String source )
    {
        checkCollisions( base.getFragments(), addition, source );
        return base.merge( addition );
    }

    private void checkCollisions( Map<String, String> fragments, AggregateResult addition, String source )
    {
        for ( Map.Entry<String, String> fragment : addition.getFragments().entrySet() )
        {
            String previous = fragments.get( fragment.getKey() );
            if ( previous != null && !previous.equals( fragment.getValue() ) )
            {
                log.warn( "Source fragment " + fragment.getKey() + " from " + source
                    + " overrides a different fragment with the same identifier" );
            }
        }
    }

}
