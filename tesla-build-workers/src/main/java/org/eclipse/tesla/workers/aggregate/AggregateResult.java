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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The merged facts of a set of modules. Dependencies are kept in declaration order including duplicates, fragments are
 * keyed by identifier where a later fragment replaces an earlier one with the same identifier. Merging is associative,
 * but order-sensitive for colliding fragment identifiers.
 */
public final class AggregateResult
{

    public static final AggregateResult EMPTY =
        new AggregateResult( Collections.<NamedDependency> emptyList(), Collections.<NamedDependency> emptyList(),
                             Collections.<String, String> emptyMap() );

    private final List<NamedDependency> dependencies;

    private final List<NamedDependency> devDependencies;

    private final Map<String, String> fragments;

    private AggregateResult( List<NamedDependency> dependencies, List<NamedDependency> devDependencies,
                             Map<String, String> fragments )
    {
        this.dependencies = Collections.unmodifiableList( dependencies );
        this.devDependencies = Collections.unmodifiableList( devDependencies );
        this.fragments = Collections.unmodifiableMap( fragments );
    }

    /**
     * Creates an aggregate from the specified facts, in iteration order.
     * 
     * @param facts The facts, may be {@code null}.
     * @return The aggregate, never {@code null}.
     */
    public static AggregateResult of( Collection<? extends Fact> facts )
    {
        if ( facts == null || facts.isEmpty() )
        {
            return EMPTY;
        }

        List<NamedDependency> dependencies = new ArrayList<NamedDependency>();
        List<NamedDependency> devDependencies = new ArrayList<NamedDependency>();
        Map<String, String> fragments = new LinkedHashMap<String, String>();

        for ( Fact fact : facts )
        {
            if ( fact instanceof NamedDependency )
            {
                NamedDependency dependency = (NamedDependency) fact;
                if ( dependency.getKind() == DependencyKind.DEV )
                {
                    devDependencies.add( dependency );
                }
                else
                {
                    dependencies.add( dependency );
                }
            }
            else if ( fact instanceof SourceFragment )
            {
                SourceFragment fragment = (SourceFragment) fact;
                fragments.put( fragment.getIdentifier(), fragment.getContent() );
            }
            else if ( fact != null )
            {
                throw new IllegalArgumentException( "unsupported fact " + fact );
            }
        }

        return new AggregateResult( dependencies, devDependencies, fragments );
    }

    /**
     * Appends the specified aggregate to this one. Dependencies of the other aggregate follow those of this aggregate,
     * its fragments replace fragments of this aggregate with the same identifier.
     * 
     * @param other The aggregate to append, may be {@code null}.
     * @return The merged aggregate, never {@code null}.
     */
    public AggregateResult merge( AggregateResult other )
    {
        if ( other == null || other.isEmpty() )
        {
            return this;
        }
        if ( isEmpty() )
        {
            return other;
        }

        List<NamedDependency> dependencies = new ArrayList<NamedDependency>( this.dependencies );
        dependencies.addAll( other.dependencies );

        List<NamedDependency> devDependencies = new ArrayList<NamedDependency>( this.devDependencies );
        devDependencies.addAll( other.devDependencies );

        Map<String, String> fragments = new LinkedHashMap<String, String>( this.fragments );
        fragments.putAll( other.fragments );

        return new AggregateResult( dependencies, devDependencies, fragments );
    }

    /**
     * Merges the specified aggregates in iteration order, copying every fact once.
     * 
     * @param aggregates The aggregates to merge, must not be {@code null}.
     * @return The merged aggregate, never {@code null}.
     */
    public static AggregateResult mergeAll( Collection<AggregateResult> aggregates )
    {
        if ( aggregates == null )
        {
            throw new IllegalArgumentException( "aggregates not specified" );
        }

        List<NamedDependency> dependencies = new ArrayList<NamedDependency>();
        List<NamedDependency> devDependencies = new ArrayList<NamedDependency>();
        Map<String, String> fragments = new LinkedHashMap<String, String>();

        for ( AggregateResult aggregate : aggregates )
        {
            if ( aggregate != null )
            {
                dependencies.addAll( aggregate.dependencies );
                devDependencies.addAll( aggregate.devDependencies );
                fragments.putAll( aggregate.fragments );
            }
        }

        if ( dependencies.isEmpty() && devDependencies.isEmpty() && fragments.isEmpty() )
        {
            return EMPTY;
        }
        return new AggregateResult( dependencies, devDependencies, fragments );
    }

    public List<NamedDependency> getDependencies()
    {
        return dependencies;
    }

    public List<NamedDependency> getDevDependencies()
    {
        return devDependencies;
    }

    public List<NamedDependency> getDependencies( DependencyKind kind )
    {
        return ( kind == DependencyKind.DEV ) ? devDependencies : dependencies;
    }

    /**
     * Gets the source fragments.
     * 
     * @return The (read-only) fragment contents keyed by identifier, never {@code null}.
     */
    public Map<String, String> getFragments()
    {
        return fragments;
    }

    public boolean isEmpty()
    {
        return dependencies.isEmpty() && devDependencies.isEmpty() && fragments.isEmpty();
    }

    @Override
    public boolean equals( Object obj )
    {
        if ( this == obj )
        {
            return true;
        }
        if ( !( obj instanceof AggregateResult ) )
        {
            return false;
        }
        AggregateResult that = (AggregateResult) obj;
        return dependencies.equals( that.dependencies ) && devDependencies.equals( that.devDependencies )
            && fragments.equals( that.fragments );
    }

    @Override
    public int hashCode()
    {
        int hash = 17;
        hash = hash * 31 + dependencies.hashCode();
        hash = hash * 31 + devDependencies.hashCode();
        hash = hash * 31 + fragments.hashCode();
        return hash;
    }

    @Override
    public String toString()
    {
        return "dependencies=" + dependencies + ", devDependencies=" + devDependencies + ", fragments="
            + fragments.keySet();
    }

}
