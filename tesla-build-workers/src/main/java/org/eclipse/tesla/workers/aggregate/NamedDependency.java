package org.eclipse.tesla.workers.aggregate;

/*******************************************************************************
 * Copyright (c) 2011 Sonatype, Inc.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Public License v1.0
 * which accompanies this distribution, and is available at
 *   http://www.eclipse.org/legal/epl-v10.html
 *******************************************************************************/

/**
 * A dependency on an external package, e.g. an npm package required by the bundle.
 */
public final class NamedDependency
    extends Fact
{

    private final String name;

    private final String version;

    private final DependencyKind kind;

    public NamedDependency( String name, String version, DependencyKind kind )
    {
        if ( name == null || name.length() <= 0 )
        {
            throw new IllegalArgumentException( "dependency name not specified" );
        }
        if ( version == null )
        {
            throw new IllegalArgumentException( "version of dependency " + name + " not specified" );
        }
        if ( kind == null )
        {
            throw new IllegalArgumentException( "kind of dependency " + name + " not specified" );
        }
        this.name = name;
        this.version = version;
        this.kind = kind;
    }

    public static NamedDependency runtime( String name, String version )
    {
        return new NamedDependency( name, version, DependencyKind.RUNTIME );
    }

    public static NamedDependency dev( String name, String version )
    {
        return new NamedDependency( name, version, DependencyKind.DEV );
    }

    public String getName()
    {
        return name;
    }

    public String getVersion()
    {
        return version;
    }

    public DependencyKind getKind()
    {
        return kind;
    }

    @Override
    public boolean equals( Object obj )
    {
        if ( this == obj )
        {
            return true;
        }
        if ( !( obj instanceof NamedDependency ) )
        {
            return false;
        }
        NamedDependency that = (NamedDependency) obj;
        return name.equals( that.name ) && version.equals( that.version ) && kind == that.kind;
    }

    @Override
    public int hashCode()
    {
        int hash = 17;
        hash = hash * 31 + name.hashCode();
        hash = hash * 31 + version.hashCode();
        hash = hash * 31 + kind.hashCode();
        return hash;
    }

    @Override
    public String toString()
    {
        return name + "@" + version + ( kind == DependencyKind.DEV ? " (dev)" : "" );
    }

}
