package org.eclipse.tesla.workers.aggregate;

/*******************************************************************************
 * Copyright (c) 2011 Sonatype, Inc.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Public License v1.0
 * which accompanies this distribution, and is available at
 *   http://www.eclipse.org/legal/epl-v10.html
 *******************************************************************************/

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

public class SimpleBuildModule
    implements BuildModule
{

    private final String id;

    private final List<String> dependencyIds;

    private final List<Fact> localFacts;

    public SimpleBuildModule( String id, Collection<String> dependencyIds, Collection<? extends Fact> localFacts )
    {
        if ( id == null || id.length() <= 0 )
        {
            throw new IllegalArgumentException( "module identifier not specified" );
        }
        this.id = id;
        this.dependencyIds =
            ( dependencyIds != null ) ? Collections.unmodifiableList( new ArrayList<String>( dependencyIds ) )
                            : Collections.<String> emptyList();
        this.localFacts =
            ( localFacts != null ) ? Collections.unmodifiableList( new ArrayList<Fact>( localFacts ) )
                            : Collections.<Fact> emptyList();
    }

    public SimpleBuildModule( String id, List<? extends Fact> localFacts, String... dependencyIds )
    {
        this( id, Arrays.asList( dependencyIds ), localFacts );
    }

    public String getId()
    {
        return id;
    }

    public List<String> getDependencyIds()
    {
        return dependencyIds;
    }

    public Collection<? extends Fact> getLocalFacts()
    {
        return localFacts;
    }

    @Override
    public String toString()
    {
        return id + " -> " + dependencyIds;
    }

}
