package org.eclipse.tesla.workers;

/*******************************************************************************
 * Copyright (c) 2011 Sonatype, Inc.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Public License v1.0
 * which accompanies this distribution, and is available at
 *   http://www.eclipse.org/legal/epl-v10.html
 *******************************************************************************/

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Signals a cycle in a module graph. Cycles are configuration errors and always abort aggregation.
 */
public class CyclicDependencyException
    extends BuildException
{

    private static final long serialVersionUID = 7808519235217412046L;

    private final List<String> cycle;

    /**
     * @param cycle The module identifiers along the cycle, the first module repeated at the end.
     */
    public CyclicDependencyException( List<String> cycle )
    {
        super( "Cyclic module dependency: " + join( cycle ) );
        this.cycle = Collections.unmodifiableList( new ArrayList<String>( cycle ) );
    }

    public List<String> getCycle()
    {
        return cycle;
    }

    private static String join( List<String> cycle )
    {
        StringBuilder sb = new StringBuilder( 128 );
        for ( String id : cycle )
        {
            if ( sb.length() > 0 )
            {
                sb.append( " -> " );
            }
            sb.append( id );
        }
        return sb.toString();
    }

}
