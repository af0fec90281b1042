package org.eclipse.tesla.workers.maven;

/*******************************************************************************
 * Copyright (c) 2011 Sonatype, Inc.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Public License v1.0
 * which accompanies this distribution, and is available at
 *   http://www.eclipse.org/legal/epl-v10.html
 *******************************************************************************/

import java.io.File;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.apache.maven.artifact.Artifact;
import org.eclipse.tesla.workers.SessionInitException;

/**
 * Selects the files of resolved plugin dependencies that make up the classpath of a tool. The selected files are both
 * the class path of the tool's isolated class loader and the inputs of its session fingerprint.
 */
public final class MavenToolClasspath
{

    private MavenToolClasspath()
    {
        // hide
    }

    /**
     * Selects the artifacts matching any of the given keys. A key is either {@code groupId:artifactId} or a bare
     * {@code groupId}, the latter selecting every artifact of the group. Artifacts keep their resolution order.
     * 
     * @param toolId The identifier of the tool whose classpath is selected, used for error reporting.
     * @param artifacts The resolved plugin artifacts, may be {@code null}.
     * @param keys The keys of the artifacts to select, must not be {@code null}.
     * @return The files of the selected artifacts, never {@code null}.
     * @throws SessionInitException If a key matches no artifact or a matching artifact is not resolved.
     */
    public static List<File> select( String toolId, Collection<Artifact> artifacts, Collection<String> keys )
    {
        if ( keys == null )
        {
            throw new IllegalArgumentException( "tool artifacts not specified" );
        }

        Set<File> files = new LinkedHashSet<File>();
        List<String> unmatched = new ArrayList<String>();

        for ( String key : keys )
        {
            boolean matched = false;
            if ( artifacts != null )
            {
                for ( Artifact artifact : artifacts )
                {
                    if ( matches( artifact, key ) )
                    {
                        if ( artifact.getFile() == null )
                        {
                            throw new SessionInitException( toolId, files, "artifact " + artifact.getId()
                                + " has not been resolved" );
                        }
                        files.add( artifact.getFile() );
                        matched = true;
                    }
                }
            }
            if ( !matched )
            {
                unmatched.add( key );
            }
        }

        if ( !unmatched.isEmpty() )
        {
            throw new SessionInitException( toolId, files, "no plugin dependency matches " + unmatched );
        }

        return new ArrayList<File>( files );
    }

    static boolean matches( Artifact artifact, String key )
    {
        int colon = key.indexOf( ':' );
        if ( colon < 0 )
        {
            return key.equals( artifact.getGroupId() );
        }
        return key.substring( 0, colon ).equals( artifact.getGroupId() )
            && key.substring( colon + 1 ).equals( artifact.getArtifactId() );
    }

}
