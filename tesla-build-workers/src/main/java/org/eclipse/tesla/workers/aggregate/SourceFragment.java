package org.eclipse.tesla.workers.aggregate;

/*******************************************************************************
 * Copyright (c) 2011 Sonatype, Inc.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Public License v1.0
 * which accompanies this distribution, and is available at
 *   http://www.eclipse.org/legal/epl-v10.html
 *******************************************************************************/

/**
 * A generated source fragment, identified by the relative path it is written to.
 */
public final class SourceFragment
    extends Fact
{

    private final String identifier;

    private final String content;

    public SourceFragment( String identifier, String content )
    {
        if ( identifier == null || identifier.length() <= 0 )
        {
            throw new IllegalArgumentException( "fragment identifier not specified" );
        }
        if ( content == null )
        {
            throw new IllegalArgumentException( "content of fragment " + identifier + " not specified" );
        }
        this.identifier = identifier;
        this.content = content;
    }

    public String getIdentifier()
    {
        return identifier;
    }

    public String getContent()
    {
        return content;
    }

    @Override
    public boolean equals( Object obj )
    {
        if ( this == obj )
        {
            return true;
        }
        if ( !( obj instanceof SourceFragment ) )
        {
            return false;
        }
        SourceFragment that = (SourceFragment) obj;
        return identifier.equals( that.identifier ) && content.equals( that.content );
    }

    @Override
    public int hashCode()
    {
        return identifier.hashCode() * 31 + content.hashCode();
    }

    @Override
    public String toString()
    {
        return identifier + " (" + content.length() + " chars)";
    }

}
