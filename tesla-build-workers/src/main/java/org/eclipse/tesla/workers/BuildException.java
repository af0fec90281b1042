package org.eclipse.tesla.workers;

/*******************************************************************************
 * Copyright (c) 2011 Sonatype, Inc.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Public License v1.0
 * which accompanies this distribution, and is available at
 *   http://www.eclipse.org/legal/epl-v10.html
 *******************************************************************************/

/**
 * Base class of the failures raised while acquiring tool sessions, aggregating module facts or running generation
 * steps. Every subclass names the file or module implicated in the failure.
 */
public class BuildException
    extends RuntimeException
{

    private static final long serialVersionUID = 2961413468917290457L;

    public BuildException( String message )
    {
        super( message );
    }

    public BuildException( String message, Throwable cause )
    {
        super( message, cause );
    }

}
