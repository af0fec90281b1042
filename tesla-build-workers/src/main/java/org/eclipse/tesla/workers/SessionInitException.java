package org.eclipse.tesla.workers;

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
import java.util.Collections;
import java.util.List;

/**
 * Signals that the handle to an external tool could not be constructed, e.g. because the tool is missing from its
 * classpath, no adapter supports the requested tool version or the tool binary failed to start.
 */
public class SessionInitException
    extends BuildException
{

    private static final long serialVersionUID = 5532713096475391166L;

    private final String toolId;

    private final List<File> inputs;

    public SessionInitException( String toolId, Collection<File> inputs, String message )
    {
        this( toolId, inputs, message, null );
    }

    public SessionInitException( String toolId, Collection<File> inputs, String message, Throwable cause )
    {
        super( "Could not initialize tool " + toolId + " from " + inputs + ": " + message, cause );
        this.toolId = toolId;
        this.inputs =
            ( inputs != null ) ? Collections.unmodifiableList( new ArrayList<File>( inputs ) )
                            : Collections.<File> emptyList();
    }

    public String getToolId()
    {
        return toolId;
    }

    public List<File> getInputs()
    {
        return inputs;
    }

}
