package org.eclipse.tesla.workers;

/*******************************************************************************
 * Copyright (c) 2011 Sonatype, Inc.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Public License v1.0
 * which accompanies this distribution, and is available at
 *   http://www.eclipse.org/legal/epl-v10.html
 *******************************************************************************/

import java.io.File;

/**
 * Signals that a declared input file does not exist. Aborts the whole generation step.
 */
public class InputNotFoundException
    extends BuildException
{

    private static final long serialVersionUID = -4101785436339713937L;

    private final File input;

    public InputNotFoundException( File input )
    {
        super( "Input not found: " + input );
        this.input = input;
    }

    /**
     * Gets the missing input.
     * 
     * @return The missing input file, never {@code null}.
     */
    public File getInput()
    {
        return input;
    }

}
