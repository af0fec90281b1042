package org.eclipse.tesla.workers;

/*******************************************************************************
 * Copyright (c) 2011 Sonatype, Inc.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Public License v1.0
 * which accompanies this distribution, and is available at
 *   http://www.eclipse.org/legal/epl-v10.html
 *******************************************************************************/

import java.io.File;

import org.eclipse.tesla.workers.internal.Messages;

/**
 * Signals that the tool failed to process one input file. Carries the input file and the output directory so that
 * callers can retry just that file.
 */
public class InvocationException
    extends BuildException
{

    private static final long serialVersionUID = -1389245009387318713L;

    private final File input;

    private final File outputDirectory;

    public InvocationException( File input, File outputDirectory, Throwable cause )
    {
        super( Messages.format( input, 0, 0, "could not generate output into " + outputDirectory + ", "
            + Messages.describe( cause ), null ), cause );
        this.input = input;
        this.outputDirectory = outputDirectory;
    }

    public File getInput()
    {
        return input;
    }

    public File getOutputDirectory()
    {
        return outputDirectory;
    }

}
