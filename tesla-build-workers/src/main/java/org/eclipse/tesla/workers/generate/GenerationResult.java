package org.eclipse.tesla.workers.generate;

/*******************************************************************************
 * Copyright (c) 2011 Sonatype, Inc.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Public License v1.0
 * which accompanies this distribution, and is available at
 *   http://www.eclipse.org/legal/epl-v10.html
 *******************************************************************************/

import java.io.File;
import java.util.ArrayList;
import java.util.List;

import org.eclipse.tesla.workers.GenerationException;
import org.eclipse.tesla.workers.InvocationException;

/**
 * The outcome of a generation step. Instances are safe for concurrent updates while the step runs.
 */
public class GenerationResult
{

    private final File outputDirectory;

    private final List<File> processedFiles = new ArrayList<File>();

    private final List<InvocationException> errors = new ArrayList<InvocationException>();

    private final List<String> log = new ArrayList<String>();

    public GenerationResult( File outputDirectory )
    {
        this.outputDirectory = outputDirectory;
    }

    public File getOutputDirectory()
    {
        return outputDirectory;
    }

    public synchronized List<File> getProcessedFiles()
    {
        return new ArrayList<File>( processedFiles );
    }

    public synchronized List<InvocationException> getErrors()
    {
        return new ArrayList<InvocationException>( errors );
    }

    public synchronized List<String> getLog()
    {
        return new ArrayList<String>( log );
    }

    public synchronized boolean isSuccessful()
    {
        return errors.isEmpty();
    }

    /**
     * @throws GenerationException If any file failed to process.
     */
    public synchronized void failIfErrors()
    {
        if ( !errors.isEmpty() )
        {
            throw new GenerationException( errors );
        }
    }

    synchronized void addProcessed( File input, String message )
    {
        processedFiles.add( input );
        log.add( message );
    }

    synchronized void addError( InvocationException error )
    {
        errors.add( error );
        log.add( error.getMessage() );
    }

}
