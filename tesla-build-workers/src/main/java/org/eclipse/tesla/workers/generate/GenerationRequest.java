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
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Describes a single run of a generation step.
 */
public class GenerationRequest
{

    private final List<File> toolInputs;

    private final List<SourceFile> sources;

    private final File outputDirectory;

    private Map<String, String> options = Collections.emptyMap();

    private FormatResolver formatResolver = SuffixFormatResolver.templates();

    private FailurePolicy failurePolicy = FailurePolicy.COLLECT_ALL;

    private int parallelism = 1;

    /**
     * @param toolInputs The files the tool handle is built from, must not be {@code null}.
     * @param sources The input files to process, must not be {@code null}.
     * @param outputDirectory The directory to write output to, must not be {@code null}.
     */
    public GenerationRequest( Collection<File> toolInputs, Collection<SourceFile> sources, File outputDirectory )
    {
        if ( toolInputs == null )
        {
            throw new IllegalArgumentException( "tool inputs not specified" );
        }
        if ( sources == null )
        {
            throw new IllegalArgumentException( "sources not specified" );
        }
        if ( outputDirectory == null )
        {
            throw new IllegalArgumentException( "output directory not specified" );
        }
        this.toolInputs = Collections.unmodifiableList( new ArrayList<File>( toolInputs ) );
        this.sources = Collections.unmodifiableList( new ArrayList<SourceFile>( sources ) );
        this.outputDirectory = outputDirectory;
    }

    public List<File> getToolInputs()
    {
        return toolInputs;
    }

    public List<SourceFile> getSources()
    {
        return sources;
    }

    public File getOutputDirectory()
    {
        return outputDirectory;
    }

    public Map<String, String> getOptions()
    {
        return options;
    }

    public GenerationRequest setOptions( Map<String, String> options )
    {
        this.options =
            ( options != null ) ? Collections.unmodifiableMap( new LinkedHashMap<String, String>( options ) )
                            : Collections.<String, String> emptyMap();
        return this;
    }

    public FormatResolver getFormatResolver()
    {
        return formatResolver;
    }

    public GenerationRequest setFormatResolver( FormatResolver formatResolver )
    {
        if ( formatResolver == null )
        {
            throw new IllegalArgumentException( "format resolver not specified" );
        }
        this.formatResolver = formatResolver;
        return this;
    }

    public FailurePolicy getFailurePolicy()
    {
        return failurePolicy;
    }

    public GenerationRequest setFailurePolicy( FailurePolicy failurePolicy )
    {
        if ( failurePolicy == null )
        {
            throw new IllegalArgumentException( "failure policy not specified" );
        }
        this.failurePolicy = failurePolicy;
        return this;
    }

    public int getParallelism()
    {
        return parallelism;
    }

    /**
     * Sets the number of files processed at once. Only honored for tool handles that are thread-safe.
     */
    public GenerationRequest setParallelism( int parallelism )
    {
        if ( parallelism < 1 )
        {
            throw new IllegalArgumentException( "parallelism must be positive: " + parallelism );
        }
        this.parallelism = parallelism;
        return this;
    }

}
