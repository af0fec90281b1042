package org.eclipse.tesla.workers.manifest;

/*******************************************************************************
 * Copyright (c) 2011 Sonatype, Inc.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Public License v1.0
 * which accompanies this distribution, and is available at
 *   http://www.eclipse.org/legal/epl-v10.html
 *******************************************************************************/

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.eclipse.tesla.workers.aggregate.AggregateResult;
import org.eclipse.tesla.workers.aggregate.NamedDependency;

import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Writes an npm {@code package.json} listing the aggregated runtime and development dependencies. The tool packages the
 * bundler itself needs are appended to the development dependencies. A package that is listed several times ends up
 * with the version of its last declaration.
 */
public class PackageJsonWriter
    implements ManifestWriter
{

    public static final String FILENAME = "package.json";

    private final ObjectMapper mapper;

    private final Map<String, String> toolDependencies;

    public PackageJsonWriter()
    {
        this( webpackDefaults() );
    }

    public PackageJsonWriter( Map<String, String> toolDependencies )
    {
        this( new ObjectMapper(), toolDependencies );
    }

    public PackageJsonWriter( ObjectMapper mapper, Map<String, String> toolDependencies )
    {
        if ( mapper == null )
        {
            throw new IllegalArgumentException( "object mapper not specified" );
        }
        this.mapper = mapper;
        this.toolDependencies =
            ( toolDependencies != null ) ? Collections.unmodifiableMap( new LinkedHashMap<String, String>( toolDependencies ) )
                            : Collections.<String, String> emptyMap();
    }

    /**
     * Gets the development dependencies of a webpack based bundle.
     * 
     * @return The (modifiable) package versions keyed by package name, never {@code null}.
     */
    public static Map<String, String> webpackDefaults()
    {
        Map<String, String> defaults = new LinkedHashMap<String, String>();
        defaults.put( "webpack", "4.43.0" );
        defaults.put( "webpack-merge", "4.2.2" );
        defaults.put( "webpack-cli", "3.3.11" );
        defaults.put( "source-map-loader", "1.0.0" );
        defaults.put( "scalajs-friendly-source-map-loader", "0.1.5" );
        return defaults;
    }

    public File write( AggregateResult aggregate, File outputDirectory )
        throws IOException
    {
        if ( aggregate == null )
        {
            throw new IllegalArgumentException( "aggregate not specified" );
        }
        if ( outputDirectory == null )
        {
            throw new IllegalArgumentException( "output directory not specified" );
        }

        File file = new File( outputDirectory, FILENAME );
        Files.createDirectories( outputDirectory.toPath() );
        Files.write( file.toPath(), render( aggregate ).getBytes( StandardCharsets.UTF_8 ) );
        return file;
    }

    String render( AggregateResult aggregate )
        throws IOException
    {
        ObjectNode root = mapper.createObjectNode();

        ObjectNode dependencies = root.putObject( "dependencies" );
        for ( NamedDependency dependency : aggregate.getDependencies() )
        {
            dependencies.put( dependency.getName(), dependency.getVersion() );
        }

        ObjectNode devDependencies = root.putObject( "devDependencies" );
        for ( NamedDependency dependency : aggregate.getDevDependencies() )
        {
            devDependencies.put( dependency.getName(), dependency.getVersion() );
        }
        for ( Map.Entry<String, String> dependency : toolDependencies.entrySet() )
        {
            devDependencies.put( dependency.getKey(), dependency.getValue() );
        }

        DefaultPrettyPrinter printer = new DefaultPrettyPrinter();
        printer.indentObjectsWith( new DefaultIndenter( "  ", "\n" ) );

        return mapper.writer( printer ).writeValueAsString( root ) + "\n";
    }

}
