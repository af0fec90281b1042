package org.eclipse.tesla.workers.aggregate;

/*******************************************************************************
 * Copyright (c) 2011 Sonatype, Inc.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Public License v1.0
 * which accompanies this distribution, and is available at
 *   http://www.eclipse.org/legal/epl-v10.html
 *******************************************************************************/

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Reads the facts a dependency jar contributes to a bundle:
 * <ul>
 * <li>the npm packages listed in its {@code NPM_DEPENDENCIES} entry, a JSON object whose
 * {@code compileDependencies} and {@code compileDevDependencies} members (or their hyphenated variants) hold arrays of
 * <code>{ "name": "version" }</code> objects,</li>
 * <li>every JavaScript file outside the {@code scala/} directory, as a source fragment keyed by its entry name.</li>
 * </ul>
 */
public class JarFacts
{

    static final String NPM_DEPENDENCIES = "NPM_DEPENDENCIES";

    private final ObjectMapper mapper;

    public JarFacts()
    {
        this( new ObjectMapper() );
    }

    public JarFacts( ObjectMapper mapper )
    {
        if ( mapper == null )
        {
            throw new IllegalArgumentException( "object mapper not specified" );
        }
        this.mapper = mapper;
    }

    /**
     * Reads the facts from the specified jar.
     * 
     * @param jar The jar file, must not be {@code null}.
     * @return The facts in entry order, never {@code null}.
     * @throws IOException If the jar could not be read or holds a malformed {@code NPM_DEPENDENCIES} entry.
     */
    public List<Fact> read( File jar )
        throws IOException
    {
        if ( jar == null )
        {
            throw new IllegalArgumentException( "jar not specified" );
        }

        List<Fact> facts = new ArrayList<Fact>();

        ZipInputStream zip = new ZipInputStream( new BufferedInputStream( new FileInputStream( jar ) ) );
        try
        {
            for ( ZipEntry entry = zip.getNextEntry(); entry != null; entry = zip.getNextEntry() )
            {
                String name = entry.getName();
                if ( entry.isDirectory() )
                {
                    continue;
                }
                if ( NPM_DEPENDENCIES.equals( name ) )
                {
                    readDependencies( jar, readString( zip ), facts );
                }
                else if ( name.endsWith( ".js" ) && !name.startsWith( "scala/" ) )
                {
                    facts.add( new SourceFragment( name, readString( zip ) ) );
                }
            }
        }
        finally
        {
            zip.close();
        }

        return facts;
    }

    private void readDependencies( File jar, String json, List<Fact> facts )
        throws IOException
    {
        JsonNode root = mapper.readTree( json );
        if ( root == null || !root.isObject() )
        {
            throw new IOException( "Malformed " + NPM_DEPENDENCIES + " in " + jar + ", expected a JSON object" );
        }

        addDependencies( jar, root.get( "compileDependencies" ), DependencyKind.RUNTIME, facts );
        addDependencies( jar, root.get( "compile-dependencies" ), DependencyKind.RUNTIME, facts );
        addDependencies( jar, root.get( "compileDevDependencies" ), DependencyKind.DEV, facts );
        addDependencies( jar, root.get( "compile-devDependencies" ), DependencyKind.DEV, facts );
    }

    private void addDependencies( File jar, JsonNode array, DependencyKind kind, List<Fact> facts )
        throws IOException
    {
        if ( array == null || array.isNull() )
        {
            return;
        }
        if ( !array.isArray() )
        {
            throw new IOException( "Malformed " + NPM_DEPENDENCIES + " in " + jar + ", expected an array of objects" );
        }
        for ( JsonNode element : array )
        {
            for ( Iterator<Map.Entry<String, JsonNode>> it = element.fields(); it.hasNext(); )
            {
                Map.Entry<String, JsonNode> field = it.next();
                facts.add( new NamedDependency( field.getKey(), field.getValue().asText(), kind ) );
            }
        }
    }

    private static String readString( InputStream is )
        throws IOException
    {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream( 1024 );
        byte[] bytes = new byte[8192];
        for ( int n; ( n = is.read( bytes ) ) >= 0; )
        {
            buffer.write( bytes, 0, n );
        }
        return new String( buffer.toByteArray(), StandardCharsets.UTF_8 );
    }

}
