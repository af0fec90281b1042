package org.eclipse.tesla.workers.generate;

/*******************************************************************************
 * Copyright (c) 2011 Sonatype, Inc.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Public License v1.0
 * which accompanies this distribution, and is available at
 *   http://www.eclipse.org/legal/epl-v10.html
 *******************************************************************************/

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Resolves formats by file name suffix. Rules are tried in the order they were added and file names matching no rule
 * get the default format, so every file name resolves to some format.
 */
public class SuffixFormatResolver
    implements FormatResolver
{

    private final Map<String, String> rules;

    private final String defaultFormat;

    private final String prefix;

    public SuffixFormatResolver( Map<String, String> rules, String defaultFormat )
    {
        this( rules, defaultFormat, "" );
    }

    private SuffixFormatResolver( Map<String, String> rules, String defaultFormat, String prefix )
    {
        if ( rules == null )
        {
            throw new IllegalArgumentException( "format rules not specified" );
        }
        if ( defaultFormat == null )
        {
            throw new IllegalArgumentException( "default format not specified" );
        }
        this.rules = Collections.unmodifiableMap( new LinkedHashMap<String, String>( rules ) );
        this.defaultFormat = defaultFormat;
        this.prefix = ( prefix != null ) ? prefix : "";
    }

    /**
     * Creates the resolver for template files like {@code index.scala.html}.
     * 
     * @return The template format resolver, never {@code null}.
     */
    public static SuffixFormatResolver templates()
    {
        Map<String, String> rules = new LinkedHashMap<String, String>();
        rules.put( "html", "HtmlFormat" );
        rules.put( "xml", "XmlFormat" );
        rules.put( "js", "JavaScriptFormat" );
        return new SuffixFormatResolver( rules, "TxtFormat" );
    }

    /**
     * Creates a resolver that qualifies each format with the specified prefix, e.g. a package name.
     * 
     * @param prefix The prefix, may be {@code null} for none.
     * @return The new resolver, never {@code null}.
     */
    public SuffixFormatResolver withPrefix( String prefix )
    {
        return new SuffixFormatResolver( rules, defaultFormat, prefix );
    }

    public String resolve( String fileName )
    {
        if ( fileName == null )
        {
            throw new IllegalArgumentException( "file name not specified" );
        }
        for ( Map.Entry<String, String> rule : rules.entrySet() )
        {
            if ( fileName.endsWith( rule.getKey() ) )
            {
                return prefix + rule.getValue();
            }
        }
        return prefix + defaultFormat;
    }

}
