package org.eclipse.tesla.workers.tool;

/*******************************************************************************
 * Copyright (c) 2011 Sonatype, Inc.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Public License v1.0
 * which accompanies this distribution, and is available at
 *   http://www.eclipse.org/legal/epl-v10.html
 *******************************************************************************/

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.eclipse.tesla.workers.SessionInitException;
import org.eclipse.tesla.workers.ToolHandle;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class ProcessToolHandleFactoryTest
{

    private static final File SH = new File( "/bin/sh" );

    @TempDir
    File tmp;

    private File inputDirectory;

    private File outputDirectory;

    private File input;

    @BeforeEach
    public void setUp()
        throws IOException
    {
        inputDirectory = new File( tmp, "src" );
        outputDirectory = new File( tmp, "out" );
        input = new File( inputDirectory, "app/main.js" );
        input.getParentFile().mkdirs();
        new File( outputDirectory, "app" ).mkdirs();
        Files.write( input.toPath(), "console.log(1);".getBytes( StandardCharsets.UTF_8 ) );
    }

    @Test
    public void testSubstitutesPlaceholdersAndAppendsOptions()
    {
        ProcessToolHandleFactory factory =
            new ProcessToolHandleFactory( "webpack", Arrays.asList( "node", "webpack", "--entry={input}",
                                                                    "--out={output}", "--mode={format}",
                                                                    "--path={outputDir}" ), null );
        Map<String, String> options = new LinkedHashMap<String, String>();
        options.put( "profile", "true" );
        options.put( "bail", "true" );

        List<String> args = factory.newCommandLine( input, inputDirectory, outputDirectory, "production", options );

        assertThat( args ).containsExactly( "node", "webpack", "--entry=" + input.getAbsolutePath(),
                                            "--out=" + new File( outputDirectory, "app/main.js" ).getAbsolutePath(),
                                            "--mode=production", "--path=" + outputDirectory.getAbsolutePath(),
                                            "--bail=true", "--profile=true" );
    }

    @Test
    public void testRunsCommandPerInput()
        throws IOException
    {
        assumeTrue( SH.canExecute() );

        ToolHandle handle =
            new ProcessToolHandleFactory( "copy", Arrays.asList( SH.getPath(), "-c", "cp \"$0\" \"$1\"", "{input}",
                                                                 "{output}" ), tmp ).newHandle( Collections.singleton( SH ) );

        handle.invoke( input, inputDirectory, outputDirectory, "JavaScriptFormat", Collections.<String, String> emptyMap() );

        assertThat( new String( Files.readAllBytes( new File( outputDirectory, "app/main.js" ).toPath() ),
                                StandardCharsets.UTF_8 ) ).isEqualTo( "console.log(1);" );
    }

    @Test
    public void testNonZeroExitFailsWithOutput()
        throws IOException
    {
        assumeTrue( SH.canExecute() );

        ToolHandle handle =
            new ProcessToolHandleFactory( "broken", Arrays.asList( SH.getPath(), "-c", "echo bad config; exit 3" ),
                                          null ).newHandle( Collections.singleton( SH ) );

        assertThatThrownBy( () -> handle.invoke( input, inputDirectory, outputDirectory, "TxtFormat", Collections.<String, String> emptyMap() ) ).isInstanceOf( IOException.class ).hasMessageContaining( "exited with code 3" ).hasMessageContaining( "bad config" );
    }

    @Test
    public void testToolOutputIsDecodedAsUtf8ByDefault()
        throws IOException
    {
        assumeTrue( SH.canExecute() );

        ToolHandle handle =
            new ProcessToolHandleFactory( "broken", Arrays.asList( SH.getPath(), "-c", "printf 'caf\\303\\251'; exit 1" ),
                                          null ).newHandle( Collections.singleton( SH ) );

        assertThatThrownBy( () -> handle.invoke( input, inputDirectory, outputDirectory, "TxtFormat", Collections.<String, String> emptyMap() ) ).isInstanceOf( IOException.class ).hasMessageEndingWith( "caf\u00e9" );
    }

    @Test
    public void testToolOutputIsDecodedWithConfiguredCharset()
        throws IOException
    {
        assumeTrue( SH.canExecute() );

        ToolHandle handle =
            new ProcessToolHandleFactory( "broken", Arrays.asList( SH.getPath(), "-c", "printf 'caf\\351'; exit 1" ),
                                          null, StandardCharsets.ISO_8859_1, null ).newHandle( Collections.singleton( SH ) );

        assertThatThrownBy( () -> handle.invoke( input, inputDirectory, outputDirectory, "TxtFormat", Collections.<String, String> emptyMap() ) ).isInstanceOf( IOException.class ).hasMessageEndingWith( "caf\u00e9" );
    }

    @Test
    public void testMissingExecutableFailsConstruction()
    {
        File missing = new File( tmp, "node_modules/webpack/bin/webpack" );

        assertThatThrownBy( () -> new ProcessToolHandleFactory( "webpack", Arrays.asList( "node", missing.getPath() ), null ).newHandle( Collections.singleton( missing ) ) ).isInstanceOf( SessionInitException.class ).hasMessageContaining( "missing" );
    }

}
