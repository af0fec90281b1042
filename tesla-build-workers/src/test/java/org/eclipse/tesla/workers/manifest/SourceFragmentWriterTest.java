package org.eclipse.tesla.workers.manifest;

/*******************************************************************************
 * Copyright (c) 2011 Sonatype, Inc.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Public License v1.0
 * which accompanies this distribution, and is available at
 *   http://www.eclipse.org/legal/epl-v10.html
 *******************************************************************************/

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.Collections;

import org.eclipse.tesla.workers.aggregate.AggregateResult;
import org.eclipse.tesla.workers.aggregate.SourceFragment;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class SourceFragmentWriterTest
{

    @TempDir
    File tmp;

    @Test
    public void testWritesFragmentsBelowOutputDirectory()
        throws IOException
    {
        File existing = new File( tmp, "keep.txt" );
        Files.write( existing.toPath(), new byte[] { 1 } );
        AggregateResult aggregate =
            AggregateResult.of( Arrays.asList( new SourceFragment( "lib/helper.js", "exports.help = true;" ),
                                               new SourceFragment( "main.js", "require('./lib/helper');" ) ) );

        new SourceFragmentWriter().write( aggregate, tmp );

        assertThat( new String( Files.readAllBytes( new File( tmp, "lib/helper.js" ).toPath() ),
                                StandardCharsets.UTF_8 ) ).isEqualTo( "exports.help = true;" );
        assertThat( new File( tmp, "main.js" ) ).exists();
        assertThat( existing ).exists();
    }

    @Test
    public void testRejectsFragmentsOutsideOutputDirectory()
    {
        AggregateResult aggregate =
            AggregateResult.of( Collections.singletonList( new SourceFragment( "../evil.js", "x" ) ) );

        assertThatThrownBy( () -> new SourceFragmentWriter().write( aggregate, new File( tmp, "out" ) ) ).isInstanceOf( IOException.class ).hasMessageContaining( "../evil.js" );
    }

}
