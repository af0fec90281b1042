package org.eclipse.tesla.workers;

/*******************************************************************************
 * Copyright (c) 2011 Sonatype, Inc.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Public License v1.0
 * which accompanies this distribution, and is available at
 *   http://www.eclipse.org/legal/epl-v10.html
 *******************************************************************************/

import java.io.Closeable;
import java.io.File;
import java.io.IOException;
import java.util.Map;

/**
 * A live binding to an external tool like a template compiler, a source formatter or a bundler. Handles are expensive
 * to construct and cheap to reuse, they are owned by a {@link WorkerSession} which closes them once they are replaced.
 */
public interface ToolHandle
    extends Closeable
{

    /**
     * Processes a single input file.
     * 
     * @param input The input file to process, must not be {@code null}.
     * @param inputDirectory The source directory the input file was found in, must not be {@code null}. Tools usually
     *            derive the relative location of their output from it.
     * @param outputDirectory The directory to write the output to, must not be {@code null}.
     * @param format The format tag of the input file, must not be {@code null}.
     * @param options The tool specific options, must not be {@code null}.
     * @throws IOException If the input could not be processed.
     */
    void invoke( File input, File inputDirectory, File outputDirectory, String format, Map<String, String> options )
        throws IOException;

    /**
     * Tells whether {@link #invoke(File, File, File, String, Map)} may be called concurrently. Invocations on handles
     * that are not thread-safe are serialized.
     * 
     * @return {@code true} if the handle can process several files at once, {@code false} otherwise.
     */
    boolean isThreadSafe();

}
