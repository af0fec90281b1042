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

import org.eclipse.tesla.workers.aggregate.AggregateResult;

/**
 * Serializes an aggregate into the manifest format of an external tool.
 */
public interface ManifestWriter
{

    /**
     * Writes the manifest for the specified aggregate.
     * 
     * @param aggregate The aggregate to write, must not be {@code null}.
     * @param outputDirectory The directory to write to, must not be {@code null}. Created if missing.
     * @return The written manifest file, never {@code null}.
     * @throws IOException If the manifest could not be written.
     */
    File write( AggregateResult aggregate, File outputDirectory )
        throws IOException;

}
