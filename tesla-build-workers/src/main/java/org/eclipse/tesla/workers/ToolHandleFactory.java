package org.eclipse.tesla.workers;

/*******************************************************************************
 * Copyright (c) 2011 Sonatype, Inc.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Public License v1.0
 * which accompanies this distribution, and is available at
 *   http://www.eclipse.org/legal/epl-v10.html
 *******************************************************************************/

import java.io.File;
import java.util.Collection;

/**
 * Constructs tool handles from a set of input files, e.g. the classpath of a compiler or the executable of a bundler.
 */
public interface ToolHandleFactory
{

    /**
     * Constructs a new tool handle.
     * 
     * @param inputs The files the handle is built from, must not be {@code null}. These are the same files that the
     *            owning session fingerprints.
     * @return The new handle, never {@code null}.
     * @throws SessionInitException If the handle could not be constructed.
     */
    ToolHandle newHandle( Collection<File> inputs )
        throws SessionInitException;

}
