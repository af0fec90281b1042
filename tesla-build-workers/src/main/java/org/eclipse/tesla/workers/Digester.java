package org.eclipse.tesla.workers;

/*******************************************************************************
 * Copyright (c) 2011 Sonatype, Inc.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Public License v1.0
 * which accompanies this distribution, and is available at
 *   http://www.eclipse.org/legal/epl-v10.html
 *******************************************************************************/

import java.io.File;

/**
 * Incrementally computes a digest over strings, bytes and file metadata. A digester is reset after each call to
 * {@link #finish()} and can be reused afterwards.
 */
public interface Digester
{

    Digester string( String string );

    Digester strings( String... strings );

    Digester bytes( byte[] bytes );

    /**
     * Digests the absolute path, length and last-modified time of the specified file. The contents of the file are not
     * read.
     * 
     * @param file The file to digest, may be {@code null}.
     * @return This digester for chaining, never {@code null}.
     */
    Digester file( File file );

    byte[] finish();

}
