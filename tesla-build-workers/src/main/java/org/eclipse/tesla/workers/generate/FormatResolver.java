package org.eclipse.tesla.workers.generate;

/*******************************************************************************
 * Copyright (c) 2011 Sonatype, Inc.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Public License v1.0
 * which accompanies this distribution, and is available at
 *   http://www.eclipse.org/legal/epl-v10.html
 *******************************************************************************/

/**
 * Classifies input files into the output formats a tool understands.
 */
public interface FormatResolver
{

    /**
     * @param fileName The name of the input file, must not be {@code null}.
     * @return The format tag, never {@code null}.
     */
    String resolve( String fileName );

}
