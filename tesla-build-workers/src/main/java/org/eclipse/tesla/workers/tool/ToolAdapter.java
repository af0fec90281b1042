package org.eclipse.tesla.workers.tool;

/*******************************************************************************
 * Copyright (c) 2011 Sonatype, Inc.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Public License v1.0
 * which accompanies this distribution, and is available at
 *   http://www.eclipse.org/legal/epl-v10.html
 *******************************************************************************/

import org.eclipse.tesla.workers.ToolHandle;

/**
 * Bridges one version range of an external tool to the {@link ToolHandle} contract. Adapters are registered via
 * {@code META-INF/services/org.eclipse.tesla.workers.tool.ToolAdapter} and discovered from the class loader that holds
 * the tool, so an adapter can link against the tool's API directly.
 */
public interface ToolAdapter
{

    /**
     * Gets the identifier of the tool this adapter bridges, e.g. {@code twirl} or {@code scalafmt}.
     * 
     * @return The tool identifier, never {@code null}.
     */
    String getToolId();

    /**
     * Tells whether this adapter can drive the specified version of the tool.
     * 
     * @param toolVersion The requested tool version, may be {@code null} if unknown.
     * @return {@code true} if the adapter supports the version, {@code false} otherwise.
     */
    boolean supports( String toolVersion );

    /**
     * Creates a handle to the tool.
     * 
     * @param toolLoader The class loader holding the tool classpath, never {@code null}.
     * @return The tool handle, never {@code null}.
     * @throws Exception If the tool could not be initialized.
     */
    ToolHandle newHandle( ClassLoader toolLoader )
        throws Exception;

}
