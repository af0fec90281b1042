package org.eclipse.tesla.workers;

/*******************************************************************************
 * Copyright (c) 2011 Sonatype, Inc.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Public License v1.0
 * which accompanies this distribution, and is available at
 *   http://www.eclipse.org/legal/epl-v10.html
 *******************************************************************************/

/**
 * Owns the worker sessions of a build. Callers keep one manager for as long as handles should be reused, e.g. the
 * lifetime of a build daemon or of a single build, and pass it explicitly to the code that needs tool handles.
 */
public interface WorkerSessionManager
{

    /**
     * Gets the session bound to the specified tool, creating it if needed. The factory given when the session was
     * created stays in use for the lifetime of the session.
     * 
     * @param toolId The unique identifier of the tool binding, must not be {@code null}.
     * @param factory The factory to construct tool handles with, must not be {@code null}.
     * @return The session, never {@code null}.
     */
    WorkerSession getSession( String toolId, ToolHandleFactory factory );

    /**
     * Closes all sessions and releases their handles.
     */
    void close();

}
