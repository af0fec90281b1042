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
import java.util.Collection;

/**
 * Owns at most one handle to an external tool and reuses it as long as the fingerprint of the files the handle was
 * built from does not change. The general usage pattern is:
 * 
 * <pre>
 * WorkerSession session = sessionManager.getSession( &quot;twirl&quot;, handleFactory );
 * ToolHandle handle = session.get( toolClasspath );
 * for ( File input : inputs )
 * {
 *     handle.invoke( input, inputDir, outputDir, format, options );
 * }
 * </pre>
 * 
 * Sessions are safe for concurrent use. Acquiring a handle with an unchanged fingerprint does not block, at most one
 * handle is under construction per session at any time.
 * <p>
 * A handle obtained from a session is only valid until the session replaces it. When a caller observes a changed
 * fingerprint, the session publishes the new handle and then closes the previous one, even if other threads are still
 * invoking it. Callers sharing a session across threads must therefore not change its inputs while another thread
 * uses a handle from it, e.g. by fingerprinting the same tool classpath for the duration of a build. Closing the
 * session likewise closes the handle it currently holds.
 */
public interface WorkerSession
    extends Closeable
{

    /**
     * Gets the identifier of the tool this session is bound to.
     * 
     * @return The tool identifier, never {@code null}.
     */
    String getToolId();

    /**
     * Gets a handle to the tool, reconstructing it if any of the specified files was added, removed or modified since
     * the current handle was built.
     * 
     * @param inputs The files to build the handle from, must not be {@code null}.
     * @return The tool handle, never {@code null}.
     * @throws InputNotFoundException If any of the inputs does not exist.
     * @throws SessionInitException If a new handle was required but could not be constructed. The previous handle, if
     *             any, is retained in this case.
     */
    ToolHandle get( Collection<File> inputs );

    /**
     * Gets a handle to the tool for an already computed fingerprint.
     * 
     * @param fingerprint The fingerprint of the inputs, must not be {@code null}.
     * @param inputs The files to build the handle from if the fingerprint differs from the current one, must not be
     *            {@code null}.
     * @return The tool handle, never {@code null}.
     * @see #get(Collection)
     */
    ToolHandle get( Fingerprint fingerprint, Collection<File> inputs );

    /**
     * Gets the fingerprint of the current handle.
     * 
     * @return The fingerprint or {@code null} if no handle has been built yet.
     */
    Fingerprint getFingerprint();

    /**
     * Releases the current handle. A closed session must not be used anymore, closing it again has no effect.
     */
    void close();

}
