package org.eclipse.tesla.workers.generate;

/*******************************************************************************
 * Copyright (c) 2011 Sonatype, Inc.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Public License v1.0
 * which accompanies this distribution, and is available at
 *   http://www.eclipse.org/legal/epl-v10.html
 *******************************************************************************/

/**
 * Controls how a generation step reacts to a file the tool fails to process.
 */
public enum FailurePolicy
{

    /**
     * Stop at the first failed file.
     */
    FAIL_FAST,

    /**
     * Process all files and report every failure.
     */
    COLLECT_ALL

}
