package org.eclipse.tesla.workers.aggregate;

/*******************************************************************************
 * Copyright (c) 2011 Sonatype, Inc.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Public License v1.0
 * which accompanies this distribution, and is available at
 *   http://www.eclipse.org/legal/epl-v10.html
 *******************************************************************************/

/**
 * A single immutable fact declared by a module, either a {@link NamedDependency} or a {@link SourceFragment}.
 */
public abstract class Fact
{

    Fact()
    {
        // closed hierarchy
    }

}
