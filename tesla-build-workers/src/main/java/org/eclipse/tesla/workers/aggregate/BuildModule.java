package org.eclipse.tesla.workers.aggregate;

/*******************************************************************************
 * Copyright (c) 2011 Sonatype, Inc.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Public License v1.0
 * which accompanies this distribution, and is available at
 *   http://www.eclipse.org/legal/epl-v10.html
 *******************************************************************************/

import java.util.Collection;
import java.util.List;

/**
 * A node of the {@link ModuleGraph}.
 */
public interface BuildModule
{

    /**
     * @return The unique identifier of the module, never {@code null}.
     */
    String getId();

    /**
     * @return The identifiers of the modules this module directly depends on, in declaration order, never {@code null}.
     */
    List<String> getDependencyIds();

    /**
     * Gets the facts declared by this module itself. The aggregator calls this at most once per module and build.
     * 
     * @return The local facts, never {@code null}.
     */
    Collection<? extends Fact> getLocalFacts();

}
