package org.eclipse.tesla.workers;

/*******************************************************************************
 * Copyright (c) 2011 Sonatype, Inc.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Public License v1.0
 * which accompanies this distribution, and is available at
 *   http://www.eclipse.org/legal/epl-v10.html
 *******************************************************************************/

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Summarizes the per-file failures of a generation step.
 */
public class GenerationException
    extends BuildException
{

    private static final long serialVersionUID = -6318021475367260186L;

    private final List<InvocationException> errors;

    public GenerationException( List<InvocationException> errors )
    {
        super( summarize( errors ) );
        this.errors = Collections.unmodifiableList( new ArrayList<InvocationException>( errors ) );
    }

    public List<InvocationException> getErrors()
    {
        return errors;
    }

    private static String summarize( List<InvocationException> errors )
    {
        StringBuilder sb = new StringBuilder( 256 );
        sb.append( errors.size() ).append( " error" ).append( errors.size() == 1 ? "" : "s" ).append( " encountered" );
        for ( InvocationException error : errors )
        {
            sb.append( System.getProperty( "line.separator" ) ).append( "  " ).append( error.getInput() );
        }
        return sb.toString();
    }

}
