package org.eclipse.tesla.workers.internal;

/*******************************************************************************
 * Copyright (c) 2011 Sonatype, Inc.
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Public License v1.0
 * which accompanies this distribution, and is available at
 *   http://www.eclipse.org/legal/epl-v10.html
 *******************************************************************************/

import java.io.File;

/**
 * Formats problem messages so that they always name the implicated file.
 */
public class Messages
{

    private Messages()
    {
        // hide
    }

    public static String format( File file, int line, int column, String message, Throwable cause )
    {
        StringBuilder sb = new StringBuilder( 256 );
        sb.append( file.getAbsolutePath() );
        if ( line > 0 )
        {
            sb.append( " [" );
            sb.append( line );
            if ( column > 0 )
            {
                sb.append( ':' );
                sb.append( column );
            }
            sb.append( "]" );
        }
        sb.append( ": " );
        if ( message == null || message.length() <= 0 )
        {
            message = describe( cause );
        }
        sb.append( message );
        return sb.toString();
    }

    public static String describe( Throwable cause )
    {
        if ( cause == null )
        {
            return "(unknown issue)";
        }
        String message = cause.getMessage();
        if ( message == null || message.length() <= 0 )
        {
            message = cause.toString();
        }
        return message;
    }

}
