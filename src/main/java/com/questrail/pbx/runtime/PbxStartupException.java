package com.questrail.pbx.runtime;

/**
 * Indicates that the PBX could not be brought up, for example because the
 * listening address could not be bound. No connection has been accepted when
 * this is thrown.
 */
public final class PbxStartupException extends RuntimeException
{
    public PbxStartupException(String message, Throwable cause) {
        super(message, cause);
    }
}
