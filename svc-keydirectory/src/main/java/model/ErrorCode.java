package model;

import core.exceptions.InvalidSignatureException;
import core.exceptions.KeyValidationException;
import core.exceptions.NotFoundException;
import core.exceptions.StorageException;

/**
 * Wire error codes and the failure code sent with them.
 */
public enum ErrorCode
{
  INVALID_REQUEST  ( 400, "invalid_request"   ),
  INVALID_KEY      ( 400, "invalid_key"       ),
  INVALID_SIGNATURE( 400, "invalid_signature" ),
  NOT_FOUND        ( 404, "not_found"         ),
  STORAGE_ERROR    ( 503, "storage_error"     ),
  INTERNAL_ERROR   ( 500, "internal_error"    );

  private final int    failureCode;
  private final String wireCode;

  ErrorCode( int failureCode, String wireCode )
  {
    this.failureCode = failureCode;
    this.wireCode    = wireCode;
  }

  public int    getFailureCode() { return failureCode; }
  public String getWireCode()    { return wireCode;    }

  public static ErrorCode fromThrowable( Throwable err )
  {
    if( err instanceof InvalidSignatureException ) return INVALID_SIGNATURE;
    if( err instanceof KeyValidationException    ) return INVALID_KEY;
    if( err instanceof NotFoundException         ) return NOT_FOUND;
    if( err instanceof StorageException          ) return STORAGE_ERROR;
    if( err instanceof IllegalArgumentException  ) return INVALID_REQUEST;

    return INTERNAL_ERROR;
  }
}
