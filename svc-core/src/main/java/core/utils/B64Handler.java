package core.utils;

import java.util.Base64;

import core.exceptions.KeyValidationException;

public class B64Handler
{
  public static String encodeBytes( byte[] val )
  {
    if( val == null )
      return null;
    return Base64.getEncoder().encodeToString( val );
  }

  /**
   * Decodes standard (RFC 4648, padded) base64 key material.
   *
   * @param field name reported back to the caller on failure
   * @param val   base64 text
   */
  public static byte[] decodeBytes( String field, String val )
   throws KeyValidationException
  {
    if( val == null || val.isEmpty() )
    {
      throw new KeyValidationException( field, field + " is missing" );
    }

    try
    {
      return Base64.getDecoder().decode( val );
    }
    catch( IllegalArgumentException e )
    {
      throw new KeyValidationException( field, field + " is not valid base64: " + e.getMessage() );
    }
  }
}
