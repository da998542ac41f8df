package model;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

import core.exceptions.KeyValidationException;
import core.utils.B64Handler;
import model.KeyUploadRequest.PreKeyUpload;
import model.KeyUploadRequest.SignedPreKeyUpload;

/**
 * Field readers shared by the request parsers. Structural problems raise
 * IllegalArgumentException, undecodable key material KeyValidationException.
 */
public final class KeyRequestJson
{
  private KeyRequestJson()
  {
  }

  public static UUID requireUserId( JsonObject json, String field )
  {
    if( json == null )
    {
      throw new IllegalArgumentException( "request body is missing" );
    }

    Object val = json.getValue( field );
    if( !( val instanceof String ) )
    {
      throw new IllegalArgumentException( field + " is missing" );
    }

    try
    {
      return UUID.fromString( (String)val );
    }
    catch( IllegalArgumentException e )
    {
      throw new IllegalArgumentException( field + " is not a valid user id: " + val );
    }
  }

  public static byte[] requireKey( JsonObject json, String field )
   throws KeyValidationException
  {
    Object val = json.getValue( field );
    if( val != null && !( val instanceof String ) )
    {
      throw new IllegalArgumentException( field + " must be a base64 string" );
    }
    return B64Handler.decodeBytes( field, (String)val );
  }

  public static SignedPreKeyUpload requireSignedPreKey( JsonObject json, String field )
   throws KeyValidationException
  {
    Object val = json.getValue( field );
    if( !( val instanceof JsonObject ) )
    {
      throw new IllegalArgumentException( field + " is missing" );
    }

    JsonObject spk = (JsonObject)val;
    return new SignedPreKeyUpload( requireKeyId( spk, field ),
                                   requireKey( spk, "public_key" ),
                                   requireKey( spk, "signature" ) );
  }

  public static List<PreKeyUpload> optionalPreKeys( JsonObject json, String field )
   throws KeyValidationException
  {
    Object val = json.getValue( field );
    if( val == null )
    {
      return Collections.emptyList();
    }
    if( !( val instanceof JsonArray ) )
    {
      throw new IllegalArgumentException( field + " must be an array" );
    }

    JsonArray          arr  = (JsonArray)val;
    List<PreKeyUpload> keys = new ArrayList<>( arr.size() );

    for( int i = 0; i < arr.size(); i++ )
    {
      Object entry = arr.getValue( i );
      if( !( entry instanceof JsonObject ) )
      {
        throw new IllegalArgumentException( field + "[" + i + "] must be an object" );
      }

      JsonObject otk = (JsonObject)entry;
      keys.add( new PreKeyUpload( requireKeyId( otk, field + "[" + i + "]" ), requireKey( otk, "public_key" ) ) );
    }

    return keys;
  }

  private static int requireKeyId( JsonObject json, String owner )
  {
    Object val = json.getValue( "key_id" );
    if( !( val instanceof Number ) )
    {
      throw new IllegalArgumentException( owner + ".key_id is missing" );
    }

    // ids are stored as INT; a narrowed id would collide with a stored one
    Number num = (Number)val;
    long   id  = num.longValue();
    if( num.doubleValue() != id || id < 0 || id > Integer.MAX_VALUE )
    {
      throw new IllegalArgumentException( owner + ".key_id must be an integer between 0 and " + Integer.MAX_VALUE + ": " + val );
    }
    return (int)id;
  }
}
