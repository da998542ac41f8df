package model;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import org.junit.jupiter.api.Test;

import core.exceptions.KeyValidationException;
import support.TestKeys;

public class KeyUploadRequestTest
{
  private final UUID              erin     = UUID.randomUUID();
  private final TestKeys.Identity identity = new TestKeys.Identity();

  @Test
  public void parsesTheUploadWireFormat()
   throws Exception
  {
    KeyUploadRequest sent   = TestKeys.upload( erin, identity, 3, 30, 31 );
    KeyUploadRequest parsed = KeyUploadRequest.fromJson( TestKeys.toJson( sent ) );

    assertEquals( erin, parsed.getUserId() );
    assertArrayEquals( identity.getPublicKey(), parsed.getIdentityKey() );
    assertEquals( 3, parsed.getSignedPreKey().getKeyId() );
    assertArrayEquals( sent.getSignedPreKey().getSignature(), parsed.getSignedPreKey().getSignature() );
    assertEquals( 2, parsed.getOneTimePreKeys().size() );
    assertEquals( 31, parsed.getOneTimePreKeys().get( 1 ).getKeyId() );
  }

  @Test
  public void oneTimeKeysAreOptional()
   throws Exception
  {
    JsonObject json = TestKeys.toJson( TestKeys.upload( erin, identity, 3 ) );
    json.remove( "one_time_pre_keys" );

    assertTrue( KeyUploadRequest.fromJson( json ).getOneTimePreKeys().isEmpty() );
  }

  @Test
  public void structuralProblemsAreInvalidRequests()
  {
    JsonObject valid = TestKeys.toJson( TestKeys.upload( erin, identity, 3, 1 ) );

    assertThrows( IllegalArgumentException.class, () -> KeyUploadRequest.fromJson( null ) );
    assertThrows( IllegalArgumentException.class, () -> KeyUploadRequest.fromJson( valid.copy().put( "user_id", "not-a-uuid" ) ) );
    assertThrows( IllegalArgumentException.class, () -> KeyUploadRequest.fromJson( valid.copy().put( "signed_pre_key", "x" ) ) );
    assertThrows( IllegalArgumentException.class, () -> KeyUploadRequest.fromJson( valid.copy().put( "one_time_pre_keys", "x" ) ) );
    assertThrows( IllegalArgumentException.class, () -> KeyUploadRequest.fromJson( valid.copy().put( "one_time_pre_keys", new JsonArray().add( new JsonObject() ) ) ) );
  }

  @Test
  public void keyIdsOutsideTheIntRangeAreRejected()
   throws Exception
  {
    JsonObject valid = TestKeys.toJson( TestKeys.upload( erin, identity, 3, 1, 2, 7 ) );

    for( Object badId : List.of( 4294967297L, 7.9, -1, (long)Integer.MAX_VALUE + 1 ) )
    {
      JsonObject json = valid.copy();
      json.getJsonArray( "one_time_pre_keys" ).getJsonObject( 1 ).put( "key_id", badId );

      assertThrows( IllegalArgumentException.class, () -> KeyUploadRequest.fromJson( json ), "key_id " + badId );
    }

    JsonObject badSigned = valid.copy();
    badSigned.getJsonObject( "signed_pre_key" ).put( "key_id", 2.5 );
    assertThrows( IllegalArgumentException.class, () -> KeyUploadRequest.fromJson( badSigned ) );

    JsonObject widest = valid.copy();
    widest.getJsonArray( "one_time_pre_keys" ).getJsonObject( 1 ).put( "key_id", (long)Integer.MAX_VALUE );
    List<KeyUploadRequest.PreKeyUpload> parsed = KeyUploadRequest.fromJson( widest ).getOneTimePreKeys();

    assertEquals( 3, parsed.size() );
    assertEquals( Integer.MAX_VALUE, parsed.get( 1 ).getKeyId() );
  }

  @Test
  public void undecodableKeysAreInvalidKeys()
  {
    JsonObject valid = TestKeys.toJson( TestKeys.upload( erin, identity, 3, 1 ) );

    KeyValidationException e = assertThrows( KeyValidationException.class,
                                             () -> KeyUploadRequest.fromJson( valid.copy().put( "identity_key", "%%%" ) ) );
    assertEquals( "identity_key", e.getField() );

    JsonObject noIdentity = valid.copy();
    noIdentity.remove( "identity_key" );
    assertThrows( KeyValidationException.class, () -> KeyUploadRequest.fromJson( noIdentity ) );
  }

  @Test
  public void batchKeepsFirstOfRepeatedKeyIds()
  {
    Instant now = Instant.now();
    OneTimePreKey first  = new OneTimePreKey( 1, erin, new byte[ 32 ], false, now );
    OneTimePreKey repeat = new OneTimePreKey( 1, erin, new byte[ 32 ], false, now );
    OneTimePreKey other  = new OneTimePreKey( 2, erin, new byte[ 32 ], false, now );

    KeyWriteBatch batch = new KeyWriteBatch( erin, null, null, List.of( first, repeat, other ) );

    assertEquals( List.of( first, other ), batch.getOneTimePreKeys() );
  }
}
