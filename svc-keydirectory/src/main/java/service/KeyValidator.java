package service;

import java.util.List;

import core.crypto.SignatureVerifierIF;
import core.exceptions.KeyValidationException;
import model.KeyUploadRequest.PreKeyUpload;
import model.KeyUploadRequest.SignedPreKeyUpload;

/**
 * Shape checks on uploaded key material, run before any signature check or
 * write.
 */
public final class KeyValidator
{
  private KeyValidator()
  {
  }

  public static void validateIdentityKey( byte[] identityKey )
   throws KeyValidationException
  {
    requireLength( "identity_key", identityKey, SignatureVerifierIF.IdentityKeyLength );
  }

  public static void validateSignedPreKey( SignedPreKeyUpload signedPreKey )
   throws KeyValidationException
  {
    if( signedPreKey == null )
    {
      throw new KeyValidationException( "signed_pre_key", "signed_pre_key is missing" );
    }

    requireKeyId( "signed_pre_key.key_id", signedPreKey.getKeyId() );
    requireLength( "signed_pre_key.public_key", signedPreKey.getPublicKey(), SignatureVerifierIF.AgreementKeyLength );
    requireLength( "signed_pre_key.signature",  signedPreKey.getSignature(), SignatureVerifierIF.SignatureLength    );
  }

  public static void validateOneTimePreKeys( List<PreKeyUpload> keys, int maxKeys )
   throws KeyValidationException
  {
    if( keys.size() > maxKeys )
    {
      throw new KeyValidationException( "one_time_pre_keys", "at most " + maxKeys + " one-time pre-keys per upload, got " + keys.size() );
    }

    for( int i = 0; i < keys.size(); i++ )
    {
      PreKeyUpload key = keys.get( i );
      requireKeyId(  "one_time_pre_keys[" + i + "].key_id", key.getKeyId() );
      requireLength( "one_time_pre_keys[" + i + "].public_key", key.getPublicKey(), SignatureVerifierIF.AgreementKeyLength );
    }
  }

  private static void requireKeyId( String field, int keyId )
   throws KeyValidationException
  {
    if( keyId < 0 )
    {
      throw new KeyValidationException( field, field + " must not be negative" );
    }
  }

  private static void requireLength( String field, byte[] val, int length )
   throws KeyValidationException
  {
    if( val == null )
    {
      throw new KeyValidationException( field, field + " is missing" );
    }
    if( val.length != length )
    {
      throw new KeyValidationException( field, field + " must be " + length + " bytes, got " + val.length );
    }
  }
}
