package model;

import io.vertx.core.json.JsonObject;

import java.util.Collections;
import java.util.List;
import java.util.UUID;

import core.exceptions.KeyValidationException;

/**
 * Keys published by their owner: identity key, one signed pre-key and a batch
 * (possibly empty) of one-time pre-keys. Byte lengths are checked by the
 * ingestion service, not here.
 */
public class KeyUploadRequest
{
  private final UUID               userId;
  private final byte[]             identityKey;
  private final SignedPreKeyUpload signedPreKey;
  private final List<PreKeyUpload> oneTimePreKeys;

  public KeyUploadRequest( UUID userId, byte[] identityKey, SignedPreKeyUpload signedPreKey, List<PreKeyUpload> oneTimePreKeys )
  {
    this.userId         = userId;
    this.identityKey    = identityKey;
    this.signedPreKey   = signedPreKey;
    this.oneTimePreKeys = oneTimePreKeys == null ? Collections.emptyList() : List.copyOf( oneTimePreKeys );
  }

  public UUID               getUserId()         { return userId;         }
  public byte[]             getIdentityKey()    { return identityKey;    }
  public SignedPreKeyUpload getSignedPreKey()   { return signedPreKey;   }
  public List<PreKeyUpload> getOneTimePreKeys() { return oneTimePreKeys; }

  /**
   * Parses the upload wire format. {@code user_id} is the caller identity the
   * authentication layer attached to the request.
   *
   * @throws IllegalArgumentException when the request structure is wrong
   * @throws KeyValidationException   when key material is not decodable
   */
  public static KeyUploadRequest fromJson( JsonObject json )
   throws KeyValidationException
  {
    UUID userId = KeyRequestJson.requireUserId( json, "user_id" );

    return new KeyUploadRequest( userId,
                                 KeyRequestJson.requireKey( json, "identity_key" ),
                                 KeyRequestJson.requireSignedPreKey( json, "signed_pre_key" ),
                                 KeyRequestJson.optionalPreKeys( json, "one_time_pre_keys" ) );
  }

  /**
   * Signed pre-key as uploaded, before it is bound to a user and timestamp.
   */
  public static class SignedPreKeyUpload
  {
    private final int    keyId;
    private final byte[] publicKey;
    private final byte[] signature;

    public SignedPreKeyUpload( int keyId, byte[] publicKey, byte[] signature )
    {
      this.keyId     = keyId;
      this.publicKey = publicKey;
      this.signature = signature;
    }

    public int    getKeyId()     { return keyId;     }
    public byte[] getPublicKey() { return publicKey; }
    public byte[] getSignature() { return signature; }
  }

  public static class PreKeyUpload
  {
    private final int    keyId;
    private final byte[] publicKey;

    public PreKeyUpload( int keyId, byte[] publicKey )
    {
      this.keyId     = keyId;
      this.publicKey = publicKey;
    }

    public int    getKeyId()     { return keyId;     }
    public byte[] getPublicKey() { return publicKey; }
  }
}
