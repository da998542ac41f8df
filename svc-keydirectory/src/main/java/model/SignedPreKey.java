package model;

import io.vertx.core.json.JsonObject;

import java.time.Instant;
import java.util.UUID;

import core.utils.B64Handler;

/**
 * Medium-term key-agreement public key, signed by the owner's identity key.
 * Several may exist per user; bundles use the newest.
 */
public class SignedPreKey
{
  private final int     keyId;
  private final UUID    userId;
  private final byte[]  publicKey;
  private final byte[]  signature;
  private final Instant createdAt;

  public SignedPreKey( int keyId, UUID userId, byte[] publicKey, byte[] signature, Instant createdAt )
  {
    this.keyId     = keyId;
    this.userId    = userId;
    this.publicKey = publicKey;
    this.signature = signature;
    this.createdAt = createdAt;
  }

  public int     getKeyId()     { return keyId;     }
  public UUID    getUserId()    { return userId;    }
  public byte[]  getPublicKey() { return publicKey; }
  public byte[]  getSignature() { return signature; }
  public Instant getCreatedAt() { return createdAt; }

  public JsonObject toJson()
  {
    return new JsonObject().put( "key_id",     keyId )
                           .put( "public_key", B64Handler.encodeBytes( publicKey ) )
                           .put( "signature",  B64Handler.encodeBytes( signature ) );
  }

  @Override
  public String toString()
  {
    return "SignedPreKey{keyId=" + keyId + ", userId=" + userId + ", createdAt=" + createdAt + '}';
  }
}
