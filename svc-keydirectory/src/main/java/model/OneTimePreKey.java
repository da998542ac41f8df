package model;

import io.vertx.core.json.JsonObject;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import core.utils.B64Handler;
import model.KeyUploadRequest.PreKeyUpload;

/**
 * Single-use key-agreement public key. Once {@code used} it is never handed
 * out again.
 */
public class OneTimePreKey
{
  private final int     keyId;
  private final UUID    userId;
  private final byte[]  publicKey;
  private final boolean used;
  private final Instant createdAt;

  public OneTimePreKey( int keyId, UUID userId, byte[] publicKey, boolean used, Instant createdAt )
  {
    this.keyId     = keyId;
    this.userId    = userId;
    this.publicKey = publicKey;
    this.used      = used;
    this.createdAt = createdAt;
  }

  public int     getKeyId()     { return keyId;     }
  public UUID    getUserId()    { return userId;    }
  public byte[]  getPublicKey() { return publicKey; }
  public boolean isUsed()       { return used;      }
  public Instant getCreatedAt() { return createdAt; }

  /**
   * Binds uploaded one-time keys to their owner as new, unused rows.
   */
  public static List<OneTimePreKey> fromUploads( UUID userId, List<PreKeyUpload> uploads, Instant createdAt )
  {
    List<OneTimePreKey> keys = new ArrayList<>( uploads.size() );
    for( PreKeyUpload upload : uploads )
    {
      keys.add( new OneTimePreKey( upload.getKeyId(), userId, upload.getPublicKey(), false, createdAt ) );
    }
    return keys;
  }

  public OneTimePreKey markUsed()
  {
    return new OneTimePreKey( keyId, userId, publicKey, true, createdAt );
  }

  public JsonObject toJson()
  {
    return new JsonObject().put( "key_id",     keyId )
                           .put( "public_key", B64Handler.encodeBytes( publicKey ) );
  }

  @Override
  public String toString()
  {
    return "OneTimePreKey{keyId=" + keyId + ", userId=" + userId + ", used=" + used + '}';
  }
}
