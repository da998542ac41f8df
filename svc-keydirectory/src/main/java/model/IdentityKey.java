package model;

import java.time.Instant;
import java.util.UUID;

/**
 * A user's long-term public signing key. One current key per user.
 */
public class IdentityKey
{
  private final UUID    userId;
  private final byte[]  publicKey;
  private final Instant createdAt;

  public IdentityKey( UUID userId, byte[] publicKey, Instant createdAt )
  {
    this.userId    = userId;
    this.publicKey = publicKey;
    this.createdAt = createdAt;
  }

  public UUID    getUserId()    { return userId;    }
  public byte[]  getPublicKey() { return publicKey; }
  public Instant getCreatedAt() { return createdAt; }

  @Override
  public String toString()
  {
    return "IdentityKey{userId=" + userId + ", createdAt=" + createdAt + '}';
  }
}
