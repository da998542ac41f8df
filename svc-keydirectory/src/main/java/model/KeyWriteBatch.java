package model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Everything one ingestion call persists for one user. A store applies the
 * whole batch in a single transaction or not at all.
 */
public class KeyWriteBatch
{
  private final UUID                userId;
  private final IdentityKey         identityKey;     // null: leave unchanged
  private final SignedPreKey        signedPreKey;    // null: leave unchanged
  private final List<OneTimePreKey> oneTimePreKeys;

  /**
   * One-time keys repeating a key id within the batch are dropped, the first
   * occurrence wins.
   */
  public KeyWriteBatch( UUID userId, IdentityKey identityKey, SignedPreKey signedPreKey, List<OneTimePreKey> oneTimePreKeys )
  {
    this.userId         = userId;
    this.identityKey    = identityKey;
    this.signedPreKey   = signedPreKey;
    this.oneTimePreKeys = distinctByKeyId( oneTimePreKeys );
  }

  private static List<OneTimePreKey> distinctByKeyId( List<OneTimePreKey> keys )
  {
    if( keys == null || keys.isEmpty() )
    {
      return Collections.emptyList();
    }

    Map<Integer, OneTimePreKey> byId = new LinkedHashMap<>();
    for( OneTimePreKey key : keys )
    {
      byId.putIfAbsent( key.getKeyId(), key );
    }
    return Collections.unmodifiableList( new ArrayList<>( byId.values() ) );
  }

  public UUID                getUserId()         { return userId;         }
  public IdentityKey         getIdentityKey()    { return identityKey;    }
  public SignedPreKey        getSignedPreKey()   { return signedPreKey;   }
  public List<OneTimePreKey> getOneTimePreKeys() { return oneTimePreKeys; }

  @Override
  public String toString()
  {
    return "KeyWriteBatch{userId=" + userId + ", identityKey=" + ( identityKey != null ) +
           ", signedPreKey=" + ( signedPreKey == null ? "none" : signedPreKey.getKeyId() ) +
           ", oneTimePreKeys=" + oneTimePreKeys.size() + '}';
  }
}
