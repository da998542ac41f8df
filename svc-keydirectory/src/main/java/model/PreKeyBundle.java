package model;

import io.vertx.core.json.JsonObject;

import java.util.UUID;

import core.utils.B64Handler;

/**
 * Public keys a requester needs to start a session with {@code userId}.
 * Assembled per request, never stored.
 */
public class PreKeyBundle
{
  private final UUID          userId;
  private final byte[]        identityKey;
  private final SignedPreKey  signedPreKey;
  private final OneTimePreKey oneTimePreKey; // null when the pool is exhausted

  public PreKeyBundle( UUID userId, byte[] identityKey, SignedPreKey signedPreKey, OneTimePreKey oneTimePreKey )
  {
    this.userId        = userId;
    this.identityKey   = identityKey;
    this.signedPreKey  = signedPreKey;
    this.oneTimePreKey = oneTimePreKey;
  }

  public UUID          getUserId()        { return userId;        }
  public byte[]        getIdentityKey()   { return identityKey;   }
  public SignedPreKey  getSignedPreKey()  { return signedPreKey;  }
  public OneTimePreKey getOneTimePreKey() { return oneTimePreKey; }

  public boolean hasOneTimePreKey()
  {
    return oneTimePreKey != null;
  }

  public JsonObject toJson()
  {
    JsonObject json = new JsonObject().put( "user_id",        userId.toString() )
                                      .put( "identity_key",   B64Handler.encodeBytes( identityKey ) )
                                      .put( "signed_pre_key", signedPreKey.toJson() );
    if( oneTimePreKey != null )
    {
      json.put( "one_time_pre_key", oneTimePreKey.toJson() );
    }
    return json;
  }
}
