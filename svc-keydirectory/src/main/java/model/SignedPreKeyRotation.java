package model;

import io.vertx.core.json.JsonObject;

import java.util.Collections;
import java.util.List;
import java.util.UUID;

import core.exceptions.KeyValidationException;
import model.KeyUploadRequest.PreKeyUpload;
import model.KeyUploadRequest.SignedPreKeyUpload;

/**
 * A new signed pre-key, optionally with more one-time pre-keys, published
 * without re-sending the identity key.
 */
public class SignedPreKeyRotation
{
  private final UUID               userId;
  private final SignedPreKeyUpload signedPreKey;
  private final List<PreKeyUpload> oneTimePreKeys;

  public SignedPreKeyRotation( UUID userId, SignedPreKeyUpload signedPreKey, List<PreKeyUpload> oneTimePreKeys )
  {
    this.userId         = userId;
    this.signedPreKey   = signedPreKey;
    this.oneTimePreKeys = oneTimePreKeys == null ? Collections.emptyList() : List.copyOf( oneTimePreKeys );
  }

  public UUID               getUserId()         { return userId;         }
  public SignedPreKeyUpload getSignedPreKey()   { return signedPreKey;   }
  public List<PreKeyUpload> getOneTimePreKeys() { return oneTimePreKeys; }

  public static SignedPreKeyRotation fromJson( JsonObject json )
   throws KeyValidationException
  {
    return new SignedPreKeyRotation( KeyRequestJson.requireUserId( json, "user_id" ),
                                     KeyRequestJson.requireSignedPreKey( json, "signed_pre_key" ),
                                     KeyRequestJson.optionalPreKeys( json, "one_time_pre_keys" ) );
  }
}
