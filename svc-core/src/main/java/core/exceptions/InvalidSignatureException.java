package core.exceptions;

/**
 * The signed pre-key signature does not verify against the identity key.
 */
public class InvalidSignatureException extends KeyValidationException
{
  private static final long serialVersionUID = -6307722860135318547L;

  private final String userId;
  private final int    keyId;

  public InvalidSignatureException( String userId, int keyId )
  {
    super( "signature", "Signed pre-key " + keyId + " signature is not valid for the identity key of user " + userId );
    this.userId = userId;
    this.keyId  = keyId;
  }

  public String getUserId() { return userId; }
  public int    getKeyId()  { return keyId;  }
}
