package core.crypto;

import io.vertx.core.Future;


public interface SignatureVerifierIF
{
  /** Length of an encoded identity (signing) public key. */
  public static final int IdentityKeyLength = 32;

  /** Length of an encoded key-agreement public key. */
  public static final int AgreementKeyLength = 32;

  /** Length of a detached signature. */
  public static final int SignatureLength = 64;

  /**
   * Verify a detached signature over data.
   *
   * @param identityKey encoded public signing key
   * @param data        signed bytes (the signed pre-key's public key)
   * @param signature   detached signature
   * @return Future with true only if the signature is valid; a malformed key
   *         or signature yields false, never a failed future
   */
  Future<Boolean> verify( byte[] identityKey, byte[] data, byte[] signature );
}
