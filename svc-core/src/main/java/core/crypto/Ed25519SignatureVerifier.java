package core.crypto;


import io.vertx.core.Future;
import io.vertx.core.WorkerExecutor;

import org.bouncycastle.crypto.params.Ed25519PublicKeyParameters;
import org.bouncycastle.crypto.signers.Ed25519Signer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ed25519 verification of signed pre-keys. Verification runs on the worker
 * executor so it never blocks an event loop thread.
 */
public class Ed25519SignatureVerifier implements SignatureVerifierIF
{
  private static final Logger LOGGER = LoggerFactory.getLogger( Ed25519SignatureVerifier.class );

  private final WorkerExecutor workerExecutor;

  public Ed25519SignatureVerifier( WorkerExecutor workerExecutor )
  {
    this.workerExecutor = workerExecutor;
  }

  @Override
  public Future<Boolean> verify( byte[] identityKey, byte[] data, byte[] signature )
  {
    if( identityKey == null || identityKey.length != IdentityKeyLength ||
        signature   == null || signature.length   != SignatureLength   ||
        data        == null )
    {
      LOGGER.debug( "Rejecting signature check with malformed input" );
      return Future.succeededFuture( false );
    }

    return workerExecutor.executeBlocking( () -> verifyNow( identityKey, data, signature ), false );
  }

  /**
   * Synchronous verification, usable outside of Vert.x.
   */
  public static boolean verifyNow( byte[] identityKey, byte[] data, byte[] signature )
  {
    try
    {
      Ed25519PublicKeyParameters pubParams = new Ed25519PublicKeyParameters( identityKey, 0 );
      Ed25519Signer              signer    = new Ed25519Signer();

      signer.init( false, pubParams );
      signer.update( data, 0, data.length );
      return signer.verifySignature( signature );
    }
    catch( Exception e )
    {
      LOGGER.warn( "Verification failed: {}", e.getMessage() );
      return false;
    }
  }
}
