package service;

import io.vertx.core.Future;

import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import model.BundleResult;
import model.IdentityKey;
import model.OneTimePreKey;
import model.PreKeyBundle;
import model.SignedPreKey;
import store.KeyStoreIF;

/**
 * Assembles pre-key bundles for requesters that want to open a session with
 * a (possibly offline) user.
 *
 * A claimed one-time pre-key stays consumed even when the bundle never
 * reaches the requester; the call is therefore not idempotent and is never
 * retried here.
 */
public class BundleAssemblyService
{
  private static final Logger LOGGER = LoggerFactory.getLogger( BundleAssemblyService.class );

  private final KeyStoreIF keyStore;

  public BundleAssemblyService( KeyStoreIF keyStore )
  {
    this.keyStore = keyStore;
  }

  /**
   * Returns the target's identity key, newest signed pre-key and, when one is
   * left, a one-time pre-key claimed exclusively for this request.
   *
   * @return Future with FOUND, EXHAUSTED (no one-time pre-key left) or
   *         NOT_FOUND (identity key or signed pre-key missing); fails only
   *         with StorageException
   */
  public Future<BundleResult> getBundle( UUID targetUserId )
  {
    return keyStore.findIdentityKey( targetUserId )
                   .<BundleResult>compose( identityKey ->
                   {
                     if( identityKey == null )
                     {
                       LOGGER.debug( "No identity key for user {}", targetUserId );
                       return Future.succeededFuture( BundleResult.notFound( targetUserId ) );
                     }

                     return keyStore.findLatestSignedPreKey( targetUserId )
                                    .compose( signedPreKey -> assemble( targetUserId, identityKey, signedPreKey ) );
                   });
  }

  private Future<BundleResult> assemble( UUID targetUserId, IdentityKey identityKey, SignedPreKey signedPreKey )
  {
    if( signedPreKey == null )
    {
      LOGGER.debug( "No signed pre-key for user {}", targetUserId );
      return Future.succeededFuture( BundleResult.notFound( targetUserId ) );
    }

    return keyStore.claimOneTimePreKey( targetUserId )
                   .map( oneTimePreKey -> toResult( targetUserId, identityKey, signedPreKey, oneTimePreKey ) );
  }

  private BundleResult toResult( UUID targetUserId, IdentityKey identityKey, SignedPreKey signedPreKey, OneTimePreKey oneTimePreKey )
  {
    PreKeyBundle bundle = new PreKeyBundle( targetUserId, identityKey.getPublicKey(), signedPreKey, oneTimePreKey );

    if( oneTimePreKey == null )
    {
      LOGGER.info( "One-time pre-keys of user {} exhausted; bundle issued with signed pre-key {} only", targetUserId, signedPreKey.getKeyId() );
      return BundleResult.exhausted( bundle );
    }

    LOGGER.debug( "Bundle for user {} issued with one-time pre-key {}", targetUserId, oneTimePreKey.getKeyId() );
    return BundleResult.found( bundle );
  }
}
