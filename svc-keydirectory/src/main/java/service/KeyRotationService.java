package service;

import io.vertx.core.Future;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import core.crypto.SignatureVerifierIF;
import core.exceptions.InvalidSignatureException;
import core.exceptions.KeyValidationException;
import core.exceptions.NotFoundException;
import model.KeyUploadRequest.SignedPreKeyUpload;
import model.KeyWriteBatch;
import model.OneTimePreKey;
import model.SignedPreKey;
import model.SignedPreKeyRotation;
import store.KeyStoreIF;

/**
 * Replaces a user's signed pre-key. The new key must be signed by the identity
 * key already on record; earlier signed pre-keys are kept so in-flight
 * handshakes that used them can still complete.
 */
public class KeyRotationService
{
  private static final Logger LOGGER = LoggerFactory.getLogger( KeyRotationService.class );

  public static final Duration DefaultMaxAge = Duration.ofDays( 7 );

  private final KeyStoreIF          keyStore;
  private final SignatureVerifierIF verifier;
  private final Clock               clock;
  private final Duration            maxAge;
  private final int                 maxOneTimePreKeys;

  public KeyRotationService( KeyStoreIF keyStore, SignatureVerifierIF verifier, Clock clock, Duration maxAge, int maxOneTimePreKeys )
  {
    this.keyStore          = keyStore;
    this.verifier          = verifier;
    this.clock             = clock;
    this.maxAge            = maxAge;
    this.maxOneTimePreKeys = maxOneTimePreKeys;
  }

  /**
   * Stores a new signed pre-key and any one-time pre-keys sent with it in one
   * transaction.
   *
   * @return Future with the number of one-time pre-keys newly stored; fails
   *         with NotFoundException when the user has no identity key,
   *         KeyValidationException, InvalidSignatureException or
   *         StorageException
   */
  public Future<Integer> rotateSignedPreKey( SignedPreKeyRotation rotation )
  {
    UUID               userId = rotation.getUserId();
    SignedPreKeyUpload spk    = rotation.getSignedPreKey();

    try
    {
      KeyValidator.validateSignedPreKey( spk );
      KeyValidator.validateOneTimePreKeys( rotation.getOneTimePreKeys(), maxOneTimePreKeys );
    }
    catch( KeyValidationException e )
    {
      LOGGER.info( "Rejected signed pre-key rotation for user {}: {}", userId, e.getMessage() );
      return Future.failedFuture( e );
    }

    return keyStore.findIdentityKey( userId )
                   .<Integer>compose( identityKey ->
                   {
                     if( identityKey == null )
                     {
                       LOGGER.info( "Rejected signed pre-key rotation for user {}: no identity key", userId );
                       return Future.failedFuture( new NotFoundException( userId.toString(), "No identity key for user " + userId ) );
                     }

                     return verifier.verify( identityKey.getPublicKey(), spk.getPublicKey(), spk.getSignature() )
                                    .compose( valid -> write( rotation, valid ) );
                   })
                   .onSuccess( inserted -> LOGGER.info( "Signed pre-key of user {} rotated to {}, {} one-time pre-keys new", userId, spk.getKeyId(), inserted ) );
  }

  private Future<Integer> write( SignedPreKeyRotation rotation, boolean validSignature )
  {
    UUID               userId = rotation.getUserId();
    SignedPreKeyUpload spk    = rotation.getSignedPreKey();

    if( !validSignature )
    {
      LOGGER.warn( "Rejected signed pre-key rotation for user {}: key {} has an invalid signature", userId, spk.getKeyId() );
      return Future.failedFuture( new InvalidSignatureException( userId.toString(), spk.getKeyId() ) );
    }

    Instant now = clock.instant();
    return keyStore.write( new KeyWriteBatch( userId,
                                              null,
                                              new SignedPreKey( spk.getKeyId(), userId, spk.getPublicKey(), spk.getSignature(), now ),
                                              OneTimePreKey.fromUploads( userId, rotation.getOneTimePreKeys(), now ) ) );
  }

  /**
   * @return Future with true when the user's newest signed pre-key is older
   *         than the configured maximum age; fails with NotFoundException when
   *         the user has no signed pre-key
   */
  public Future<Boolean> isSignedPreKeyStale( UUID userId )
  {
    return keyStore.findLatestSignedPreKey( userId )
                   .<Boolean>compose( signedPreKey ->
                   {
                     if( signedPreKey == null )
                     {
                       return Future.failedFuture( new NotFoundException( userId.toString(), "No signed pre-key for user " + userId ) );
                     }

                     Duration age = Duration.between( signedPreKey.getCreatedAt(), clock.instant() );
                     return Future.succeededFuture( age.compareTo( maxAge ) > 0 );
                   });
  }

  public Duration getMaxAge() { return maxAge; }
}
