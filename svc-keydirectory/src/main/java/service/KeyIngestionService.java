package service;

import io.vertx.core.Future;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import core.crypto.SignatureVerifierIF;
import core.exceptions.InvalidSignatureException;
import core.exceptions.KeyValidationException;
import model.IdentityKey;
import model.KeyUploadRequest;
import model.KeyUploadRequest.SignedPreKeyUpload;
import model.KeyWriteBatch;
import model.OneTimePreKey;
import model.SignedPreKey;
import store.KeyStoreIF;

/**
 * Publishes a user's keys: validate, verify the signed pre-key against the
 * uploaded identity key, then persist everything in one store transaction.
 * A rejected upload writes nothing.
 */
public class KeyIngestionService
{
  private static final Logger LOGGER = LoggerFactory.getLogger( KeyIngestionService.class );

  private final KeyStoreIF          keyStore;
  private final SignatureVerifierIF verifier;
  private final Clock               clock;
  private final int                 maxOneTimePreKeys;

  public KeyIngestionService( KeyStoreIF keyStore, SignatureVerifierIF verifier, Clock clock, int maxOneTimePreKeys )
  {
    this.keyStore          = keyStore;
    this.verifier          = verifier;
    this.clock             = clock;
    this.maxOneTimePreKeys = maxOneTimePreKeys;
  }

  /**
   * Upload identity key, signed pre-key and one-time pre-keys.
   *
   * Safe to retry after a {@link core.exceptions.StorageException}: one-time
   * key ids that are already stored are skipped.
   *
   * @return Future with the number of one-time pre-keys newly stored; fails
   *         with KeyValidationException, InvalidSignatureException or
   *         StorageException
   */
  public Future<Integer> uploadKeys( KeyUploadRequest request )
  {
    UUID               userId = request.getUserId();
    SignedPreKeyUpload spk    = request.getSignedPreKey();

    try
    {
      KeyValidator.validateIdentityKey( request.getIdentityKey() );
      KeyValidator.validateSignedPreKey( spk );
      KeyValidator.validateOneTimePreKeys( request.getOneTimePreKeys(), maxOneTimePreKeys );
    }
    catch( KeyValidationException e )
    {
      LOGGER.info( "Rejected key upload for user {}: {}", userId, e.getMessage() );
      return Future.failedFuture( e );
    }

    return verifier.verify( request.getIdentityKey(), spk.getPublicKey(), spk.getSignature() )
                   .<Integer>compose( valid ->
                   {
                     if( !valid )
                     {
                       LOGGER.warn( "Rejected key upload for user {}: signed pre-key {} has an invalid signature", userId, spk.getKeyId() );
                       return Future.failedFuture( new InvalidSignatureException( userId.toString(), spk.getKeyId() ) );
                     }

                     Instant now = clock.instant();
                     KeyWriteBatch batch = new KeyWriteBatch( userId,
                                                              new IdentityKey( userId, request.getIdentityKey(), now ),
                                                              new SignedPreKey( spk.getKeyId(), userId, spk.getPublicKey(), spk.getSignature(), now ),
                                                              OneTimePreKey.fromUploads( userId, request.getOneTimePreKeys(), now ) );
                     return keyStore.write( batch );
                   })
                   .onSuccess( inserted -> LOGGER.info( "Keys uploaded for user {}: signed pre-key {}, {} of {} one-time pre-keys new",
                                                        userId, spk.getKeyId(), inserted, request.getOneTimePreKeys().size() ) );
  }
}
