package store;

import io.vertx.core.Future;

import java.util.UUID;

import model.IdentityKey;
import model.KeyWriteBatch;
import model.OneTimePreKey;
import model.SignedPreKey;

/**
 * Persistence for identity keys, signed pre-keys and one-time pre-keys.
 * Failed futures carry a {@link core.exceptions.StorageException}.
 */
public interface KeyStoreIF
{
  /**
   * Applies the batch in one transaction: upsert the identity key, insert or
   * replace the signed pre-key, insert the one-time pre-keys. One-time keys
   * whose id already exists for the user are skipped and keep their state.
   *
   * @return Future with the number of one-time pre-keys actually inserted
   */
  Future<Integer> write( KeyWriteBatch batch );

  /**
   * @return Future with the identity key, or null if the user has none
   */
  Future<IdentityKey> findIdentityKey( UUID userId );

  /**
   * @return Future with the signed pre-key having the greatest created_at, or
   *         null if the user has none
   */
  Future<SignedPreKey> findLatestSignedPreKey( UUID userId );

  /**
   * Atomically marks one unused one-time pre-key of the user as used and
   * returns it. Concurrent claims never return the same key.
   *
   * @return Future with the claimed key, or null when the pool is exhausted
   */
  Future<OneTimePreKey> claimOneTimePreKey( UUID userId );

  /**
   * @return Future with the number of unused one-time pre-keys
   */
  Future<Integer> countUnusedOneTimePreKeys( UUID userId );

  Future<Void> close();
}
