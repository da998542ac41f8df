package store;

import io.vertx.core.Future;

import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import core.exceptions.StorageException;
import model.IdentityKey;
import model.KeyWriteBatch;
import model.OneTimePreKey;
import model.SignedPreKey;

/**
 * Single-process key store. Every operation on a user runs under that user's
 * monitor, so writes are all-or-nothing and claims are exclusive.
 */
public class InMemoryKeyStore implements KeyStoreIF
{
  private static final Logger LOGGER = LoggerFactory.getLogger( InMemoryKeyStore.class );

  private static final Comparator<OneTimePreKey> ClaimOrder =
    Comparator.comparing( OneTimePreKey::getCreatedAt ).thenComparingInt( OneTimePreKey::getKeyId );

  private static final Comparator<SignedPreKey> LatestOrder =
    Comparator.comparing( SignedPreKey::getCreatedAt ).thenComparingInt( SignedPreKey::getKeyId );

  private final Map<UUID, UserKeys> users = new ConcurrentHashMap<>();

  private static class UserKeys
  {
    IdentityKey                 identityKey    = null;
    Map<Integer, SignedPreKey>  signedPreKeys  = new HashMap<>();
    Map<Integer, OneTimePreKey> oneTimePreKeys = new LinkedHashMap<>();
  }

  @Override
  public Future<Integer> write( KeyWriteBatch batch )
  {
    UserKeys keys = users.computeIfAbsent( batch.getUserId(), k -> new UserKeys() );

    synchronized( keys )
    {
      try
      {
        // Stage into a copy; only a fully staged batch replaces live state.
        Map<Integer, OneTimePreKey> staged   = new LinkedHashMap<>( keys.oneTimePreKeys );
        int                         inserted = 0;

        for( OneTimePreKey key : batch.getOneTimePreKeys() )
        {
          if( !staged.containsKey( key.getKeyId() ) )
          {
            stageOneTimePreKey( staged, key );
            inserted++;
          }
        }

        if( batch.getIdentityKey() != null )
        {
          keys.identityKey = batch.getIdentityKey();
        }
        if( batch.getSignedPreKey() != null )
        {
          keys.signedPreKeys.put( batch.getSignedPreKey().getKeyId(), batch.getSignedPreKey() );
        }
        keys.oneTimePreKeys = staged;

        LOGGER.debug( "Stored {} ({} new one-time pre-keys)", batch, inserted );
        return Future.succeededFuture( inserted );
      }
      catch( RuntimeException e )
      {
        LOGGER.error( "Failed to store keys for user {}: {}", batch.getUserId(), e.getMessage() );
        return Future.failedFuture( new StorageException( "Failed to store keys for user " + batch.getUserId(), e ) );
      }
    }
  }

  /**
   * Adds one new one-time pre-key to the staged pool of a write.
   * Overridden in tests to fail a write part way through; anything thrown
   * here discards the whole batch.
   */
  protected void stageOneTimePreKey( Map<Integer, OneTimePreKey> staged, OneTimePreKey key )
  {
    staged.put( key.getKeyId(), key );
  }

  @Override
  public Future<IdentityKey> findIdentityKey( UUID userId )
  {
    UserKeys keys = users.get( userId );
    if( keys == null )
    {
      return Future.succeededFuture( null );
    }

    synchronized( keys )
    {
      return Future.succeededFuture( keys.identityKey );
    }
  }

  @Override
  public Future<SignedPreKey> findLatestSignedPreKey( UUID userId )
  {
    UserKeys keys = users.get( userId );
    if( keys == null )
    {
      return Future.succeededFuture( null );
    }

    synchronized( keys )
    {
      return Future.succeededFuture( keys.signedPreKeys.values().stream().max( LatestOrder ).orElse( null ) );
    }
  }

  @Override
  public Future<OneTimePreKey> claimOneTimePreKey( UUID userId )
  {
    UserKeys keys = users.get( userId );
    if( keys == null )
    {
      return Future.succeededFuture( null );
    }

    synchronized( keys )
    {
      OneTimePreKey next = keys.oneTimePreKeys.values().stream()
                                              .filter( k -> !k.isUsed() )
                                              .min( ClaimOrder )
                                              .orElse( null );
      if( next == null )
      {
        return Future.succeededFuture( null );
      }

      OneTimePreKey claimed = next.markUsed();
      keys.oneTimePreKeys.put( claimed.getKeyId(), claimed );
      return Future.succeededFuture( claimed );
    }
  }

  @Override
  public Future<Integer> countUnusedOneTimePreKeys( UUID userId )
  {
    UserKeys keys = users.get( userId );
    if( keys == null )
    {
      return Future.succeededFuture( 0 );
    }

    synchronized( keys )
    {
      return Future.succeededFuture( (int)keys.oneTimePreKeys.values().stream().filter( k -> !k.isUsed() ).count() );
    }
  }

  @Override
  public Future<Void> close()
  {
    users.clear();
    return Future.succeededFuture();
  }
}
