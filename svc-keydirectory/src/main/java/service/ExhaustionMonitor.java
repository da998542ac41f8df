package service;

import io.vertx.core.Future;

import java.time.Clock;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import model.ReplenishmentEvent;
import model.ReplenishmentStatus;
import store.KeyStoreIF;

/**
 * Watches the size of a user's one-time pre-key pool and asks the owner to
 * upload more once it drops below the threshold. Holds no state of its own.
 */
public class ExhaustionMonitor
{
  private static final Logger LOGGER = LoggerFactory.getLogger( ExhaustionMonitor.class );

  private final KeyStoreIF              keyStore;
  private final ReplenishmentNotifierIF notifier;
  private final int                     threshold;
  private final Clock                   clock;

  public ExhaustionMonitor( KeyStoreIF keyStore, ReplenishmentNotifierIF notifier, int threshold, Clock clock )
  {
    this.keyStore  = keyStore;
    this.notifier  = notifier;
    this.threshold = threshold;
    this.clock     = clock;
  }

  public int getThreshold() { return threshold; }

  /**
   * Counts the user's unused one-time pre-keys and emits a replenishment event
   * when the count is below the threshold. Every call below the threshold
   * notifies again.
   *
   * @return Future with the evaluated status; fails with StorageException, or
   *         with the notifier's failure
   */
  public Future<ReplenishmentStatus> checkReplenishment( UUID userId )
  {
    return keyStore.countUnusedOneTimePreKeys( userId )
                   .<ReplenishmentStatus>compose( remaining ->
                   {
                     if( remaining >= threshold )
                     {
                       LOGGER.debug( "User {} has {} one-time pre-keys, threshold {}", userId, remaining, threshold );
                       return Future.succeededFuture( new ReplenishmentStatus( userId, remaining, threshold, false ) );
                     }

                     LOGGER.info( "User {} is down to {} one-time pre-keys (threshold {}); requesting replenishment", userId, remaining, threshold );
                     return notifier.notifyReplenishment( new ReplenishmentEvent( userId, remaining, threshold, clock.instant() ) )
                                    .map( v -> new ReplenishmentStatus( userId, remaining, threshold, true ) );
                   });
  }

  /**
   * @return Future with the number of unused one-time pre-keys of the user
   */
  public Future<Integer> countAvailableKeys( UUID userId )
  {
    return keyStore.countUnusedOneTimePreKeys( userId );
  }
}
