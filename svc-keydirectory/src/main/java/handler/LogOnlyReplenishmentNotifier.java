package handler;

import io.vertx.core.Future;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import model.ReplenishmentEvent;
import service.ReplenishmentNotifierIF;

/**
 * Notifier for deployments without NATS: the request is only logged.
 */
public class LogOnlyReplenishmentNotifier implements ReplenishmentNotifierIF
{
  private static final Logger LOGGER = LoggerFactory.getLogger( LogOnlyReplenishmentNotifier.class );

  @Override
  public Future<Void> notifyReplenishment( ReplenishmentEvent event )
  {
    LOGGER.warn( "NATS disabled; replenishment request for user {} ({} keys left) not delivered: {}",
                 event.getUserId(), event.getRemainingCount(), event.toJson().encode() );
    return Future.succeededFuture();
  }
}
