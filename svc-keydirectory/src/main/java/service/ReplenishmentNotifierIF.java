package service;

import io.vertx.core.Future;

import model.ReplenishmentEvent;

/**
 * Delivers replenishment signals to the owning client. Deduplication of
 * repeated signals is the implementation's concern.
 */
public interface ReplenishmentNotifierIF
{
  Future<Void> notifyReplenishment( ReplenishmentEvent event );
}
