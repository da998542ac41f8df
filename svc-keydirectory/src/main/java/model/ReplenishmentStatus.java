package model;

import io.vertx.core.json.JsonObject;

import java.util.UUID;

/**
 * Result of one replenishment check.
 */
public record ReplenishmentStatus( UUID userId, int remainingCount, int threshold, boolean notified )
{
  public boolean belowThreshold()
  {
    return remainingCount < threshold;
  }

  public JsonObject toJson()
  {
    return new JsonObject().put( "user_id",         userId.toString() )
                           .put( "remaining_count", remainingCount )
                           .put( "threshold",       threshold )
                           .put( "notified",        notified );
  }
}
