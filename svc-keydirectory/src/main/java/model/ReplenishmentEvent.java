package model;

import io.vertx.core.json.JsonObject;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.UUID;

/**
 * Signal to the notification channel that a user's one-time pre-key pool is
 * running low and the owning client should upload more.
 */
public class ReplenishmentEvent
{
  private final UUID    userId;
  private final int     remainingCount;
  private final int     threshold;
  private final Instant timestamp;

  public ReplenishmentEvent( UUID userId, int remainingCount, int threshold, Instant timestamp )
  {
    this.userId         = userId;
    this.remainingCount = remainingCount;
    this.threshold      = threshold;
    this.timestamp      = timestamp;
  }

  public UUID    getUserId()         { return userId;         }
  public int     getRemainingCount() { return remainingCount; }
  public int     getThreshold()      { return threshold;      }
  public Instant getTimestamp()      { return timestamp;      }

  public JsonObject toJson()
  {
    return new JsonObject().put( "user_id",         userId.toString() )
                           .put( "remaining_count", remainingCount )
                           .put( "threshold",       threshold )
                           .put( "timestamp",       timestamp.toString() );
  }

  public byte[] toBytes()
  {
    return toJson().encode().getBytes( StandardCharsets.UTF_8 );
  }
}
