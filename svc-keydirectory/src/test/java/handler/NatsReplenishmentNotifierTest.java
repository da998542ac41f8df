package handler;

import static org.junit.jupiter.api.Assertions.assertEquals;

import io.vertx.core.json.JsonObject;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

import org.junit.jupiter.api.Test;

import core.model.ServiceCoreIF;
import model.ReplenishmentEvent;

public class NatsReplenishmentNotifierTest
{
  private final UUID               frank = UUID.fromString( "6f1c2a44-1d2e-4b8a-9a57-0c6a4bdf3e10" );
  private final ReplenishmentEvent event = new ReplenishmentEvent( frank, 4, 20, Instant.parse( "2026-08-01T10:15:30Z" ) );

  @Test
  public void publishesOnTheUsersSubject()
  {
    assertEquals( "keys.replenish.6f1c2a44-1d2e-4b8a-9a57-0c6a4bdf3e10", NatsReplenishmentNotifier.subjectFor( event ) );
  }

  @Test
  public void headersIdentifyTheEvent()
  {
    Map<String, String> headers = new NatsReplenishmentNotifier( null, "keydirectory" ).headersFor( event );

    assertEquals( ServiceCoreIF.ReplenishmentEvent, headers.get( ServiceCoreIF.MsgHeaderEventType ) );
    assertEquals( "keydirectory", headers.get( ServiceCoreIF.MsgHeaderSourceSvcID ) );
    assertEquals( "2026-08-01T10:15:30Z", headers.get( ServiceCoreIF.MsgHeaderTimeStamp ) );
  }

  @Test
  public void payloadCarriesUserAndRemainingCount()
  {
    JsonObject payload = new JsonObject( new String( event.toBytes(), StandardCharsets.UTF_8 ) );

    assertEquals( frank.toString(), payload.getString( "user_id" ) );
    assertEquals( 4, payload.getInteger( "remaining_count" ) );
  }
}
