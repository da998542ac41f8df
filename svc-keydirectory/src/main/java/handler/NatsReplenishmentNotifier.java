package handler;

import io.vertx.core.Future;

import java.util.HashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import core.model.ServiceCoreIF;
import core.nats.NatsClient;
import model.ReplenishmentEvent;
import service.ReplenishmentNotifierIF;

/**
 * Publishes replenishment events on {@code keys.replenish.<user_id>}, the
 * subject the owning client's device listens on.
 */
public class NatsReplenishmentNotifier implements ReplenishmentNotifierIF
{
  private static final Logger LOGGER = LoggerFactory.getLogger( NatsReplenishmentNotifier.class );

  private static final String EventVersion = "1";

  private final NatsClient natsClient;
  private final String     serviceId;

  public NatsReplenishmentNotifier( NatsClient natsClient, String serviceId )
  {
    this.natsClient = natsClient;
    this.serviceId  = serviceId;
  }

  @Override
  public Future<Void> notifyReplenishment( ReplenishmentEvent event )
  {
    String subject = subjectFor( event );

    return natsClient.publish( subject, event.toBytes(), headersFor( event ) )
                     .onSuccess( v -> LOGGER.info( "Replenishment request published to {} ({} keys left)", subject, event.getRemainingCount() ) );
  }

  public static String subjectFor( ReplenishmentEvent event )
  {
    return ServiceCoreIF.ReplenishSubjectBase + event.getUserId();
  }

  Map<String, String> headersFor( ReplenishmentEvent event )
  {
    Map<String, String> headers = new HashMap<>();

    headers.put( ServiceCoreIF.MsgHeaderEventType,   ServiceCoreIF.ReplenishmentEvent );
    headers.put( ServiceCoreIF.MsgHeaderSourceSvcID, serviceId );
    headers.put( ServiceCoreIF.MsgHeaderTimeStamp,   event.getTimestamp().toString() );
    headers.put( ServiceCoreIF.MsgHeaderVersion,     EventVersion );

    return headers;
  }
}
