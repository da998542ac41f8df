package verticle;

import io.vertx.core.AbstractVerticle;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.Promise;
import io.vertx.core.eventbus.Message;
import io.vertx.core.eventbus.MessageConsumer;
import io.vertx.core.json.JsonObject;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import core.exceptions.KeyValidationException;
import core.model.ServiceCoreIF;
import model.BundleResult;
import model.ErrorCode;
import model.KeyRequestJson;
import model.KeyUploadRequest;
import model.SignedPreKeyRotation;
import service.BundleAssemblyService;
import service.ExhaustionMonitor;
import service.KeyIngestionService;
import service.KeyRotationService;

/**
 * Event bus boundary of the key directory. Requests and replies are JSON
 * objects; failures are sent with {@code message.fail( code, errorCode )}
 * where errorCode is the wire code of {@link ErrorCode}.
 */
public class KeysEventBusVert extends AbstractVerticle
{
  private static final Logger LOGGER = LoggerFactory.getLogger( KeysEventBusVert.class );

  private final KeyIngestionService   ingestionService;
  private final BundleAssemblyService bundleService;
  private final ExhaustionMonitor     exhaustionMonitor;
  private final KeyRotationService    rotationService;

  private final List<MessageConsumer<Object>> consumers = new ArrayList<>();

  public KeysEventBusVert( KeyIngestionService ingestionService, BundleAssemblyService bundleService,
                           ExhaustionMonitor exhaustionMonitor, KeyRotationService rotationService )
  {
    this.ingestionService  = ingestionService;
    this.bundleService     = bundleService;
    this.exhaustionMonitor = exhaustionMonitor;
    this.rotationService   = rotationService;
  }

  @Override
  public void start( Promise<Void> startPromise )
  {
    register( ServiceCoreIF.EventBusKeysUpload,         this::handleUpload            );
    register( ServiceCoreIF.EventBusKeysFetch,          this::handleFetch             );
    register( ServiceCoreIF.EventBusKeysRotate,         this::handleRotate            );
    register( ServiceCoreIF.EventBusKeysCount,          this::handleCount             );
    register( ServiceCoreIF.EventBusReplenishmentCheck, this::handleReplenishmentCheck );
    register( ServiceCoreIF.EventBusRotationCheck,      this::handleRotationCheck     );

    List<Future<Void>> registrations = new ArrayList<>();
    for( MessageConsumer<Object> consumer : consumers )
    {
      Promise<Void> registered = Promise.promise();
      consumer.completionHandler( registered );
      registrations.add( registered.future() );
    }

    Future.all( registrations )
          .onSuccess( v ->
           {
             LOGGER.info( "KeysEventBusVert started with {} addresses", consumers.size() );
             startPromise.complete();
           })
          .onFailure( err ->
           {
             LOGGER.error( "Failed to register key directory consumers: {}", err.getMessage(), err );
             startPromise.fail( err );
           });
  }

  @Override
  public void stop( Promise<Void> stopPromise )
  {
    List<Future<Void>> unregistrations = new ArrayList<>();
    for( MessageConsumer<Object> consumer : consumers )
    {
      unregistrations.add( consumer.unregister() );
    }
    consumers.clear();

    Future.all( unregistrations )
          .onComplete( ar ->
           {
             LOGGER.info( "KeysEventBusVert stopped" );
             stopPromise.complete();
           });
  }

  private void register( String address, Handler<Message<Object>> handler )
  {
    consumers.add( vertx.eventBus().consumer( address, handler ) );
  }

  private void handleUpload( Message<Object> message )
  {
    KeyUploadRequest request;
    try
    {
      request = KeyUploadRequest.fromJson( body( message ) );
    }
    catch( KeyValidationException | IllegalArgumentException e )
    {
      fail( message, e );
      return;
    }

    ingestionService.uploadKeys( request )
                    .onSuccess( inserted -> message.reply( storedReply( inserted ) ) )
                    .onFailure( err -> fail( message, err ) );
  }

  private void handleFetch( Message<Object> message )
  {
    UUID targetUserId;
    try
    {
      targetUserId = KeyRequestJson.requireUserId( body( message ), "target_user_id" );
    }
    catch( IllegalArgumentException e )
    {
      fail( message, e );
      return;
    }

    bundleService.getBundle( targetUserId )
                 .onSuccess( result -> replyBundle( message, result ) )
                 .onFailure( err -> fail( message, err ) );
  }

  private void replyBundle( Message<Object> message, BundleResult result )
  {
    switch( result.getStatus() )
    {
      case FOUND:
      case EXHAUSTED:
        // exhaustion is reported only by the absent one_time_pre_key field
        message.reply( result.getBundle().toJson() );
        break;
      case NOT_FOUND:
      default:
        message.fail( ErrorCode.NOT_FOUND.getFailureCode(), ErrorCode.NOT_FOUND.getWireCode() );
        break;
    }
  }

  private void handleRotate( Message<Object> message )
  {
    SignedPreKeyRotation rotation;
    try
    {
      rotation = SignedPreKeyRotation.fromJson( body( message ) );
    }
    catch( KeyValidationException | IllegalArgumentException e )
    {
      fail( message, e );
      return;
    }

    rotationService.rotateSignedPreKey( rotation )
                   .onSuccess( inserted -> message.reply( storedReply( inserted ) ) )
                   .onFailure( err -> fail( message, err ) );
  }

  private void handleCount( Message<Object> message )
  {
    UUID userId;
    try
    {
      userId = KeyRequestJson.requireUserId( body( message ), "user_id" );
    }
    catch( IllegalArgumentException e )
    {
      fail( message, e );
      return;
    }

    exhaustionMonitor.countAvailableKeys( userId )
                     .onSuccess( remaining -> message.reply( new JsonObject().put( "user_id",         userId.toString() )
                                                                             .put( "remaining_count", remaining ) ) )
                     .onFailure( err -> fail( message, err ) );
  }

  private void handleReplenishmentCheck( Message<Object> message )
  {
    UUID userId;
    try
    {
      userId = KeyRequestJson.requireUserId( body( message ), "user_id" );
    }
    catch( IllegalArgumentException e )
    {
      fail( message, e );
      return;
    }

    exhaustionMonitor.checkReplenishment( userId )
                     .onSuccess( status -> message.reply( status.toJson() ) )
                     .onFailure( err -> fail( message, err ) );
  }

  private void handleRotationCheck( Message<Object> message )
  {
    UUID userId;
    try
    {
      userId = KeyRequestJson.requireUserId( body( message ), "user_id" );
    }
    catch( IllegalArgumentException e )
    {
      fail( message, e );
      return;
    }

    rotationService.isSignedPreKeyStale( userId )
                   .onSuccess( stale -> message.reply( new JsonObject().put( "user_id", userId.toString() )
                                                                       .put( "stale",   stale ) ) )
                   .onFailure( err -> fail( message, err ) );
  }

  private static JsonObject body( Message<Object> message )
  {
    Object body = message.body();
    if( !( body instanceof JsonObject ) )
    {
      throw new IllegalArgumentException( "request body must be a JSON object" );
    }
    return (JsonObject)body;
  }

  private static JsonObject storedReply( int inserted )
  {
    return new JsonObject().put( "status",               ServiceCoreIF.SUCCESS )
                           .put( "one_time_keys_stored", inserted );
  }

  private static void fail( Message<Object> message, Throwable err )
  {
    ErrorCode code = ErrorCode.fromThrowable( err );

    if( code == ErrorCode.INTERNAL_ERROR )
    {
      LOGGER.error( "Unexpected failure on {}: {}", message.address(), err.getMessage(), err );
    }
    else
    {
      LOGGER.debug( "Request on {} failed with {}: {}", message.address(), code.getWireCode(), err.getMessage() );
    }

    message.fail( code.getFailureCode(), code.getWireCode() );
  }
}
