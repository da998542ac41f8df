package verticle;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;

import java.time.Clock;
import java.util.UUID;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import core.model.ChildVerticle;
import core.model.ServiceCoreIF;
import helper.KeyDirectoryConfig;
import service.KeyDirectoryService;
import store.InMemoryKeyStore;
import support.RecordingNotifier;
import support.TestKeys;

@ExtendWith( VertxExtension.class )
public class KeyDirectoryServiceVertTest
{
  @Test
  public void deploysTheKeysBoundary( Vertx vertx, VertxTestContext ctx )
   throws Exception
  {
    KeyDirectoryService     svc    = KeyDirectoryService.getInstance();
    KeyDirectoryConfig      config = KeyDirectoryConfig.fromJson( "{\"keys\":{\"storeType\":\"memory\"}}" );
    KeyDirectoryServiceVert vert   = new KeyDirectoryServiceVert( svc, config, new InMemoryKeyStore(), new RecordingNotifier(), Clock.systemUTC() );

    UUID              henry    = UUID.randomUUID();
    TestKeys.Identity identity = new TestKeys.Identity();

    vertx.deployVerticle( vert )
         .compose( id -> vertx.eventBus().<JsonObject>request( ServiceCoreIF.EventBusKeysUpload, TestKeys.toJson( TestKeys.upload( henry, identity, 1, 1 ) ) ) )
         .onComplete( ctx.succeeding( reply -> ctx.verify( () ->
          {
            assertEquals( ServiceCoreIF.SUCCESS, reply.body().getString( "status" ) );
            assertTrue( svc.getDeployedVerticles().stream()
                           .map( ChildVerticle::vertName )
                           .anyMatch( name -> name.equals( KeysEventBusVert.class.getName() ) ) );
            ctx.completeNow();
          })));
  }

  @Test
  public void requiresStoreAndNotifier()
   throws Exception
  {
    KeyDirectoryConfig config = KeyDirectoryConfig.fromJson( "{}" );

    assertThrows( Exception.class, () -> new KeyDirectoryServiceVert( KeyDirectoryService.getInstance(), null,   new InMemoryKeyStore(), new RecordingNotifier(), Clock.systemUTC() ) );
    assertThrows( Exception.class, () -> new KeyDirectoryServiceVert( KeyDirectoryService.getInstance(), config, null,                   new RecordingNotifier(), Clock.systemUTC() ) );
  }
}
