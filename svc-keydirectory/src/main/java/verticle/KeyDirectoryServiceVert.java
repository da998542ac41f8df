package verticle;

import io.vertx.core.AbstractVerticle;
import io.vertx.core.Promise;
import io.vertx.core.WorkerExecutor;

import java.time.Clock;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import core.crypto.Ed25519SignatureVerifier;
import core.crypto.SignatureVerifierIF;
import core.model.ChildVerticle;
import helper.KeyDirectoryConfig;
import service.BundleAssemblyService;
import service.ExhaustionMonitor;
import service.KeyDirectoryService;
import service.KeyIngestionService;
import service.KeyRotationService;
import service.ReplenishmentNotifierIF;
import store.KeyStoreIF;

/**
 * Main verticle of the key directory. Wires the services onto the injected
 * store and notifier and deploys the event bus boundary.
 */
public class KeyDirectoryServiceVert extends AbstractVerticle
{
  private static final Logger LOGGER = LoggerFactory.getLogger( KeyDirectoryServiceVert.class );

  private static final String VerifyPoolName = "signature-verify";

  private final KeyDirectoryService     svc;
  private final KeyDirectoryConfig      config;
  private final KeyStoreIF              keyStore;
  private final ReplenishmentNotifierIF notifier;
  private final Clock                   clock;

  private WorkerExecutor workerExecutor = null;

  public KeyDirectoryServiceVert( KeyDirectoryService svc, KeyDirectoryConfig config, KeyStoreIF keyStore,
                                  ReplenishmentNotifierIF notifier, Clock clock )
   throws Exception
  {
    if( config == null )
    {
      String msg = "config can not be null.";
      LOGGER.error( msg );
      throw new Exception( msg );
    }

    if( keyStore == null || notifier == null )
    {
      String msg = "key store and notifier are required.";
      LOGGER.error( msg );
      throw new Exception( msg );
    }

    this.svc      = svc;
    this.config   = config;
    this.keyStore = keyStore;
    this.notifier = notifier;
    this.clock    = clock;
  }

  @Override
  public void start( Promise<Void> startPromise )
  {
    workerExecutor = vertx.createSharedWorkerExecutor( VerifyPoolName );

    KeyDirectoryConfig.KeysConfig keys     = config.getKeys();
    SignatureVerifierIF           verifier = new Ed25519SignatureVerifier( workerExecutor );

    KeysEventBusVert keysVert =
      new KeysEventBusVert( new KeyIngestionService( keyStore, verifier, clock, keys.getMaxOneTimeKeysPerUpload() ),
                            new BundleAssemblyService( keyStore ),
                            new ExhaustionMonitor( keyStore, notifier, keys.getReplenishThreshold(), clock ),
                            new KeyRotationService( keyStore, verifier, clock, keys.getSignedPreKeyMaxAge(), keys.getMaxOneTimeKeysPerUpload() ) );

    vertx.deployVerticle( keysVert )
         .onSuccess( id ->
          {
            childDeployments().add( new ChildVerticle( keysVert.getClass().getName(), id ) );
            LOGGER.info( "KeysEventBusVert deployed successfully: {}", id );
            LOGGER.info( "KeyDirectoryServiceVert started successfully" );
            startPromise.complete();
          })
         .onFailure( err ->
          {
            String msg = "Fatal error during verticle deployment: " + err.getMessage();
            LOGGER.error( msg, err );
            cleanup();
            startPromise.fail( msg );
          });
  }

  @Override
  public void stop( Promise<Void> stopPromise )
  {
    LOGGER.info( "Stopping KeyDirectoryServiceVert" );
    cleanup();
    stopPromise.complete();
  }

  private List<ChildVerticle> childDeployments()
  {
    return svc.getDeployedVerticles();
  }

  private void cleanup()
  {
    if( workerExecutor != null )
    {
      try
      {
        workerExecutor.close();
        LOGGER.info( "Closed worker executor" );
      }
      catch( Exception e )
      {
        LOGGER.warn( "Error while closing worker executor: " + e.getMessage(), e );
      }
      workerExecutor = null;
    }

    LOGGER.info( "KeyDirectoryServiceVert cleanup completed" );
  }
}
