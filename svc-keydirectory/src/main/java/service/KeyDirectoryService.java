package service;

import io.vertx.core.Vertx;
import io.vertx.core.VertxOptions;
import io.vertx.pgclient.PgBuilder;
import io.vertx.pgclient.PgConnectOptions;
import io.vertx.sqlclient.Pool;
import io.vertx.sqlclient.PoolOptions;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import core.model.ChildVerticle;
import core.nats.NatsClient;
import core.utils.ConfigReader;
import handler.LogOnlyReplenishmentNotifier;
import handler.NatsReplenishmentNotifier;
import helper.KeyDirectoryConfig;
import store.InMemoryKeyStore;
import store.KeyStoreIF;
import store.PgKeyStore;
import verticle.KeyDirectoryServiceVert;

/**
 * Process entry point of the key directory service.
 *
 * Configuration comes from the file named by KEYDIR_CONFIG_FILE when set,
 * otherwise from the keyDirectoryConfig.json entry of the ConfigMap named by
 * CONFIG_MAP_NAME.
 */
public class KeyDirectoryService
{
  private static final Logger LOGGER       = LoggerFactory.getLogger( KeyDirectoryService.class );
  private static final String ConfEnvKey   = "CONFIG_MAP_NAME";
  private static final String ConfFileKey  = "KEYDIR_CONFIG_FILE";
  private static final String DefaultConf  = "keydirectory-svc-config";
  private static final String ConfDataKey  = "keyDirectoryConfig.json";
  private static final long   InitTimeoutS = 60;

  private Vertx               vertx      = null;
  private ConfigReader        confReader = null;
  private KeyDirectoryConfig  config     = null;
  private KeyStoreIF          keyStore   = null;
  private NatsClient          natsClient = null;

  private List<ChildVerticle> deployedVerticles = new ArrayList<ChildVerticle>();

  // Static inner helper class responsible for holding the Singleton instance
  private static class SingletonHelper
  {
    private static final KeyDirectoryService INSTANCE = new KeyDirectoryService();
  }

  public static KeyDirectoryService getInstance()
  {
    return SingletonHelper.INSTANCE;
  }

  private KeyDirectoryService()
  {
  }

  public void init( Vertx vertx )
   throws Exception
  {
    this.vertx  = vertx;
    this.config = loadConfig();
    config.validate();

    LOGGER.info( "*** Service id = {}; store = {}; replenish threshold = {}",
                 config.getServiceId(), config.getKeys().getStoreType(), config.getKeys().getReplenishThreshold() );

    initKeyStore();
    ReplenishmentNotifierIF notifier = initNotifier();
    initMainVerticle( notifier );

    LOGGER.info( "KeyDirectoryService initialization completed successfully" );
  }

  private KeyDirectoryConfig loadConfig()
   throws Exception
  {
    String configFile = System.getenv( ConfFileKey );
    if( configFile != null && !configFile.isBlank() )
    {
      LOGGER.info( "Reading configuration from file {}", configFile );
      return KeyDirectoryConfig.fromFile( configFile );
    }

    confReader = new ConfigReader();
    String configName = ConfigReader.configMapName( ConfEnvKey, DefaultConf );

    LOGGER.info( "*** Namespace = " + confReader.getNamespace() + "; Config map name = " + configName );
    return KeyDirectoryConfig.fromJson( confReader.getRequiredValue( configName, ConfDataKey ) );
  }

  private void initKeyStore()
   throws Exception
  {
    KeyDirectoryConfig.KeysConfig keys = config.getKeys();

    if( KeyDirectoryConfig.StoreMemory.equals( keys.getStoreType() ) )
    {
      LOGGER.warn( "Using the in-memory key store; keys do not survive a restart" );
      keyStore = new InMemoryKeyStore();
      return;
    }

    KeyDirectoryConfig.PostgresConfig pg = config.getPostgres();

    PgConnectOptions connectOptions = new PgConnectOptions().setHost( pg.getHost() )
                                                            .setPort( pg.getPort() )
                                                            .setDatabase( pg.getDatabase() )
                                                            .setUser( pg.getUser() )
                                                            .setPassword( pg.getPassword() );

    Pool pool = PgBuilder.pool()
                         .with( new PoolOptions().setMaxSize( pg.getPoolSize() ) )
                         .connectingTo( connectOptions )
                         .using( vertx )
                         .build();

    PgKeyStore pgStore = new PgKeyStore( vertx, pool, keys.getTransactionTimeoutMs() );
    keyStore = pgStore;

    if( pg.isInitSchema() )
    {
      pgStore.initSchema().toCompletionStage().toCompletableFuture().get( InitTimeoutS, TimeUnit.SECONDS );
    }

    LOGGER.info( "Key store connected to {}:{}/{}", pg.getHost(), pg.getPort(), pg.getDatabase() );
  }

  private ReplenishmentNotifierIF initNotifier()
  {
    if( !config.getNats().isEnabled() )
    {
      LOGGER.warn( "NATS disabled; replenishment requests are only logged" );
      return new LogOnlyReplenishmentNotifier();
    }

    try
    {
      LOGGER.info( "KeyDirectoryService.initNotifier() - Initializing NATS client..." );
      natsClient = new NatsClient( vertx, config.getNats().toClientConfig(), config.getServiceId() );
      return new NatsReplenishmentNotifier( natsClient, config.getServiceId() );
    }
    catch( Exception e )
    {
      String msg = "Failed to initialize NATS client: " + e.getMessage();
      LOGGER.error( msg, e );
      cleanupResources();
      throw new RuntimeException( msg, e );
    }
  }

  private void initMainVerticle( ReplenishmentNotifierIF notifier )
  {
    try
    {
      KeyDirectoryServiceVert mainVert = new KeyDirectoryServiceVert( this, config, keyStore, notifier, Clock.systemUTC() );

      String mainVertId = vertx.deployVerticle( mainVert )
                               .toCompletionStage()
                               .toCompletableFuture().get( InitTimeoutS, TimeUnit.SECONDS );

      deployedVerticles.add( new ChildVerticle( mainVert.getClass().getName(), mainVertId ) );
      LOGGER.info( "KeyDirectoryServiceVert deployment id is: " + mainVertId );
    }
    catch( Exception e )
    {
      String msg = "Fatal initialization error in KeyDirectoryService: " + e.getMessage();
      LOGGER.error( msg, e );
      cleanupResources();
      throw new RuntimeException( msg, e );
    }
  }

  public List<ChildVerticle> getDeployedVerticles()
  {
    return deployedVerticles;
  }

  public void cleanupResources()
  {
    LOGGER.info( "Starting cleanup of KeyDirectoryService resources" );

    if( !deployedVerticles.isEmpty() && vertx != null )
    {
      // children are recorded before the verticle that deployed them
      for( ChildVerticle child : deployedVerticles )
      {
        String vertInfo = child.vertName() + " with id = " + child.id();
        try
        {
          vertx.undeploy( child.id() ).toCompletionStage().toCompletableFuture().get( 10, TimeUnit.SECONDS );
          LOGGER.info( "Successfully undeployed verticle: " + vertInfo );
        }
        catch( Exception e )
        {
          LOGGER.warn( "Error while undeploying verticle " + vertInfo + ": " + e.getMessage(), e );
        }
      }
    }
    deployedVerticles.clear();

    if( keyStore != null )
    {
      try
      {
        keyStore.close().toCompletionStage().toCompletableFuture().get( 10, TimeUnit.SECONDS );
      }
      catch( Exception e )
      {
        LOGGER.warn( "Error while closing key store: " + e.getMessage(), e );
      }
      keyStore = null;
    }

    if( natsClient != null )
    {
      natsClient.cleanup();
      natsClient = null;
    }

    if( confReader != null )
    {
      try
      {
        confReader.close();
      }
      catch( Exception e )
      {
        LOGGER.warn( "Error while closing kubeClient: " + e.getMessage(), e );
      }
      confReader = null;
    }

    if( vertx != null )
    {
      try
      {
        vertx.close().toCompletionStage().toCompletableFuture().get();
        LOGGER.info( "Closed Vertx instance" );
      }
      catch( Exception e )
      {
        LOGGER.warn( "Error while closing Vertx instance: " + e.getMessage(), e );
      }
      vertx = null;
    }
  }

  public static void main( String[] args )
  {
    VertxOptions options = new VertxOptions().setWorkerPoolSize( 20 )
                                             .setEventLoopPoolSize( 4 );
    Vertx vertx = Vertx.vertx( options );

    KeyDirectoryService svc = KeyDirectoryService.getInstance();

    try
    {
      svc.init( vertx );
    }
    catch( Exception e )
    {
      String msg = "Fatal error in KeyDirectoryService: " + e.getMessage();
      LOGGER.error( msg, e );
      svc.cleanupResources();
      System.exit( 1 );
    }

    Runtime.getRuntime().addShutdownHook( new Thread( () ->
    {
      LOGGER.info( "Shutdown hook triggered - cleaning up resources" );
      svc.cleanupResources();
    }));
  }
}
