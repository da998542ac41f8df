package core.nats;

import io.nats.client.Connection;
import io.nats.client.ConnectionListener;
import io.nats.client.ErrorListener;
import io.nats.client.Nats;
import io.nats.client.Options;
import io.nats.client.impl.Headers;
import io.nats.client.impl.NatsMessage;
import io.vertx.core.Future;
import io.vertx.core.Vertx;

import java.io.FileInputStream;
import java.io.FileReader;
import java.security.KeyStore;
import java.security.PrivateKey;
import java.security.Security;
import java.security.cert.Certificate;
import java.security.cert.CertificateFactory;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.util.Map;

import javax.net.ssl.KeyManagerFactory;
import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManagerFactory;

import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.bouncycastle.openssl.PEMKeyPair;
import org.bouncycastle.openssl.PEMParser;
import org.bouncycastle.openssl.jcajce.JcaPEMKeyConverter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Plain publish-side NATS client. Connects once (optionally with mutual TLS
 * from PEM files) and publishes core NATS messages off the event loop.
 */
public class NatsClient
{
  private static final Logger LOGGER = LoggerFactory.getLogger( NatsClient.class );

  // Config map keys
  public static final String NATS_URLS             = "natsUrls";
  public static final String NATS_USE_TLS          = "natsUseTLS";
  public static final String NATS_CA_CERT_PATH     = "natsCaCertPath";
  public static final String NATS_CLIENT_CERT_PATH = "natsClientCertPath";
  public static final String NATS_CLIENT_KEY_PATH  = "natsClientKeyPath";

  private static final int MAX_CONNECT_ATTEMPTS = 3;
  private static final int CONNECT_RETRY_MS     = 2000;

  private final Vertx      vertx;
  private final String     serviceId;
  private final Connection natsConnection;

  public NatsClient( Vertx vertx, Map<String, String> natsConfig, String serviceId )
   throws Exception
  {
    this.vertx          = vertx;
    this.serviceId      = serviceId;
    this.natsConnection = connect( natsConfig );
  }

  private Connection connect( Map<String, String> natsConfig )
   throws Exception
  {
    String natsUrls = natsConfig.get( NATS_URLS );
    if( natsUrls == null || natsUrls.isBlank() )
    {
      throw new IllegalArgumentException( "NATS urls not configured" );
    }

    for( int attempt = 1; attempt <= MAX_CONNECT_ATTEMPTS; attempt++ )
    {
      try
      {
        Options.Builder builder = new Options.Builder()
          .servers( natsUrls.split( "," ) )
          .connectionName( serviceId )
          .reconnectWait( Duration.ofSeconds( 2 ) )
          .maxReconnects( -1 )
          .connectionTimeout( Duration.ofSeconds( 15 ) )
          .connectionListener( this::handleConnectionEvent )
          .errorListener( new ErrorListener()
          {
            @Override
            public void errorOccurred( Connection conn, String error )
            {
              LOGGER.warn( "NATS error: {}", error );
            }

            @Override
            public void exceptionOccurred( Connection conn, Exception exp )
            {
              LOGGER.error( "NATS exception: {}", exp == null ? "null" : exp.getMessage(), exp );
            }
          });

        if( Boolean.parseBoolean( natsConfig.get( NATS_USE_TLS ) ) )
        {
          builder.sslContext( createSSLContext( natsConfig.get( NATS_CA_CERT_PATH ),
                                                natsConfig.get( NATS_CLIENT_CERT_PATH ),
                                                natsConfig.get( NATS_CLIENT_KEY_PATH ) ) );
        }

        Connection conn = Nats.connect( builder.build() );
        LOGGER.info( "NATS connection established for {} to {}", serviceId, natsUrls );
        return conn;
      }
      catch( Exception e )
      {
        LOGGER.error( "Error building NATS connection (attempt {}/{}): {}", attempt, MAX_CONNECT_ATTEMPTS, e.getMessage() );

        if( attempt == MAX_CONNECT_ATTEMPTS )
        {
          throw new Exception( "Failed to build NATS connection after " + MAX_CONNECT_ATTEMPTS + " attempts", e );
        }
        Thread.sleep( CONNECT_RETRY_MS );
      }
    }

    throw new IllegalStateException( "unreachable" );
  }

  private void handleConnectionEvent( Connection conn, ConnectionListener.Events type )
  {
    LOGGER.info( "NATS connection event for {}: {}", serviceId, type );
  }

  /**
   * Publish a message with optional headers.
   */
  public Future<Void> publish( String subject, byte[] data, Map<String, String> headers )
  {
    return vertx.<Void>executeBlocking( () ->
    {
      if( natsConnection.getStatus() != Connection.Status.CONNECTED )
      {
        throw new IllegalStateException( "NATS connection not ready: " + natsConnection.getStatus() );
      }

      if( headers != null && !headers.isEmpty() )
      {
        Headers natsHeaders = new Headers();
        headers.forEach( natsHeaders::add );

        natsConnection.publish( NatsMessage.builder()
                                           .subject( subject )
                                           .data( data )
                                           .headers( natsHeaders )
                                           .build() );
      }
      else
      {
        natsConnection.publish( subject, data );
      }
      return null;
    }, false )
    .onFailure( err -> LOGGER.error( "Failed to publish to {}: {}", subject, err.getMessage() ) );
  }

  private SSLContext createSSLContext( String caPath, String certPath, String keyPath )
   throws Exception
  {
    if( Security.getProvider( "BC" ) == null )
    {
      Security.addProvider( new BouncyCastleProvider() );
    }

    CertificateFactory cf = CertificateFactory.getInstance( "X.509" );

    X509Certificate caCert;
    try( FileInputStream caInput = new FileInputStream( caPath ) )
    {
      caCert = (X509Certificate) cf.generateCertificate( caInput );
    }

    KeyStore trustStore = KeyStore.getInstance( KeyStore.getDefaultType() );
    trustStore.load( null, null );
    trustStore.setCertificateEntry( "ca", caCert );

    TrustManagerFactory tmf = TrustManagerFactory.getInstance( TrustManagerFactory.getDefaultAlgorithm() );
    tmf.init( trustStore );

    Certificate clientCert;
    try( FileInputStream certInput = new FileInputStream( certPath ) )
    {
      clientCert = cf.generateCertificate( certInput );
    }

    KeyStore keyStore = KeyStore.getInstance( KeyStore.getDefaultType() );
    keyStore.load( null, null );
    keyStore.setKeyEntry( "client", loadPrivateKey( keyPath ), "".toCharArray(), new Certificate[] { clientCert } );

    KeyManagerFactory kmf = KeyManagerFactory.getInstance( KeyManagerFactory.getDefaultAlgorithm() );
    kmf.init( keyStore, "".toCharArray() );

    SSLContext sslContext = SSLContext.getInstance( "TLS" );
    sslContext.init( kmf.getKeyManagers(), tmf.getTrustManagers(), null );

    return sslContext;
  }

  private PrivateKey loadPrivateKey( String keyPath )
   throws Exception
  {
    try( PEMParser parser = new PEMParser( new FileReader( keyPath ) ) )
    {
      Object             object    = parser.readObject();
      JcaPEMKeyConverter converter = new JcaPEMKeyConverter().setProvider( "BC" );

      if( object instanceof PEMKeyPair )
      {
        return converter.getPrivateKey( ( (PEMKeyPair)object ).getPrivateKeyInfo() );
      }
      if( object instanceof PrivateKeyInfo )
      {
        return converter.getPrivateKey( (PrivateKeyInfo)object );
      }

      throw new IllegalArgumentException( "Unsupported private key format in " + keyPath );
    }
  }

  public void cleanup()
  {
    try
    {
      natsConnection.close();
      LOGGER.info( "NATS connection closed for {}", serviceId );
    }
    catch( InterruptedException e )
    {
      Thread.currentThread().interrupt();
      LOGGER.warn( "Interrupted while closing NATS connection" );
    }
  }
}
